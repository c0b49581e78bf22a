package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.ExpressionKind;

public record UnrecognizedExpression(String source, String reason) implements Expression {

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.UNRECOGNIZED;
    }
}
