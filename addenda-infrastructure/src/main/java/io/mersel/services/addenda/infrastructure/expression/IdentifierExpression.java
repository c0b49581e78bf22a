package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.ExpressionKind;

public record IdentifierExpression(String source, String name) implements Expression {

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.IDENTIFIER;
    }
}
