package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.ExpressionKind;

import java.util.List;

/**
 * Ruta {@code a.b.0.c}: claves de mapa o índices de lista.
 */
public record PathExpression(String source, List<String> segments) implements Expression {

    public PathExpression {
        segments = List.copyOf(segments);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.PATH;
    }

    public String root() {
        return segments.get(0);
    }
}
