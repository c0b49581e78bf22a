package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.AggregateFunction;
import io.mersel.services.addenda.application.enums.ExpressionKind;

import java.util.List;

/**
 * Agregación {@code funcion(ruta)}. Un argumento vacío equivale a una lista vacía.
 */
public record FunctionExpression(String source, AggregateFunction function, List<String> argument)
        implements Expression {

    public FunctionExpression {
        argument = List.copyOf(argument);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.FUNCTION;
    }

    public boolean hasArgument() {
        return !argument.isEmpty();
    }
}
