package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.ExpressionKind;
import io.mersel.services.addenda.application.enums.ValueFormat;

/**
 * {@code base | formato[:argumento]}.
 *
 * @param base       expresión sin formato (identificador, ruta o función)
 * @param format     formato reconocido; {@code null} si la palabra clave es desconocida,
 *                   en cuyo caso el valor se entrega sin formatear
 * @param formatName palabra clave tal como se escribió
 * @param argument   texto tras {@code :}; {@code null} si no hay
 */
public record FormattedExpression(
        String source,
        Expression base,
        ValueFormat format,
        String formatName,
        String argument
) implements Expression {

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.FORMATTED;
    }

    public boolean isKnownFormat() {
        return format != null;
    }
}
