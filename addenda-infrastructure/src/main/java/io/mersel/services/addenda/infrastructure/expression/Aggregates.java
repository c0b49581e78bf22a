package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.AggregateFunction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Optional;

/**
 * Funciones de agregación sobre los valores alcanzados por una ruta.
 * <p>
 * Las funciones numéricas ignoran entradas no numéricas; sobre una lista vacía
 * {@code sum}, {@code avg}, {@code max} y {@code min} devuelven {@code 0}, y
 * {@code first}/{@code last} devuelven cadena vacía.
 */
public final class Aggregates {

    private Aggregates() {
    }

    public static String apply(AggregateFunction function, List<Object> values) {
        return switch (function) {
            case COUNT -> String.valueOf(values.size());
            case FIRST -> values.isEmpty() ? "" : ValueFormatter.toText(values.get(0));
            case LAST -> values.isEmpty() ? "" : ValueFormatter.toText(values.get(values.size() - 1));
            case SUM, AVG, MAX, MIN -> numeric(function, numbers(values));
        };
    }

    private static String numeric(AggregateFunction function, List<BigDecimal> numbers) {
        if (numbers.isEmpty()) {
            return "0";
        }
        BigDecimal result = switch (function) {
            case SUM -> sum(numbers);
            case AVG -> sum(numbers)
                    .divide(BigDecimal.valueOf(numbers.size()), MathContext.DECIMAL64)
                    .stripTrailingZeros();
            case MAX -> numbers.stream().reduce(BigDecimal::max).orElse(BigDecimal.ZERO);
            case MIN -> numbers.stream().reduce(BigDecimal::min).orElse(BigDecimal.ZERO);
            default -> throw new IllegalArgumentException("Función no numérica: " + function);
        };
        return result.toPlainString();
    }

    private static BigDecimal sum(List<BigDecimal> numbers) {
        return numbers.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static List<BigDecimal> numbers(List<Object> values) {
        return values.stream()
                .map(ValueFormatter::toNumber)
                .flatMap(Optional::stream)
                .toList();
    }
}
