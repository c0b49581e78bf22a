package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.ValueFormat;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Conversión de valores a texto y formatos {@code uppercase}, {@code lowercase}, {@code title},
 * {@code date}, {@code number} y {@code currency}.
 * <p>
 * Un valor que no se puede interpretar según el formato se devuelve en su forma textual.
 */
public final class ValueFormatter {

    static final int DEFAULT_DECIMALS = 2;
    static final String DEFAULT_CURRENCY_SYMBOL = "$";

    /** Cota de precisión y de |escala| para que un exponente grande no se expanda al formatear. */
    static final int MAX_NUMBER_MAGNITUDE = 1000;

    private static final List<DateTimeFormatter> DATE_TIME_INPUTS = List.of(
            strict("uuuu-MM-dd'T'HH:mm:ss"));

    // STRICT: 31/02/2024 no se ajusta a fin de mes, se rechaza.
    private static final List<DateTimeFormatter> DATE_INPUTS = List.of(
            strict("uuuu-MM-dd"),
            strict("dd/MM/uuuu"),
            strict("MM/dd/uuuu"));

    private ValueFormatter() {
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * {@code null} → {@code ""}, booleanos → {@code "true"/"false"}, números en forma plana.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        if (value instanceof BigDecimal) {
            BigDecimal number = (BigDecimal) value;
            return isBounded(number) ? number.toPlainString() : number.toString();
        }
        return String.valueOf(value);
    }

    public static String format(Object value, ValueFormat format, String argument) {
        String text = toText(value);
        return switch (format) {
            case UPPERCASE -> text.toUpperCase(Locale.ROOT);
            case LOWERCASE -> text.toLowerCase(Locale.ROOT);
            case TITLE -> titleCase(text);
            case DATE -> formatDate(value, argument);
            case NUMBER -> formatNumber(value, argument);
            case CURRENCY -> formatCurrency(value, argument);
        };
    }

    /**
     * Mayúscula al inicio de cada secuencia de letras, minúsculas en el resto
     * ({@code "juan o'neil"} → {@code "Juan O'Neil"}).
     */
    public static String titleCase(String text) {
        var sb = new StringBuilder(text.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                sb.append(c);
                previousIsLetter = false;
            }
        }
        return sb.toString();
    }

    /**
     * Interpreta el valor como número. Acepta {@link Number} y texto numérico.
     * <p>
     * Valores con precisión o escala fuera de {@link #MAX_NUMBER_MAGNITUDE} (p. ej. {@code 1E200000000})
     * se tratan como no numéricos.
     */
    public static Optional<BigDecimal> toNumber(Object value) {
        if (value == null || value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal) {
            return Optional.of((BigDecimal) value).filter(ValueFormatter::isBounded);
        }
        String text = value.toString().strip();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text)).filter(ValueFormatter::isBounded);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static boolean isBounded(BigDecimal number) {
        return number.precision() <= MAX_NUMBER_MAGNITUDE
                && Math.abs((long) number.scale()) <= MAX_NUMBER_MAGNITUDE;
    }

    static String formatNumber(Object value, String argument) {
        int decimals = parseDecimals(argument);
        return toNumber(value)
                .map(n -> n.setScale(decimals, RoundingMode.HALF_UP).toPlainString())
                .orElseGet(() -> toText(value));
    }

    static String formatCurrency(Object value, String argument) {
        String symbol = argument == null || argument.isEmpty() ? DEFAULT_CURRENCY_SYMBOL : argument;
        var pattern = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        pattern.setRoundingMode(RoundingMode.HALF_UP);
        return toNumber(value)
                .map(n -> symbol + pattern.format(n))
                .orElseGet(() -> toText(value));
    }

    static String formatDate(Object value, String argument) {
        String strftime = argument == null || argument.isEmpty() ? StrftimeFormatter.DEFAULT_PATTERN : argument;
        Optional<LocalDateTime> parsed = toDateTime(value);
        if (parsed.isEmpty()) {
            return toText(value);
        }
        try {
            return StrftimeFormatter.toFormatter(strftime).format(parsed.get());
        } catch (DateTimeException | IllegalArgumentException e) {
            return toText(value);
        }
    }

    private static Optional<LocalDateTime> toDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return Optional.of((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return Optional.of(((LocalDate) value).atStartOfDay());
        }
        if (value instanceof ZonedDateTime) {
            return Optional.of(((ZonedDateTime) value).toLocalDateTime());
        }
        if (value instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) value).toLocalDateTime());
        }
        if (!(value instanceof CharSequence)) {
            return Optional.empty();
        }
        String text = value.toString().strip();
        for (DateTimeFormatter input : DATE_TIME_INPUTS) {
            try {
                return Optional.of(LocalDateTime.parse(text, input));
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        for (DateTimeFormatter input : DATE_INPUTS) {
            try {
                TemporalAccessor parsed = input.parse(text);
                return Optional.of(LocalDate.from(parsed).atStartOfDay());
            } catch (DateTimeException e) {
                continue;
            }
        }
        return Optional.empty();
    }

    private static int parseDecimals(String argument) {
        if (argument == null) {
            return DEFAULT_DECIMALS;
        }
        String trimmed = argument.strip();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit) || trimmed.length() > 3) {
            return DEFAULT_DECIMALS;
        }
        return Integer.parseInt(trimmed);
    }
}
