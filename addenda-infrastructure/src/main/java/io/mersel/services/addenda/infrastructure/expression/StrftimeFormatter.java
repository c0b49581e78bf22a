package io.mersel.services.addenda.infrastructure.expression;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.Locale;

/**
 * Traduce patrones estilo strftime ({@code %Y-%m-%d}) a {@link DateTimeFormatter}.
 * Las directivas desconocidas se copian literalmente.
 */
final class StrftimeFormatter {

    static final String DEFAULT_PATTERN = "%Y-%m-%d";

    private StrftimeFormatter() {
    }

    static DateTimeFormatter toFormatter(String strftime) {
        var builder = new DateTimeFormatterBuilder();
        var literal = new StringBuilder();
        for (int i = 0; i < strftime.length(); i++) {
            char c = strftime.charAt(i);
            if (c != '%' || i + 1 >= strftime.length()) {
                literal.append(c);
                continue;
            }
            char directive = strftime.charAt(++i);
            String pattern = javaPattern(directive);
            if (pattern == null) {
                literal.append(directive == '%' ? "%" : "%" + directive);
                continue;
            }
            if (literal.length() > 0) {
                builder.appendLiteral(literal.toString());
                literal.setLength(0);
            }
            builder.appendPattern(pattern);
        }
        if (literal.length() > 0) {
            builder.appendLiteral(literal.toString());
        }
        return builder.toFormatter(Locale.ENGLISH);
    }

    private static String javaPattern(char directive) {
        return switch (directive) {
            case 'Y' -> "yyyy";
            case 'y' -> "yy";
            case 'm' -> "MM";
            case 'd' -> "dd";
            case 'H' -> "HH";
            case 'I' -> "hh";
            case 'M' -> "mm";
            case 'S' -> "ss";
            case 'f' -> "SSSSSS";
            case 'p' -> "a";
            case 'b' -> "MMM";
            case 'B' -> "MMMM";
            case 'a' -> "EEE";
            case 'A' -> "EEEE";
            case 'j' -> "DDD";
            default -> null;
        };
    }
}
