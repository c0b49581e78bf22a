package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.ValueFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

@DisplayName("ValueFormatter")
class ValueFormatterTest {

    @Test
    @DisplayName("toText: null, booleanos y BigDecimal")
    void to_text() {
        assertThat(ValueFormatter.toText(null)).isEmpty();
        assertThat(ValueFormatter.toText(Boolean.TRUE)).isEqualTo("true");
        assertThat(ValueFormatter.toText(new BigDecimal("1E+3"))).isEqualTo("1000");
        assertThat(ValueFormatter.toText(42)).isEqualTo("42");
    }

    @ParameterizedTest(name = "{0} | {1}:{2} → {3}")
    @DisplayName("Formatos reconocidos")
    @CsvSource(delimiter = ';', value = {
            "juan pérez;     TITLE;    ;          Juan Pérez",
            "abc;            UPPERCASE;;          ABC",
            "ABC;            LOWERCASE;;          abc",
            "1234.5;         NUMBER;   ;          1234.50",
            "2.345;          NUMBER;   1;         2.3",
            "2.355;          NUMBER;   2;         2.36",
            "1234567.891;    CURRENCY; ;          $1,234,567.89",
            "1500;           CURRENCY; USD;       USD1,500.00",
            "2025-07-20;     DATE;     ;          2025-07-20",
            "2025-07-20T10:15:00; DATE; %d/%m/%Y %H:%M; 20/07/2025 10:15",
            "20/07/2025;     DATE;     %Y%m%d;    20250720",
            "mañana;         DATE;     ;          mañana",
            "n/a;            NUMBER;   ;          n/a",
            "31/02/2024;     DATE;     ;          31/02/2024",
            "2024-02-30;     DATE;     ;          2024-02-30",
            "29/02/2024;     DATE;     ;          2024-02-29"
    })
    void formatos(String value, ValueFormat format, String argument, String expected) {
        assertThat(ValueFormatter.format(value, format, argument)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Fecha nativa con nombre de mes en inglés")
    void fecha_nativa() {
        assertThat(ValueFormatter.format(LocalDate.of(2025, 7, 20), ValueFormat.DATE, "%d %b %Y"))
                .isEqualTo("20 Jul 2025");
    }

    @Test
    @DisplayName("toNumber ignora texto no numérico")
    void to_number() {
        assertThat(ValueFormatter.toNumber(" 10.50 ")).contains(new BigDecimal("10.50"));
        assertThat(ValueFormatter.toNumber("diez")).isEmpty();
        assertThat(ValueFormatter.toNumber(true)).isEmpty();
    }

    @Test
    @DisplayName("Precisión o escala fuera de rango se trata como no numérico")
    void numero_fuera_de_rango() {
        assertThat(ValueFormatter.toNumber("1E200000000")).isEmpty();
        assertThat(ValueFormatter.toNumber("1E-200000000")).isEmpty();
        assertThat(ValueFormatter.toNumber(new BigDecimal("1E200000000"))).isEmpty();
        assertThat(ValueFormatter.toNumber("1E+999")).isPresent();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertThat(ValueFormatter.format("1E200000000", ValueFormat.NUMBER, null)).isEqualTo("1E200000000");
            assertThat(ValueFormatter.format("1E200000000", ValueFormat.CURRENCY, null)).isEqualTo("1E200000000");
            assertThat(ValueFormatter.toText(new BigDecimal("1E200000000"))).isEqualTo("1E+200000000");
        });
    }
}
