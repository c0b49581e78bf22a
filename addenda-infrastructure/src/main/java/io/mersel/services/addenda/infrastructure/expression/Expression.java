package io.mersel.services.addenda.infrastructure.expression;

import io.mersel.services.addenda.application.enums.ExpressionKind;

/**
 * Expresión de plantilla ya clasificada. Se obtiene con {@link ExpressionClassifier#classify(String)}.
 */
public interface Expression {

    ExpressionKind kind();

    /** Texto original, sin llaves y sin espacios en los extremos. */
    String source();
}
