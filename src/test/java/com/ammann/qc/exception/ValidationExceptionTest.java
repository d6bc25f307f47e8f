/* (C)2026 */
package com.ammann.qc.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ValidationExceptionTest {

    @Test
    void insufficientDataFormatsCounts() {
        ValidationException exception = ValidationException.insufficientData("measurements", 1, 0);

        assertThat(exception)
                .isInstanceOf(ApiException.class)
                .hasMessage("Insufficient measurements: need at least 1, but got 0");
    }

    @Test
    void invalidParameterNamesParameterAndExpectation() {
        ValidationException exception =
                ValidationException.invalidParameter("ewmaLambda", 1.5, "value in (0, 1]");

        assertThat(exception.getMessage())
                .isEqualTo("Invalid parameter 'ewmaLambda': got '1.5', expected value in (0, 1]");
    }

    @Test
    void keepsCause() {
        IllegalArgumentException cause = new IllegalArgumentException("root");

        assertThat(new ValidationException("wrapped", cause)).hasCause(cause);
    }
}
