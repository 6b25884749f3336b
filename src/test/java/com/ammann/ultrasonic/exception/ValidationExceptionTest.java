/* (C)2026 */
package com.ammann.ultrasonic.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationExceptionTest
{

    @Test
    void invalidParameterNamesValueAndExpectation()
    {
        ValidationException e = ValidationException.invalidParameter("thicknessMm", -1.0, "positive value");

        assertThat(e.getMessage()).isEqualTo("Invalid parameter 'thicknessMm': got '-1.0', expected positive value");
    }

    @Test
    void missingParameterNamesContext()
    {
        ValidationException e = ValidationException.missingParameter("roi", "region-of-interest reference mode");

        assertThat(e.getMessage()).contains("'roi'").contains("region-of-interest reference mode");
    }

    @Test
    void insufficientDataReportsCounts()
    {
        ValidationException e = ValidationException.insufficientData("points", 3, 2);

        assertThat(e.getMessage()).isEqualTo("Insufficient points: need at least 3, but got 2");
        assertThat(e).isInstanceOf(ApiException.class);
    }
}
