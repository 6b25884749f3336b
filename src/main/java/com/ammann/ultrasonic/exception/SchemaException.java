/* (C)2026 */
package com.ammann.ultrasonic.exception;

import com.ammann.ultrasonic.enumeration.MeasurementMode;
import java.util.List;

/**
 * Exception indicating that an input table lacks columns required by the selected
 * measurement mode.
 *
 * <p>Raised before any computation starts. Mapped to HTTP 400 with code
 * {@code SCHEMA_ERROR} by {@link GlobalExceptionHandler}.
 */
public class SchemaException extends ApiException {

    private final List<String> missingColumns;

    public SchemaException(MeasurementMode mode, List<String> missingColumns) {
        super(String.format("Missing columns for %s mode: %s", mode, missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
