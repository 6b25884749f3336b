/* (C)2026 */
package com.ammann.ultrasonic.exception;

/**
 * Base unchecked exception for all fatal errors raised by the stress analysis pipeline.
 *
 * <p>Numeric edge cases (division by zero, non-finite input) are never reported
 * through this hierarchy; they are absorbed as missing-value sentinels. Subclasses
 * cover the conditions that abort a run before any output is produced and are mapped
 * to HTTP status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }

    public ApiException(Throwable cause) {
        super(cause);
    }
}
