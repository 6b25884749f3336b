/* (C)2026 */
package com.ammann.ultrasonic.exception;

/**
 * Raised by a scattered-data interpolator when the input points span no area
 * (fewer than three distinct positions, or all positions on one line).
 *
 * <p>Recovered by the interpolation service and reported as an unavailable grid;
 * never surfaced to API clients.
 */
public class DegenerateGeometryException extends ApiException
{
    public DegenerateGeometryException(String message)
    {
        super(message);
    }
}
