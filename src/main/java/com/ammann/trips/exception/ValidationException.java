package com.ammann.trips.exception;

/**
 * Exception indicating that a caller-supplied parameter or dataset does not meet
 * the constraints of the requested analytics operation.
 *
 * <p>Raised before any algorithm runs; input is never silently coerced.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a malformed element inside an input sequence.
     */
    public static ValidationException invalidElement(String sequenceName, int index, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid %s at index %d: got '%s', expected %s",
                        sequenceName, index, value, expected));
    }
}
