package com.ammann.trips.exception;

/**
 * Base unchecked exception for all application-level errors raised by the trip analytics core.
 *
 * <p>Subclasses separate rejected caller input ({@link ValidationException}) from broken
 * internal state ({@link InvariantViolationException}) so the request layer can report the
 * first to end users and treat the second as a server fault.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }
    public ApiException(String message) {
        super(message);
    }
}
