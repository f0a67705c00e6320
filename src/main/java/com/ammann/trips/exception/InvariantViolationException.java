/* (C)2026 */
package com.ammann.trips.exception;

/**
 * Internal error raised when a data structure detects that its own ordering or size
 * invariant no longer holds.
 *
 * <p>Unreachable in a correct implementation. The affected computation is aborted rather
 * than returning a silently wrong result.
 */
public class InvariantViolationException extends ApiException
{
    public InvariantViolationException(String structure, String detail)
    {
        super(String.format("%s invariant violated: %s", structure, detail));
    }
}
