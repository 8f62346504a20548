// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.exception;

/// Throw this to reject a malformed or contradictory request before any accumulation begins.
public class InvalidRequestException extends ProjectionException {
    public InvalidRequestException (String message) {
        super("Invalid request: " + message);
    }

    public InvalidRequestException (String message, Throwable cause) {
        super("Invalid request: " + message, cause);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.REQUEST;
    }

}
