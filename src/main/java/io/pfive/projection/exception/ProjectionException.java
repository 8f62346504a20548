// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.exception;

/// Superclass for all exceptions representing problems with a projection or remap call. Each
/// carries an ErrorType so callers that only need to distinguish whole-call failures from
/// per-variable failures can switch on the type rather than on exception classes. Request
/// validation failures abort the whole call, while derived variable failures are caught at the
/// worker boundary and recorded against a single variable.
public abstract class ProjectionException extends RuntimeException {

    public ProjectionException (String message) {
        super(message);
    }

    public ProjectionException (String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorType errorType ();

    public enum ErrorType {
        REQUEST(true),
        DERIVED_VARIABLE(false),
        REMAP_ALIGNMENT(true);
        /// Whether this kind of error fails the whole call rather than one variable.
        public final boolean fatal;
        ErrorType (boolean fatal) {
            this.fatal = fatal;
        }
    }
}
