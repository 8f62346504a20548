// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.util;

/// Thrown when someone calls get() on an Err instead of an Ok variant of Ret, typically when asking
/// a MapResult for a variable whose computation failed. The message is the recorded error.
public class MissingReturnValueException extends RuntimeException {
    public MissingReturnValueException (String message) {
        super(message);
    }
}
