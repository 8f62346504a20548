// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.util;

import java.util.function.Function;

/// The outcome of computing one variable's map, containing either the map or an error.
///
/// Java has Optional, which is just like null in that it doesn't tell you why the object is not
/// present. A projection request for several variables can partially succeed, so every variable
/// carries one of these: an Ok wrapping the finished map, or an Err explaining what went wrong for
/// that variable alone. Callers must check which one they have rather than assume every requested
/// variable is present.
///
/// Ok and Err are subclasses of abstract Ret as this avoids having an empty field in every
/// instance.
public abstract class Ret<T> {

    public boolean isErr () {
        return false;
    }

    public boolean isOk () {
        return false;
    }

    /// If the return value is Ok, returns the value. If it is an error, throw an exception.
    public final T get () {
        return getOrThrow(MissingReturnValueException::new);
    }

    public abstract T getOrThrow (Function<String, RuntimeException> exceptionFactory);

    /// Returns the error message. Will throw an exception if a return value is present instead of error.
    public abstract String errorMessage ();

    // Convenience factory methods to allow static imports and creating return values without using the 'new' operator.
    // That is: return ok(x); or return err("Description"); rather than return new Ret.Ok<>(x);

    public static <T> Ok<T> ok (T result) {
        return new Ok<>(result);
    }

    public static <T> Err<T> err (String message) {
        return new Err<>(message, null);
    }

    /// Keep the exception that caused the failure, so callers can inspect its type.
    public static <T> Err<T> err (Throwable cause) {
        String message = cause.getMessage() == null ? cause.toString() : cause.getMessage();
        return new Err<>(message, cause);
    }

    /// An Ok or Err instance should never wrap a null reference. The whole point is to eliminate
    /// null references.
    private static void checkNotNull (Object o) {
        if (o == null) {
            throw new IllegalArgumentException("Supplied result or error must not be null.");
        }
    }

    // Java already defines an Error type, which essentially means "very bad exception you should not catch".
    // Use a different name (Err), scoped as an inner class of Ret to avoid confusion with this Error type.

    public static class Err<T> extends Ret<T> {
        public final String message; // Cannot be null.
        public final Throwable cause; // May be null when the error was not caused by an exception.

        public Err (String message, Throwable cause) {
            checkNotNull(message);
            this.message = message;
            this.cause = cause;
        }

        @Override
        public boolean isErr () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            throw exceptionFactory.apply(message);
        }

        @Override
        public String errorMessage () {
            return message;
        }

        @Override
        public String toString () {
            return "Err<%s>".formatted(message);
        }
    }

    public static class Ok<T> extends Ret<T> {
        public final T result; // Cannot be null.

        public Ok (T result) {
            checkNotNull(result);
            this.result = result;
        }

        @Override
        public boolean isOk () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, RuntimeException> exceptionFactory) {
            return result;
        }

        @Override
        public String errorMessage () {
            throw new IllegalStateException("This is not an error, so has no error message.");
        }

        @Override
        public String toString () {
            return "Ok<%s>".formatted(result.toString());
        }
    }

}
