// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.exception;

/// A specific derived variable cannot be computed for this data, for example because the stored
/// fields it is composed from are absent or because it is measured relative to a data center that
/// was not supplied. Only the variable in question fails, siblings in the same request continue.
public class DerivedVariableException extends ProjectionException {

    public final String variableName;

    public DerivedVariableException (String variableName, String message) {
        super(String.format("Cannot derive '%s': %s", variableName, message));
        this.variableName = variableName;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.DERIVED_VARIABLE;
    }
}
