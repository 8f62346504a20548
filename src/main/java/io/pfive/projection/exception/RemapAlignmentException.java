// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.exception;

/// The requested coarse resolution is not a power-of-two sub-multiple of the source map, or the
/// source map's pixels do not line up with whole coarse pixels.
public class RemapAlignmentException extends ProjectionException {
    public RemapAlignmentException (String message) {
        super("Remap: " + message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.REMAP_ALIGNMENT;
    }
}
