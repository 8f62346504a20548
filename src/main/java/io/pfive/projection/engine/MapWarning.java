// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

/// A non-fatal problem with one variable of a MapResult. The map for that variable is still present.
public record MapWarning (String variable, Kind kind, String message) {

    public enum Kind {
        /// No record contributed to the map, so every pixel is NaN.
        EMPTY_RESULT
    }

    public static MapWarning emptyResult (String variable) {
        return new MapWarning(variable, Kind.EMPTY_RESULT,
              "No records contributed to '%s' after range selection and masking.".formatted(variable));
    }

}
