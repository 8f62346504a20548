// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.variable;

/// How the per-record value of a variable is obtained and how its map is finalized.
public enum VariableKind {
    /// A field read directly from each record.
    STORED,
    /// Computed per record from stored fields alone.
    DERIVED,
    /// Computed per record from stored fields and the position of the data center.
    CENTER_RELATIVE,
    /// The weighted standard deviation of a base variable, from its first and second moments.
    DISPERSION,
    /// Mass deposited in each pixel divided by the pixel area.
    SURFACE_DENSITY;

    public boolean needsDataCenter () {
        return this == CENTER_RELATIVE;
    }
}
