// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.record;

/// The two kinds of simulation records the engine can project. They differ in the field that
/// carries their mass (density for cells, which must be multiplied by the cell volume) and in
/// whether they cover an area on the projection plane.
public enum RecordKind {
    CELL("rho"),
    PARTICLE("mass");

    /// Name of the stored field from which the mass equivalent of one record is computed.
    public final String massField;

    RecordKind (String massField) {
        this.massField = massField;
    }
}
