// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.record;

import io.pfive.projection.geometry.Axis;

/// One immutable simulation record, either an AMR cell or a particle. The projection engine is
/// written once against this interface: it needs a position along each axis, the side length of
/// the square the record covers on the projection plane, field values by schema index, and a
/// mass equivalent used as the default weight.
public interface Record {

    /// Coordinate of the record's center along the given axis, in code units.
    double center (Axis axis, double boxLength);

    /// Side length of the cube this record fills. Zero for point-like records.
    double size (double boxLength);

    /// Value of the stored field at the given FieldSchema index.
    double field (int index);

    /// Mass carried by this record, computed from the field at massFieldIndex.
    double massEquivalent (int massFieldIndex, double boxLength);

}
