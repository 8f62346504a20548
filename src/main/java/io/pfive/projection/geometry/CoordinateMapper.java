// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

import io.pfive.projection.record.Record;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Places records on the projection plane. Instances are immutable and hold no per-record state,
/// so one mapper is shared by every worker of a projection call.
///
/// Footprints are in code units measured from the box origin, which is what range selection and
/// pixel binning work with. The map center is only applied when reporting positions relative to it.
public class CoordinateMapper {

    public final Direction direction;
    public final double boxLength;
    /// Map center in code units, indexed by Axis ordinal.
    private final double[] center;

    public CoordinateMapper (Direction direction, double boxLength, double[] center) {
        checkNotNull(direction);
        checkArgument(boxLength > 0, "Box length must be positive.");
        checkArgument(center.length == 3, "Center must have three coordinates.");
        this.direction = direction;
        this.boxLength = boxLength;
        this.center = center.clone();
    }

    public Footprint map (Record record) {
        double a = record.center(direction.a, boxLength);
        double b = record.center(direction.b, boxLength);
        double depth = record.center(direction.depth, boxLength);
        return new Footprint(a, b, record.size(boxLength) / 2, depth);
    }

    /// Map center along the horizontal map axis, in code units.
    public double centerA () {
        return center[direction.a.ordinal()];
    }

    public double centerB () {
        return center[direction.b.ordinal()];
    }

    /// The footprint's in-plane position relative to the map center, as {a, b}.
    public double[] relativeToCenter (Footprint footprint) {
        return new double[] {footprint.a() - centerA(), footprint.b() - centerB()};
    }

}
