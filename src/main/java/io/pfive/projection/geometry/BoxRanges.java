// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

import static com.google.common.base.Preconditions.checkNotNull;

/// The selected sub-volume of the box, one AxisRange per principal axis.
public record BoxRanges (AxisRange x, AxisRange y, AxisRange z) {

    public static final BoxRanges FULL = new BoxRanges(AxisRange.FULL, AxisRange.FULL, AxisRange.FULL);

    public BoxRanges {
        checkNotNull(x);
        checkNotNull(y);
        checkNotNull(z);
    }

    public AxisRange get (Axis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }

}
