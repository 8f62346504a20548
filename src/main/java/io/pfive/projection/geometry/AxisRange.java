// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

import io.pfive.projection.exception.InvalidRequestException;

import javax.annotation.Nullable;

/// A selected interval along one axis, expressed as fractions of the box length in [0, 1].
/// Membership is half-open, except that a range reaching the upper box edge includes that edge,
/// so a record centered exactly on the far wall of the box is not lost.
public record AxisRange (double min, double max) {

    public static final AxisRange FULL = new AxisRange(0, 1);

    public AxisRange {
        if (!(min < max)) {
            throw new InvalidRequestException("Range must have positive width, got [%s, %s].".formatted(min, max));
        }
        if (min < 0 || max > 1) {
            throw new InvalidRequestException("Range [%s, %s] lies outside the box.".formatted(min, max));
        }
    }

    /// Convert a range given in user units, relative to a center also given in user units, into
    /// box fractions. Null bounds select the whole box on that side. Bounds beyond the box are
    /// clamped to the box, but the requested interval itself must not be empty or inverted.
    ///
    /// @param boxLengthInUnit the box length expressed in the same unit as the bounds and center.
    public static AxisRange fromUnits (@Nullable Double lower, @Nullable Double upper, double center,
                                       double boxLengthInUnit) {
        double min = (lower == null) ? 0 : (lower + center) / boxLengthInUnit;
        double max = (upper == null) ? 1 : (upper + center) / boxLengthInUnit;
        if (!(min < max)) {
            throw new InvalidRequestException(
                  "Range [%s, %s] around center %s is empty or inverted.".formatted(lower, upper, center));
        }
        min = Math.max(min, 0);
        max = Math.min(max, 1);
        if (!(min < max)) {
            throw new InvalidRequestException(
                  "Range [%s, %s] around center %s does not intersect the box.".formatted(lower, upper, center));
        }
        return new AxisRange(min, max);
    }

    public boolean contains (double fraction) {
        if (fraction < min) return false;
        return fraction < max || (max == 1 && fraction == 1);
    }

    public boolean isFull () {
        return min == 0 && max == 1;
    }

}
