// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

/// One coordinate of the map center: either the middle of the box along that axis, or an explicit
/// value in the range unit of the request. Each axis is resolved independently.
public record CenterCoordinate (boolean atBoxCenter, double value) {

    private static final CenterCoordinate BOX_CENTER = new CenterCoordinate(true, Double.NaN);

    public static CenterCoordinate boxCenter () {
        return BOX_CENTER;
    }

    public static CenterCoordinate of (double value) {
        return new CenterCoordinate(false, value);
    }

    /// @return the coordinate in the same unit as boxLengthInUnit.
    public double resolve (double boxLengthInUnit) {
        return atBoxCenter ? boxLengthInUnit / 2 : value;
    }

    @Override
    public String toString () {
        return atBoxCenter ? "boxcenter" : Double.toString(value);
    }
}
