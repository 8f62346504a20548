// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import io.pfive.projection.geometry.PixelGrid;

/// The area covered by a map on the projection plane, along the horizontal (a) and vertical (b)
/// axes of the map. Width and height are always positive.
public record Extent (double minA, double maxA, double minB, double maxB) {

    /// The extent in code units of the pixel window of the given grid.
    public static Extent of (PixelGrid grid, double boxLength) {
        return new Extent(grid.minA(boxLength), grid.maxA(boxLength), grid.minB(boxLength), grid.maxB(boxLength));
    }

    public double width () {
        return maxA - minA;
    }

    public double height () {
        return maxB - minB;
    }

    /// Width divided by height.
    public double ratio () {
        return width() / height();
    }

    /// Express this extent relative to a point on the plane.
    public Extent relativeTo (double a, double b) {
        return new Extent(minA - a, maxA - a, minB - b, maxB - b);
    }

    public Extent scale (double factor) {
        return new Extent(minA * factor, maxA * factor, minB * factor, maxB * factor);
    }

    public double[] toArray () {
        return new double[] {minA, maxA, minB, maxB};
    }

}
