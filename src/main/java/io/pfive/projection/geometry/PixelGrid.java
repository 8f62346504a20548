// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

import static com.google.common.base.Preconditions.checkArgument;

/// A window onto a uniform global grid of res x res pixels spanning the whole box face. The window
/// starts at pixel (offsetA, offsetB) of the global grid and is nx pixels wide and ny high. Keeping
/// the global resolution and offsets, rather than just a bounding box, lets a finished map be
/// coarsened by whole blocks of pixels and compared with maps projected directly at lower
/// resolution.
///
/// Pixel values are stored in flat arrays, row by row along the vertical (b) axis.
public record PixelGrid (int res, int offsetA, int offsetB, int nx, int ny) {

    /// Offsets within this many pixels of an integer are treated as that integer, so that ranges
    /// computed through unit conversions still land on pixel edges.
    static final double SNAP_TOLERANCE = 1e-9;

    public PixelGrid {
        checkArgument(res > 0, "Resolution must be positive.");
        checkArgument(nx > 0 && ny > 0, "Pixel grid must have positive dimensions.");
        checkArgument(offsetA >= 0 && offsetA + nx <= res, "Horizontal pixel window outside the box.");
        checkArgument(offsetB >= 0 && offsetB + ny <= res, "Vertical pixel window outside the box.");
    }

    /// The smallest window of the global res x res grid that contains both ranges.
    public static PixelGrid covering (int res, AxisRange rangeA, AxisRange rangeB) {
        int r1 = snapFloor(rangeA.min() * res);
        int r2 = snapCeil(rangeA.max() * res);
        int r3 = snapFloor(rangeB.min() * res);
        int r4 = snapCeil(rangeB.max() * res);
        return new PixelGrid(res, r1, r3, Math.max(r2 - r1, 1), Math.max(r4 - r3, 1));
    }

    private static int snapFloor (double v) {
        return (int) Math.floor(snap(v));
    }

    private static int snapCeil (double v) {
        return (int) Math.ceil(snap(v));
    }

    /// @return the nearest integer if v is within SNAP_TOLERANCE of it, otherwise v unchanged.
    static double snap (double v) {
        double r = Math.rint(v);
        return Math.abs(v - r) < SNAP_TOLERANCE ? r : v;
    }

    public int nElements () {
        return nx * ny;
    }

    /// Does not perform range checks, for use in constrained iteration over provably safe ranges.
    public int flatIndex (int x, int y) {
        return y * nx + x;
    }

    public int xForFlatIndex (int flatIndex) {
        return flatIndex % nx;
    }

    public int yForFlatIndex (int flatIndex) {
        return flatIndex / nx;
    }

    /// Side length of one pixel in code units.
    public double pixelSize (double boxLength) {
        return boxLength / res;
    }

    public double pixelArea (double boxLength) {
        double size = pixelSize(boxLength);
        return size * size;
    }

    /// Continuous horizontal pixel coordinate of a position in code units, relative to this window.
    public double pixelA (double a, double boxLength) {
        return a / boxLength * res - offsetA;
    }

    public double pixelB (double b, double boxLength) {
        return b / boxLength * res - offsetB;
    }

    public double minA (double boxLength) { return offsetA * pixelSize(boxLength); }
    public double maxA (double boxLength) { return (offsetA + nx) * pixelSize(boxLength); }
    public double minB (double boxLength) { return offsetB * pixelSize(boxLength); }
    public double maxB (double boxLength) { return (offsetB + ny) * pixelSize(boxLength); }

    public boolean isPowerOfTwo () {
        return Integer.bitCount(res) == 1;
    }

    /// The refinement depth this grid corresponds to. Only meaningful when isPowerOfTwo().
    public int depth () {
        checkArgument(isPowerOfTwo(), "Resolution %s is not a power of two.", res);
        return Integer.numberOfTrailingZeros(res);
    }

    /// True if every edge of this window falls on a boundary between blocks of factor x factor pixels.
    public boolean alignedTo (int factor) {
        return offsetA % factor == 0 && offsetB % factor == 0
              && (offsetA + nx) % factor == 0 && (offsetB + ny) % factor == 0;
    }

    /// Returns a grid covering the same area with pixels factor times larger on each side.
    public PixelGrid coarsen (int factor) {
        checkArgument(factor > 0 && res % factor == 0, "Factor %s does not divide resolution %s.", factor, res);
        checkArgument(alignedTo(factor), "Pixel window is not aligned to blocks of %s.", factor);
        return new PixelGrid(res / factor, offsetA / factor, offsetB / factor, nx / factor, ny / factor);
    }

}
