// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/// Decides which pixels a record footprint contributes to, and with what share of its weight.
///
/// A record is selected when the center of its footprint lies inside the requested ranges on all
/// three axes, using the half-open membership of AxisRange. Selection never depends on how much of
/// the footprint lies inside a range. A selected record deposits its whole weight: if part of a
/// large cell hangs over the edge of the pixel window, the shares of the pixels it does cover are
/// scaled up so that they still add up to one. This keeps the total weight in a map equal to the
/// total weight of the selected records.
///
/// A footprint that covers a single pixel yields exactly one pair with fraction 1.0. Otherwise each
/// covered pixel receives the covered part of the footprint area divided by the in-window area,
/// which is 1/N^2 for a cell aligned over an N x N block of pixels.
public class LevelBinner {

    private final PixelGrid grid;
    private final BoxRanges ranges;
    private final Direction direction;
    private final double boxLength;

    public LevelBinner (PixelGrid grid, BoxRanges ranges, Direction direction, double boxLength) {
        this.grid = checkNotNull(grid);
        this.ranges = checkNotNull(ranges);
        this.direction = checkNotNull(direction);
        this.boxLength = boxLength;
    }

    public PixelGrid grid () {
        return grid;
    }

    /// @return true if the footprint center lies within the selected ranges on every axis.
    public boolean selects (Footprint footprint) {
        return ranges.get(direction.a).contains(footprint.a() / boxLength)
              && ranges.get(direction.b).contains(footprint.b() / boxLength)
              && ranges.get(direction.depth).contains(footprint.depth() / boxLength);
    }

    /// Emit every (pixel, fraction) pair for the footprint into the sink.
    /// @return the number of pairs emitted, zero if the record is not selected.
    public int bin (Footprint footprint, PixelFraction.Sink sink) {
        if (!selects(footprint)) return 0;
        double u = grid.pixelA(footprint.a(), boxLength);
        double v = grid.pixelB(footprint.b(), boxLength);
        double halfWidth = footprint.halfWidth() / boxLength * grid.res();
        // Footprints narrower than the snapping tolerance would collapse onto a pixel edge.
        if (footprint.isPoint() || halfWidth < PixelGrid.SNAP_TOLERANCE) {
            int x = pointIndex(PixelGrid.snap(u), grid.nx());
            int y = pointIndex(PixelGrid.snap(v), grid.ny());
            if (x < 0 || y < 0) return 0;
            sink.accept(grid.flatIndex(x, y), 1.0);
            return 1;
        }
        // Edges that are pixel edges up to rounding are moved onto them, so no sliver of a
        // footprint reaches a neighbouring pixel.
        double loA = Math.max(PixelGrid.snap(u - halfWidth), 0);
        double hiA = Math.min(PixelGrid.snap(u + halfWidth), grid.nx());
        double loB = Math.max(PixelGrid.snap(v - halfWidth), 0);
        double hiB = Math.min(PixelGrid.snap(v + halfWidth), grid.ny());
        if (!(loA < hiA && loB < hiB)) return 0;
        int x0 = (int) Math.floor(loA);
        int x1 = Math.min((int) Math.ceil(hiA), grid.nx()) - 1;
        int y0 = (int) Math.floor(loB);
        int y1 = Math.min((int) Math.ceil(hiB), grid.ny()) - 1;
        if (x0 == x1 && y0 == y1) {
            sink.accept(grid.flatIndex(x0, y0), 1.0);
            return 1;
        }
        double area = (hiA - loA) * (hiB - loB);
        int emitted = 0;
        for (int y = y0; y <= y1; y++) {
            double overlapB = Math.min(hiB, y + 1) - Math.max(loB, y);
            if (overlapB <= 0) continue;
            for (int x = x0; x <= x1; x++) {
                double overlapA = Math.min(hiA, x + 1) - Math.max(loA, x);
                if (overlapA <= 0) continue;
                sink.accept(grid.flatIndex(x, y), overlapA * overlapB / area);
                emitted += 1;
            }
        }
        return emitted;
    }

    /// Convenience form of bin() that collects the pairs, mostly for tests and diagnostics.
    public List<PixelFraction> bin (Footprint footprint) {
        List<PixelFraction> fractions = new ArrayList<>();
        bin(footprint, (pixel, fraction) -> fractions.add(new PixelFraction(pixel, fraction)));
        return fractions;
    }

    /// A point exactly on the far edge of the window belongs to the last pixel.
    private static int pointIndex (double coordinate, int n) {
        int i = (int) Math.floor(coordinate);
        if (i == n && coordinate == n) i = n - 1;
        if (i < 0 || i >= n) return -1;
        return i;
    }

}
