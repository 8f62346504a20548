// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.record;

import io.pfive.projection.geometry.Axis;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/// An AMR cell at a given refinement level. Grid addresses are one-based within their level, so
/// along each axis the cell spans `[(i - 1) * size, i * size]` and its center is at
/// `(i - 0.5) * size`, where `size = boxLength / 2^level`.
public final class CellRecord implements Record {

    public final int level;
    public final int cx;
    public final int cy;
    public final int cz;
    private final double[] fields;

    public CellRecord (int level, int cx, int cy, int cz, double... fields) {
        checkArgument(level >= 0 && level < 31, "Level out of range: %s", level);
        int n = 1 << level;
        checkArgument(cx >= 1 && cx <= n && cy >= 1 && cy <= n && cz >= 1 && cz <= n,
              "Cell address (%s, %s, %s) outside level %s grid.", cx, cy, cz, level);
        this.level = level;
        this.cx = cx;
        this.cy = cy;
        this.cz = cz;
        this.fields = fields.clone();
    }

    public int address (Axis axis) {
        return switch (axis) {
            case X -> cx;
            case Y -> cy;
            case Z -> cz;
        };
    }

    @Override
    public double center (Axis axis, double boxLength) {
        return (address(axis) - 0.5) * size(boxLength);
    }

    @Override
    public double size (double boxLength) {
        return boxLength / (1 << level);
    }

    @Override
    public double field (int index) {
        return fields[index];
    }

    @Override
    public double massEquivalent (int massFieldIndex, double boxLength) {
        double size = size(boxLength);
        return fields[massFieldIndex] * size * size * size;
    }

    @Override
    public String toString () {
        return "Cell[L%d (%d,%d,%d) %s]".formatted(level, cx, cy, cz, Arrays.toString(fields));
    }
}
