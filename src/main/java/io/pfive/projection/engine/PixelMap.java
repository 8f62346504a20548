// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import io.pfive.projection.geometry.PixelGrid;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// The finished map of one variable, in output units, with NaN in pixels nothing contributed to.
///
/// Besides the values, a map keeps what is needed to coarsen it later without the source records:
/// the total weight in each pixel for weighted means, and for dispersions the weighted mean and
/// variance of the base variable. Weights and moments are in code units. Surface density and
/// summed maps carry no weights.
///
/// Arrays are copied on the way in and on the way out, so instances can be shared between threads.
public class PixelMap {

    public final String variable;
    public final String unit;
    /// Multiplier that was applied to code-unit results to express them in the output unit.
    public final double unitFactor;
    public final AggregationMode mode;
    public final PixelGrid grid;
    /// Number of records that deposited into this map.
    public final int recordCount;

    private final double[] values;
    private final double[] weights;
    private final double[] mean;
    private final double[] variance;

    public PixelMap (String variable, String unit, double unitFactor, AggregationMode mode, PixelGrid grid,
                     int recordCount, double[] values, @Nullable double[] weights,
                     @Nullable double[] mean, @Nullable double[] variance) {
        this.variable = checkNotNull(variable);
        this.unit = checkNotNull(unit);
        this.unitFactor = unitFactor;
        this.mode = checkNotNull(mode);
        this.grid = checkNotNull(grid);
        this.recordCount = recordCount;
        checkArgument(values.length == grid.nElements(), "Values do not match the pixel grid.");
        checkArgument(weights == null || weights.length == values.length, "Weights do not match values.");
        checkArgument((mean == null) == (variance == null), "Moments must be given together.");
        checkArgument(mean == null || weights != null, "Moments are only meaningful with weights.");
        this.values = values.clone();
        this.weights = copy(weights);
        this.mean = copy(mean);
        this.variance = copy(variance);
    }

    private static double[] copy (@Nullable double[] array) {
        return array == null ? null : array.clone();
    }

    public int nx () {
        return grid.nx();
    }

    public int ny () {
        return grid.ny();
    }

    public double value (int x, int y) {
        return values[grid.flatIndex(x, y)];
    }

    /// @return a copy of the values in the flat layout of the grid, row by row.
    public double[] values () {
        return values.clone();
    }

    /// @return the values as rows, indexed [y][x] with y along the vertical map axis.
    public double[][] toArray () {
        double[][] rows = new double[grid.ny()][grid.nx()];
        for (int y = 0; y < grid.ny(); y++) {
            System.arraycopy(values, y * grid.nx(), rows[y], 0, grid.nx());
        }
        return rows;
    }

    public boolean hasWeights () {
        return weights != null;
    }

    public @Nullable double[] weights () {
        return copy(weights);
    }

    public boolean hasMoments () {
        return mean != null;
    }

    /// Weighted mean of the base variable of a dispersion, in code units.
    public @Nullable double[] mean () {
        return copy(mean);
    }

    /// Weighted variance of the base variable of a dispersion, in squared code units.
    public @Nullable double[] variance () {
        return copy(variance);
    }

    public boolean isEmpty () {
        return recordCount == 0;
    }

    /// Sum of the retained pixel weights, or NaN for maps without weights.
    public double totalWeight () {
        if (weights == null) return Double.NaN;
        double total = 0;
        for (double w : weights) total += w;
        return total;
    }

    @Override
    public String toString () {
        return "PixelMap[%s (%s) %dx%d %s]".formatted(variable, unit, grid.nx(), grid.ny(), mode);
    }
}
