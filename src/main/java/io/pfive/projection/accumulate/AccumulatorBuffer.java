// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.accumulate;

import static com.google.common.base.Preconditions.checkArgument;

/// Parallel arrays of running sums for one variable over the pixels of a map, in the flat layout of
/// PixelGrid. The running mean and the centred square sum are only present for variables finalized
/// as a dispersion, and are null otherwise. Each buffer is written by exactly one worker and is
/// never shared while being filled.
///
/// The arrays are exposed directly as the inner accumulation loop touches them for every pixel of
/// every record. Nothing outside the accumulate package should write to them.
public class AccumulatorBuffer {
    public final double[] weightedSum;
    public final double[] weightSum;
    /// Weighted mean of the contributions so far, updated incrementally.
    public final double[] runningMean;
    /// Weighted sum of squared deviations from the running mean.
    public final double[] centredSquareSum;

    public AccumulatorBuffer (int nPixels, boolean moments) {
        checkArgument(nPixels > 0, "Buffer must have at least one pixel.");
        this.weightedSum = new double[nPixels];
        this.weightSum = new double[nPixels];
        this.runningMean = moments ? new double[nPixels] : null;
        this.centredSquareSum = moments ? new double[nPixels] : null;
    }

    public int nPixels () {
        return weightSum.length;
    }

    public boolean hasMoments () {
        return centredSquareSum != null;
    }

    public double totalWeight () {
        double total = 0;
        for (double w : weightSum) total += w;
        return total;
    }

}
