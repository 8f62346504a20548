// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.accumulate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/// Folds (pixel, value, weight, fraction) contributions into an AccumulatorBuffer and turns the
/// sums into per-pixel results. Every contribution adds `value * weight * fraction` to the weighted
/// sum and `weight * fraction` to the weight sum, so the order of contributions only affects
/// floating point rounding.
///
/// Dispersions keep a weighted running mean and a sum of squared deviations from it, updated one
/// contribution at a time (West's weighted form of Welford's method). A pixel whose contributions
/// are all equal has a dispersion of exactly zero.
///
/// Pixels that received no weight finalize to NaN, whatever the finalization.
public class WeightedAccumulator {

    private final AccumulatorBuffer buffer;

    public WeightedAccumulator (int nPixels, boolean moments) {
        this.buffer = new AccumulatorBuffer(nPixels, moments);
    }

    public AccumulatorBuffer buffer () {
        return buffer;
    }

    public void add (int pixel, double value, double weight, double fraction) {
        checkContribution(pixel, weight, fraction);
        double w = weight * fraction;
        buffer.weightedSum[pixel] += value * w;
        buffer.weightSum[pixel] += w;
    }

    /// Add a contribution to the mean and to the centred square sum, for dispersion variables.
    public void addMoments (int pixel, double value, double weight, double fraction) {
        checkArgument(buffer.hasMoments(), "This accumulator does not track second moments.");
        checkContribution(pixel, weight, fraction);
        double w = weight * fraction;
        if (w == 0) return;
        buffer.weightedSum[pixel] += value * w;
        double total = buffer.weightSum[pixel] + w;
        double delta = value - buffer.runningMean[pixel];
        buffer.runningMean[pixel] += delta * (w / total);
        buffer.centredSquareSum[pixel] += w * delta * (value - buffer.runningMean[pixel]);
        buffer.weightSum[pixel] = total;
    }

    private void checkContribution (int pixel, double weight, double fraction) {
        checkElementIndex(pixel, buffer.nPixels(), "Pixel index");
        checkArgument(weight >= 0 && Double.isFinite(weight), "Weight must be finite and non-negative, got %s.", weight);
        checkArgument(fraction >= 0 && fraction <= 1, "Pixel fraction must be in [0, 1], got %s.", fraction);
    }

    /// @return the weighted mean of all contributions in each pixel.
    public double[] finalizeMean () {
        return meanOf(buffer.weightedSum);
    }

    /// @return the incrementally updated weighted mean in each pixel. Equal to finalizeMean() up to
    /// rounding, and exactly the common value where all contributions are equal.
    public double[] finalizeRunningMean () {
        checkArgument(buffer.hasMoments(), "This accumulator does not track second moments.");
        double[] result = new double[buffer.nPixels()];
        for (int i = 0; i < result.length; i++) {
            result[i] = buffer.weightSum[i] > 0 ? buffer.runningMean[i] : Double.NaN;
        }
        return result;
    }

    /// @return the weighted (population) variance of contributions in each pixel.
    public double[] finalizeVariance () {
        checkArgument(buffer.hasMoments(), "This accumulator does not track second moments.");
        return meanOf(buffer.centredSquareSum);
    }

    /// @return the weighted standard deviation of contributions in each pixel.
    public double[] finalizeDispersion () {
        return dispersion(finalizeVariance());
    }

    /// @return the plain weighted sum in each pixel.
    public double[] finalizeSum () {
        double[] result = new double[buffer.nPixels()];
        for (int i = 0; i < result.length; i++) {
            result[i] = buffer.weightSum[i] > 0 ? buffer.weightedSum[i] : Double.NaN;
        }
        return result;
    }

    private double[] meanOf (double[] sums) {
        double[] result = new double[buffer.nPixels()];
        for (int i = 0; i < result.length; i++) {
            double w = buffer.weightSum[i];
            result[i] = w > 0 ? sums[i] / w : Double.NaN;
        }
        return result;
    }

    /// Square roots of per-pixel variances. Rounding can leave a variance a few ulps below zero,
    /// which is clamped.
    public static double[] dispersion (double[] variance) {
        double[] result = new double[variance.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = dispersion(variance[i]);
        }
        return result;
    }

    public static double dispersion (double variance) {
        if (Double.isNaN(variance)) return Double.NaN;
        return Math.sqrt(Math.max(variance, 0));
    }

}
