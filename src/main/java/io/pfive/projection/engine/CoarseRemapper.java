// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import com.google.common.collect.ImmutableMap;
import io.pfive.projection.accumulate.WeightedAccumulator;
import io.pfive.projection.exception.RemapAlignmentException;
import io.pfive.projection.geometry.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// Re-bins the finished maps of a MapResult onto the grid of a coarser refinement depth, using only
/// the values, weights and moments kept in each PixelMap. Each coarse pixel combines a block of
/// f x f fine pixels, where f = 2^(L - L') for source depth L and target depth L'.
///
/// Weighted means are recombined with the fine pixel weights, which gives the same result as
/// projecting directly at the coarse depth whenever record footprints line up with coarse pixels.
/// Dispersions merge the means and variances of their fine pixels with the parallel form of the
/// weighted variance update, so a block of pixels that all hold the same value stays at exactly
/// zero. Maps without
/// weights are averaged over their finite pixels, and summed maps are block sums. A coarse pixel
/// with no contributing fine pixel is NaN.
public class CoarseRemapper {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public MapResult remap (MapResult result, int targetDepth) {
        PixelGrid fine = result.grid;
        if (!fine.isPowerOfTwo()) {
            throw new RemapAlignmentException("source resolution %d is not a power of two.".formatted(fine.res()));
        }
        int sourceDepth = fine.depth();
        if (targetDepth < 0 || targetDepth > sourceDepth) {
            throw new RemapAlignmentException("target depth %d must be between 0 and source depth %d."
                  .formatted(targetDepth, sourceDepth));
        }
        int factor = 1 << (sourceDepth - targetDepth);
        if (!fine.alignedTo(factor)) {
            throw new RemapAlignmentException(("map window at offset (%d, %d) of size %dx%d does not fall on whole "
                  + "pixels of depth %d.").formatted(fine.offsetA(), fine.offsetB(), fine.nx(), fine.ny(), targetDepth));
        }
        PixelGrid coarse = fine.coarsen(factor);
        var maps = ImmutableMap.<String, PixelMap>builder();
        result.maps().forEach((name, map) -> maps.put(name, remapOne(map, coarse, factor)));
        LOG.debug("Remapped {} maps from depth {} to {}.", result.maps().size(), sourceDepth, targetDepth);
        return result.withCoarseMaps(new CoarseMaps(targetDepth, coarse, maps.build(), result.extent()));
    }

    private PixelMap remapOne (PixelMap map, PixelGrid coarse, int factor) {
        PixelGrid fine = map.grid;
        double[] values = map.values();
        double[] weights = map.weights();
        double[] mean = map.mean();
        double[] variance = map.variance();
        int n = coarse.nElements();
        double[] coarseValues = new double[n];
        double[] coarseWeights = (weights == null) ? null : new double[n];
        double[] coarseMean = (mean == null) ? null : new double[n];
        double[] coarseVariance = (variance == null) ? null : new double[n];
        for (int cy = 0; cy < coarse.ny(); cy++) {
            for (int cx = 0; cx < coarse.nx(); cx++) {
                double sum = 0;
                double weightSum = 0;
                double blockMean = 0;
                double squareSum = 0;
                int nFinite = 0;
                for (int y = cy * factor; y < (cy + 1) * factor; y++) {
                    for (int x = cx * factor; x < (cx + 1) * factor; x++) {
                        int f = fine.flatIndex(x, y);
                        double w = (weights == null) ? 0 : weights[f];
                        if (weights != null && w > 0) {
                            double total = weightSum + w;
                            if (mean != null) {
                                double delta = mean[f] - blockMean;
                                blockMean += delta * (w / total);
                                squareSum += variance[f] * w + delta * delta * (weightSum * w / total);
                            } else {
                                sum += values[f] * w;
                            }
                            weightSum = total;
                        } else if (weights == null && Double.isFinite(values[f])) {
                            sum += values[f];
                            nFinite += 1;
                        }
                    }
                }
                int c = coarse.flatIndex(cx, cy);
                if (weights != null) {
                    coarseWeights[c] = weightSum;
                    if (weightSum <= 0) {
                        coarseValues[c] = Double.NaN;
                        if (mean != null) {
                            coarseMean[c] = Double.NaN;
                            coarseVariance[c] = Double.NaN;
                        }
                    } else if (mean != null) {
                        coarseMean[c] = blockMean;
                        coarseVariance[c] = squareSum / weightSum;
                        coarseValues[c] = WeightedAccumulator.dispersion(coarseVariance[c]) * map.unitFactor;
                    } else {
                        coarseValues[c] = sum / weightSum;
                    }
                } else if (nFinite == 0) {
                    coarseValues[c] = Double.NaN;
                } else if (map.mode == AggregationMode.SUM) {
                    coarseValues[c] = sum;
                } else {
                    coarseValues[c] = sum / nFinite;
                }
            }
        }
        return new PixelMap(map.variable, map.unit, map.unitFactor, map.mode, coarse, map.recordCount,
              coarseValues, coarseWeights, coarseMean, coarseVariance);
    }

}
