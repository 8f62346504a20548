// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import io.pfive.projection.exception.BadParameterException;
import io.pfive.projection.units.UnitScale;

import static com.google.common.base.Preconditions.checkNotNull;

/// The three ways a request can fix the map resolution. All of them are reduced to `res`, the
/// number of pixels that would span the whole box face. The map itself then covers only the pixels
/// of that global grid that intersect the selected ranges.
public interface ResolutionSpec {

    /// Highest depth accepted, keeping pixel offsets within the range of int. The size of the map
    /// window is checked separately once the ranges are known.
    int MAX_DEPTH = 30;

    int resolution (double boxLength, UnitScale units);

    static ResolutionSpec pixels (int pixels) {
        return new PixelCount(pixels);
    }

    static ResolutionSpec pixelSize (double size, String unit) {
        return new PixelSize(size, unit);
    }

    static ResolutionSpec depth (int level) {
        return new Depth(level);
    }

    /// An explicit number of pixels across the box.
    record PixelCount (int pixels) implements ResolutionSpec {
        @Override
        public int resolution (double boxLength, UnitScale units) {
            if (pixels < 1 || pixels > (1 << MAX_DEPTH)) throw new BadParameterException("pixels", pixels);
            return pixels;
        }
    }

    /// An explicit pixel side length in the given length unit. The pixel count is rounded up, so
    /// pixels may come out slightly smaller than requested.
    record PixelSize (double size, String unit) implements ResolutionSpec {
        public PixelSize {
            checkNotNull(unit);
        }

        @Override
        public int resolution (double boxLength, UnitScale units) {
            if (!(size > 0) || Double.isInfinite(size)) throw new BadParameterException("pixelSize", size);
            double sizeInCodeUnits = size / units.factor(unit);
            double res = Math.ceil(boxLength / sizeInCodeUnits - 1e-9);
            if (res > (1 << MAX_DEPTH)) throw new BadParameterException("pixelSize", size);
            return (int) Math.max(res, 1);
        }
    }

    /// The effective resolution of a refinement level, 2^level pixels across the box.
    record Depth (int level) implements ResolutionSpec {
        @Override
        public int resolution (double boxLength, UnitScale units) {
            if (level < 0 || level > MAX_DEPTH) throw new BadParameterException("depth", level);
            return 1 << level;
        }
    }

}
