// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import com.google.common.collect.ImmutableMap;
import io.pfive.projection.geometry.PixelGrid;

/// Maps re-binned from a MapResult onto the coarser grid of the given refinement depth. The extent
/// is in code units and equals that of the source maps, as coarsening only merges whole pixels.
public record CoarseMaps (int depth, PixelGrid grid, ImmutableMap<String, PixelMap> maps, Extent extent) {

    public PixelMap get (String variable) {
        PixelMap map = maps.get(variable);
        if (map == null) throw new IllegalArgumentException("No coarse map for variable: " + variable);
        return map;
    }

    /// Side length of one coarse pixel in code units.
    public double pixelSize (double boxLength) {
        return grid.pixelSize(boxLength);
    }

}
