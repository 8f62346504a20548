// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.pfive.projection.geometry.Direction;
import io.pfive.projection.geometry.PixelGrid;
import io.pfive.projection.util.Ret;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// The outcome of one projection call: a map or an error for every requested variable, in request
/// order, plus the geometry shared by all the maps. A call can partially succeed, so callers should
/// check errors() or use outcome() rather than assume every variable has a map.
///
/// Immutable. Coarse remapping returns a new MapResult with the coarse maps added.
public class MapResult {

    private final ImmutableMap<String, Ret<PixelMap>> outcomes;
    private final ImmutableList<MapWarning> warnings;
    public final Direction direction;
    public final double boxLength;
    public final PixelGrid grid;
    /// Map center along the horizontal and vertical map axes, in code units.
    public final double centerA;
    public final double centerB;
    public final String rangeUnit;
    public final double rangeUnitFactor;
    private final ImmutableMap<Integer, CoarseMaps> coarseMaps;

    public MapResult (Map<String, Ret<PixelMap>> outcomes, ImmutableList<MapWarning> warnings, Direction direction,
                      double boxLength, PixelGrid grid, double centerA, double centerB, String rangeUnit,
                      double rangeUnitFactor, Map<Integer, CoarseMaps> coarseMaps) {
        this.outcomes = ImmutableMap.copyOf(outcomes);
        this.warnings = checkNotNull(warnings);
        this.direction = checkNotNull(direction);
        this.boxLength = boxLength;
        this.grid = checkNotNull(grid);
        this.centerA = centerA;
        this.centerB = centerB;
        this.rangeUnit = checkNotNull(rangeUnit);
        this.rangeUnitFactor = rangeUnitFactor;
        this.coarseMaps = ImmutableMap.copyOf(coarseMaps);
    }

    /// Returns a copy of this result with maps at one more coarse depth. An existing entry for the
    /// same depth is replaced.
    public MapResult withCoarseMaps (CoarseMaps coarse) {
        var merged = new LinkedHashMap<>(coarseMaps);
        merged.put(coarse.depth(), coarse);
        return new MapResult(outcomes, warnings, direction, boxLength, grid, centerA, centerB,
              rangeUnit, rangeUnitFactor, merged);
    }

    /// Names of all requested variables in request order, whether they succeeded or not.
    public ImmutableList<String> variables () {
        return outcomes.keySet().asList();
    }

    public Ret<PixelMap> outcome (String variable) {
        Ret<PixelMap> outcome = outcomes.get(variable);
        checkArgument(outcome != null, "Variable '%s' was not requested.", variable);
        return outcome;
    }

    /// @throws io.pfive.projection.util.MissingReturnValueException if the variable failed.
    public PixelMap get (String variable) {
        return outcome(variable).get();
    }

    public boolean succeeded (String variable) {
        return outcome(variable).isOk();
    }

    /// The maps of all variables that succeeded, in request order.
    public ImmutableMap<String, PixelMap> maps () {
        var builder = ImmutableMap.<String, PixelMap>builder();
        outcomes.forEach((name, ret) -> {
            if (ret.isOk()) builder.put(name, ret.get());
        });
        return builder.build();
    }

    /// Output unit of each variable that succeeded.
    public ImmutableMap<String, String> units () {
        var builder = ImmutableMap.<String, String>builder();
        maps().forEach((name, map) -> builder.put(name, map.unit));
        return builder.build();
    }

    /// Error message for each variable that failed, in request order.
    public ImmutableMap<String, String> errors () {
        var builder = ImmutableMap.<String, String>builder();
        outcomes.forEach((name, ret) -> {
            if (ret.isErr()) builder.put(name, ret.errorMessage());
        });
        return builder.build();
    }

    public boolean hasErrors () {
        return outcomes.values().stream().anyMatch(Ret::isErr);
    }

    public ImmutableList<MapWarning> warnings () {
        return warnings;
    }

    /// Number of pixels spanning the whole box face.
    public int resolution () {
        return grid.res();
    }

    /// Covered area in code units, measured from the box origin.
    public Extent extent () {
        return Extent.of(grid, boxLength);
    }

    /// Covered area in code units, relative to the map center.
    public Extent extentCenter () {
        return extent().relativeTo(centerA, centerB);
    }

    public Extent extentInRangeUnit () {
        return extent().scale(rangeUnitFactor);
    }

    public Extent extentCenterInRangeUnit () {
        return extentCenter().scale(rangeUnitFactor);
    }

    /// Width of the map divided by its height.
    public double ratio () {
        return extent().ratio();
    }

    /// Side length of one pixel in code units.
    public double pixelSize () {
        return grid.pixelSize(boxLength);
    }

    public double pixelSizeInRangeUnit () {
        return pixelSize() * rangeUnitFactor;
    }

    public ImmutableMap<Integer, CoarseMaps> coarseMaps () {
        return coarseMaps;
    }

    public CoarseMaps coarse (int depth) {
        CoarseMaps coarse = coarseMaps.get(depth);
        checkArgument(coarse != null, "No coarse maps at depth %s.", depth);
        return coarse;
    }

    @Override
    public String toString () {
        return "MapResult[%s, %dx%d of %d, errors %s]".formatted(variables(), grid.nx(), grid.ny(), grid.res(),
              errors().keySet());
    }
}
