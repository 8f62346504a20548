// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import com.google.common.collect.ImmutableList;
import io.pfive.projection.background.ProgressListener;
import io.pfive.projection.exception.BadParameterException;
import io.pfive.projection.exception.DerivedVariableException;
import io.pfive.projection.exception.InvalidRequestException;
import io.pfive.projection.geometry.Axis;
import io.pfive.projection.geometry.AxisRange;
import io.pfive.projection.geometry.BoxRanges;
import io.pfive.projection.geometry.CenterCoordinate;
import io.pfive.projection.geometry.Direction;
import io.pfive.projection.geometry.PixelGrid;
import io.pfive.projection.record.DatasetInfo;
import io.pfive.projection.record.FieldSchema;
import io.pfive.projection.units.UnitScale;
import io.pfive.projection.variable.DerivedVariableResolver;
import io.pfive.projection.variable.Variable;
import io.pfive.projection.variable.VariableCatalog;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/// Everything one projection call needs besides the records themselves. Built with a Builder and
/// validated in one step against the data set it will be applied to, so that every problem with
/// the request surfaces as an InvalidRequestException before any accumulation begins. Instances are
/// immutable and shared read-only by all workers of the call.
///
/// Ranges and the map center are given in the range unit. The data center used by radial and
/// angular variables may use its own unit. Internally all lengths are converted to code units.
public class ProjectionRequest {

    public final DatasetInfo info;
    public final ImmutableList<Variable> variables;
    /// Output unit name for each variable, in the same order.
    public final ImmutableList<String> units;
    private final double[] unitFactors;
    public final Direction direction;
    public final ResolutionSpec resolutionSpec;
    public final PixelGrid grid;
    public final BoxRanges ranges;
    public final String rangeUnit;
    public final double rangeUnitFactor;
    private final double[] center;
    private final double[] dataCenter;
    public final Weighting weighting;
    /// The resolved variable behind the weighting, or null for unweighted requests.
    public final @Nullable Variable weightVariable;
    public final AggregationMode mode;
    private final boolean[] mask;
    public final int maxConcurrency;
    public final ProgressListener progress;

    private ProjectionRequest (Builder builder, DatasetInfo info, UnitScale unitScale) {
        this.info = info;
        this.direction = checkNotNull(builder.direction);
        this.weighting = checkNotNull(builder.weighting);
        this.mode = checkNotNull(builder.mode);
        this.progress = (builder.progress == null) ? ProgressListener.NONE : builder.progress;
        this.maxConcurrency = builder.maxConcurrency;
        if (maxConcurrency < 1) throw new BadParameterException("maxConcurrency", maxConcurrency);

        // Variables and their output units.
        if (builder.variables.isEmpty()) throw new InvalidRequestException("No variables requested.");
        FieldSchema schema = info.schema();
        var variableBuilder = ImmutableList.<Variable>builder();
        Set<String> seen = new HashSet<>();
        for (String name : builder.variables) {
            Variable variable = VariableCatalog.resolve(name, schema);
            if (!seen.add(variable.name())) {
                throw new InvalidRequestException("Variable '%s' requested more than once.".formatted(variable.name()));
            }
            if (variable.isDispersion() && mode == AggregationMode.SUM) {
                throw new InvalidRequestException("Dispersion '%s' cannot be summed.".formatted(variable.name()));
            }
            variableBuilder.add(variable);
        }
        this.variables = variableBuilder.build();
        this.units = expandUnits(builder.units, variables.size());
        this.unitFactors = new double[units.size()];
        for (int i = 0; i < unitFactors.length; i++) {
            String unit = units.get(i);
            if (!unitScale.knows(unit)) throw new BadParameterException("units", unit);
            unitFactors[i] = unitScale.factor(unit);
        }

        // Center and ranges, converted from the range unit to box fractions and code units.
        this.rangeUnit = (builder.rangeUnit == null) ? UnitScale.STANDARD : builder.rangeUnit;
        this.rangeUnitFactor = unitScale.factor(rangeUnit);
        double boxInRangeUnit = info.boxLength() * rangeUnitFactor;
        this.center = new double[3];
        AxisRange[] axisRanges = new AxisRange[3];
        for (Axis axis : Axis.values()) {
            int i = axis.ordinal();
            double c = checkNotNull(builder.center[i], "Center coordinate").resolve(boxInRangeUnit);
            if (!Double.isFinite(c)) throw new BadParameterException("center", Arrays.toString(builder.center));
            center[i] = c / rangeUnitFactor;
            axisRanges[i] = AxisRange.fromUnits(builder.ranges[i][0], builder.ranges[i][1], c, boxInRangeUnit);
        }
        this.ranges = new BoxRanges(axisRanges[0], axisRanges[1], axisRanges[2]);

        if (builder.dataCenter == null) {
            this.dataCenter = null;
        } else {
            String dataCenterUnit = (builder.dataCenterUnit == null) ? rangeUnit : builder.dataCenterUnit;
            double factor = unitScale.factor(dataCenterUnit);
            this.dataCenter = new double[3];
            for (int i = 0; i < 3; i++) {
                double c = checkNotNull(builder.dataCenter[i], "Data center coordinate")
                      .resolve(info.boxLength() * factor);
                if (!Double.isFinite(c)) throw new BadParameterException("dataCenter", Arrays.toString(builder.dataCenter));
                dataCenter[i] = c / factor;
            }
        }

        this.weightVariable = resolveWeighting(weighting, info, direction, dataCenter);

        // Resolution and the window of pixels covering the in-plane ranges.
        this.resolutionSpec = (builder.resolution == null)
              ? ResolutionSpec.depth(info.maxLevel())
              : builder.resolution;
        int res = resolutionSpec.resolution(info.boxLength(), unitScale);
        this.grid = PixelGrid.covering(res, ranges.get(direction.a), ranges.get(direction.b));
        if ((long) grid.nx() * grid.ny() > Integer.MAX_VALUE - 8) {
            throw new BadParameterException("resolution", "%dx%d pixels".formatted(grid.nx(), grid.ny()));
        }

        this.mask = (builder.mask == null) ? null : builder.mask.clone();
    }

    /// The weight must be a plain per-record quantity that can be derived from this data set. A
    /// weight that cannot be computed would fail every variable, so it fails the request instead.
    private static @Nullable Variable resolveWeighting (Weighting weighting, DatasetInfo info, Direction direction,
                                                        @Nullable double[] dataCenter) {
        if (weighting.isUnweighted()) return null;
        Variable variable = VariableCatalog.resolve(weighting.variable(), info.schema());
        if (variable.isDispersion() || variable.isSurfaceDensity()) {
            throw new InvalidRequestException("Cannot weight by '%s', which is not a per-record quantity."
                  .formatted(variable.name()));
        }
        try {
            new DerivedVariableResolver(info, direction, dataCenter).resolve(variable);
        } catch (DerivedVariableException e) {
            throw new InvalidRequestException("Weighting by '%s' is not possible for this data. %s"
                  .formatted(variable.name(), e.getMessage()), e);
        }
        return variable;
    }

    /// One unit for all variables, one per variable, or the standard unit if none were given.
    private static ImmutableList<String> expandUnits (List<String> units, int nVariables) {
        if (units.isEmpty()) return ImmutableList.copyOf(Collections.nCopies(nVariables, UnitScale.STANDARD));
        if (units.size() == 1) return ImmutableList.copyOf(Collections.nCopies(nVariables, units.get(0)));
        if (units.size() != nVariables) {
            throw new InvalidRequestException("Got %d units for %d variables.".formatted(units.size(), nVariables));
        }
        return ImmutableList.copyOf(units);
    }

    public static Builder builder () {
        return new Builder();
    }

    public double unitFactor (int variableIndex) {
        return unitFactors[variableIndex];
    }

    /// Map center in code units, indexed by Axis ordinal.
    public double[] center () {
        return center.clone();
    }

    /// Data center in code units indexed by Axis ordinal, or null if none was given.
    public @Nullable double[] dataCenter () {
        return dataCenter == null ? null : dataCenter.clone();
    }

    public boolean hasMask () {
        return mask != null;
    }

    public int maskLength () {
        return mask == null ? 0 : mask.length;
    }

    /// @return true if the record at the given position in the record set should be projected.
    public boolean unmasked (int recordIndex) {
        return mask == null || mask[recordIndex];
    }

    @Override
    public String toString () {
        return "ProjectionRequest[%s along %s, res %d, %s, %s, concurrency %d]"
              .formatted(variables, direction, grid.res(), weighting, mode, maxConcurrency);
    }

    /// Accumulates request parameters in any order. Nothing is checked until build().
    public static class Builder {
        private final List<String> variables = new ArrayList<>();
        private final List<String> units = new ArrayList<>();
        private Direction direction = Direction.Z;
        private ResolutionSpec resolution;
        private final Double[][] ranges = new Double[3][2];
        private String rangeUnit;
        private final CenterCoordinate[] center = {
              CenterCoordinate.of(0), CenterCoordinate.of(0), CenterCoordinate.of(0)
        };
        private CenterCoordinate[] dataCenter;
        private String dataCenterUnit;
        private Weighting weighting = Weighting.MASS;
        private AggregationMode mode = AggregationMode.MEAN;
        private boolean[] mask;
        private int maxConcurrency = 0;
        private ProgressListener progress;

        public Builder variables (String... names) {
            variables.addAll(Arrays.asList(names));
            return this;
        }

        public Builder variables (List<String> names) {
            variables.addAll(names);
            return this;
        }

        public Builder units (String... unitNames) {
            units.addAll(Arrays.asList(unitNames));
            return this;
        }

        public Builder units (List<String> unitNames) {
            units.addAll(unitNames);
            return this;
        }

        public Builder direction (Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder resolution (ResolutionSpec resolution) {
            this.resolution = resolution;
            return this;
        }

        /// Bounds are relative to the center and in the range unit. Null leaves that side open.
        public Builder range (Axis axis, @Nullable Double min, @Nullable Double max) {
            ranges[axis.ordinal()][0] = min;
            ranges[axis.ordinal()][1] = max;
            return this;
        }

        public Builder xRange (@Nullable Double min, @Nullable Double max) {
            return range(Axis.X, min, max);
        }

        public Builder yRange (@Nullable Double min, @Nullable Double max) {
            return range(Axis.Y, min, max);
        }

        public Builder zRange (@Nullable Double min, @Nullable Double max) {
            return range(Axis.Z, min, max);
        }

        public Builder rangeUnit (String unit) {
            this.rangeUnit = unit;
            return this;
        }

        public Builder center (CenterCoordinate x, CenterCoordinate y, CenterCoordinate z) {
            center[0] = x;
            center[1] = y;
            center[2] = z;
            return this;
        }

        public Builder centerOnBox () {
            CenterCoordinate bc = CenterCoordinate.boxCenter();
            return center(bc, bc, bc);
        }

        public Builder dataCenter (CenterCoordinate x, CenterCoordinate y, CenterCoordinate z) {
            this.dataCenter = new CenterCoordinate[] {x, y, z};
            return this;
        }

        public Builder dataCenter (double x, double y, double z) {
            return dataCenter(CenterCoordinate.of(x), CenterCoordinate.of(y), CenterCoordinate.of(z));
        }

        public Builder dataCenterUnit (String unit) {
            this.dataCenterUnit = unit;
            return this;
        }

        public Builder weighting (Weighting weighting) {
            this.weighting = weighting;
            return this;
        }

        public Builder mode (AggregationMode mode) {
            this.mode = mode;
            return this;
        }

        /// One flag per record in the record set, true for records to keep.
        public Builder mask (boolean[] mask) {
            this.mask = mask;
            return this;
        }

        public Builder maxConcurrency (int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder progress (ProgressListener progress) {
            this.progress = progress;
            return this;
        }

        /// Validate the parameters against the data set and freeze them.
        /// @throws InvalidRequestException describing the first problem found.
        public ProjectionRequest build (DatasetInfo info, UnitScale unitScale) {
            checkNotNull(info);
            checkNotNull(unitScale);
            return new ProjectionRequest(this, info, unitScale);
        }
    }

}
