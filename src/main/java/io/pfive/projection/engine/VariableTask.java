// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import io.pfive.projection.Configuration;
import io.pfive.projection.accumulate.AccumulatorBuffer;
import io.pfive.projection.accumulate.WeightedAccumulator;
import io.pfive.projection.geometry.PixelGrid;
import io.pfive.projection.record.Record;
import io.pfive.projection.util.MilliTimer;
import io.pfive.projection.util.Ret;
import io.pfive.projection.variable.DerivedVariableResolver;
import io.pfive.projection.variable.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// Computes the map of a single variable over all selected records. Each task owns its accumulator
/// exclusively and only reads the shared BinnedRecords and request, so any number of tasks may run
/// at once. Anything thrown while computing is caught and kept as the error outcome of this
/// variable, leaving sibling tasks unaffected.
public class VariableTask implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final int variableIndex;
    private final Variable variable;
    private final ProjectionRequest request;
    private final BinnedRecords binned;
    private final DerivedVariableResolver resolver;

    private volatile Ret<PixelMap> result;

    public VariableTask (int variableIndex, ProjectionRequest request, BinnedRecords binned,
                         DerivedVariableResolver resolver) {
        this.variableIndex = variableIndex;
        this.variable = request.variables.get(variableIndex);
        this.request = request;
        this.binned = binned;
        this.resolver = resolver;
    }

    @Override
    public void run () {
        // Catch any exception or error to prevent crashing pooled threads and record it for this variable.
        try {
            MilliTimer timer = new MilliTimer();
            result = Ret.ok(compute());
            if (Configuration.LOG_WORKER_TIMING) {
                LOG.info("Projected {} over {} records in {}.", variable, binned.size(), timer.getElapsedString());
            }
        } catch (Throwable t) {
            LOG.error("Error projecting variable {}: {}", variable, t.toString());
            result = Ret.err(t);
        } finally {
            request.progress.increment();
        }
    }

    public Variable variable () {
        return variable;
    }

    /// The outcome of this task, or null if it has not run yet.
    public Ret<PixelMap> result () {
        return result;
    }

    private PixelMap compute () {
        // Resolving inside the worker keeps a variable that cannot be derived from failing the call.
        DerivedVariableResolver.ValueFunction valueFunction = resolver.resolve(variable);
        boolean moments = variable.isDispersion();
        boolean summed = variable.isSurfaceDensity() || request.mode == AggregationMode.SUM;
        PixelGrid grid = binned.grid;
        WeightedAccumulator accumulator = new WeightedAccumulator(grid.nElements(), moments);
        for (int i = 0; i < binned.size(); i++) {
            Record record = binned.record(i);
            double value = valueFunction.valueOf(record);
            double weight = summed ? 1.0 : binned.weight(i);
            for (int p = binned.start(i); p < binned.end(i); p++) {
                if (moments) {
                    accumulator.addMoments(binned.pixel(p), value, weight, binned.fraction(p));
                } else {
                    accumulator.add(binned.pixel(p), value, weight, binned.fraction(p));
                }
            }
        }
        return finish(accumulator, grid);
    }

    private PixelMap finish (WeightedAccumulator accumulator, PixelGrid grid) {
        String unit = request.units.get(variableIndex);
        double factor = request.unitFactor(variableIndex);
        int count = binned.size();
        AccumulatorBuffer buffer = accumulator.buffer();
        if (variable.isSurfaceDensity()) {
            // Mass per area is an average density over the pixel, so it is labeled MEAN and coarsened
            // by averaging, even though it is accumulated as a sum.
            double[] values = accumulator.finalizeSum();
            scale(values, factor / grid.pixelArea(request.info.boxLength()));
            return new PixelMap(variable.name(), unit, factor, AggregationMode.MEAN, grid, count, values,
                  null, null, null);
        }
        if (request.mode == AggregationMode.SUM) {
            double[] values = accumulator.finalizeSum();
            scale(values, factor);
            return new PixelMap(variable.name(), unit, factor, AggregationMode.SUM, grid, count, values,
                  null, null, null);
        }
        if (variable.isDispersion()) {
            double[] mean = accumulator.finalizeRunningMean();
            double[] variance = accumulator.finalizeVariance();
            double[] values = WeightedAccumulator.dispersion(variance);
            scale(values, factor);
            return new PixelMap(variable.name(), unit, factor, AggregationMode.MEAN, grid, count, values,
                  buffer.weightSum, mean, variance);
        }
        double[] values = accumulator.finalizeMean();
        scale(values, factor);
        return new PixelMap(variable.name(), unit, factor, AggregationMode.MEAN, grid, count, values,
              buffer.weightSum, null, null);
    }

    private static void scale (double[] values, double factor) {
        if (factor == 1) return;
        for (int i = 0; i < values.length; i++) values[i] *= factor;
    }

}
