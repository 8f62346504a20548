// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import com.google.common.collect.ImmutableList;
import io.pfive.projection.exception.InvalidRequestException;
import io.pfive.projection.geometry.CoordinateMapper;
import io.pfive.projection.record.RecordSet;
import io.pfive.projection.units.UnitScale;
import io.pfive.projection.util.MilliTimer;
import io.pfive.projection.util.Ret;
import io.pfive.projection.variable.DerivedVariableResolver;
import io.pfive.projection.variable.DerivedVariableResolver.ValueFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/// Entry points for projecting records onto pixel maps and for coarsening finished maps.
///
/// A projection call first places every unmasked record on the pixel grid once, then computes one
/// map per requested variable as an independent task under the request's concurrency budget, and
/// finally assembles the immutable MapResult on the calling thread. The engine itself holds no
/// per-call state and may be used from several threads at once.
public class ProjectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final UnitScale unitScale;
    private final ThreadScheduler scheduler;
    private final CoarseRemapper remapper = new CoarseRemapper();

    public ProjectionEngine (UnitScale unitScale) {
        this(unitScale, new ThreadScheduler());
    }

    public ProjectionEngine (UnitScale unitScale, ThreadScheduler scheduler) {
        this.unitScale = checkNotNull(unitScale);
        this.scheduler = checkNotNull(scheduler);
    }

    /// Validate the request parameters against the record set's data set and project.
    public MapResult project (RecordSet<?> records, ProjectionRequest.Builder requestBuilder) {
        return project(records, requestBuilder.build(records.info(), unitScale));
    }

    public MapResult project (RecordSet<?> records, ProjectionRequest request) {
        checkNotNull(records);
        checkNotNull(request);
        if (!request.info.equals(records.info())) {
            throw new InvalidRequestException("Request was built for a different data set than the records.");
        }
        if (request.hasMask() && request.maskLength() != records.size()) {
            throw new InvalidRequestException("Mask has %d entries for %d records."
                  .formatted(request.maskLength(), records.size()));
        }
        MilliTimer timer = new MilliTimer();
        LOG.info("Projecting {} records: {}", records.size(), request);

        var mapper = new CoordinateMapper(request.direction, request.info.boxLength(), request.center());
        var resolver = new DerivedVariableResolver(request.info, request.direction, request.dataCenter());
        ValueFunction weightOf = (request.weightVariable == null) ? null : resolver.resolve(request.weightVariable);
        BinnedRecords binned = BinnedRecords.bin(records, request, mapper, weightOf);
        LOG.debug("{} records selected onto {}x{} pixels, total weight {} ({}).", binned.size(),
              request.grid.nx(), request.grid.ny(), binned.totalWeight(), request.weighting);

        List<VariableTask> tasks = new ArrayList<>();
        for (int i = 0; i < request.variables.size(); i++) {
            tasks.add(new VariableTask(i, request, binned, resolver));
        }
        request.progress.beginTask("Projecting " + request.variables, tasks.size());
        scheduler.runAll(tasks, request.maxConcurrency);

        Map<String, Ret<PixelMap>> outcomes = new LinkedHashMap<>();
        var warnings = ImmutableList.<MapWarning>builder();
        for (VariableTask task : tasks) {
            Ret<PixelMap> outcome = task.result();
            if (outcome == null) {
                outcome = Ret.err("Task for " + task.variable() + " did not complete.");
            }
            String name = task.variable().name();
            outcomes.put(name, outcome);
            if (outcome.isOk() && outcome.get().isEmpty()) {
                MapWarning warning = MapWarning.emptyResult(name);
                LOG.warn(warning.message());
                warnings.add(warning);
            }
        }
        MapResult result = new MapResult(outcomes, warnings.build(), request.direction, request.info.boxLength(),
              request.grid, mapper.centerA(), mapper.centerB(), request.rangeUnit, request.rangeUnitFactor, Map.of());
        if (result.hasErrors()) {
            LOG.warn("Projection finished with errors: {}", result.errors());
        }
        LOG.info("Projection of {} variables done in {}.", tasks.size(), timer.getElapsedString());
        return result;
    }

    /// Returns a copy of the result with all its maps re-binned at the given coarser depth.
    /// @throws io.pfive.projection.exception.RemapAlignmentException if the target is not a valid
    ///         power-of-two sub-multiple of the result's resolution.
    public MapResult remap (MapResult result, int targetDepth) {
        return remapper.remap(checkNotNull(result), targetDepth);
    }

}
