// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import io.pfive.projection.background.ProgressListener;
import io.pfive.projection.exception.InvalidRequestException;
import io.pfive.projection.geometry.CenterCoordinate;
import io.pfive.projection.geometry.Direction;
import io.pfive.projection.record.CellRecord;
import io.pfive.projection.record.DatasetInfo;
import io.pfive.projection.record.FieldSchema;
import io.pfive.projection.record.ParticleRecord;
import io.pfive.projection.record.RecordSet;
import io.pfive.projection.units.MapUnitScale;
import io.pfive.projection.util.MissingReturnValueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.pfive.projection.engine.TestRecords.cell;
import static io.pfive.projection.engine.TestRecords.cells;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectionEngineTest {

    private static final double TOLERANCE = 1e-9;

    private final ProjectionEngine engine = new ProjectionEngine(MapUnitScale.standardOnly());

    /// Four level 1 cells tiling a box of length 2, so each cell has unit size and fills one pixel.
    private static RecordSet<CellRecord> alignedQuad () {
        return alignedQuad(2.0);
    }

    /// The same four level 1 cells in a box of any length.
    private static RecordSet<CellRecord> alignedQuad (double boxLength) {
        return cells(boxLength, 1, 1,
              cell(1, 1, 1, 1, 1.0, 0),
              cell(1, 2, 1, 1, 2.0, 0),
              cell(1, 1, 2, 1, 3.0, 0),
              cell(1, 2, 2, 1, 4.0, 0));
    }

    private static void assertClose (double expected, double actual) {
        assertEquals(expected, actual, TOLERANCE * Math.max(1, Math.abs(expected)));
    }

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        void alignedCellsReproduceTheirValues () {
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho", "sd")
                  .resolution(ResolutionSpec.depth(1))
                  .weighting(Weighting.UNWEIGHTED)
                  .maxConcurrency(2));
            double[][] expected = {{1, 2}, {3, 4}};
            assertArrayEquals(expected, result.get("rho").toArray());
            assertArrayEquals(expected, result.get("sd").toArray());
            assertTrue(result.errors().isEmpty());
            assertTrue(result.warnings().isEmpty());
        }

        @Test
        void coarseCellSplatsUnderFineCell () {
            // Weight of the coarse cell is 2 * 1^3, weight of the fine cell is 8 * 0.5^3 = 1.
            RecordSet<CellRecord> records = cells(1.0, 0, 1,
                  cell(0, 1, 1, 1, 2.0, 10),
                  cell(1, 1, 1, 1, 8.0, 20));
            MapResult result = engine.project(records, ProjectionRequest.builder()
                  .variables("vx")
                  .resolution(ResolutionSpec.depth(1))
                  .maxConcurrency(1));
            PixelMap vx = result.get("vx");
            assertClose((10 * 2 * 0.25 + 20 * 1) / (2 * 0.25 + 1), vx.value(0, 0));
            assertEquals(10, vx.value(1, 0));
            assertEquals(10, vx.value(0, 1));
            assertEquals(10, vx.value(1, 1));
        }

        @Test
        void dispersionMatchesWeightedMoments () {
            double[] masses = {1.0, 2.5, 0.5, 3.0, 1.5};
            double[] velocities = {-3.0, 4.0, 1.0, 0.5, 12.0};
            ParticleRecord[] particles = new ParticleRecord[masses.length];
            for (int i = 0; i < masses.length; i++) {
                particles[i] = new ParticleRecord(0.3 + 0.01 * i, 0.4, 0.5, masses[i], velocities[i], 0, 0, 0);
            }
            MapResult result = engine.project(TestRecords.particles(1.0, particles), ProjectionRequest.builder()
                  .variables("sigma_x", "σ")
                  .resolution(ResolutionSpec.depth(0))
                  .maxConcurrency(2));
            double w = 0, wv = 0, wSpeed = 0, wv2 = 0;
            for (int i = 0; i < masses.length; i++) {
                w += masses[i];
                wv += masses[i] * velocities[i];
                wSpeed += masses[i] * Math.abs(velocities[i]);
                wv2 += masses[i] * velocities[i] * velocities[i];
            }
            double mean = wv / w;
            assertClose(Math.sqrt(Math.max(wv2 / w - mean * mean, 0)), result.get("sigma_x").value(0, 0));
            // Only vx is nonzero, so the speed dispersion is that of |vx|.
            double meanSpeed = wSpeed / w;
            assertClose(Math.sqrt(Math.max(wv2 / w - meanSpeed * meanSpeed, 0)), result.get("sigma").value(0, 0));
        }

        @Test
        void weightIsConservedAcrossPartialWindows () {
            List<CellRecord> list = TestRecords.randomCells(42, 500, 2, 5);
            MapResult result = engine.project(cells(1.0, 2, 5, list), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.depth(6))
                  .xRange(0.1, 0.83)
                  .maxConcurrency(1));
            int rho = TestRecords.CELL_SCHEMA.indexOf("rho");
            double expected = 0;
            for (CellRecord c : list) {
                double x = (c.cx - 0.5) / (1 << c.level);
                if (x >= 0.1 && x < 0.83) expected += c.massEquivalent(rho, 1.0);
            }
            assertClose(expected, result.get("rho").totalWeight());
        }

        @Test
        void summedMassIsDepositedMass () {
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("mass")
                  .mode(AggregationMode.SUM)
                  .resolution(ResolutionSpec.depth(1))
                  .maxConcurrency(1));
            assertArrayEquals(new double[][] {{1, 2}, {3, 4}}, result.get("mass").toArray());
            assertEquals(AggregationMode.SUM, result.get("mass").mode);

            MapResult single = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("mass")
                  .mode(AggregationMode.SUM)
                  .resolution(ResolutionSpec.depth(0))
                  .maxConcurrency(1));
            assertClose(10, single.get("mass").value(0, 0));
        }

        @Test
        void outputUnitScalesValues () {
            var engine = new ProjectionEngine(new MapUnitScale(Map.of("g_cm3", 1e-3)));
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .units("g_cm3")
                  .resolution(ResolutionSpec.depth(1))
                  .maxConcurrency(1));
            assertClose(4e-3, result.get("rho").value(1, 1));
            assertEquals("g_cm3", result.units().get("rho"));
        }
    }

    @Nested
    @DisplayName("Weighting")
    class WeightingByVariable {

        /// A level 0 cell with vx 10 under a level 1 cell with vx 20, in a unit box.
        private RecordSet<CellRecord> nested () {
            return cells(1.0, 0, 1,
                  cell(0, 1, 1, 1, 2.0, 10),
                  cell(1, 1, 1, 1, 8.0, 20));
        }

        private PixelMap vx (Weighting weighting) {
            return engine.project(nested(), ProjectionRequest.builder()
                  .variables("vx")
                  .resolution(ResolutionSpec.depth(1))
                  .weighting(weighting)
                  .maxConcurrency(1)).get("vx");
        }

        @Test
        void volumeWeightingUsesCellVolume () {
            // Volumes are 1 and 1/8; the coarse cell puts a quarter of its volume in each pixel.
            PixelMap vx = vx(Weighting.VOLUME);
            assertClose((10 * 0.25 + 20 * 0.125) / (0.25 + 0.125), vx.value(0, 0));
            assertEquals(10, vx.value(1, 1));
            assertClose(1.125, vx.totalWeight());
        }

        @Test
        void storedFieldCanBeTheWeight () {
            PixelMap vx = vx(Weighting.by("density"));
            assertClose((10 * 2 * 0.25 + 20 * 8) / (2 * 0.25 + 8), vx.value(0, 0));
            assertEquals(10, vx.value(0, 1));
        }

        @Test
        void weightingByMassNameMatchesMassWeighting () {
            assertArrayEquals(vx(Weighting.MASS).values(), vx(Weighting.parse(" mass ")).values());
            assertArrayEquals(vx(Weighting.UNWEIGHTED).values(), vx(Weighting.parse("none")).values());
        }

        @Test
        void volumeWeightedSurfaceQuantitiesStillUseMass () {
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("sd", "rho")
                  .resolution(ResolutionSpec.depth(1))
                  .weighting(Weighting.VOLUME)
                  .maxConcurrency(2));
            assertArrayEquals(new double[][] {{1, 2}, {3, 4}}, result.get("sd").toArray());
            assertClose(4.0, result.get("rho").totalWeight());
        }

        @Test
        void particlesCannotBeVolumeWeighted () {
            var particles = TestRecords.particles(1.0, new ParticleRecord(0.5, 0.5, 0.5, 1, 0, 0, 0, 0));
            assertThrows(InvalidRequestException.class, () -> engine.project(particles, ProjectionRequest.builder()
                  .variables("vx")
                  .weighting(Weighting.VOLUME)
                  .maxConcurrency(1)));
        }
    }

    @Nested
    @DisplayName("Boxes whose length is not a power of two")
    class UnevenBoxes {

        @ParameterizedTest
        @ValueSource(doubles = {0.3, 48.0})
        void alignedCellsReproduceTheirValues (double boxLength) {
            MapResult result = engine.project(alignedQuad(boxLength), ProjectionRequest.builder()
                  .variables("rho", "sd", "sigma_x")
                  .resolution(ResolutionSpec.depth(1))
                  .weighting(Weighting.UNWEIGHTED)
                  .maxConcurrency(2));
            double[][] expected = {{1, 2}, {3, 4}};
            assertArrayEquals(expected, result.get("rho").toArray());
            assertArrayEquals(new double[][] {{0, 0}, {0, 0}}, result.get("sigma_x").toArray());
            // Mass per area of a cell of size s is rho * s.
            double size = boxLength / 2;
            PixelMap sd = result.get("sd");
            for (int y = 0; y < 2; y++) {
                for (int x = 0; x < 2; x++) assertClose(expected[y][x] * size, sd.value(x, y));
            }
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.3, 48.0, 1.0})
        void ownLevelCellsLeaveNeighboursEmpty (double boxLength) {
            CellRecord[] diagonal = new CellRecord[32];
            for (int i = 1; i <= 32; i++) diagonal[i - 1] = cell(5, i, i, 1 + (i * 7) % 32, 1.0 + i / 10.0, i);
            MapResult result = engine.project(cells(boxLength, 5, 5, diagonal), ProjectionRequest.builder()
                  .variables("vx", "sigma_x")
                  .resolution(ResolutionSpec.depth(5))
                  .maxConcurrency(2));
            PixelMap vx = result.get("vx");
            PixelMap sigma = result.get("sigma_x");
            for (int y = 0; y < 32; y++) {
                for (int x = 0; x < 32; x++) {
                    if (x == y) {
                        assertClose(x + 1, vx.value(x, y));
                        assertEquals(0.0, sigma.value(x, y));
                    } else {
                        assertTrue(Double.isNaN(vx.value(x, y)), "pixel (%d, %d)".formatted(x, y));
                        assertTrue(Double.isNaN(sigma.value(x, y)), "pixel (%d, %d)".formatted(x, y));
                    }
                }
            }
        }

        @Test
        void windowInUnevenBoxSelectsTheSameCells () {
            // The same window and cells in box units, projected in boxes of 1 and 48.
            List<CellRecord> list = TestRecords.randomCells(7, 400, 3, 6);
            MapResult unit = engine.project(cells(1.0, 3, 6, list), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.depth(6))
                  .xRange(0.25, 0.75)
                  .maxConcurrency(1));
            MapResult large = engine.project(cells(48.0, 3, 6, list), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.depth(6))
                  .xRange(12.0, 36.0)
                  .maxConcurrency(1));
            assertEquals(unit.grid, large.grid);
            double[] a = unit.get("rho").values();
            double[] b = large.get("rho").values();
            for (int i = 0; i < a.length; i++) {
                if (Double.isNaN(a[i])) assertTrue(Double.isNaN(b[i]), "pixel " + i);
                else assertClose(a[i], b[i]);
            }
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        void maskedRecordsDoNotContribute () {
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.depth(1))
                  .mask(new boolean[] {true, false, true, true})
                  .maxConcurrency(1));
            PixelMap rho = result.get("rho");
            assertEquals(1, rho.value(0, 0));
            assertTrue(Double.isNaN(rho.value(1, 0)));
            assertEquals(3, rho.recordCount);
        }

        @Test
        void maskOfWrongLengthIsRejected () {
            var builder = ProjectionRequest.builder()
                  .variables("rho")
                  .mask(new boolean[] {true, false})
                  .maxConcurrency(1);
            assertThrows(InvalidRequestException.class, () -> engine.project(alignedQuad(), builder));
        }

        @Test
        void emptySelectionWarnsAndYieldsNaN () {
            // All four cells are centered at z = 0.5, below the selected slab.
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho", "vx")
                  .resolution(ResolutionSpec.depth(1))
                  .zRange(1.5, null)
                  .maxConcurrency(2));
            assertEquals(2, result.warnings().size());
            assertEquals(MapWarning.Kind.EMPTY_RESULT, result.warnings().get(0).kind());
            assertEquals("rho", result.warnings().get(0).variable());
            for (double v : result.get("rho").values()) assertTrue(Double.isNaN(v));
            assertTrue(result.get("rho").isEmpty());
        }

        @Test
        void recordOnUpperRangeBoundIsExcluded () {
            // Cell centers lie at x = 0.5 and 1.5. A range ending at 1.5 excludes the second column.
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.depth(1))
                  .xRange(0.0, 1.5)
                  .maxConcurrency(1));
            PixelMap rho = result.get("rho");
            assertEquals(2, rho.nx());
            assertEquals(1, rho.value(0, 0));
            assertTrue(Double.isNaN(rho.value(1, 0)));

            MapResult inclusive = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.depth(1))
                  .xRange(0.5, 1.6)
                  .maxConcurrency(1));
            assertEquals(2, inclusive.get("rho").value(1, 0));
            assertEquals(1, inclusive.get("rho").value(0, 0));
        }

        @Test
        void particlesLandInOnePixel () {
            RecordSet<ParticleRecord> records = TestRecords.particles(1.0,
                  new ParticleRecord(0.1, 0.1, 0.5, 1.0, 0, 0, 0, 0),
                  new ParticleRecord(1.0, 1.0, 0.5, 2.0, 0, 0, 0, 0),
                  new ParticleRecord(0.6, 0.3, 0.5, 4.0, 0, 0, 0, 0));
            MapResult result = engine.project(records, ProjectionRequest.builder()
                  .variables("mass")
                  .mode(AggregationMode.SUM)
                  .resolution(ResolutionSpec.depth(2))
                  .maxConcurrency(1));
            PixelMap mass = result.get("mass");
            assertEquals(1.0, mass.value(0, 0));
            // A particle on the far wall of the box belongs to the last pixel.
            assertEquals(2.0, mass.value(3, 3));
            assertEquals(4.0, mass.value(2, 1));
            assertTrue(Double.isNaN(mass.value(1, 1)));
        }

        @Test
        void projectionAlongXUsesYAndZ () {
            RecordSet<CellRecord> records = cells(1.0, 1, 1, cell(1, 1, 1, 2, 1.0, 7.0));
            MapResult result = engine.project(records, ProjectionRequest.builder()
                  .variables("vx")
                  .direction(Direction.X)
                  .resolution(ResolutionSpec.depth(1))
                  .maxConcurrency(1));
            // Horizontal map axis is y, vertical is z.
            assertEquals(7.0, result.get("vx").value(0, 1));
            assertTrue(Double.isNaN(result.get("vx").value(1, 0)));
        }
    }

    @Nested
    @DisplayName("Geometry")
    class Geometry {

        @Test
        void extentsInCodeAndRangeUnits () {
            var engine = new ProjectionEngine(new MapUnitScale(Map.of("kpc", 2.0)));
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.depth(2))
                  .rangeUnit("kpc")
                  .centerOnBox()
                  .xRange(-1.0, 1.0)
                  .maxConcurrency(1));
            // Box length 2 is 4 kpc, the center is at 2 kpc, so x covers [0.5, 1.5] in code units.
            assertArrayEquals(new double[] {0.5, 1.5, 0.0, 2.0}, result.extent().toArray(), TOLERANCE);
            assertArrayEquals(new double[] {-0.5, 0.5, -1.0, 1.0}, result.extentCenter().toArray(), TOLERANCE);
            assertArrayEquals(new double[] {1.0, 3.0, 0.0, 4.0}, result.extentInRangeUnit().toArray(), TOLERANCE);
            assertClose(0.5, result.ratio());
            assertClose(0.5, result.pixelSize());
            assertClose(1.0, result.pixelSizeInRangeUnit());
            assertEquals(4, result.resolution());
            assertEquals(2, result.grid.nx());
            assertEquals(4, result.grid.ny());
        }

        @Test
        void explicitPixelCountAndSize () {
            MapResult counted = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.pixels(6))
                  .maxConcurrency(1));
            assertEquals(6, counted.grid.nx());

            MapResult sized = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .resolution(ResolutionSpec.pixelSize(0.3, "standard"))
                  .maxConcurrency(1));
            // ceil(2 / 0.3) = 7 pixels across the box.
            assertEquals(7, sized.resolution());
            // Cells no longer line up with pixels, but every cell still deposits its whole mass.
            assertClose(10.0, counted.get("rho").totalWeight());
            assertClose(10.0, sized.get("rho").totalWeight());
        }
    }

    @Nested
    @DisplayName("Concurrency and failures")
    class ConcurrencyAndFailures {

        private MapResult run (int maxConcurrency, ThreadScheduler scheduler) {
            var engine = new ProjectionEngine(MapUnitScale.standardOnly(), scheduler);
            List<CellRecord> list = TestRecords.randomCells(7, 800, 2, 6);
            return engine.project(cells(1.0, 2, 6, list), ProjectionRequest.builder()
                  .variables("rho", "vx", "v", "sigma_x", "sd", "T", "r_cylinder", "vphi_cylinder")
                  .resolution(ResolutionSpec.depth(5))
                  .dataCenter(CenterCoordinate.boxCenter(), CenterCoordinate.boxCenter(), CenterCoordinate.boxCenter())
                  .maxConcurrency(maxConcurrency));
        }

        @Test
        void resultsDoNotDependOnThreadCount () {
            MapResult sequential = run(1, new ThreadScheduler());
            MapResult parallel = run(8, new ThreadScheduler());
            assertEquals(sequential.variables(), parallel.variables());
            for (String name : sequential.variables()) {
                double[] a = sequential.get(name).values();
                double[] b = parallel.get(name).values();
                assertEquals(a.length, b.length);
                for (int i = 0; i < a.length; i++) {
                    if (Double.isNaN(a[i])) {
                        assertTrue(Double.isNaN(b[i]), name);
                    } else {
                        assertEquals(a[i], b[i], 1e-9 * Math.max(1, Math.abs(a[i])), name);
                    }
                }
            }
        }

        @Test
        void concurrencyBudgetIsRespected () {
            ThreadScheduler scheduler = new ThreadScheduler();
            MapResult result = run(3, scheduler);
            assertFalse(result.hasErrors());
            assertTrue(scheduler.peakConcurrency() >= 1);
            assertTrue(scheduler.peakConcurrency() <= 3);
            assertEquals(0, scheduler.activeCount());
        }

        @Test
        void badDerivedVariableFailsAlone () {
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho", "r_cylinder")
                  .resolution(ResolutionSpec.depth(1))
                  .maxConcurrency(2));
            assertTrue(result.succeeded("rho"));
            assertArrayEquals(new double[][] {{1, 2}, {3, 4}}, result.get("rho").toArray());
            assertFalse(result.succeeded("r_cylinder"));
            assertTrue(result.errors().get("r_cylinder").contains("data center"));
            assertThrows(MissingReturnValueException.class, () -> result.get("r_cylinder"));
            assertEquals(List.of("rho"), result.maps().keySet().asList());
        }

        @Test
        void missingInputFieldFailsAlone () {
            FieldSchema schema = FieldSchema.of("rho", "vx", "vy", "vz");
            RecordSet<CellRecord> records = RecordSet.of(DatasetInfo.cells(schema, 1.0, 1, 1),
                  List.of(new CellRecord(1, 1, 1, 1, 1.0, 1.0, 2.0, 2.0)));
            MapResult result = engine.project(records, ProjectionRequest.builder()
                  .variables("cs", "v")
                  .resolution(ResolutionSpec.depth(1))
                  .maxConcurrency(1));
            assertTrue(result.errors().get("cs").contains("'p'"));
            assertClose(3.0, result.get("v").value(0, 0));
        }

        @Test
        void negativeWeightFailsVariables () {
            RecordSet<CellRecord> records = cells(1.0, 1, 1, cell(1, 1, 1, 1, -1.0, 5));
            MapResult result = engine.project(records, ProjectionRequest.builder()
                  .variables("vx")
                  .resolution(ResolutionSpec.depth(1))
                  .maxConcurrency(1));
            assertTrue(result.hasErrors());
            assertTrue(result.errors().get("vx").contains("Weight"));
        }

        @Test
        void requestForOtherDatasetIsRejected () {
            DatasetInfo other = DatasetInfo.cells(TestRecords.CELL_SCHEMA, 5.0, 1, 1);
            ProjectionRequest request = ProjectionRequest.builder()
                  .variables("rho")
                  .maxConcurrency(1)
                  .build(other, MapUnitScale.standardOnly());
            assertThrows(InvalidRequestException.class, () -> engine.project(alignedQuad(), request));
        }

        @Test
        void progressIsReportedPerVariable () {
            var counter = new AtomicInteger();
            var totals = new int[1];
            engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho", "vx", "sd")
                  .maxConcurrency(2)
                  .progress(new ProgressListener() {
                      @Override
                      public void beginTask (String title, int totalSteps) {
                          totals[0] = totalSteps;
                      }

                      @Override
                      public void increment (int n) {
                          counter.addAndGet(n);
                      }
                  }));
            assertEquals(3, totals[0]);
            assertEquals(3, counter.get());
        }

        @Test
        void noCoarseMapsUntilRemapped () {
            MapResult result = engine.project(alignedQuad(), ProjectionRequest.builder()
                  .variables("rho")
                  .maxConcurrency(1));
            assertTrue(result.coarseMaps().isEmpty());
            assertNull(result.get("rho").mean());
        }
    }

}
