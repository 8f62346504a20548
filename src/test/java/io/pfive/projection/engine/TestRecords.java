// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import io.pfive.projection.record.CellRecord;
import io.pfive.projection.record.DatasetInfo;
import io.pfive.projection.record.FieldSchema;
import io.pfive.projection.record.ParticleRecord;
import io.pfive.projection.record.RecordSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/// Small synthetic data sets for engine tests.
final class TestRecords {

    static final FieldSchema CELL_SCHEMA = FieldSchema.of("rho", "vx", "vy", "vz", "p");
    static final FieldSchema PARTICLE_SCHEMA = FieldSchema.of("mass", "vx", "vy", "vz", "birth");

    private TestRecords () { }

    static CellRecord cell (int level, int cx, int cy, int cz, double rho, double vx) {
        return new CellRecord(level, cx, cy, cz, rho, vx, 0, 0, 1);
    }

    static RecordSet<CellRecord> cells (double boxLength, int minLevel, int maxLevel, CellRecord... cells) {
        return cells(boxLength, minLevel, maxLevel, List.of(cells));
    }

    static RecordSet<CellRecord> cells (double boxLength, int minLevel, int maxLevel, List<CellRecord> cells) {
        return RecordSet.of(DatasetInfo.cells(CELL_SCHEMA, boxLength, minLevel, maxLevel), cells);
    }

    static RecordSet<ParticleRecord> particles (double boxLength, ParticleRecord... particles) {
        return RecordSet.of(DatasetInfo.particles(PARTICLE_SCHEMA, boxLength, 10), List.of(particles));
    }

    /// Random cells with levels in [minLevel, maxLevel]. Cells may overlap, which the engine does
    /// not care about.
    static List<CellRecord> randomCells (long seed, int n, int minLevel, int maxLevel) {
        Random random = new Random(seed);
        List<CellRecord> cells = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int level = minLevel + random.nextInt(maxLevel - minLevel + 1);
            int span = 1 << level;
            cells.add(new CellRecord(level,
                  1 + random.nextInt(span), 1 + random.nextInt(span), 1 + random.nextInt(span),
                  0.5 + random.nextDouble() * 2,
                  random.nextGaussian() * 10,
                  random.nextGaussian() * 10,
                  random.nextGaussian() * 10,
                  0.1 + random.nextDouble()));
        }
        return cells;
    }

    /// One full layer of cells at the given level tiling the box face, plus random finer cells,
    /// so that every pixel down to that level's resolution receives weight.
    static List<CellRecord> coveredLayerPlusRandom (long seed, int layerLevel, int nRandom, int maxLevel) {
        Random random = new Random(seed);
        List<CellRecord> cells = new ArrayList<>();
        int span = 1 << layerLevel;
        for (int y = 1; y <= span; y++) {
            for (int x = 1; x <= span; x++) {
                cells.add(new CellRecord(layerLevel, x, y, 1 + random.nextInt(span),
                      0.5 + random.nextDouble(), random.nextGaussian(), random.nextGaussian(),
                      random.nextGaussian(), 1));
            }
        }
        cells.addAll(randomCells(seed + 1, nRandom, layerLevel, maxLevel));
        return cells;
    }

}
