// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.record;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// Properties shared by all records of one snapshot, as reported by the reader that produced them.
/// Lengths are in code units. The adiabatic index gamma is only used for the sound speed.
public record DatasetInfo (
      RecordKind kind,
      FieldSchema schema,
      double boxLength,
      int minLevel,
      int maxLevel,
      double gamma
) {
    public static final double DEFAULT_GAMMA = 5.0 / 3.0;

    public DatasetInfo {
        checkNotNull(kind);
        checkNotNull(schema);
        checkArgument(boxLength > 0 && Double.isFinite(boxLength), "Box length must be positive.");
        checkArgument(minLevel >= 0 && minLevel <= maxLevel, "Levels must satisfy 0 <= min <= max.");
        checkArgument(maxLevel < 31, "Refinement levels above 30 are not representable.");
        checkArgument(gamma > 0, "Adiabatic index must be positive.");
    }

    public static DatasetInfo cells (FieldSchema schema, double boxLength, int minLevel, int maxLevel) {
        return new DatasetInfo(RecordKind.CELL, schema, boxLength, minLevel, maxLevel, DEFAULT_GAMMA);
    }

    public static DatasetInfo particles (FieldSchema schema, double boxLength, int maxLevel) {
        return new DatasetInfo(RecordKind.PARTICLE, schema, boxLength, 0, maxLevel, DEFAULT_GAMMA);
    }

    public int massFieldIndex () {
        return schema.indexOf(kind.massField);
    }

    /// Edge length of a cell at the given refinement level.
    public double cellSize (int level) {
        return boxLength / (1 << level);
    }
}
