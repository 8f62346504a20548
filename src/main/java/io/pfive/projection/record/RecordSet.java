// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.record;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// An ordered, already geometrically filtered sequence of records of one kind, together with the
/// snapshot properties needed to interpret them. The order matters only for aligning an optional
/// boolean mask. Shared read-only by all projection workers.
public record RecordSet<R extends Record> (DatasetInfo info, ImmutableList<R> records) {

    public RecordSet {
        checkNotNull(info);
        checkNotNull(records);
        for (R record : records) {
            if (record instanceof CellRecord cell) {
                checkArgument(info.kind() == RecordKind.CELL, "Cell record in a %s data set.", info.kind());
                checkArgument(cell.level >= info.minLevel() && cell.level <= info.maxLevel(),
                      "Cell level %s outside data set levels [%s, %s].", cell.level, info.minLevel(), info.maxLevel());
            } else {
                checkArgument(info.kind() == RecordKind.PARTICLE, "Particle record in a %s data set.", info.kind());
            }
        }
    }

    public static <R extends Record> RecordSet<R> of (DatasetInfo info, List<R> records) {
        return new RecordSet<>(info, ImmutableList.copyOf(records));
    }

    public int size () {
        return records.size();
    }

    public R get (int i) {
        return records.get(i);
    }
}
