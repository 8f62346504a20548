// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import io.pfive.projection.geometry.CoordinateMapper;
import io.pfive.projection.geometry.Footprint;
import io.pfive.projection.geometry.LevelBinner;
import io.pfive.projection.geometry.PixelGrid;
import io.pfive.projection.record.Record;
import io.pfive.projection.record.RecordSet;
import io.pfive.projection.variable.DerivedVariableResolver.ValueFunction;

import javax.annotation.Nullable;

/// The pixels and footprint shares of every selected record, computed once per call and then read
/// by all variable workers. Only records that are unmasked, inside the ranges and that land on at
/// least one pixel are kept. Pairs for record i are stored at positions [start(i), end(i)) of the
/// pixel and fraction arrays.
///
/// Each record's weight, the value of the weighting variable or 1 for unweighted requests, is also
/// precomputed here. It is checked for
/// validity by each worker as it is accumulated, so that a bad weight fails the variables using it
/// rather than the whole call.
public class BinnedRecords {

    private final RecordSet<?> records;
    private final int[] recordIndex;
    private final int[] pairStart;
    private final int[] pixels;
    private final double[] fractions;
    private final double[] weights;
    public final PixelGrid grid;

    private BinnedRecords (RecordSet<?> records, PixelGrid grid, TIntArrayList recordIndex, TIntArrayList pairStart,
                           TIntArrayList pixels, TDoubleArrayList fractions, TDoubleArrayList weights) {
        this.records = records;
        this.grid = grid;
        this.recordIndex = recordIndex.toArray();
        this.pairStart = pairStart.toArray();
        this.pixels = pixels.toArray();
        this.fractions = fractions.toArray();
        this.weights = weights.toArray();
    }

    public static BinnedRecords bin (RecordSet<?> records, ProjectionRequest request, CoordinateMapper mapper,
                                     @Nullable ValueFunction weightOf) {
        double boxLength = records.info().boxLength();
        var binner = new LevelBinner(request.grid, request.ranges, request.direction, boxLength);

        TIntArrayList recordIndex = new TIntArrayList();
        TIntArrayList pairStart = new TIntArrayList();
        TIntArrayList pixels = new TIntArrayList();
        TDoubleArrayList fractions = new TDoubleArrayList();
        TDoubleArrayList weights = new TDoubleArrayList();
        pairStart.add(0);
        for (int i = 0; i < records.size(); i++) {
            if (!request.unmasked(i)) continue;
            Record record = records.get(i);
            Footprint footprint = mapper.map(record);
            int nPairs = binner.bin(footprint, (pixel, fraction) -> {
                pixels.add(pixel);
                fractions.add(fraction);
            });
            if (nPairs == 0) continue;
            recordIndex.add(i);
            pairStart.add(pixels.size());
            weights.add(weightOf == null ? 1.0 : weightOf.valueOf(record));
        }
        return new BinnedRecords(records, request.grid, recordIndex, pairStart, pixels, fractions, weights);
    }

    /// Number of selected records.
    public int size () {
        return recordIndex.length;
    }

    public Record record (int i) {
        return records.get(recordIndex[i]);
    }

    public double weight (int i) {
        return weights[i];
    }

    public int start (int i) {
        return pairStart[i];
    }

    public int end (int i) {
        return pairStart[i + 1];
    }

    public int pixel (int pair) {
        return pixels[pair];
    }

    public double fraction (int pair) {
        return fractions[pair];
    }

    /// Sum of the weights of all selected records.
    public double totalWeight () {
        double total = 0;
        for (double w : weights) total += w;
        return total;
    }

}
