// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.units;

import com.google.common.collect.ImmutableMap;
import io.pfive.projection.exception.InvalidRequestException;

import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/// A UnitScale backed by an immutable map, which is how readers hand over their scaling tables.
public class MapUnitScale implements UnitScale {

    private final ImmutableMap<String, Double> factors;

    public MapUnitScale (Map<String, Double> factors) {
        for (Map.Entry<String, Double> entry : factors.entrySet()) {
            double f = entry.getValue();
            checkArgument(Double.isFinite(f) && f > 0, "Unit factor for %s must be positive and finite.", entry.getKey());
        }
        this.factors = ImmutableMap.copyOf(factors);
    }

    /// A table that knows only code units.
    public static MapUnitScale standardOnly () {
        return new MapUnitScale(Map.of());
    }

    @Override
    public double factor (String unitName) {
        if (unitName == null || unitName.equals(STANDARD)) return 1.0;
        Double factor = factors.get(unitName);
        if (factor == null) throw new InvalidRequestException("Unknown unit: " + unitName);
        return factor;
    }

    @Override
    public boolean knows (String unitName) {
        return unitName == null || unitName.equals(STANDARD) || factors.containsKey(unitName);
    }

}
