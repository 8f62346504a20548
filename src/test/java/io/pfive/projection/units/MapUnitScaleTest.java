// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.units;

import io.pfive.projection.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapUnitScaleTest {

    private final MapUnitScale scale = new MapUnitScale(Map.of("kpc", 48.8, "Msol_pc2", 0.02));

    @Test
    void standardUnitIsAlwaysOne () {
        assertEquals(1.0, scale.factor(UnitScale.STANDARD));
        assertEquals(1.0, scale.factor(null));
        assertEquals(1.0, MapUnitScale.standardOnly().factor("standard"));
    }

    @Test
    void knownUnits () {
        assertEquals(48.8, scale.factor("kpc"));
        assertTrue(scale.knows("Msol_pc2"));
        assertTrue(scale.knows(UnitScale.STANDARD));
        assertFalse(scale.knows("Mpc"));
        assertFalse(MapUnitScale.standardOnly().knows("kpc"));
    }

    @Test
    void unknownUnitIsRequestError () {
        assertThrows(InvalidRequestException.class, () -> scale.factor("Mpc"));
    }

    @Test
    void factorsMustBePositive () {
        assertThrows(IllegalArgumentException.class, () -> new MapUnitScale(Map.of("bad", 0.0)));
        assertThrows(IllegalArgumentException.class, () -> new MapUnitScale(Map.of("bad", Double.NaN)));
    }

}
