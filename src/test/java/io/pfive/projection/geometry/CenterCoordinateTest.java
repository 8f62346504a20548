// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CenterCoordinateTest {

    @Test
    void boxCenterResolvesToHalfTheBox () {
        CenterCoordinate bc = CenterCoordinate.boxCenter();
        assertTrue(bc.atBoxCenter());
        assertSame(bc, CenterCoordinate.boxCenter());
        assertEquals(5.0, bc.resolve(10));
        assertEquals(24.0, bc.resolve(48));
        assertEquals("boxcenter", bc.toString());
    }

    @Test
    void explicitValueIgnoresTheBox () {
        CenterCoordinate c = CenterCoordinate.of(3.5);
        assertFalse(c.atBoxCenter());
        assertEquals(3.5, c.value());
        assertEquals(3.5, c.resolve(100));
        assertEquals("3.5", c.toString());
    }

}
