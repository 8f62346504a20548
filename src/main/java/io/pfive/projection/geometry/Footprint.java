// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

/// The square a record covers on the projection plane, plus its coordinate along the line of
/// sight. All values are absolute positions in code units. Particles have zero half width.
public record Footprint (double a, double b, double halfWidth, double depth) {

    public boolean isPoint () {
        return halfWidth == 0;
    }

}
