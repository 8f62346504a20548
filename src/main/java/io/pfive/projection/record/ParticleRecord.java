// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.record;

import io.pfive.projection.geometry.Axis;

import java.util.Arrays;

/// A discrete particle with a continuous position in code units. Particles have no extent, so
/// they always land in exactly one pixel.
public final class ParticleRecord implements Record {

    public final double x;
    public final double y;
    public final double z;
    private final double[] fields;

    public ParticleRecord (double x, double y, double z, double... fields) {
        this.x = x;
        this.y = y;
        this.z = z;
        this.fields = fields.clone();
    }

    @Override
    public double center (Axis axis, double boxLength) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }

    @Override
    public double size (double boxLength) {
        return 0;
    }

    @Override
    public double field (int index) {
        return fields[index];
    }

    @Override
    public double massEquivalent (int massFieldIndex, double boxLength) {
        return fields[massFieldIndex];
    }

    @Override
    public String toString () {
        return "Particle[(%g,%g,%g) %s]".formatted(x, y, z, Arrays.toString(fields));
    }
}
