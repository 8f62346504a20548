// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

/// A projection direction, which is always along one of the principal axes. Each direction fixes
/// which box axes become the horizontal (a) and vertical (b) axes of the map, and which one is
/// collapsed (depth). The in-plane axes keep a right-handed ordering where possible, matching the
/// orientation of maps produced by the usual analysis tools.
public enum Direction {
    Z(Axis.X, Axis.Y, Axis.Z),
    Y(Axis.X, Axis.Z, Axis.Y),
    X(Axis.Y, Axis.Z, Axis.X);

    public final Axis a;
    public final Axis b;
    public final Axis depth;

    Direction (Axis a, Axis b, Axis depth) {
        this.a = a;
        this.b = b;
        this.depth = depth;
    }

    public static Direction parse (String name) {
        return Direction.valueOf(name.trim().toUpperCase());
    }
}
