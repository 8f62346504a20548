// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.geometry;

/// The three principal axes of the simulation box.
public enum Axis {
    X, Y, Z
}
