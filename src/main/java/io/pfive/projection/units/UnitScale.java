// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.units;

/// Looks up the multiplicative factor converting a quantity from simulation code units into a
/// named physical unit. The table itself belongs to the simulation reader; the projection engine
/// only uses it to interpret requested output units and range units. The name "standard" always
/// means code units with a factor of one.
public interface UnitScale {

    String STANDARD = "standard";

    /// @throws io.pfive.projection.exception.InvalidRequestException if the unit is unknown.
    double factor (String unitName);

    /// Whether this table can interpret the given unit name.
    boolean knows (String unitName);

}
