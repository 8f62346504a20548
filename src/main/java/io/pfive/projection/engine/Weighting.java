// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.engine;

import io.pfive.projection.variable.VariableCatalog;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/// The weight each record carries when averaged into a pixel: the value of a per-record variable,
/// or nothing at all. The variable is resolved like any requested variable when the request is
/// built, so it may be a stored field or a derived quantity such as `volume`.
public record Weighting (@Nullable String variable) {

    /// Particle mass, or density times cell volume for cells.
    public static final Weighting MASS = new Weighting("mass");
    /// Cell volume, the cube of the cell size.
    public static final Weighting VOLUME = new Weighting("volume");
    /// Every record counts equally, scaled only by the share of its footprint in the pixel.
    public static final Weighting UNWEIGHTED = new Weighting(null);

    public Weighting {
        if (variable != null) {
            variable = VariableCatalog.canonicalName(variable);
            checkArgument(!variable.isEmpty(), "Weighting variable must not be blank.");
        }
    }

    public static Weighting by (String variable) {
        return new Weighting(variable);
    }

    /// Read a weighting by name. `none` and `unweighted` select no weighting, any other name is
    /// taken as the variable to weight by.
    public static Weighting parse (String name) {
        String trimmed = name.trim();
        if (trimmed.equalsIgnoreCase("none") || trimmed.equalsIgnoreCase("unweighted")) return UNWEIGHTED;
        return by(trimmed);
    }

    public boolean isUnweighted () {
        return variable == null;
    }

    @Override
    public String toString () {
        return isUnweighted() ? "unweighted" : variable + "-weighted";
    }
}
