// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.variable;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/// A variable name that has been recognized against a data set's field schema. Dispersions carry
/// the name of the variable whose spread they measure in `base`, which is null for all other kinds.
public record Variable (String name, VariableKind kind, @Nullable String base) {

    public Variable {
        checkNotNull(name);
        checkNotNull(kind);
        checkArgument((kind == VariableKind.DISPERSION) == (base != null), "Only dispersions have a base variable.");
    }

    public static Variable stored (String name) {
        return new Variable(name, VariableKind.STORED, null);
    }

    public boolean isDispersion () {
        return kind == VariableKind.DISPERSION;
    }

    public boolean isSurfaceDensity () {
        return kind == VariableKind.SURFACE_DENSITY;
    }

    @Override
    public String toString () {
        return name;
    }
}
