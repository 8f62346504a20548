// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.variable;

import com.google.common.collect.ImmutableMap;
import io.pfive.projection.exception.InvalidRequestException;
import io.pfive.projection.record.FieldSchema;

import java.util.Set;

/// The closed set of variable names the engine understands beyond the stored fields of a data set,
/// and the alternative spellings accepted for them. Names are resolved when a request is built, so
/// a misspelled variable fails immediately instead of producing an empty map.
public abstract class VariableCatalog {

    private static final ImmutableMap<String, String> ALIASES = ImmutableMap.of(
          "ρ", "rho",
          "density", "rho",
          "ϕ", "phi",
          "Σ", "sd",
          "surfacedensity", "sd"
    );

    private static final String SIGMA_SYMBOL = "σ";

    private static final ImmutableMap<String, Variable> KNOWN;

    static {
        var builder = ImmutableMap.<String, Variable>builder();
        for (String name : Set.of("v", "v2", "vx2", "vy2", "vz2", "ekin", "mass", "volume", "cs", "T")) {
            builder.put(name, new Variable(name, VariableKind.DERIVED, null));
        }
        for (String name : Set.of("x", "y", "z", "r_cylinder", "r_sphere", "phi",
              "vr_cylinder", "vphi_cylinder", "vr_cylinder2", "vphi_cylinder2",
              "vr_sphere", "vtheta_sphere", "vphi_sphere")) {
            builder.put(name, new Variable(name, VariableKind.CENTER_RELATIVE, null));
        }
        dispersion(builder, "sigma_x", "vx");
        dispersion(builder, "sigma_y", "vy");
        dispersion(builder, "sigma_z", "vz");
        dispersion(builder, "sigma", "v");
        dispersion(builder, "sigma_r_cylinder", "vr_cylinder");
        dispersion(builder, "sigma_phi_cylinder", "vphi_cylinder");
        builder.put("sd", new Variable("sd", VariableKind.SURFACE_DENSITY, null));
        KNOWN = builder.build();
    }

    private static void dispersion (ImmutableMap.Builder<String, Variable> builder, String name, String base) {
        builder.put(name, new Variable(name, VariableKind.DISPERSION, base));
    }

    /// Replace an alternative spelling with the name used in results.
    public static String canonicalName (String name) {
        String trimmed = name.trim();
        if (trimmed.startsWith(SIGMA_SYMBOL)) {
            String rest = trimmed.substring(SIGMA_SYMBOL.length());
            if (!rest.isEmpty() && !rest.startsWith("_")) rest = "_" + rest;
            return "sigma" + rest;
        }
        return ALIASES.getOrDefault(trimmed, trimmed);
    }

    /// @return true if the name, after alias replacement, is a derived variable of this catalog.
    public static boolean isDerived (String name) {
        return KNOWN.containsKey(canonicalName(name));
    }

    /// Look up a requested name. Fields stored in the data set take precedence over derived
    /// variables of the same name.
    /// @throws InvalidRequestException if the name is neither a stored field nor a known derived variable.
    public static Variable resolve (String requestedName, FieldSchema schema) {
        String name = canonicalName(requestedName);
        if (schema.contains(name)) return Variable.stored(name);
        Variable known = KNOWN.get(name);
        if (known == null) {
            throw new InvalidRequestException("Unknown variable '%s'. Stored fields are %s."
                  .formatted(requestedName, schema.names()));
        }
        return known;
    }

}
