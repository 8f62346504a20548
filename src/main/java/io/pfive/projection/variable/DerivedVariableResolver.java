// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.projection.variable;

import io.pfive.projection.exception.DerivedVariableException;
import io.pfive.projection.geometry.Axis;
import io.pfive.projection.geometry.Direction;
import io.pfive.projection.record.DatasetInfo;
import io.pfive.projection.record.FieldSchema;
import io.pfive.projection.record.Record;
import io.pfive.projection.record.RecordKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.lang.invoke.MethodHandles;

/// Turns a Variable into a function from records to the value accumulated for that variable.
///
/// All field lookups are resolved to schema indexes here, once per variable, so the functions
/// returned only read record arrays. Resolution is also where a variable turns out to be
/// impossible for the data at hand: a missing input field or a center-relative quantity without a
/// data center raises a DerivedVariableException, which the worker records against that variable.
///
/// Cylindrical quantities use the line of sight as the cylinder axis, so the radius is measured in
/// the projection plane. Spherical angles are measured from the line of sight. Velocity components
/// are zero where the radius they are defined against is zero.
public class DerivedVariableResolver {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final double TWO_PI = 2 * Math.PI;

    /// The value one record contributes to a variable before weighting.
    @FunctionalInterface
    public interface ValueFunction {
        double valueOf (Record record);
    }

    private final DatasetInfo info;
    private final FieldSchema schema;
    private final Direction direction;
    /// Data center in code units indexed by Axis ordinal, or null if none was supplied.
    private final double[] dataCenter;

    public DerivedVariableResolver (DatasetInfo info, Direction direction, @Nullable double[] dataCenter) {
        this.info = info;
        this.schema = info.schema();
        this.direction = direction;
        this.dataCenter = (dataCenter == null) ? null : dataCenter.clone();
    }

    public ValueFunction resolve (Variable variable) {
        return switch (variable.kind()) {
            case STORED -> stored(variable.name(), variable.name());
            case DERIVED -> derived(variable.name());
            case CENTER_RELATIVE -> centerRelative(variable.name());
            case DISPERSION -> resolveBase(variable);
            case SURFACE_DENSITY -> mass(variable.name());
        };
    }

    /// Dispersions accumulate the moments of their base variable.
    private ValueFunction resolveBase (Variable dispersion) {
        String base = dispersion.base();
        if (schema.contains(base) || !VariableCatalog.isDerived(base)) return stored(dispersion.name(), base);
        Variable baseVariable = VariableCatalog.resolve(base, schema);
        if (baseVariable.kind().needsDataCenter()) requireDataCenter(dispersion.name());
        try {
            return resolve(baseVariable);
        } catch (DerivedVariableException e) {
            throw new DerivedVariableException(dispersion.name(), "base variable unavailable. " + e.getMessage());
        }
    }

    private int requireField (String variable, String field) {
        int index = schema.indexOf(field);
        if (index == FieldSchema.NOT_PRESENT) {
            throw new DerivedVariableException(variable, "field '%s' is not present in %s.".formatted(field, schema));
        }
        return index;
    }

    private void requireDataCenter (String variable) {
        if (dataCenter == null) {
            throw new DerivedVariableException(variable, "a data center is required for quantities relative to a center.");
        }
    }

    private ValueFunction stored (String variable, String field) {
        int i = requireField(variable, field);
        return r -> r.field(i);
    }

    private ValueFunction mass (String variable) {
        int m = requireField(variable, info.kind().massField);
        double boxLength = info.boxLength();
        return r -> r.massEquivalent(m, boxLength);
    }

    private ValueFunction derived (String name) {
        switch (name) {
            case "mass":
                return mass(name);
            case "volume": {
                if (info.kind() != RecordKind.CELL) {
                    throw new DerivedVariableException(name, "particles have no volume.");
                }
                double boxLength = info.boxLength();
                return r -> {
                    double size = r.size(boxLength);
                    return size * size * size;
                };
            }
            case "cs": {
                int p = requireField(name, "p");
                int rho = requireField(name, "rho");
                double gamma = info.gamma();
                return r -> Math.sqrt(gamma * r.field(p) / r.field(rho));
            }
            case "T": {
                int p = requireField(name, "p");
                int rho = requireField(name, "rho");
                return r -> r.field(p) / r.field(rho);
            }
            default:
                break;
        }
        int vx = requireField(name, "vx");
        int vy = requireField(name, "vy");
        int vz = requireField(name, "vz");
        switch (name) {
            case "v":
                return r -> Math.sqrt(speedSquared(r, vx, vy, vz));
            case "v2":
                return r -> speedSquared(r, vx, vy, vz);
            case "vx2":
                return r -> r.field(vx) * r.field(vx);
            case "vy2":
                return r -> r.field(vy) * r.field(vy);
            case "vz2":
                return r -> r.field(vz) * r.field(vz);
            case "ekin": {
                ValueFunction m = mass(name);
                return r -> 0.5 * m.valueOf(r) * speedSquared(r, vx, vy, vz);
            }
            default:
                throw new DerivedVariableException(name, "not a supported derived variable.");
        }
    }

    private static double speedSquared (Record r, int vx, int vy, int vz) {
        double x = r.field(vx);
        double y = r.field(vy);
        double z = r.field(vz);
        return x * x + y * y + z * z;
    }

    private ValueFunction centerRelative (String name) {
        requireDataCenter(name);
        double boxLength = info.boxLength();
        Axis a = direction.a;
        Axis b = direction.b;
        Axis d = direction.depth;
        double ca = dataCenter[a.ordinal()];
        double cb = dataCenter[b.ordinal()];
        double cd = dataCenter[d.ordinal()];
        switch (name) {
            case "x":
                return offset(Axis.X, boxLength);
            case "y":
                return offset(Axis.Y, boxLength);
            case "z":
                return offset(Axis.Z, boxLength);
            case "r_cylinder":
                return r -> Math.hypot(r.center(a, boxLength) - ca, r.center(b, boxLength) - cb);
            case "r_sphere":
                return r -> Math.sqrt(square(r.center(a, boxLength) - ca)
                      + square(r.center(b, boxLength) - cb)
                      + square(r.center(d, boxLength) - cd));
            case "phi":
                return r -> {
                    double angle = Math.atan2(r.center(b, boxLength) - cb, r.center(a, boxLength) - ca);
                    return angle < 0 ? angle + TWO_PI : angle;
                };
            default:
                break;
        }
        int va = requireField(name, velocityField(a));
        int vb = requireField(name, velocityField(b));
        int vd = requireField(name, velocityField(d));
        switch (name) {
            case "vr_cylinder":
                return r -> radialInPlane(r, boxLength, ca, cb, va, vb);
            case "vr_cylinder2":
                return r -> square(radialInPlane(r, boxLength, ca, cb, va, vb));
            case "vphi_cylinder":
            case "vphi_sphere":
                return r -> azimuthal(r, boxLength, ca, cb, va, vb);
            case "vphi_cylinder2":
                return r -> square(azimuthal(r, boxLength, ca, cb, va, vb));
            case "vr_sphere":
                return r -> {
                    double da = r.center(a, boxLength) - ca;
                    double db = r.center(b, boxLength) - cb;
                    double dd = r.center(d, boxLength) - cd;
                    double radius = Math.sqrt(da * da + db * db + dd * dd);
                    if (radius == 0) return 0;
                    return (da * r.field(va) + db * r.field(vb) + dd * r.field(vd)) / radius;
                };
            case "vtheta_sphere":
                return r -> {
                    double da = r.center(a, boxLength) - ca;
                    double db = r.center(b, boxLength) - cb;
                    double dd = r.center(d, boxLength) - cd;
                    double cylinder = Math.hypot(da, db);
                    double radius = Math.sqrt(cylinder * cylinder + dd * dd);
                    if (cylinder == 0 || radius == 0) return 0;
                    double inPlane = (da * r.field(va) + db * r.field(vb)) / cylinder;
                    return (dd * inPlane - cylinder * r.field(vd)) / radius;
                };
            default:
                LOG.debug("No center-relative formula for {}", name);
                throw new DerivedVariableException(name, "not a supported center-relative variable.");
        }
    }

    private ValueFunction offset (Axis axis, double boxLength) {
        double c = dataCenter[axis.ordinal()];
        return r -> r.center(axis, boxLength) - c;
    }

    /// Velocity component along the in-plane radius vector from the data center.
    private double radialInPlane (Record r, double boxLength, double ca, double cb, int va, int vb) {
        double da = r.center(direction.a, boxLength) - ca;
        double db = r.center(direction.b, boxLength) - cb;
        double radius = Math.hypot(da, db);
        if (radius == 0) return 0;
        return (da * r.field(va) + db * r.field(vb)) / radius;
    }

    /// Velocity component perpendicular to the in-plane radius, positive counterclockwise.
    private double azimuthal (Record r, double boxLength, double ca, double cb, int va, int vb) {
        double da = r.center(direction.a, boxLength) - ca;
        double db = r.center(direction.b, boxLength) - cb;
        double radius = Math.hypot(da, db);
        if (radius == 0) return 0;
        return (da * r.field(vb) - db * r.field(va)) / radius;
    }

    private static double square (double v) {
        return v * v;
    }

    private static String velocityField (Axis axis) {
        return "v" + axis.name().toLowerCase();
    }

}
