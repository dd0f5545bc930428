package binoculars.ext.sixs.geometry;

import java.util.Arrays;

/**
 * A single rotation stage of a diffractometer: its name and its unit rotation axis.
 *
 * <p>The axis is copied on construction and on access, so instances are immutable and
 * can be shared between threads.
 *
 * @param name the stage name, e.g. "mu", "omega"
 * @param axis the unit rotation axis [x, y, z] in the lab frame
 */
public record AxisNode(String name, double[] axis) {

    public AxisNode {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Axis name must not be empty");
        }
        if (axis == null || axis.length != 3) {
            throw new IllegalArgumentException("Axis vector of '" + name + "' must be [x, y, z]");
        }
        double norm = Math.sqrt(axis[0] * axis[0] + axis[1] * axis[1] + axis[2] * axis[2]);
        if (Math.abs(norm - 1.0) > 1e-9) {
            throw new IllegalArgumentException("Axis vector of '" + name + "' must be a unit vector, got "
                    + Arrays.toString(axis));
        }
        axis = axis.clone();
    }

    public static AxisNode of(String name, double x, double y, double z) {
        return new AxisNode(name, new double[]{x, y, z});
    }

    @Override
    public double[] axis() {
        return axis.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AxisNode other)) return false;
        return name.equals(other.name) && Arrays.equals(axis, other.axis);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(axis);
    }

    @Override
    public String toString() {
        return name + Arrays.toString(axis);
    }
}
