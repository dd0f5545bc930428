package binoculars.ext.sixs.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RotationFunctions - 3x3 rotation matrices for diffractometer stages.
 *
 * <p>Matrices are plain {@code double[3][3]} arrays in row-major order. Every method
 * returns a new array and never modifies its arguments, so all of them can be called
 * concurrently without synchronization.
 *
 * <p>Stage chain:
 * <pre>
 * reference root → stage 1 → stage 2 → ... → mount point
 * R = R(θ1, u1) · R(θ2, u2) · ... · R(θn, un)
 * </pre>
 * Each stage rotates in the frame already rotated by the stages it is mounted on.
 *
 * @since 0.1.0
 */
public final class RotationFunctions {
    private static final Logger logger = LoggerFactory.getLogger(RotationFunctions.class);

    private RotationFunctions() {
    }

    // ==================== ROTATIONS ====================

    /**
     * Builds the rotation matrix for an angle about a unit axis (Rodrigues formula).
     * <pre>
     * R = I·cosθ + (1 − cosθ)·u·uᵗ + sinθ·[u]ₓ
     * </pre>
     *
     * @param theta angle in radians
     * @param axis unit rotation axis [x, y, z]
     * @return the rotation matrix
     * @throws IllegalArgumentException if the axis is not a 3-vector
     */
    public static double[][] rotationMatrix(double theta, double[] axis) {
        if (axis == null || axis.length != 3) {
            throw new IllegalArgumentException("Rotation axis must be [x, y, z]");
        }
        double c = Math.cos(theta);
        double s = Math.sin(theta);
        double oneMinusC = 1 - c;
        double ux = axis[0];
        double uy = axis[1];
        double uz = axis[2];

        return new double[][]{
                {c + ux * ux * oneMinusC, ux * uy * oneMinusC - uz * s, ux * uz * oneMinusC + uy * s},
                {ux * uy * oneMinusC + uz * s, c + uy * uy * oneMinusC, uy * uz * oneMinusC - ux * s},
                {ux * uz * oneMinusC - uy * s, uy * uz * oneMinusC + ux * s, c + uz * uz * oneMinusC}
        };
    }

    /**
     * Composes the rotations of an ordered stage list, left to right.
     *
     * @param thetas angles in radians, one per stage, ordered from the reference root outward
     * @param axes unit axes, same order as {@code thetas}
     * @return R(θ1, u1) · R(θ2, u2) · ... · R(θn, un), identity for empty input
     * @throws IllegalArgumentException if the lists differ in length
     */
    public static double[][] compose(double[] thetas, List<double[]> axes) {
        if (thetas.length != axes.size()) {
            throw new IllegalArgumentException(String.format(
                    "Got %d angle values for %d rotation axes", thetas.length, axes.size()));
        }
        double[][] result = identity();
        for (int i = 0; i < thetas.length; i++) {
            result = multiply(result, rotationMatrix(thetas[i], axes.get(i)));
        }
        if (logger.isTraceEnabled()) {
            logger.trace("Composed {} rotations: {}", thetas.length, formatMatrix(result));
        }
        return result;
    }

    // ==================== MATRIX HELPERS ====================

    public static double[][] identity() {
        return diagonal(1, 1, 1);
    }

    public static double[][] diagonal(double d0, double d1, double d2) {
        return new double[][]{
                {d0, 0, 0},
                {0, d1, 0},
                {0, 0, d2}
        };
    }

    /**
     * Matrix product a · b for 3x3 matrices.
     */
    public static double[][] multiply(double[][] a, double[][] b) {
        double[][] result = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                result[i][j] = a[i][0] * b[0][j] + a[i][1] * b[1][j] + a[i][2] * b[2][j];
            }
        }
        return result;
    }

    /**
     * Matrix-vector product m · v.
     */
    public static double[] multiply(double[][] m, double[] v) {
        return new double[]{
                m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2],
                m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2],
                m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2]
        };
    }

    public static double[][] transpose(double[][] m) {
        double[][] result = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                result[i][j] = m[j][i];
            }
        }
        return result;
    }

    /**
     * Inverts a 3x3 matrix through its adjugate.
     *
     * @param m the matrix to invert
     * @return the inverse
     * @throws IllegalStateException if the matrix is singular
     */
    public static double[][] invert(double[][] m) {
        double c00 = m[1][1] * m[2][2] - m[1][2] * m[2][1];
        double c01 = m[1][2] * m[2][0] - m[1][0] * m[2][2];
        double c02 = m[1][0] * m[2][1] - m[1][1] * m[2][0];
        double det = m[0][0] * c00 + m[0][1] * c01 + m[0][2] * c02;

        if (det == 0 || !Double.isFinite(det)) {
            throw new IllegalStateException("Cannot invert matrix " + formatMatrix(m) + " (det=" + det + ")");
        }

        double inv = 1.0 / det;
        return new double[][]{
                {c00 * inv, (m[0][2] * m[2][1] - m[0][1] * m[2][2]) * inv, (m[0][1] * m[1][2] - m[0][2] * m[1][1]) * inv},
                {c01 * inv, (m[0][0] * m[2][2] - m[0][2] * m[2][0]) * inv, (m[0][2] * m[1][0] - m[0][0] * m[1][2]) * inv},
                {c02 * inv, (m[0][1] * m[2][0] - m[0][0] * m[2][1]) * inv, (m[0][0] * m[1][1] - m[0][1] * m[1][0]) * inv}
        };
    }

    /**
     * Deep copy of a 3x3 matrix, validating its shape.
     *
     * @throws IllegalArgumentException if the array is not 3x3
     */
    public static double[][] copyOf(double[][] m) {
        if (m == null || m.length != 3) {
            throw new IllegalArgumentException("Matrix must be 3x3");
        }
        double[][] copy = new double[3][];
        for (int i = 0; i < 3; i++) {
            if (m[i] == null || m[i].length != 3) {
                throw new IllegalArgumentException("Matrix must be 3x3");
            }
            copy[i] = m[i].clone();
        }
        return copy;
    }

    /**
     * Formats a matrix for log output.
     */
    public static String formatMatrix(double[][] m) {
        return String.format("[[%.6f, %.6f, %.6f], [%.6f, %.6f, %.6f], [%.6f, %.6f, %.6f]]",
                m[0][0], m[0][1], m[0][2],
                m[1][0], m[1][1], m[1][2],
                m[2][0], m[2][1], m[2][2]);
    }
}
