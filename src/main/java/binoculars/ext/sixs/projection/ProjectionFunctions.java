package binoculars.ext.sixs.projection;

import binoculars.ext.sixs.geometry.RotationFunctions;
import binoculars.ext.sixs.model.PixelGeometry;
import binoculars.ext.sixs.model.ProjectionInput;

/**
 * Pure coordinate transforms behind the {@link ProjectionType} variants.
 *
 * <p>Transform chain for the reciprocal-space variants:
 * <pre>
 * pixel position → kf = pixel / |pixel|        (outgoing direction)
 * M   = (R · UB)⁻¹
 * out = (M · P · kf − M · ki) · k              ki = (1, 0, 0)
 * </pre>
 * HK and Qpar/Qper are post-processing steps over that shared transform.
 */
public final class ProjectionFunctions {

    /**
     * Incident beam direction in the lab frame.
     */
    public static final double[] INCIDENT_DIRECTION = {1, 0, 0};

    private static final double TAU = 2 * Math.PI;

    private ProjectionFunctions() {
    }

    // ==================== SHARED STEPS ====================

    /**
     * Unit direction of every pixel. A zero-length vector is divided by 1 and stays the
     * zero vector; the weight channel is expected to exclude such a pixel.
     *
     * @return 3 x rows x columns grid of directions
     */
    public static double[][][] normalizedDirections(PixelGeometry pixels) {
        int rows = pixels.rows();
        int cols = pixels.columns();
        double[][][] directions = new double[3][rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double x = pixels.get(0, i, j);
                double y = pixels.get(1, i, j);
                double z = pixels.get(2, i, j);
                double norm = Math.sqrt(x * x + y * y + z * z);
                if (norm == 0) {
                    norm = 1;
                }
                directions[0][i][j] = x / norm;
                directions[1][i][j] = y / norm;
                directions[2][i][j] = z / norm;
            }
        }
        return directions;
    }

    /**
     * Momentum transfer of every pixel expressed in the basis of {@code ub}.
     *
     * @param input frame input; its own UB is ignored in favour of {@code ub}
     * @param ub basis to express the result in
     * @return 3 x rows x columns grid
     * @throws IllegalStateException if R · UB is singular
     */
    public static double[][][] momentumTransfer(ProjectionInput input, double[][] ub) {
        double[][] rub1 = RotationFunctions.invert(RotationFunctions.multiply(input.r(), ub));
        double[][] rub1p = RotationFunctions.multiply(rub1, input.p());
        double[] incident = RotationFunctions.multiply(rub1, INCIDENT_DIRECTION);
        double k = input.k();

        double[][][] kf = normalizedDirections(input.pixels());
        int rows = input.pixels().rows();
        int cols = input.pixels().columns();
        double[][][] out = new double[3][rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double x = kf[0][i][j];
                double y = kf[1][i][j];
                double z = kf[2][i][j];
                for (int c = 0; c < 3; c++) {
                    double outgoing = rub1p[c][0] * x + rub1p[c][1] * y + rub1p[c][2] * z;
                    out[c][i][j] = (outgoing - incident[c]) * k;
                }
            }
        }
        return out;
    }

    // ==================== VARIANTS ====================

    /**
     * Raw lab-frame y and z of every pixel, ignoring all rotations.
     */
    public static double[][][] realSpace(ProjectionInput input) {
        return new double[][][]{input.pixels().component(1), input.pixels().component(2)};
    }

    /**
     * Column and row index of every pixel.
     */
    public static double[][][] pixelIndices(ProjectionInput input) {
        int rows = input.pixels().rows();
        int cols = input.pixels().columns();
        double[][] columnIndex = new double[rows][cols];
        double[][] rowIndex = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                columnIndex[i][j] = j;
                rowIndex[i][j] = i;
            }
        }
        return new double[][][]{columnIndex, rowIndex};
    }

    public static double[][][] hkl(ProjectionInput input) {
        return momentumTransfer(input, input.ub());
    }

    public static double[][][] hk(ProjectionInput input) {
        return dropLast(hkl(input));
    }

    /**
     * Lab-frame momentum transfer: the HKL transform with UB = diag(2π, 2π, 2π).
     */
    public static double[][][] qxQyQz(ProjectionInput input) {
        return momentumTransfer(input, RotationFunctions.diagonal(TAU, TAU, TAU));
    }

    public static double[][][] qparQper(ProjectionInput input) {
        return toParallelPerpendicular(qxQyQz(input));
    }

    // ==================== POST-PROCESSING ====================

    static double[][][] dropLast(double[][][] coordinates) {
        double[][][] result = new double[coordinates.length - 1][][];
        System.arraycopy(coordinates, 0, result, 0, result.length);
        return result;
    }

    /**
     * Qpar = √(Qx² + Qy²), Qper = Qz.
     */
    static double[][][] toParallelPerpendicular(double[][][] q) {
        double[][] qx = q[0];
        double[][] qy = q[1];
        int rows = qx.length;
        int cols = rows == 0 ? 0 : qx[0].length;
        double[][] qpar = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                qpar[i][j] = Math.sqrt(qx[i][j] * qx[i][j] + qy[i][j] * qy[i][j]);
            }
        }
        return new double[][][]{qpar, q[2]};
    }
}
