package binoculars.ext.sixs.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lab-frame Cartesian position of every detector pixel, a 3 x rows x columns grid,
 * centred on the direct-beam pixel.
 *
 * <p>Lab frame: x along the incident beam, y horizontal, z vertical. Static for a given
 * detector, central pixel and sample-detector distance, so one instance serves every
 * frame of a job. The grids are copied on construction and never exposed for writing.
 */
public final class PixelGeometry {
    private static final Logger logger = LoggerFactory.getLogger(PixelGeometry.class);

    private final double[][][] components;
    private final int rows;
    private final int columns;

    /**
     * @param x lab x of each pixel, rows x columns
     * @param y lab y of each pixel, rows x columns
     * @param z lab z of each pixel, rows x columns
     */
    public PixelGeometry(double[][] x, double[][] y, double[][] z) {
        this.rows = x.length;
        this.columns = rows == 0 ? 0 : x[0].length;
        if (rows == 0 || columns == 0) {
            throw new IllegalArgumentException("Pixel geometry must not be empty");
        }
        if (!ArrayShapes.hasShape(x, rows, columns) || !ArrayShapes.hasShape(y, rows, columns)
                || !ArrayShapes.hasShape(z, rows, columns)) {
            throw new IllegalArgumentException("Pixel geometry components must all be " + rows + "x" + columns);
        }
        this.components = new double[][][]{ArrayShapes.copy(x), ArrayShapes.copy(y), ArrayShapes.copy(z)};
    }

    /**
     * Places a detector in the lab frame at distance {@code sdd} along the beam, with the
     * central pixel on the beam axis.
     *
     * <pre>
     * lab = [sdd, −(x − x0), (y − y0)]
     * </pre>
     * where (y0, x0) is the detector-frame position of the central pixel.
     *
     * @param detector detector description
     * @param centralPixelX column of the direct-beam pixel
     * @param centralPixelY row of the direct-beam pixel
     * @param sdd sample-detector distance, same unit as the detector positions
     * @throws IllegalArgumentException if the central pixel lies outside the detector
     */
    public static PixelGeometry fromDetector(Detector detector, int centralPixelX, int centralPixelY, double sdd) {
        int rows = detector.rows();
        int cols = detector.columns();
        if (centralPixelX < 0 || centralPixelX >= cols || centralPixelY < 0 || centralPixelY >= rows) {
            throw new IllegalArgumentException(String.format(
                    "Central pixel (%d, %d) lies outside detector '%s' of %d columns x %d rows",
                    centralPixelX, centralPixelY, detector.name(), cols, rows));
        }

        double y0 = detector.yAt(centralPixelY, centralPixelX);
        double x0 = detector.xAt(centralPixelY, centralPixelX);

        double[][] labX = new double[rows][cols];
        double[][] labY = new double[rows][cols];
        double[][] labZ = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                labX[i][j] = sdd;
                labY[i][j] = -(detector.xAt(i, j) - x0);
                labZ[i][j] = detector.yAt(i, j) - y0;
            }
        }

        logger.info("Pixel geometry for {}: {}x{} pixels, central pixel ({}, {}), sdd {}",
                detector.name(), rows, cols, centralPixelX, centralPixelY, sdd);
        return new PixelGeometry(labX, labY, labZ);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    /**
     * @param component 0 for x, 1 for y, 2 for z
     */
    public double get(int component, int row, int col) {
        return components[component][row][col];
    }

    /**
     * Copy of one component grid.
     *
     * @param component 0 for x, 1 for y, 2 for z
     */
    public double[][] component(int component) {
        return ArrayShapes.copy(components[component]);
    }
}
