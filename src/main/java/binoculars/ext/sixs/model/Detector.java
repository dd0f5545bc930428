package binoculars.ext.sixs.model;

/**
 * Static description of an area detector: per-pixel Cartesian positions in the detector
 * plane and the hardware bad-pixel mask.
 *
 * <p>Positions follow the detector's own frame: {@code y} along rows (slow axis),
 * {@code x} along columns (fast axis), in metres. Arrays are copied on construction
 * and on access.
 *
 * @param name detector model name, e.g. "imxpads140"
 * @param y row-direction position of each pixel centre, rows x columns
 * @param x column-direction position of each pixel centre, rows x columns
 * @param mask true for bad pixels, rows x columns
 */
public record Detector(String name, double[][] y, double[][] x, boolean[][] mask) {

    public Detector {
        int rows = y.length;
        int cols = rows == 0 ? 0 : y[0].length;
        if (rows == 0 || cols == 0) {
            throw new IllegalArgumentException("Detector '" + name + "' has no pixels");
        }
        if (!ArrayShapes.hasShape(y, rows, cols) || !ArrayShapes.hasShape(x, rows, cols)
                || !ArrayShapes.hasShape(mask, rows, cols)) {
            throw new IllegalArgumentException(String.format(
                    "Detector '%s' position and mask arrays must all be %dx%d", name, rows, cols));
        }
        y = ArrayShapes.copy(y);
        x = ArrayShapes.copy(x);
        mask = ArrayShapes.copy(mask);
    }

    public int rows() {
        return y.length;
    }

    public int columns() {
        return y[0].length;
    }

    @Override
    public double[][] y() {
        return ArrayShapes.copy(y);
    }

    @Override
    public double[][] x() {
        return ArrayShapes.copy(x);
    }

    @Override
    public boolean[][] mask() {
        return ArrayShapes.copy(mask);
    }

    double yAt(int row, int col) {
        return y[row][col];
    }

    double xAt(int row, int col) {
        return x[row][col];
    }
}
