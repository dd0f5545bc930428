package binoculars.ext.sixs.model;

/**
 * Shape checks and copies for the 2D grids used by frames, masks and geometry.
 */
public final class ArrayShapes {

    private ArrayShapes() {
    }

    public static boolean hasShape(double[][] array, int rows, int cols) {
        if (array == null || array.length != rows) {
            return false;
        }
        for (double[] row : array) {
            if (row == null || row.length != cols) {
                return false;
            }
        }
        return true;
    }

    public static boolean hasShape(boolean[][] array, int rows, int cols) {
        if (array == null || array.length != rows) {
            return false;
        }
        for (boolean[] row : array) {
            if (row == null || row.length != cols) {
                return false;
            }
        }
        return true;
    }

    public static double[][] copy(double[][] array) {
        double[][] copy = new double[array.length][];
        for (int i = 0; i < array.length; i++) {
            copy[i] = array[i].clone();
        }
        return copy;
    }

    public static boolean[][] copy(boolean[][] array) {
        boolean[][] copy = new boolean[array.length][];
        for (int i = 0; i < array.length; i++) {
            copy[i] = array[i].clone();
        }
        return copy;
    }

    public static String describe(double[][] array) {
        return array.length + "x" + (array.length == 0 ? 0 : array[0].length);
    }

    public static String describe(boolean[][] array) {
        return array.length + "x" + (array.length == 0 ? 0 : array[0].length);
    }
}
