package binoculars.ext.sixs.jobs;

/**
 * Explicit inclusive range of scan points, overriding the scan's own point count.
 *
 * @param first first point index
 * @param last last point index, inclusive
 */
public record PointRange(int first, int last) {

    public PointRange {
        if (first < 0 || last < first) {
            throw new IllegalArgumentException(String.format("Invalid point range %d-%d", first, last));
        }
        if (last - first == Integer.MAX_VALUE) {
            throw new IllegalArgumentException(String.format("Point range %d-%d has too many points", first, last));
        }
    }

    public int count() {
        return Math.addExact(last - first, 1);
    }

    @Override
    public String toString() {
        return first + "," + last;
    }
}
