package binoculars.ext.sixs.model;

/**
 * A contiguous range of scan points processed by one worker.
 *
 * @param scan scan number
 * @param firstPoint first point index
 * @param lastPoint last point index, inclusive
 * @param weight scheduling cost estimate (the point count), only used for load balancing
 */
public record Job(int scan, int firstPoint, int lastPoint, int weight) {

    public Job {
        if (firstPoint < 0) {
            throw new IllegalArgumentException("First point must not be negative, got: " + firstPoint);
        }
        if (lastPoint < firstPoint) {
            throw new IllegalArgumentException(String.format(
                    "Last point %d is before first point %d", lastPoint, firstPoint));
        }
        if (weight < 1) {
            throw new IllegalArgumentException("Job weight must be at least 1, got: " + weight);
        }
    }

    public int pointCount() {
        return lastPoint - firstPoint + 1;
    }

    @Override
    public String toString() {
        return String.format("Job[scan=%d, points=%d-%d, weight=%d]", scan, firstPoint, lastPoint, weight);
    }
}
