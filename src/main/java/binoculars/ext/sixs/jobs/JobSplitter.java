package binoculars.ext.sixs.jobs;

import binoculars.ext.sixs.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits scans into jobs of roughly {@code targetWeight} points.
 *
 * <p>A scan of N points becomes a single job when N &le; {@value #SINGLE_JOB_FACTOR} x target.
 * Otherwise it is cut into jobs of exactly {@code targetWeight} points followed by one job
 * holding the remainder:
 * <pre>
 * N = 100, T = 30  →  [0-29] [30-59] [60-89] [90-99]
 * N =  40, T = 30  →  [0-39]
 * </pre>
 *
 * <p>Jobs of a scan are contiguous, ordered and do not overlap; their weights sum to N.
 */
public final class JobSplitter {
    private static final Logger logger = LoggerFactory.getLogger(JobSplitter.class);

    /**
     * Scans up to this multiple of the target weight are kept whole.
     */
    public static final double SINGLE_JOB_FACTOR = 1.4;

    /**
     * Source of scan point counts.
     */
    @FunctionalInterface
    public interface PointCounter {
        int countPoints(int scan) throws IOException;
    }

    private JobSplitter() {
    }

    /**
     * Splits one scan.
     *
     * @param scan scan number
     * @param pointCount number of points N; no job is produced when N &lt; 1
     * @param start index of the first point
     * @param targetWeight points per job, at least 1
     * @throws IllegalArgumentException if the target weight or start is invalid, or if the
     *         last point index would not fit in an int
     */
    public static Stream<Job> split(int scan, int pointCount, int start, int targetWeight) {
        if (targetWeight < 1) {
            throw new IllegalArgumentException("Target weight must be at least 1, got: " + targetWeight);
        }
        if (start < 0) {
            throw new IllegalArgumentException("First point must not be negative, got: " + start);
        }
        if (pointCount < 1) {
            logger.warn("Scan {} has no points to process ({}), no job generated", scan, pointCount);
            return Stream.empty();
        }
        int end;
        try {
            end = Math.addExact(start, pointCount);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format(
                    "Scan %d: %d points from point %d exceed the point index range", scan, pointCount, start), e);
        }
        if (pointCount <= SINGLE_JOB_FACTOR * targetWeight) {
            return Stream.of(new Job(scan, start, end - 1, pointCount));
        }
        Iterator<Job> chunks = new ChunkIterator(scan, start, end, targetWeight);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(chunks,
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Splits one scan using an explicit inclusive point range instead of the scan's own
     * point count.
     */
    public static Stream<Job> split(int scan, PointRange range, int targetWeight) {
        return split(scan, range.count(), range.first(), targetWeight);
    }

    /**
     * Splits several scans, in scan order. Point counts are requested from {@code counter}
     * only when the stream reaches the scan, and never when {@code override} is given.
     *
     * @param scans scan numbers
     * @param override explicit point range applied to every scan, or null
     * @param targetWeight points per job
     * @param counter source of point counts
     * @throws UncheckedIOException from the stream if a point count cannot be read
     */
    public static Stream<Job> generateJobs(List<Integer> scans, PointRange override,
                                           int targetWeight, PointCounter counter) {
        if (scans.isEmpty()) {
            logger.warn("Empty scan selection, no job generated");
        }
        return scans.stream().flatMap(scan -> {
            if (override != null) {
                return split(scan, override, targetWeight);
            }
            try {
                return split(scan, counter.countPoints(scan), 0, targetWeight);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read the point count of scan " + scan, e);
            }
        });
    }

    private static final class ChunkIterator implements Iterator<Job> {
        private final int scan;
        private final int end;
        private final int targetWeight;
        private int next;

        ChunkIterator(int scan, int start, int end, int targetWeight) {
            this.scan = scan;
            this.next = start;
            this.end = end;
            this.targetWeight = targetWeight;
        }

        @Override
        public boolean hasNext() {
            return next < end;
        }

        @Override
        public Job next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int size = Math.min(targetWeight, end - next);
            Job job = new Job(scan, next, next + size - 1, size);
            next += size;
            return job;
        }
    }
}
