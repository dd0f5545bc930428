package binoculars.ext.sixs.jobs;

import binoculars.ext.sixs.model.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JobSplitter.
 */
class JobSplitterTest {

    // ==================== Single Scan Tests ====================

    @Test
    @DisplayName("100 points at target 30 give three full jobs and a remainder")
    void testChunksWithRemainder() {
        List<Job> jobs = JobSplitter.split(7, 100, 0, 30).collect(Collectors.toList());
        assertEquals(List.of(
                new Job(7, 0, 29, 30),
                new Job(7, 30, 59, 30),
                new Job(7, 60, 89, 30),
                new Job(7, 90, 99, 10)), jobs);
    }

    @Test
    @DisplayName("Scans up to 1.4 x target stay whole")
    void testSingleJobThreshold() {
        assertEquals(List.of(new Job(1, 0, 39, 40)), JobSplitter.split(1, 40, 0, 30).collect(Collectors.toList()));
        assertEquals(List.of(new Job(1, 0, 41, 42)), JobSplitter.split(1, 42, 0, 30).collect(Collectors.toList()));
        assertEquals(List.of(new Job(1, 0, 29, 30), new Job(1, 30, 42, 13)),
                JobSplitter.split(1, 43, 0, 30).collect(Collectors.toList()));
    }

    @Test
    void testExactMultipleHasNoEmptyRemainder() {
        List<Job> jobs = JobSplitter.split(1, 90, 0, 30).collect(Collectors.toList());
        assertEquals(3, jobs.size());
        assertEquals(89, jobs.get(2).lastPoint());
    }

    @Test
    @DisplayName("Explicit point range offsets every job")
    void testPointRangeOverride() {
        List<Job> jobs = JobSplitter.split(3, new PointRange(10, 109), 30).collect(Collectors.toList());
        assertEquals(List.of(
                new Job(3, 10, 39, 30),
                new Job(3, 40, 69, 30),
                new Job(3, 70, 99, 30),
                new Job(3, 100, 109, 10)), jobs);
    }

    @Test
    void testNoPoints() {
        assertEquals(0, JobSplitter.split(1, 0, 0, 30).count());
        assertEquals(0, JobSplitter.split(1, -3, 0, 30).count());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> JobSplitter.split(1, 10, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> JobSplitter.split(1, 10, -1, 5));
    }

    @Test
    @DisplayName("Point indices past the int range are rejected, not wrapped")
    void testPointIndexOverflow() {
        assertThrows(IllegalArgumentException.class,
                () -> JobSplitter.split(1, 10, Integer.MAX_VALUE - 5, 5));
        assertThrows(IllegalArgumentException.class, () -> new PointRange(0, Integer.MAX_VALUE));
        assertEquals(Integer.MAX_VALUE, new PointRange(1, Integer.MAX_VALUE).count());

        List<Job> jobs = JobSplitter.split(1, 3, Integer.MAX_VALUE - 3, 30).collect(Collectors.toList());
        assertEquals(List.of(new Job(1, Integer.MAX_VALUE - 3, Integer.MAX_VALUE - 1, 3)), jobs);
    }

    @ParameterizedTest
    @CsvSource({
            "1, 1",
            "1, 1000",
            "1000, 1000",
            "1401, 1000",
            "5003, 1000",
            "77, 7",
            "100, 1"
    })
    @DisplayName("Jobs are contiguous, ordered and their weights sum to the point count")
    void testPartitionProperties(int pointCount, int target) {
        List<Job> jobs = JobSplitter.split(5, pointCount, 4, target).collect(Collectors.toList());
        assertEquals(4, jobs.get(0).firstPoint());
        assertEquals(4 + pointCount - 1, jobs.get(jobs.size() - 1).lastPoint());
        int total = 0;
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            assertEquals(job.pointCount(), job.weight());
            if (i > 0) {
                assertEquals(jobs.get(i - 1).lastPoint() + 1, job.firstPoint());
            }
            if (jobs.size() > 1) {
                assertTrue(job.weight() <= target);
            }
            total += job.weight();
        }
        assertEquals(pointCount, total);
    }

    // ==================== Multi-Scan Tests ====================

    @Test
    @DisplayName("Point counts are requested only when the stream reaches a scan")
    void testLazyPointCounts() {
        List<Integer> requested = new ArrayList<>();
        JobSplitter.PointCounter counter = scan -> {
            requested.add(scan);
            return 50;
        };

        Iterator<Job> jobs = JobSplitter.generateJobs(List.of(4, 5, 6), null, 30, counter).iterator();
        assertTrue(requested.isEmpty());

        assertEquals(new Job(4, 0, 29, 30), jobs.next());
        assertEquals(List.of(4), requested);
        assertEquals(new Job(4, 30, 49, 20), jobs.next());
        assertEquals(List.of(4), requested);

        assertEquals(5, jobs.next().scan());
        assertEquals(List.of(4, 5), requested);
    }

    @Test
    void testScanOrderThenChunkOrder() {
        List<Job> jobs = JobSplitter.generateJobs(List.of(9, 2), null, 10, scan -> scan * 10)
                .collect(Collectors.toList());
        assertEquals(List.of(9, 9, 9, 9, 9, 9, 9, 9, 9, 2, 2),
                jobs.stream().map(Job::scan).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("With a point range the scans are never opened")
    void testOverrideSkipsCounter() {
        JobSplitter.PointCounter counter = scan -> {
            throw new AssertionError("point count of scan " + scan + " requested");
        };
        List<Job> jobs = JobSplitter.generateJobs(List.of(1, 2), new PointRange(5, 14), 1000, counter)
                .collect(Collectors.toList());
        assertEquals(List.of(new Job(1, 5, 14, 10), new Job(2, 5, 14, 10)), jobs);
    }

    @Test
    void testEmptySelection() {
        assertEquals(0, JobSplitter.generateJobs(List.of(), null, 10, scan -> 10).count());
    }

    @Test
    void testCounterFailure() {
        JobSplitter.PointCounter counter = scan -> {
            throw new IOException("unreadable");
        };
        UncheckedIOException e = assertThrows(UncheckedIOException.class,
                () -> JobSplitter.generateJobs(List.of(8), null, 10, counter).count());
        assertTrue(e.getMessage().contains("scan 8"));
    }
}
