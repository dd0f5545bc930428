package binoculars.ext.sixs.service;

import binoculars.ext.sixs.model.Job;
import org.slf4j.MDC;

/**
 * Scopes log output to one job by setting the MDC keys {@value #SCAN_KEY} and
 * {@value #POINTS_KEY} on the current thread.
 *
 * <pre>{@code
 * try (JobLogContext ignored = JobLogContext.open(job)) {
 *     logger.info("Processing...");  // [scan=42 points=0-29]
 * }
 * }</pre>
 *
 * <p>Closing restores whatever values the keys held before, so contexts nest.
 */
public final class JobLogContext implements AutoCloseable {

    public static final String SCAN_KEY = "scan";
    public static final String POINTS_KEY = "points";

    private final String previousScan;
    private final String previousPoints;
    private boolean closed;

    private JobLogContext(String scan, String points) {
        this.previousScan = MDC.get(SCAN_KEY);
        this.previousPoints = MDC.get(POINTS_KEY);
        MDC.put(SCAN_KEY, scan);
        MDC.put(POINTS_KEY, points);
    }

    public static JobLogContext open(Job job) {
        return new JobLogContext(String.valueOf(job.scan()), job.firstPoint() + "-" + job.lastPoint());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        restore(SCAN_KEY, previousScan);
        restore(POINTS_KEY, previousPoints);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
