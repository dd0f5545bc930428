package binoculars.ext.sixs;

import binoculars.ext.sixs.config.BackendConfiguration;
import binoculars.ext.sixs.jobs.JobSplitter;
import binoculars.ext.sixs.jobs.ScanRanges;
import binoculars.ext.sixs.model.FrameResult;
import binoculars.ext.sixs.model.Job;
import binoculars.ext.sixs.service.DetectorGeometryProvider;
import binoculars.ext.sixs.service.RectangularDetectorProvider;
import binoculars.ext.sixs.service.ScanJobProcessor;
import binoculars.ext.sixs.service.ScanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Entry point of the SIXS backend: turns a scan selection into jobs and jobs into
 * per-point projected coordinates.
 *
 * <pre>{@code
 * SixsBackend backend = new SixsBackend(BackendConfiguration.fromYaml(path), store);
 * backend.generateJobs("12-14").forEach(job -> {
 *     try (Stream<FrameResult> frames = backend.processJob(job)) {
 *         frames.forEach(consumer);
 *     }
 * });
 * }</pre>
 *
 * <p>Job generation and job processing share no state, so jobs may be processed on
 * different threads or machines.
 */
public class SixsBackend {
    private static final Logger logger = LoggerFactory.getLogger(SixsBackend.class);

    private final BackendConfiguration config;
    private final ScanJobProcessor processor;

    public SixsBackend(BackendConfiguration config, ScanStore store) {
        this(config, store, new RectangularDetectorProvider());
    }

    public SixsBackend(BackendConfiguration config, ScanStore store, DetectorGeometryProvider detectors) {
        this.config = config;
        this.processor = new ScanJobProcessor(config, store, detectors);
        logger.info("SIXS backend ready: {}", config);
    }

    public BackendConfiguration getConfiguration() {
        return config;
    }

    /**
     * Lazily splits the selected scans into jobs. Scan files are opened for their point
     * count only when the stream reaches them, and not at all when a point range is
     * configured.
     *
     * @param selection scan selection, e.g. "1-3, 7"
     * @throws binoculars.ext.sixs.config.ConfigurationException for a malformed selection,
     *         or from the stream for a missing scan file
     */
    public Stream<Job> generateJobs(String selection) {
        List<Integer> scans = ScanRanges.parse(selection);
        logger.info("Generating jobs for scans {} with target weight {}", scans, config.getTargetWeight());
        return JobSplitter.generateJobs(scans, config.getPointRange().orElse(null),
                config.getTargetWeight(), processor::countPoints);
    }

    /**
     * @see ScanJobProcessor#processJob(Job)
     */
    public Stream<FrameResult> processJob(Job job) throws IOException {
        return processor.processJob(job);
    }

    /**
     * @see ScanRanges#destinationOptions(List)
     */
    public Map<String, String> getDestinationOptions(String selection) {
        return ScanRanges.destinationOptions(ScanRanges.parse(selection));
    }
}
