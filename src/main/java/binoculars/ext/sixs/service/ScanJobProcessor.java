package binoculars.ext.sixs.service;

import binoculars.ext.sixs.config.BackendConfiguration;
import binoculars.ext.sixs.config.ConfigurationException;
import binoculars.ext.sixs.model.Detector;
import binoculars.ext.sixs.model.Diffractometer;
import binoculars.ext.sixs.model.FrameResult;
import binoculars.ext.sixs.model.Job;
import binoculars.ext.sixs.model.PixelGeometry;
import binoculars.ext.sixs.model.Sample;
import binoculars.ext.sixs.model.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns a {@link Job} into a lazy stream of {@link FrameResult}s.
 *
 * <p>Each call to {@link #processJob(Job)} opens its own {@link ScanHandle}. The handle
 * is closed once, whichever comes first:
 * <ul>
 *   <li>the last point of the job has been produced</li>
 *   <li>a point fails</li>
 *   <li>the stream is closed, e.g. by try-with-resources after an early exit</li>
 * </ul>
 *
 * <pre>{@code
 * try (Stream<FrameResult> frames = processor.processJob(job)) {
 *     frames.forEach(consumer);
 * }
 * }</pre>
 */
public class ScanJobProcessor {
    private static final Logger logger = LoggerFactory.getLogger(ScanJobProcessor.class);

    private final BackendConfiguration config;
    private final ScanStore store;
    private final DetectorGeometryProvider detectors;
    private final ScanFileLocator locator;

    public ScanJobProcessor(BackendConfiguration config, ScanStore store, DetectorGeometryProvider detectors) {
        this.config = config;
        this.store = store;
        this.detectors = detectors;
        this.locator = new ScanFileLocator(config.getNexusFile());
    }

    /**
     * Number of points of a scan, i.e. the number of images in its image channel.
     *
     * @throws ConfigurationException if the scan file does not exist
     * @throws IOException if the scan file cannot be read
     */
    public int countPoints(int scan) throws IOException {
        Path file = locator.locate(scan);
        try (ScanHandle handle = store.open(file)) {
            int count = handle.getPointCount(config.getInstrument().imageChannel());
            logger.debug("Scan {} ({}) has {} points", scan, file, count);
            return count;
        }
    }

    /**
     * Opens the job's scan and returns the frames of its points, in order.
     *
     * @throws ConfigurationException if the scan file is missing or does not fit the configuration
     * @throws IOException if the scan file, mask or scan metadata cannot be read
     * @throws binoculars.ext.sixs.geometry.UnsupportedGeometryException if the scan's
     *         diffractometer is unknown
     */
    public Stream<FrameResult> processJob(Job job) throws IOException {
        Path file = locator.locate(job.scan());
        FrameProcessor processor;
        ScanHandle handle;
        try (JobLogContext ignored = JobLogContext.open(job)) {
            logger.info("Starting {} from {}", job, file);
            handle = store.open(file);
            try {
                processor = new FrameProcessor(buildContext(job.scan(), handle));
            } catch (IOException | RuntimeException e) {
                closeAfterFailure(handle, e);
                throw e;
            }
        }

        FrameIterator frames = new FrameIterator(job, processor, handle);
        Spliterator<FrameResult> spliterator = Spliterators.spliteratorUnknownSize(frames,
                Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(frames::closeHandle);
    }

    /**
     * Reads everything that stays fixed during a scan: diffractometer, source, pixel
     * geometry and masks.
     */
    ScanContext buildContext(int scan, ScanHandle handle) throws IOException {
        InstrumentVariant instrument = config.getInstrument();
        Diffractometer diffractometer = Diffractometer.of(handle.getDiffractometerName(), handle.getUbMatrix());
        if (diffractometer.axes().type() != instrument.getExpectedDiffractometer()) {
            logger.warn("Scan {} declares diffractometer {} but instrument {} expects {}", scan,
                    diffractometer.name(), instrument.getConfigName(),
                    instrument.getExpectedDiffractometer().getDiffractometerName());
        }
        Source source = new Source(handle.getWavelength());

        Detector detector = detectors.getDetector(config.getDetector());
        PixelGeometry pixels;
        boolean[][] mask;
        try {
            pixels = PixelGeometry.fromDetector(detector,
                    config.getCentralPixelX(), config.getCentralPixelY(), config.getSdd());
            mask = ScanContext.combineMasks(detector.mask(), MaskLoader.load(config.getMaskMatrix().orElse(null)));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        ScanContext context = new ScanContext(scan, instrument, diffractometer, Sample.defaults(), source,
                pixels, mask, config.getProjection(), config.getDetectorRoll());
        logger.info("Scan {}: {} with sample chain {} and detector chain {}, wavelength {}, projection {}",
                scan, diffractometer.name(), diffractometer.axes().sample(), diffractometer.axes().detector(),
                source.wavelength(), config.getProjectionName());
        return context;
    }

    private static void closeAfterFailure(ScanHandle handle, Exception failure) {
        try {
            handle.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Produces one frame per point and owns the scan handle.
     */
    private static final class FrameIterator implements Iterator<FrameResult> {
        private final Job job;
        private final FrameProcessor processor;
        private final ScanHandle handle;
        private final AtomicBoolean closed = new AtomicBoolean();
        private int next;

        FrameIterator(Job job, FrameProcessor processor, ScanHandle handle) {
            this.job = job;
            this.processor = processor;
            this.handle = handle;
            this.next = job.firstPoint();
        }

        @Override
        public boolean hasNext() {
            return next <= job.lastPoint() && !closed.get();
        }

        @Override
        public FrameResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException(job + " has no more points");
            }
            try (JobLogContext ignored = JobLogContext.open(job)) {
                int index = next++;
                FrameResult result;
                try {
                    result = processor.process(handle, index);
                } catch (RuntimeException e) {
                    if (closed.compareAndSet(false, true)) {
                        closeAfterFailure(handle, e);
                    }
                    throw e;
                }
                if (next > job.lastPoint()) {
                    logger.info("Finished {}", job);
                    closeHandle();
                }
                return result;
            }
        }

        void closeHandle() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                handle.close();
                logger.debug("Closed scan handle of {}", job);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close scan " + job.scan(), e);
            }
        }
    }
}
