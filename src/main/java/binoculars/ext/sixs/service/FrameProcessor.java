package binoculars.ext.sixs.service;

import binoculars.ext.sixs.geometry.InstrumentAxes;
import binoculars.ext.sixs.geometry.RotationFunctions;
import binoculars.ext.sixs.model.ArrayShapes;
import binoculars.ext.sixs.model.Frame;
import binoculars.ext.sixs.model.FrameResult;
import binoculars.ext.sixs.model.PixelGeometry;
import binoculars.ext.sixs.model.ProjectionInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Per-point pipeline: reads a frame, builds the sample and detector rotations, applies
 * the pixel masks and runs the configured projection.
 *
 * <p>Pipeline per point:
 * <pre>
 * channels → Frame → R = compose(sample angles), P = compose(detector angles) [· roll]
 *          → ProjectionInput{pixels, k, UB, R, P} → projection → FrameResult
 * </pre>
 *
 * <p>One processor serves the points of one scan. It keeps no mutable state.
 */
public class FrameProcessor {
    private static final Logger logger = LoggerFactory.getLogger(FrameProcessor.class);

    /**
     * Axis of the detector roll correction: the incident beam.
     */
    static final double[] ROLL_AXIS = {1, 0, 0};

    private final ScanContext context;
    private final List<String> sampleChannels;
    private final List<String> detectorChannels;
    private final String imageChannel;

    /**
     * @throws binoculars.ext.sixs.config.ConfigurationException if the instrument has no
     *         channel for one of the chain stages
     */
    public FrameProcessor(ScanContext context) {
        this.context = context;
        this.sampleChannels = context.sampleChannels();
        this.detectorChannels = context.detectorChannels();
        this.imageChannel = context.instrument().imageChannel();
    }

    /**
     * Reads and processes one point.
     *
     * @throws FrameProcessingException on any failure, carrying the scan and point index
     */
    public FrameResult process(ScanHandle handle, int index) {
        try {
            return process(readFrame(handle, index));
        } catch (FrameProcessingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to process scan {} point {}", context.scan(), index, e);
            throw new FrameProcessingException(context.scan(), index, e);
        }
    }

    /**
     * Reads the image and stage angles of one point through the instrument's channel mapping.
     */
    public Frame readFrame(ScanHandle handle, int index) throws IOException {
        double[][] image = handle.readImage(imageChannel, index);
        double[] sampleAngles = readScalars(handle, sampleChannels, index);
        double[] detectorAngles = readScalars(handle, detectorChannels, index);
        return new Frame(index, image, sampleAngles, detectorAngles);
    }

    /**
     * Processes an already-read frame.
     *
     * @throws FrameProcessingException on any failure, carrying the scan and point index
     */
    public FrameResult process(Frame frame) {
        try {
            ProjectionInput input = buildProjectionInput(frame);
            double[][] weights = computeWeights(frame.image());
            double[][][] coordinates = context.projection().project(input);

            logger.debug("Processed scan {} point {}", context.scan(), frame.index());
            return new FrameResult(frame.index(), frame.image(), weights, input,
                    context.projection().getAxisLabels(), coordinates);
        } catch (RuntimeException e) {
            logger.error("Failed to process scan {} point {}", context.scan(), frame.index(), e);
            throw new FrameProcessingException(context.scan(), frame.index(), e);
        }
    }

    /**
     * Builds the sample rotation R, the detector rotation P (with the optional roll
     * correction about the beam) and assembles the projection input.
     */
    ProjectionInput buildProjectionInput(Frame frame) {
        InstrumentAxes axes = context.diffractometer().axes();

        double[][] r = axes.sample().rotation(toRadians(frame.sampleAngles()));
        double[][] p = axes.detector().rotation(toRadians(frame.detectorAngles()));
        if (context.detectorRoll().isPresent()) {
            double roll = Math.toRadians(context.detectorRoll().get());
            p = RotationFunctions.multiply(p, RotationFunctions.rotationMatrix(roll, ROLL_AXIS));
        }

        if (logger.isTraceEnabled()) {
            logger.trace("Point {}: R={}, P={}", frame.index(),
                    RotationFunctions.formatMatrix(r), RotationFunctions.formatMatrix(p));
        }
        return new ProjectionInput(context.pixels(), context.source().wavevector(),
                context.diffractometer().ub(), r, p);
    }

    /**
     * 1 for valid pixels, 0 where the combined mask is set.
     *
     * @throws IllegalArgumentException if the image does not match the detector
     */
    double[][] computeWeights(double[][] image) {
        PixelGeometry pixels = context.pixels();
        if (!ArrayShapes.hasShape(image, pixels.rows(), pixels.columns())) {
            throw new IllegalArgumentException(String.format("Image of %s does not match the %dx%d detector",
                    ArrayShapes.describe(image), pixels.rows(), pixels.columns()));
        }
        double[][] weights = new double[pixels.rows()][pixels.columns()];
        for (int i = 0; i < weights.length; i++) {
            for (int j = 0; j < weights[i].length; j++) {
                weights[i][j] = context.isMasked(i, j) ? 0.0 : 1.0;
            }
        }
        return weights;
    }

    private static double[] readScalars(ScanHandle handle, List<String> channels, int index) throws IOException {
        double[] values = new double[channels.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = handle.readScalar(channels.get(i), index);
        }
        return values;
    }

    private static double[] toRadians(double[] degrees) {
        double[] radians = new double[degrees.length];
        for (int i = 0; i < degrees.length; i++) {
            radians[i] = Math.toRadians(degrees[i]);
        }
        return radians;
    }
}
