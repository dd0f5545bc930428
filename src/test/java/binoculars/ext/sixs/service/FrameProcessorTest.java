package binoculars.ext.sixs.service;

import binoculars.ext.sixs.geometry.RotationFunctions;
import binoculars.ext.sixs.model.Diffractometer;
import binoculars.ext.sixs.model.Frame;
import binoculars.ext.sixs.model.FrameResult;
import binoculars.ext.sixs.model.PixelGeometry;
import binoculars.ext.sixs.model.ProjectionInput;
import binoculars.ext.sixs.model.Sample;
import binoculars.ext.sixs.model.Source;
import binoculars.ext.sixs.projection.ProjectionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FrameProcessor against a mocked scan file.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FrameProcessorTest {

    private static final int SCAN = 17;

    @Mock
    private ScanHandle handle;

    private PixelGeometry pixels;
    private boolean[][] mask;

    @BeforeEach
    void setUp() throws IOException {
        pixels = new PixelGeometry(
                new double[][]{{1, 1, 1}, {1, 1, 1}},
                new double[][]{{0, 0.1, 0.2}, {0, 0.1, 0.2}},
                new double[][]{{0, 0, 0}, {0.1, 0.1, 0.1}});
        mask = new boolean[2][3];
        mask[0][2] = true;

        when(handle.readImage(eq("xpad_image"), anyInt())).thenReturn(new double[][]{{1, 2, 3}, {4, 5, 6}});
        when(handle.readScalar(eq("UHV_MU"), anyInt())).thenReturn(0.0);
        when(handle.readScalar(eq("UHV_OMEGA"), anyInt())).thenReturn(90.0);
        when(handle.readScalar(eq("UHV_DELTA"), anyInt())).thenReturn(10.0);
        when(handle.readScalar(eq("UHV_GAMMA"), anyInt())).thenReturn(0.0);
    }

    private FrameProcessor processor(ProjectionType projection, Double roll) {
        ScanContext context = new ScanContext(SCAN, InstrumentVariant.FLY_SCAN_UHV,
                Diffractometer.of("ZAXIS", RotationFunctions.identity()), Sample.defaults(), new Source(1.54),
                pixels, mask, projection, Optional.ofNullable(roll));
        return new FrameProcessor(context);
    }

    // ==================== Frame Reading ====================

    @Test
    @DisplayName("Stage angles are read through the instrument channel names")
    void testReadFrame() throws IOException {
        Frame frame = processor(ProjectionType.HKL, null).readFrame(handle, 4);

        assertEquals(4, frame.index());
        assertArrayEquals(new double[]{0.0, 90.0}, frame.sampleAngles());
        assertArrayEquals(new double[]{0.0, 10.0, 0.0}, frame.detectorAngles());
        verify(handle).readScalar("UHV_OMEGA", 4);
        verify(handle).readScalar("UHV_DELTA", 4);
    }

    // ==================== Processing ====================

    @Test
    @DisplayName("Angles are converted to radians before composing R and P")
    void testRotationsFromDegrees() throws IOException {
        FrameProcessor processor = processor(ProjectionType.HKL, null);
        ProjectionInput input = processor.buildProjectionInput(processor.readFrame(handle, 0));

        double[][] expectedR = RotationFunctions.compose(new double[]{0, Math.toRadians(90)},
                List.of(new double[]{0, 0, 1}, new double[]{0, -1, 0}));
        double[][] expectedP = RotationFunctions.rotationMatrix(Math.toRadians(10), new double[]{0, -1, 0});
        for (int i = 0; i < 3; i++) {
            assertArrayEquals(expectedR[i], input.r()[i], 1e-12);
            assertArrayEquals(expectedP[i], input.p()[i], 1e-12);
        }
        assertEquals(2 * Math.PI / 1.54, input.k(), 1e-12);
    }

    @Test
    @DisplayName("Detector roll is applied about the beam after the detector chain")
    void testDetectorRoll() throws IOException {
        FrameProcessor processor = processor(ProjectionType.HKL, 30.0);
        ProjectionInput input = processor.buildProjectionInput(processor.readFrame(handle, 0));

        double[][] expected = RotationFunctions.multiply(
                RotationFunctions.rotationMatrix(Math.toRadians(10), new double[]{0, -1, 0}),
                RotationFunctions.rotationMatrix(Math.toRadians(30), new double[]{1, 0, 0}));
        for (int i = 0; i < 3; i++) {
            assertArrayEquals(expected[i], input.p()[i], 1e-12);
        }
    }

    @Test
    @DisplayName("Masked pixels get weight 0, all others 1")
    void testWeights() {
        FrameResult result = processor(ProjectionType.QPARQPER, null).process(handle, 3);

        assertEquals(3, result.index());
        assertArrayEquals(new double[]{1, 1, 0}, result.weights()[0]);
        assertArrayEquals(new double[]{1, 1, 1}, result.weights()[1]);
        assertArrayEquals(new double[]{4, 5, 6}, result.intensity()[1]);
        assertEquals(List.of("Qpar", "Qper"), result.axisLabels());
        assertEquals(2, result.coordinates().length);
    }

    @Test
    void testCoordinatesMatchProjection() throws IOException {
        FrameProcessor processor = processor(ProjectionType.HKL, null);
        FrameResult result = processor.process(handle, 0);
        double[][][] expected = ProjectionType.HKL.project(
                processor.buildProjectionInput(processor.readFrame(handle, 0)));
        for (int c = 0; c < 3; c++) {
            for (int i = 0; i < 2; i++) {
                assertArrayEquals(expected[c][i], result.coordinates()[c][i], 1e-12);
            }
        }
    }

    // ==================== Failures ====================

    @Test
    @DisplayName("Read failures carry scan and point")
    void testReadFailure() throws IOException {
        when(handle.readImage("xpad_image", 9)).thenThrow(new IOException("HDF5 read error"));

        FrameProcessingException e = assertThrows(FrameProcessingException.class,
                () -> processor(ProjectionType.HKL, null).process(handle, 9));

        assertEquals(SCAN, e.getScan());
        assertEquals(9, e.getPoint());
        assertTrue(e.getMessage().startsWith("An error occurred for scan 17 at point 9"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testImageShapeMismatch() throws IOException {
        when(handle.readImage("xpad_image", 2)).thenReturn(new double[4][4]);

        FrameProcessingException e = assertThrows(FrameProcessingException.class,
                () -> processor(ProjectionType.HKL, null).process(handle, 2));

        assertEquals(2, e.getPoint());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void testMaskShapeMismatch() {
        mask = new boolean[3][3];
        assertThrows(IllegalArgumentException.class, () -> processor(ProjectionType.HKL, null));
    }

    @Test
    void testCombineMasks() {
        boolean[][] hardware = {{true, false}, {false, false}};
        boolean[][] user = {{false, false}, {false, true}};
        boolean[][] combined = ScanContext.combineMasks(hardware, user);
        assertArrayEquals(new boolean[]{true, false}, combined[0]);
        assertArrayEquals(new boolean[]{false, true}, combined[1]);
        assertArrayEquals(new boolean[]{true, false}, ScanContext.combineMasks(hardware, null)[0]);
        assertThrows(IllegalArgumentException.class,
                () -> ScanContext.combineMasks(hardware, new boolean[3][2]));
    }
}
