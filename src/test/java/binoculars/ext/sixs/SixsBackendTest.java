package binoculars.ext.sixs;

import binoculars.ext.sixs.config.BackendConfiguration;
import binoculars.ext.sixs.config.ConfigurationException;
import binoculars.ext.sixs.geometry.RotationFunctions;
import binoculars.ext.sixs.jobs.PointRange;
import binoculars.ext.sixs.model.FrameResult;
import binoculars.ext.sixs.model.Job;
import binoculars.ext.sixs.service.InstrumentVariant;
import binoculars.ext.sixs.service.RectangularDetectorProvider;
import binoculars.ext.sixs.service.ScanHandle;
import binoculars.ext.sixs.service.ScanStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests of the backend facade over a mocked SBSMedH scan store.
 */
class SixsBackendTest {

    @TempDir
    Path tempDir;

    private ScanStore store;
    private ScanHandle handle;

    @BeforeEach
    void setUp() throws IOException {
        for (int scan : List.of(12, 13, 14)) {
            Files.createFile(tempDir.resolve(String.format("med_%05d.nxs", scan)));
        }
        handle = mock(ScanHandle.class);
        when(handle.getDiffractometerName()).thenReturn("SOLEIL SIXS MED1+2");
        when(handle.getUbMatrix()).thenReturn(RotationFunctions.diagonal(2.0, 2.0, 2.0));
        when(handle.getWavelength()).thenReturn(0.7);
        when(handle.getPointCount("data_03")).thenReturn(25);
        when(handle.readImage(eq("data_03"), anyInt())).thenReturn(new double[2][2]);
        when(handle.readScalar(anyString(), anyInt())).thenReturn(1.0);

        store = mock(ScanStore.class);
        when(store.open(any(Path.class))).thenReturn(handle);
    }

    private BackendConfiguration.Builder configBuilder() {
        return new BackendConfiguration.Builder()
                .instrument(InstrumentVariant.SBS_MED_H)
                .nexusFile(tempDir.resolve("med_{scanno}.nxs").toString())
                .projection("qxqyqz")
                .sdd(1.0)
                .centralPixel(0, 1)
                .detector("pair")
                .targetWeight(10);
    }

    private SixsBackend backend(BackendConfiguration config) {
        return new SixsBackend(config, store, new RectangularDetectorProvider().register("pair", 2, 2, 1e-3, 1e-3));
    }

    @Test
    @DisplayName("Jobs of several scans, split by target weight")
    void testGenerateJobs() {
        List<Job> jobs = backend(configBuilder().build()).generateJobs("12-13").collect(Collectors.toList());
        assertEquals(List.of(
                new Job(12, 0, 9, 10), new Job(12, 10, 19, 10), new Job(12, 20, 24, 5),
                new Job(13, 0, 9, 10), new Job(13, 10, 19, 10), new Job(13, 20, 24, 5)), jobs);
    }

    @Test
    @DisplayName("Scan files are opened only when job generation reaches them")
    void testGenerateJobsLazily() throws IOException {
        Iterator<Job> jobs = backend(configBuilder().build()).generateJobs("12, 13, 14").iterator();
        verify(store, never()).open(any(Path.class));
        jobs.next();
        verify(store, times(1)).open(any(Path.class));
    }

    @Test
    void testPointRangeOverride() throws IOException {
        SixsBackend backend = backend(configBuilder().pointRange(new PointRange(3, 7)).build());
        List<Job> jobs = backend.generateJobs("12 14").collect(Collectors.toList());
        assertEquals(List.of(new Job(12, 3, 7, 5), new Job(14, 3, 7, 5)), jobs);
        verify(store, never()).open(any(Path.class));
    }

    @Test
    void testMissingScanDuringGeneration() {
        SixsBackend backend = backend(configBuilder().build());
        assertThrows(ConfigurationException.class, () -> backend.generateJobs("12, 99").collect(Collectors.toList()));
    }

    @Test
    void testMalformedSelection() {
        assertThrows(ConfigurationException.class, () -> backend(configBuilder().build()).generateJobs("12-x"));
    }

    @Test
    @DisplayName("Processing a job yields Qx/Qy/Qz frames for every point")
    void testProcessJob() throws IOException {
        SixsBackend backend = backend(configBuilder().build());
        Job job = backend.generateJobs("14").findFirst().orElseThrow();

        List<FrameResult> frames;
        try (Stream<FrameResult> stream = backend.processJob(job)) {
            frames = stream.collect(Collectors.toList());
        }

        assertEquals(10, frames.size());
        for (FrameResult frame : frames) {
            assertEquals(List.of("Qx", "Qy", "Qz"), frame.axisLabels());
            assertEquals(3, frame.coordinates().length);
        }
        verify(handle).readScalar("data_18", 9);
        verify(handle).readScalar("data_19", 9);
    }

    @Test
    void testDestinationOptions() {
        Map<String, String> options = backend(configBuilder().build()).getDestinationOptions("14, 12-13");
        assertEquals(Map.of("first", "12", "last", "14", "range", "14,12,13"), options);
    }
}
