package binoculars.ext.sixs.config;

import binoculars.ext.sixs.jobs.PointRange;
import binoculars.ext.sixs.projection.ProjectionType;
import binoculars.ext.sixs.service.InstrumentVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BackendConfiguration parsing and validation.
 */
class BackendConfigurationTest {

    @TempDir
    Path tempDir;

    private static Map<String, Object> minimal() {
        Map<String, Object> config = new HashMap<>();
        config.put("instrument", "FlyScanUHV");
        config.put("nexusfile", "/data/sixs/align_{scanno}.nxs");
        config.put("projection", "hkl");
        config.put("sdd", 1.162);
        config.put("centralpixel", "311, 117");
        return config;
    }

    // ==================== YAML Tests ====================

    @Test
    @DisplayName("Full YAML document is parsed into typed settings")
    void testFromYaml() throws IOException {
        Path file = tempDir.resolve("sixs.yml");
        Files.writeString(file, String.join("\n",
                "instrument: SBSMedH",
                "nexusfile: /data/sixs/scan_{scanno}.nxs",
                "projection: QparQperProjection",
                "sdd: 0.8",
                "centralpixel: [120, 300]",
                "detector: maxipix",
                "maskmatrix: /data/sixs/mask.npy",
                "detrot: 0.5",
                "pr: 10, 250",
                "target_weight: 200",
                ""));

        BackendConfiguration config = BackendConfiguration.fromYaml(file);

        assertEquals(InstrumentVariant.SBS_MED_H, config.getInstrument());
        assertEquals("/data/sixs/scan_{scanno}.nxs", config.getNexusFile());
        assertSame(ProjectionType.QPARQPER, config.getProjection());
        assertEquals(0.8, config.getSdd());
        assertEquals(120, config.getCentralPixelX());
        assertEquals(300, config.getCentralPixelY());
        assertEquals("maxipix", config.getDetector());
        assertEquals(Optional.of(Paths.get("/data/sixs/mask.npy")), config.getMaskMatrix());
        assertEquals(Optional.of(0.5), config.getDetectorRoll());
        assertEquals(Optional.of(new PointRange(10, 250)), config.getPointRange());
        assertEquals(200, config.getTargetWeight());
    }

    @Test
    void testMissingYamlFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> BackendConfiguration.fromYaml(tempDir.resolve("absent.yml")));
        assertInstanceOf(NoSuchFileException.class, e.getCause());
    }

    @Test
    void testYamlRootNotAMap() throws IOException {
        Path file = tempDir.resolve("list.yml");
        Files.writeString(file, "- a\n- b\n");
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromYaml(file));
    }

    // ==================== Map Tests ====================

    @Test
    @DisplayName("Optional settings fall back to their defaults")
    void testDefaults() {
        BackendConfiguration config = BackendConfiguration.fromMap(minimal());
        assertEquals(BackendConfiguration.DEFAULT_DETECTOR, config.getDetector());
        assertEquals(BackendConfiguration.DEFAULT_TARGET_WEIGHT, config.getTargetWeight());
        assertTrue(config.getMaskMatrix().isEmpty());
        assertTrue(config.getDetectorRoll().isEmpty());
        assertTrue(config.getPointRange().isEmpty());
        assertEquals(311, config.getCentralPixelX());
        assertEquals(117, config.getCentralPixelY());
    }

    @Test
    void testMissingRequiredKeys() {
        for (String key : List.of("instrument", "nexusfile", "projection", "sdd", "centralpixel")) {
            Map<String, Object> config = minimal();
            config.remove(key);
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> BackendConfiguration.fromMap(config), key);
            assertTrue(e.getMessage().contains(key), e.getMessage());
        }
    }

    @Test
    void testInvalidValues() {
        Map<String, Object> badSdd = minimal();
        badSdd.put("sdd", "far");
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromMap(badSdd));

        Map<String, Object> negativeSdd = minimal();
        negativeSdd.put("sdd", -1);
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromMap(negativeSdd));

        Map<String, Object> unknownInstrument = minimal();
        unknownInstrument.put("instrument", "FlyScanDiamond");
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromMap(unknownInstrument));

        Map<String, Object> unknownProjection = minimal();
        unknownProjection.put("projection", "thetatwotheta");
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromMap(unknownProjection));

        Map<String, Object> reversedRange = minimal();
        reversedRange.put("pr", "20,10");
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromMap(reversedRange));

        Map<String, Object> unboundedRange = minimal();
        unboundedRange.put("pr", "0, 2147483647");
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromMap(unboundedRange));

        Map<String, Object> zeroWeight = minimal();
        zeroWeight.put("target_weight", 0);
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.fromMap(zeroWeight));
    }

    @Test
    @DisplayName("Unparsable detector rotation is ignored")
    void testUnparsableDetectorRotation() {
        Map<String, Object> config = minimal();
        config.put("detrot", "tilted");
        assertTrue(BackendConfiguration.fromMap(config).getDetectorRoll().isEmpty());
    }

    @Test
    void testInstrumentNameCaseInsensitive() {
        Map<String, Object> config = minimal();
        config.put("instrument", "flyscanuhv2");
        assertEquals(InstrumentVariant.FLY_SCAN_UHV2, BackendConfiguration.fromMap(config).getInstrument());
    }

    @Test
    void testParseIntPair() {
        assertArrayEquals(new int[]{1, 2}, BackendConfiguration.parseIntPair("1,2", "k"));
        assertArrayEquals(new int[]{1, 2}, BackendConfiguration.parseIntPair("(1, 2)", "k"));
        assertArrayEquals(new int[]{1, 2}, BackendConfiguration.parseIntPair("1 2", "k"));
        assertArrayEquals(new int[]{1, 2}, BackendConfiguration.parseIntPair(List.of(1, 2), "k"));
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.parseIntPair("1,2,3", "k"));
        assertThrows(ConfigurationException.class, () -> BackendConfiguration.parseIntPair("a,b", "k"));
    }

    @Test
    void testBuilderValidation() {
        BackendConfiguration.Builder builder = new BackendConfiguration.Builder()
                .instrument(InstrumentVariant.FLY_SCAN_UHV)
                .nexusFile("/data/{scanno}.nxs")
                .projection("hk")
                .sdd(1.0);
        assertThrows(ConfigurationException.class, builder::build);

        BackendConfiguration config = builder.centralPixel(0, 0).build();
        assertSame(ProjectionType.HK, config.getProjection());
        assertEquals("hk", config.getProjectionName());
    }
}
