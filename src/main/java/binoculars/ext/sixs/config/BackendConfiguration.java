package binoculars.ext.sixs.config;

import binoculars.ext.sixs.jobs.PointRange;
import binoculars.ext.sixs.projection.Projection;
import binoculars.ext.sixs.projection.ProjectionRegistry;
import binoculars.ext.sixs.service.InstrumentVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settings of the SIXS backend.
 *
 * <p>Built either through the fluent {@link Builder} or from a YAML document:
 * <pre>
 * instrument: FlyScanUHV
 * nexusfile: /data/sixs/align_{scanno}.nxs
 * projection: hkl
 * sdd: 1.162
 * centralpixel: 311, 117
 * maskmatrix: /data/sixs/mask.npy   # optional
 * detrot: 0.5                       # optional, degrees
 * pr: 10, 250                       # optional, inclusive point range
 * target_weight: 500                # optional, default 1000
 * detector: imxpads140              # optional, default imxpads140
 * </pre>
 *
 * <p>Instances are immutable and validated on {@link Builder#build()}.
 */
public final class BackendConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(BackendConfiguration.class);

    public static final String DEFAULT_DETECTOR = "imxpads140";
    public static final int DEFAULT_TARGET_WEIGHT = 1000;

    private final InstrumentVariant instrument;
    private final String nexusFile;
    private final String projectionName;
    private final Projection projection;
    private final double sdd;
    private final int centralPixelX;
    private final int centralPixelY;
    private final String detector;
    private final Path maskMatrix;
    private final Double detectorRoll;
    private final PointRange pointRange;
    private final int targetWeight;

    private BackendConfiguration(Builder builder) {
        this.instrument = builder.instrument;
        this.nexusFile = builder.nexusFile;
        this.projectionName = builder.projectionName;
        this.projection = ProjectionRegistry.getProjection(builder.projectionName);
        this.sdd = builder.sdd;
        this.centralPixelX = builder.centralPixelX;
        this.centralPixelY = builder.centralPixelY;
        this.detector = builder.detector;
        this.maskMatrix = builder.maskMatrix;
        this.detectorRoll = builder.detectorRoll;
        this.pointRange = builder.pointRange;
        this.targetWeight = builder.targetWeight;
    }

    // ==================== YAML ====================

    /**
     * Loads a configuration from a YAML file.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static BackendConfiguration fromYaml(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file does not exist: " + path,
                    new NoSuchFileException(path.toString()));
        }
        Yaml yaml = new Yaml();
        try (InputStream in = Files.newInputStream(path)) {
            Object loaded = yaml.load(in);
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new ConfigurationException("YAML root is not a map: " + path);
            }
            logger.info("Loading backend configuration from {}", path);
            return fromMap(toStringKeys(map));
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Error reading configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a configuration from already-parsed key/value pairs.
     *
     * @throws ConfigurationException if a required key is missing or a value is invalid
     */
    public static BackendConfiguration fromMap(Map<String, Object> config) {
        Builder builder = new Builder()
                .instrument(InstrumentVariant.fromConfigName(requireString(config, "instrument")))
                .nexusFile(requireString(config, "nexusfile"))
                .projection(requireString(config, "projection"))
                .sdd(requireDouble(config, "sdd"));

        int[] central = parseIntPair(require(config, "centralpixel"), "centralpixel");
        builder.centralPixel(central[0], central[1]);

        optionalString(config, "detector").ifPresent(builder::detector);
        optionalString(config, "maskmatrix").map(Paths::get).ifPresent(builder::maskMatrix);

        Object detrot = config.get("detrot");
        if (detrot != null) {
            try {
                builder.detectorRoll(Double.parseDouble(detrot.toString().trim()));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring detector rotation '{}': not a number", detrot);
            }
        }

        Object pr = config.get("pr");
        if (pr != null) {
            int[] range = parseIntPair(pr, "pr");
            try {
                builder.pointRange(new PointRange(range[0], range[1]));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid point range 'pr': " + e.getMessage(), e);
            }
        }

        Object weight = config.get("target_weight");
        if (weight != null) {
            builder.targetWeight((int) parseNumber(weight, "target_weight"));
        }

        return builder.build();
    }

    private static Map<String, Object> toStringKeys(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static Object require(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            throw new ConfigurationException("Missing required configuration key '" + key + "'");
        }
        return value;
    }

    private static String requireString(Map<String, Object> config, String key) {
        String value = require(config, key).toString().trim();
        if (value.isEmpty()) {
            throw new ConfigurationException("Configuration key '" + key + "' must not be empty");
        }
        return value;
    }

    private static Optional<String> optionalString(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null || value.toString().trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.toString().trim());
    }

    private static double requireDouble(Map<String, Object> config, String key) {
        return parseNumber(require(config, key), key);
    }

    private static double parseNumber(Object value, String key) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Configuration key '" + key + "' is not a number: " + value, e);
        }
    }

    /**
     * Accepts "a,b", "a b", "(a, b)" or a two-element YAML list.
     */
    static int[] parseIntPair(Object value, String key) {
        String[] parts;
        if (value instanceof List<?> list) {
            parts = list.stream().map(String::valueOf).toArray(String[]::new);
        } else {
            String text = value.toString().trim().replaceAll("^[(\\[]|[)\\]]$", "");
            parts = text.trim().split("[,\\s]+");
        }
        if (parts.length != 2) {
            throw new ConfigurationException(String.format(
                    "Configuration key '%s' must hold two integers, got: %s", key, value));
        }
        try {
            return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
        } catch (NumberFormatException e) {
            throw new ConfigurationException(String.format(
                    "Configuration key '%s' must hold two integers, got: %s", key, value), e);
        }
    }

    // ==================== ACCESSORS ====================

    public InstrumentVariant getInstrument() {
        return instrument;
    }

    /**
     * Scan file template; {@code {scanno}} is replaced by the zero-padded scan number.
     */
    public String getNexusFile() {
        return nexusFile;
    }

    public String getProjectionName() {
        return projectionName;
    }

    public Projection getProjection() {
        return projection;
    }

    public double getSdd() {
        return sdd;
    }

    public int getCentralPixelX() {
        return centralPixelX;
    }

    public int getCentralPixelY() {
        return centralPixelY;
    }

    public String getDetector() {
        return detector;
    }

    public Optional<Path> getMaskMatrix() {
        return Optional.ofNullable(maskMatrix);
    }

    /**
     * Detector roll about the beam axis, in degrees.
     */
    public Optional<Double> getDetectorRoll() {
        return Optional.ofNullable(detectorRoll);
    }

    public Optional<PointRange> getPointRange() {
        return Optional.ofNullable(pointRange);
    }

    public int getTargetWeight() {
        return targetWeight;
    }

    @Override
    public String toString() {
        return String.format("BackendConfiguration[instrument=%s, nexusfile=%s, projection=%s, sdd=%s, "
                        + "centralpixel=%d,%d, detector=%s, maskmatrix=%s, detrot=%s, pr=%s, target_weight=%d]",
                instrument.getConfigName(), nexusFile, projectionName, sdd, centralPixelX, centralPixelY,
                detector, maskMatrix, detectorRoll, pointRange, targetWeight);
    }

    // ==================== BUILDER ====================

    /**
     * Fluent builder; {@link #build()} validates all required settings.
     */
    public static class Builder {
        private InstrumentVariant instrument;
        private String nexusFile;
        private String projectionName;
        private double sdd = Double.NaN;
        private int centralPixelX = -1;
        private int centralPixelY = -1;
        private String detector = DEFAULT_DETECTOR;
        private Path maskMatrix;
        private Double detectorRoll;
        private PointRange pointRange;
        private int targetWeight = DEFAULT_TARGET_WEIGHT;

        public Builder instrument(InstrumentVariant instrument) {
            this.instrument = instrument;
            return this;
        }

        public Builder nexusFile(String nexusFile) {
            this.nexusFile = nexusFile;
            return this;
        }

        public Builder projection(String projectionName) {
            this.projectionName = projectionName;
            return this;
        }

        public Builder sdd(double sdd) {
            this.sdd = sdd;
            return this;
        }

        public Builder centralPixel(int x, int y) {
            this.centralPixelX = x;
            this.centralPixelY = y;
            return this;
        }

        public Builder detector(String detector) {
            this.detector = detector;
            return this;
        }

        public Builder maskMatrix(Path maskMatrix) {
            this.maskMatrix = maskMatrix;
            return this;
        }

        public Builder detectorRoll(Double degrees) {
            this.detectorRoll = degrees;
            return this;
        }

        public Builder pointRange(PointRange pointRange) {
            this.pointRange = pointRange;
            return this;
        }

        public Builder targetWeight(int targetWeight) {
            this.targetWeight = targetWeight;
            return this;
        }

        /**
         * @throws ConfigurationException if a required setting is missing or invalid
         */
        public BackendConfiguration build() {
            if (instrument == null) {
                throw new ConfigurationException("Instrument is required");
            }
            if (nexusFile == null || nexusFile.trim().isEmpty()) {
                throw new ConfigurationException("Scan file template 'nexusfile' is required");
            }
            if (!(sdd > 0) || !Double.isFinite(sdd)) {
                throw new ConfigurationException("Sample-detector distance 'sdd' must be positive, got: " + sdd);
            }
            if (centralPixelX < 0 || centralPixelY < 0) {
                throw new ConfigurationException(String.format(
                        "Central pixel must be non-negative, got: %d,%d", centralPixelX, centralPixelY));
            }
            if (detector == null || detector.trim().isEmpty()) {
                throw new ConfigurationException("Detector name must not be empty");
            }
            if (targetWeight < 1) {
                throw new ConfigurationException("Target weight must be at least 1, got: " + targetWeight);
            }
            if (detectorRoll != null && !Double.isFinite(detectorRoll)) {
                throw new ConfigurationException("Detector rotation must be finite, got: " + detectorRoll);
            }
            BackendConfiguration config = new BackendConfiguration(this);
            logger.debug("Built {}", config);
            return config;
        }
    }
}
