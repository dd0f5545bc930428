package binoculars.ext.sixs.service;

import binoculars.ext.sixs.config.ConfigurationException;
import binoculars.ext.sixs.model.Detector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detectors laid out as a regular grid of identical pixels.
 *
 * <p>Pixel centres sit at {@code (index + 0.5) * pixelSize} along each direction, in
 * metres. Built-in models carry no bad pixels; other models can be added with
 * {@link #register(String, int, int, double, double)}.
 *
 * <p>Descriptions are computed on first use and cached.
 */
public class RectangularDetectorProvider implements DetectorGeometryProvider {
    private static final Logger logger = LoggerFactory.getLogger(RectangularDetectorProvider.class);

    /**
     * Grid layout of one detector model.
     */
    public record Layout(int rows, int columns, double pixelSizeY, double pixelSizeX) {
        public Layout {
            if (rows < 1 || columns < 1) {
                throw new IllegalArgumentException("Detector needs at least one pixel, got " + rows + "x" + columns);
            }
            if (!(pixelSizeY > 0) || !(pixelSizeX > 0)) {
                throw new IllegalArgumentException("Pixel sizes must be positive");
            }
        }
    }

    private final Map<String, Layout> layouts = new ConcurrentHashMap<>();
    private final Map<String, Detector> detectors = new ConcurrentHashMap<>();

    public RectangularDetectorProvider() {
        register("imxpads140", 240, 560, 130e-6, 130e-6);
        register("maxipix", 516, 516, 55e-6, 55e-6);
    }

    /**
     * Adds or replaces a detector model.
     *
     * @return this provider for chaining
     */
    public RectangularDetectorProvider register(String name, int rows, int columns,
                                               double pixelSizeY, double pixelSizeX) {
        String key = normalize(name);
        layouts.put(key, new Layout(rows, columns, pixelSizeY, pixelSizeX));
        detectors.remove(key);
        return this;
    }

    @Override
    public Detector getDetector(String name) {
        if (name == null) {
            throw new ConfigurationException("No detector configured");
        }
        String key = normalize(name);
        Layout layout = layouts.get(key);
        if (layout == null) {
            throw new ConfigurationException(String.format(
                    "Unknown detector '%s', known detectors: %s", name, layouts.keySet()));
        }
        return detectors.computeIfAbsent(key, k -> build(k, layout));
    }

    private static Detector build(String name, Layout layout) {
        double[][] y = new double[layout.rows()][layout.columns()];
        double[][] x = new double[layout.rows()][layout.columns()];
        for (int i = 0; i < layout.rows(); i++) {
            for (int j = 0; j < layout.columns(); j++) {
                y[i][j] = (i + 0.5) * layout.pixelSizeY();
                x[i][j] = (j + 0.5) * layout.pixelSizeX();
            }
        }
        logger.info("Built detector {}: {} rows x {} columns, pixel size {} x {} m",
                name, layout.rows(), layout.columns(), layout.pixelSizeY(), layout.pixelSizeX());
        return new Detector(name, y, x, new boolean[layout.rows()][layout.columns()]);
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
