package binoculars.ext.sixs.projection;

import binoculars.ext.sixs.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe static registry mapping configuration names to {@link Projection}s.
 *
 * <p>Names are matched case-insensitively. Every built-in {@link ProjectionType} is
 * registered under its short name ("hkl") and its long name ("hklprojection"); other
 * projections can be added with {@link #registerProjection(String, Projection)}.
 *
 * <pre>{@code
 * Projection projection = ProjectionRegistry.getProjection("QparQperProjection");
 * projection.getAxisLabels();  // [Qpar, Qper]
 * }</pre>
 *
 * <p>An unknown name fails with a {@link ConfigurationException}; there is no default
 * projection.
 */
public final class ProjectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProjectionRegistry.class);

    private static final Map<String, Projection> PROJECTIONS = new ConcurrentHashMap<>();

    static {
        registerProjection("realspace", ProjectionType.REALSPACE);
        registerProjection("pixels", ProjectionType.PIXELS);
        registerProjection("hkl", ProjectionType.HKL);
        registerProjection("hklprojection", ProjectionType.HKL);
        registerProjection("hk", ProjectionType.HK);
        registerProjection("hkprojection", ProjectionType.HK);
        registerProjection("qxqyqz", ProjectionType.QXQYQZ);
        registerProjection("qxqyqzprojection", ProjectionType.QXQYQZ);
        registerProjection("qparqper", ProjectionType.QPARQPER);
        registerProjection("qparqperprojection", ProjectionType.QPARQPER);
        logger.debug("ProjectionRegistry initialized with {} names", PROJECTIONS.size());
    }

    private ProjectionRegistry() {
    }

    /**
     * Registers a projection under a name, replacing any projection already registered there.
     *
     * @throws IllegalArgumentException if the name is empty or the projection is null
     */
    public static void registerProjection(String name, Projection projection) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Projection name must not be empty");
        }
        if (projection == null) {
            throw new IllegalArgumentException("Projection for '" + name + "' must not be null");
        }
        String normalized = normalize(name);
        Projection existing = PROJECTIONS.put(normalized, projection);
        if (existing != null && existing != projection) {
            logger.warn("Replaced projection '{}': {} -> {}", normalized, existing, projection);
        }
    }

    /**
     * Looks up a projection by configuration name.
     *
     * @param name e.g. "hkl", "QxQyQzProjection"
     * @return the registered projection, never null
     * @throws ConfigurationException if no projection is registered under the name
     */
    public static Projection getProjection(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new ConfigurationException("No projection configured");
        }
        Projection projection = PROJECTIONS.get(normalize(name));
        if (projection == null) {
            throw new ConfigurationException(String.format(
                    "Unknown projection '%s', known projections: %s", name, PROJECTIONS.keySet()));
        }
        logger.debug("Resolved projection '{}' to {}", name, projection);
        return projection;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
