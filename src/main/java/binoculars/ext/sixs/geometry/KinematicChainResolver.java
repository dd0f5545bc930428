package binoculars.ext.sixs.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe static resolver from diffractometer names to their stage chains.
 *
 * <p>Chains depend only on the stage topology, never on angle values, so they are
 * resolved once per {@link DiffractometerType} and cached. The cached
 * {@link InstrumentAxes} are immutable and shared read-only by every frame of every
 * scan of that type, from any number of worker threads.
 *
 * <pre>{@code
 * InstrumentAxes axes = KinematicChainResolver.axesFor("ZAXIS");
 * axes.sample().names();    // [mu, omega]
 * axes.detector().names();  // [mu, delta, gamma]
 * }</pre>
 */
public final class KinematicChainResolver {

    private static final Logger logger = LoggerFactory.getLogger(KinematicChainResolver.class);

    private static final Map<DiffractometerType, InstrumentAxes> CACHE = new ConcurrentHashMap<>();

    private KinematicChainResolver() {
    }

    /**
     * Builds the stage graph of a named diffractometer.
     *
     * @param name diffractometer name as stored in the scan file
     * @return a fresh, modifiable graph
     * @throws UnsupportedGeometryException if the name is not a supported diffractometer
     */
    public static KinematicGraph buildGraph(String name) {
        DiffractometerType type = DiffractometerType.fromName(name)
                .orElseThrow(() -> new UnsupportedGeometryException(name));
        return type.createGraph();
    }

    /**
     * Resolves the ordered stage names from {@code root} to {@code target}.
     *
     * @throws IllegalArgumentException if there is no such path
     */
    public static List<String> resolveChain(KinematicGraph graph, String root, String target) {
        return graph.resolvePath(root, target);
    }

    /**
     * Returns the cached sample and detector chains of a named diffractometer,
     * resolving them on first use.
     *
     * @throws UnsupportedGeometryException if the name is not a supported diffractometer
     */
    public static InstrumentAxes axesFor(String name) {
        DiffractometerType type = DiffractometerType.fromName(name)
                .orElseThrow(() -> new UnsupportedGeometryException(name));
        return axesFor(type);
    }

    public static InstrumentAxes axesFor(DiffractometerType type) {
        return CACHE.computeIfAbsent(type, KinematicChainResolver::resolve);
    }

    private static InstrumentAxes resolve(DiffractometerType type) {
        KinematicGraph graph = type.createGraph().unmodifiableCopy();
        KinematicChain sample = KinematicChain.resolve(graph, type.getRoot(), type.getSampleMount());
        KinematicChain detector = KinematicChain.resolve(graph, type.getRoot(), type.getDetectorMount());

        logger.info("Resolved kinematic chains for {}: sample [{}], detector [{}]",
                type.getDiffractometerName(), sample, detector);
        return new InstrumentAxes(type, sample, detector, graph);
    }
}
