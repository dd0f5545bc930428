package binoculars.ext.sixs.geometry;

import java.util.Arrays;
import java.util.Optional;

/**
 * Diffractometer topologies with a known stage layout.
 *
 * <p>Each type knows its stages, how they are stacked, the reference root and the
 * stages the sample and the detector are mounted on.
 */
public enum DiffractometerType {

    /**
     * Z-axis geometry: mu carries both the sample (omega) and the detector arm (delta, gamma).
     */
    ZAXIS("ZAXIS", "mu", "omega", "gamma") {
        @Override
        KinematicGraph createGraph() {
            return new KinematicGraph()
                    .addNode(AxisNode.of("mu", 0, 0, 1))
                    .addNode(AxisNode.of("omega", 0, -1, 0))
                    .addNode(AxisNode.of("delta", 0, -1, 0))
                    .addNode(AxisNode.of("gamma", 0, 0, 1))
                    .addEdge("mu", "omega")
                    .addEdge("mu", "delta")
                    .addEdge("delta", "gamma");
        }
    },

    /**
     * SIXS MED1+2: pitch carries the sample (mu) and the detector arm (gamma, delta).
     */
    SOLEIL_SIXS_MED1_2("SOLEIL SIXS MED1+2", "pitch", "mu", "delta") {
        @Override
        KinematicGraph createGraph() {
            return new KinematicGraph()
                    .addNode(AxisNode.of("pitch", 0, -1, 0))
                    .addNode(AxisNode.of("mu", 0, 0, 1))
                    .addNode(AxisNode.of("gamma", 0, 0, 1))
                    .addNode(AxisNode.of("delta", 0, -1, 0))
                    .addEdge("pitch", "mu")
                    .addEdge("pitch", "gamma")
                    .addEdge("gamma", "delta");
        }
    };

    private final String diffractometerName;
    private final String root;
    private final String sampleMount;
    private final String detectorMount;

    DiffractometerType(String diffractometerName, String root, String sampleMount, String detectorMount) {
        this.diffractometerName = diffractometerName;
        this.root = root;
        this.sampleMount = sampleMount;
        this.detectorMount = detectorMount;
    }

    abstract KinematicGraph createGraph();

    /**
     * Name as stored in the scan file.
     */
    public String getDiffractometerName() {
        return diffractometerName;
    }

    public String getRoot() {
        return root;
    }

    public String getSampleMount() {
        return sampleMount;
    }

    public String getDetectorMount() {
        return detectorMount;
    }

    public static Optional<DiffractometerType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(t -> t.diffractometerName.equals(trimmed))
                .findFirst();
    }
}
