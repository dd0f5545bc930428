package binoculars.ext.sixs.geometry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered stages from a reference root to a mount point (sample or detector).
 *
 * @param endpoint the mount point this chain ends at
 * @param axes the stages, root first
 */
public record KinematicChain(String endpoint, List<AxisNode> axes) {

    public KinematicChain {
        if (axes == null || axes.isEmpty()) {
            throw new IllegalArgumentException("Kinematic chain to '" + endpoint + "' is empty");
        }
        axes = List.copyOf(axes);
    }

    /**
     * Builds the chain along the unique graph path from {@code root} to {@code endpoint}.
     */
    public static KinematicChain resolve(KinematicGraph graph, String root, String endpoint) {
        List<AxisNode> axes = graph.resolvePath(root, endpoint).stream()
                .map(graph::getNode)
                .collect(Collectors.toList());
        return new KinematicChain(endpoint, axes);
    }

    public List<String> names() {
        return axes.stream().map(AxisNode::name).collect(Collectors.toUnmodifiableList());
    }

    public List<double[]> axisVectors() {
        return axes.stream().map(AxisNode::axis).collect(Collectors.toList());
    }

    public int size() {
        return axes.size();
    }

    /**
     * Rotation of the mount point for the given stage angles.
     *
     * @param radians one angle per stage, root first
     */
    public double[][] rotation(double[] radians) {
        return RotationFunctions.compose(radians, axisVectors());
    }

    @Override
    public String toString() {
        return String.join(" → ", names());
    }
}
