package binoculars.ext.sixs.model;

import binoculars.ext.sixs.geometry.AxisNode;
import binoculars.ext.sixs.geometry.InstrumentAxes;
import binoculars.ext.sixs.geometry.KinematicGraph;

/**
 * Sample lattice and orientation offsets.
 *
 * <p>Not consumed by the projections (the UB matrix comes from the scan file). The
 * orientation stages ux → uy → uz are kept so the full instrument graph, with the
 * sample hanging below its mount stage, can be built and inspected.
 */
public record Sample(double a, double b, double c,
                     double alpha, double beta, double gamma,
                     double ux, double uy, double uz) {

    public static final String FIRST_ORIENTATION_AXIS = "ux";

    /**
     * Placeholder lattice used when the scan file carries none.
     */
    public static Sample defaults() {
        return new Sample(1.54, 1.54, 1.54, 90, 90, 90, 0, 0, 0);
    }

    public KinematicGraph orientationGraph() {
        return new KinematicGraph()
                .addNode(AxisNode.of("ux", 1, 0, 0))
                .addNode(AxisNode.of("uy", 0, 1, 0))
                .addNode(AxisNode.of("uz", 0, 0, 1))
                .addEdge("ux", "uy")
                .addEdge("uy", "uz");
    }

    /**
     * Diffractometer stages plus the sample orientation stages mounted on the sample stage.
     */
    public KinematicGraph mountedOn(InstrumentAxes axes) {
        return new KinematicGraph()
                .merge(axes.graph())
                .merge(orientationGraph())
                .addEdge(axes.type().getSampleMount(), FIRST_ORIENTATION_AXIS)
                .unmodifiableCopy();
    }
}
