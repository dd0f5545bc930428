package binoculars.ext.sixs.projection;

import binoculars.ext.sixs.model.ProjectionInput;

import java.util.List;
import java.util.function.Function;

/**
 * The available projections. Each constant pairs its axis labels with a pure transform
 * from {@link ProjectionFunctions}.
 */
public enum ProjectionType implements Projection {

    REALSPACE(List.of("x", "y"), ProjectionFunctions::realSpace),
    PIXELS(List.of("x", "y"), ProjectionFunctions::pixelIndices),
    HKL(List.of("H", "K", "L"), ProjectionFunctions::hkl),
    HK(List.of("H", "K"), ProjectionFunctions::hk),
    QXQYQZ(List.of("Qx", "Qy", "Qz"), ProjectionFunctions::qxQyQz),
    QPARQPER(List.of("Qpar", "Qper"), ProjectionFunctions::qparQper);

    private final List<String> axisLabels;
    private final Function<ProjectionInput, double[][][]> transform;

    ProjectionType(List<String> axisLabels, Function<ProjectionInput, double[][][]> transform) {
        this.axisLabels = axisLabels;
        this.transform = transform;
    }

    @Override
    public double[][][] project(ProjectionInput input) {
        return transform.apply(input);
    }

    @Override
    public List<String> getAxisLabels() {
        return axisLabels;
    }
}
