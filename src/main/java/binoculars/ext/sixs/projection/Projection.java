package binoculars.ext.sixs.projection;

import binoculars.ext.sixs.model.ProjectionInput;

import java.util.List;

/**
 * Converts the pixels of one frame into output coordinates.
 *
 * <p>Implementations must be pure functions of the {@link ProjectionInput}: no state,
 * deterministic, safe to share between frames and threads.
 *
 * @see ProjectionRegistry
 */
public interface Projection {

    /**
     * @param input pixel geometry, wavevector, UB and stage rotations of one frame
     * @return one rows x columns grid per output coordinate, in {@link #getAxisLabels()} order
     */
    double[][][] project(ProjectionInput input);

    /**
     * @return the name of each output coordinate
     */
    List<String> getAxisLabels();
}
