package binoculars.ext.sixs.model;

import java.util.List;

/**
 * Output of one processed scan point, handed to the accumulation stage.
 *
 * @param index point index within the scan
 * @param intensity detector intensities, rows x columns
 * @param weights 1 for valid pixels, 0 for masked pixels
 * @param input the projection input the coordinates were computed from
 * @param axisLabels one label per coordinate grid
 * @param coordinates one rows x columns grid per projected coordinate
 */
public record FrameResult(int index,
                          double[][] intensity,
                          double[][] weights,
                          ProjectionInput input,
                          List<String> axisLabels,
                          double[][][] coordinates) {

    public FrameResult {
        axisLabels = List.copyOf(axisLabels);
        if (coordinates.length != axisLabels.size()) {
            throw new IllegalArgumentException(String.format(
                    "Got %d coordinate grids for axis labels %s", coordinates.length, axisLabels));
        }
    }
}
