package binoculars.ext.sixs.model;

import binoculars.ext.sixs.geometry.RotationFunctions;

/**
 * Everything a projection needs for one frame. Built fresh per frame.
 *
 * @param pixels lab-frame pixel positions
 * @param k wavevector magnitude 2π / wavelength
 * @param ub UB matrix
 * @param r sample rotation
 * @param p detector rotation
 */
public record ProjectionInput(PixelGeometry pixels, double k, double[][] ub, double[][] r, double[][] p) {

    public ProjectionInput {
        if (pixels == null) {
            throw new IllegalArgumentException("Pixel geometry is required");
        }
        ub = RotationFunctions.copyOf(ub);
        r = RotationFunctions.copyOf(r);
        p = RotationFunctions.copyOf(p);
    }

    @Override
    public double[][] ub() {
        return RotationFunctions.copyOf(ub);
    }

    @Override
    public double[][] r() {
        return RotationFunctions.copyOf(r);
    }

    @Override
    public double[][] p() {
        return RotationFunctions.copyOf(p);
    }
}
