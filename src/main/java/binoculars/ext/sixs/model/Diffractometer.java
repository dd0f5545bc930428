package binoculars.ext.sixs.model;

import binoculars.ext.sixs.geometry.InstrumentAxes;
import binoculars.ext.sixs.geometry.KinematicChainResolver;
import binoculars.ext.sixs.geometry.RotationFunctions;

/**
 * Diffractometer of a scan file: its name, UB matrix and resolved stage chains.
 * Read once per scan file and immutable afterwards.
 *
 * @param name diffractometer name as stored in the scan file
 * @param ub 3x3 reciprocal-to-lab transform
 * @param axes sample and detector chains for this diffractometer type
 */
public record Diffractometer(String name, double[][] ub, InstrumentAxes axes) {

    public Diffractometer {
        ub = RotationFunctions.copyOf(ub);
    }

    /**
     * Resolves the stage chains for {@code name} and pairs them with the UB matrix.
     *
     * @throws binoculars.ext.sixs.geometry.UnsupportedGeometryException for an unknown name
     */
    public static Diffractometer of(String name, double[][] ub) {
        return new Diffractometer(name, ub, KinematicChainResolver.axesFor(name));
    }

    @Override
    public double[][] ub() {
        return RotationFunctions.copyOf(ub);
    }
}
