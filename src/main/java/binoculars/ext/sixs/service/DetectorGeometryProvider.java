package binoculars.ext.sixs.service;

import binoculars.ext.sixs.model.Detector;

/**
 * Source of static detector descriptions: pixel positions and bad-pixel masks.
 */
@FunctionalInterface
public interface DetectorGeometryProvider {

    /**
     * @param name detector model name, e.g. "imxpads140"
     * @return the detector description
     * @throws binoculars.ext.sixs.config.ConfigurationException if the model is unknown
     */
    Detector getDetector(String name);
}
