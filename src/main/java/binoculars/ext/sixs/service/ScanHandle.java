package binoculars.ext.sixs.service;

import java.io.Closeable;
import java.io.IOException;

/**
 * Read-only handle on one open scan file.
 *
 * <p>A handle is owned by a single job and closed when the job's frame stream ends.
 * Channels are physical channel names; see {@link InstrumentVariant} for the mapping
 * from logical stage names.
 */
public interface ScanHandle extends Closeable {

    /**
     * @return diffractometer name as stored in the scan file, e.g. "ZAXIS"
     */
    String getDiffractometerName() throws IOException;

    /**
     * @return 3x3 UB matrix of the scan
     */
    double[][] getUbMatrix() throws IOException;

    /**
     * @return monochromator wavelength
     */
    double getWavelength() throws IOException;

    /**
     * @param imageChannel channel holding one detector image per point
     * @return number of points in the scan
     */
    int getPointCount(String imageChannel) throws IOException;

    /**
     * @return value of a scalar channel at a point, e.g. a stage angle in degrees
     */
    double readScalar(String channel, int index) throws IOException;

    /**
     * @return detector image of a point, rows x columns
     */
    double[][] readImage(String channel, int index) throws IOException;
}
