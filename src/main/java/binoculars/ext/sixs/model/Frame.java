package binoculars.ext.sixs.model;

/**
 * Raw values of one scan point, as read from storage.
 *
 * @param index point index within the scan
 * @param image detector intensities, rows x columns
 * @param sampleAngles sample-chain stage angles in degrees, root first
 * @param detectorAngles detector-chain stage angles in degrees, root first
 */
public record Frame(int index, double[][] image, double[] sampleAngles, double[] detectorAngles) {
}
