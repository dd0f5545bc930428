package binoculars.ext.sixs.model;

/**
 * X-ray source of a scan.
 *
 * @param wavelength monochromator wavelength, positive, same length unit as the output coordinates
 */
public record Source(double wavelength) {

    public Source {
        if (!(wavelength > 0) || !Double.isFinite(wavelength)) {
            throw new IllegalArgumentException("Wavelength must be positive, got: " + wavelength);
        }
    }

    /**
     * Wavevector magnitude k = 2π / wavelength.
     */
    public double wavevector() {
        return 2 * Math.PI / wavelength;
    }
}
