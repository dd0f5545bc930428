package binoculars.ext.sixs.geometry;

/**
 * Thrown when a scan names a diffractometer whose kinematic chain is not known.
 * Fatal for the run: raised while resolving geometry, before any job executes.
 */
public class UnsupportedGeometryException extends IllegalArgumentException {

    private final String diffractometerName;

    public UnsupportedGeometryException(String diffractometerName) {
        super("Not yet supported diffractometer type: " + diffractometerName);
        this.diffractometerName = diffractometerName;
    }

    public String getDiffractometerName() {
        return diffractometerName;
    }
}
