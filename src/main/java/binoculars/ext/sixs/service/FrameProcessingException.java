package binoculars.ext.sixs.service;

/**
 * Failure while processing one scan point. Carries the scan and point it happened at;
 * fatal for the enclosing job only.
 */
public class FrameProcessingException extends RuntimeException {

    private final int scan;
    private final int point;

    public FrameProcessingException(int scan, int point, Throwable cause) {
        super(String.format("An error occurred for scan %d at point %d: %s", scan, point, cause.getMessage()), cause);
        this.scan = scan;
        this.point = point;
    }

    public int getScan() {
        return scan;
    }

    public int getPoint() {
        return point;
    }
}
