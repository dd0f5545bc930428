package binoculars.ext.sixs.service;

import java.io.IOException;

/**
 * Thrown when a file cannot be read because its format (file extension) is not supported.
 */
public class UnsupportedFormatException extends IOException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
