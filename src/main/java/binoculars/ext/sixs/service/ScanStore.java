package binoculars.ext.sixs.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens scan files for reading. Implementations wrap a concrete file format.
 */
@FunctionalInterface
public interface ScanStore {

    /**
     * Opens a scan file read-only. Every call returns a new, independent handle.
     *
     * @param scanFile path of an existing scan file
     * @throws IOException if the file cannot be opened
     */
    ScanHandle open(Path scanFile) throws IOException;
}
