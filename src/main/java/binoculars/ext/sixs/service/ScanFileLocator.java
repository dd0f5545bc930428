package binoculars.ext.sixs.service;

import binoculars.ext.sixs.config.ConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves scan numbers to scan files through a template such as
 * {@code /data/sixs/align_{scanno}.nxs}, where {@code {scanno}} becomes the scan number
 * zero-padded to five digits.
 */
public class ScanFileLocator {

    public static final String SCAN_PLACEHOLDER = "{scanno}";

    private final String template;

    public ScanFileLocator(String template) {
        if (template == null || !template.contains(SCAN_PLACEHOLDER)) {
            throw new ConfigurationException(String.format(
                    "Scan file template '%s' must contain %s", template, SCAN_PLACEHOLDER));
        }
        this.template = template;
    }

    /**
     * Path for a scan, without checking it exists.
     */
    public Path pathFor(int scan) {
        return Paths.get(template.replace(SCAN_PLACEHOLDER, String.format("%05d", scan)));
    }

    /**
     * @throws ConfigurationException if the scan file does not exist
     */
    public Path locate(int scan) {
        Path path = pathFor(scan);
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException(String.format("Scan %d not found: %s does not exist", scan, path));
        }
        return path;
    }
}
