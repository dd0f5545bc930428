package binoculars.ext.sixs.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads user-supplied pixel masks. Any non-zero value marks a pixel as masked.
 *
 * <p>Supported formats:
 * <ul>
 *   <li><b>.txt</b> - whitespace-separated numbers, one image row per line</li>
 *   <li><b>.npy</b> - NumPy array file (format 1.0 to 3.0), 2-D, boolean, integer or
 *       floating point</li>
 * </ul>
 */
public final class MaskLoader {
    private static final Logger logger = LoggerFactory.getLogger(MaskLoader.class);

    private static final byte[] NPY_MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([<>|=])([a-z])(\\d+)'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

    private MaskLoader() {
    }

    /**
     * Reads a mask file.
     *
     * @param path mask file, may be null
     * @return rows x columns, true where masked, or null when no path is given
     * @throws NoSuchFileException if the file does not exist
     * @throws UnsupportedFormatException if the extension is neither .txt nor .npy
     * @throws IOException if the content cannot be parsed
     */
    public static boolean[][] load(Path path) throws IOException {
        if (path == null) {
            return null;
        }
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Can not load mask");
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String extension = dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);

        boolean[][] mask;
        switch (extension) {
            case ".txt" -> mask = loadText(path);
            case ".npy" -> mask = loadNpy(path);
            default -> throw new UnsupportedFormatException(String.format(
                    "Unknown extension '%s', unable to load mask %s", extension, path));
        }

        logger.info("Loaded {}x{} mask from {} ({} pixels masked)",
                mask.length, mask[0].length, path, countMasked(mask));
        return mask;
    }

    // ==================== TEXT ====================

    static boolean[][] loadText(Path path) throws IOException {
        List<boolean[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] tokens = trimmed.split("[\\s,]+");
                boolean[] row = new boolean[tokens.length];
                for (int j = 0; j < tokens.length; j++) {
                    try {
                        row[j] = Double.parseDouble(tokens[j]) != 0;
                    } catch (NumberFormatException e) {
                        throw new IOException(String.format(
                                "%s line %d: '%s' is not a number", path, lineNumber, tokens[j]), e);
                    }
                }
                if (!rows.isEmpty() && rows.get(0).length != row.length) {
                    throw new IOException(String.format("%s line %d: expected %d values, got %d",
                            path, lineNumber, rows.get(0).length, row.length));
                }
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            throw new IOException("Mask file is empty: " + path);
        }
        return rows.toArray(new boolean[0][]);
    }

    // ==================== NPY ====================

    static boolean[][] loadNpy(Path path) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(path)).order(ByteOrder.LITTLE_ENDIAN);
        for (byte b : NPY_MAGIC) {
            if (!buffer.hasRemaining() || buffer.get() != b) {
                throw new IOException("Not a NumPy array file: " + path);
            }
        }
        if (buffer.remaining() < 2) {
            throw new IOException("Truncated NumPy header: " + path);
        }
        int major = buffer.get() & 0xff;
        buffer.get(); // minor version
        int headerLength;
        switch (major) {
            case 1 -> headerLength = buffer.getShort() & 0xffff;
            case 2, 3 -> headerLength = buffer.getInt();
            default -> throw new IOException("Unsupported NumPy format version " + major + ": " + path);
        }
        if (headerLength < 0 || headerLength > buffer.remaining()) {
            throw new IOException("Truncated NumPy header: " + path);
        }
        byte[] headerBytes = new byte[headerLength];
        buffer.get(headerBytes);
        String header = new String(headerBytes, major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

        Matcher descr = DESCR.matcher(header);
        Matcher fortran = FORTRAN.matcher(header);
        Matcher shape = SHAPE.matcher(header);
        if (!descr.find() || !fortran.find() || !shape.find()) {
            throw new IOException("Malformed NumPy header '" + header.trim() + "': " + path);
        }

        String[] dims = shape.group(1).trim().split("\\s*,\\s*");
        if (dims.length != 2 || dims[1].isEmpty()) {
            throw new IOException("Mask must be a 2-D array, got shape (" + shape.group(1) + "): " + path);
        }
        int rows = Integer.parseInt(dims[0]);
        int cols = Integer.parseInt(dims[1]);
        if (rows < 1 || cols < 1) {
            throw new IOException("Mask must not be empty, got shape (" + shape.group(1) + "): " + path);
        }
        boolean fortranOrder = fortran.group(1).equals("True");

        char byteOrder = descr.group(1).charAt(0);
        char kind = descr.group(2).charAt(0);
        int itemSize = Integer.parseInt(descr.group(3));
        buffer.order(byteOrder == '>' ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);

        long expected = (long) rows * cols * itemSize;
        if (buffer.remaining() < expected) {
            throw new IOException(String.format("NumPy data truncated: expected %d bytes, got %d: %s",
                    expected, buffer.remaining(), path));
        }

        boolean[][] mask = new boolean[rows][cols];
        for (int n = 0; n < rows * cols; n++) {
            int row = fortranOrder ? n % rows : n / cols;
            int col = fortranOrder ? n / rows : n % cols;
            mask[row][col] = readNonZero(buffer, kind, itemSize, path);
        }
        return mask;
    }

    private static boolean readNonZero(ByteBuffer buffer, char kind, int itemSize, Path path) throws IOException {
        switch (kind) {
            case 'b', 'i', 'u' -> {
                return switch (itemSize) {
                    case 1 -> buffer.get() != 0;
                    case 2 -> buffer.getShort() != 0;
                    case 4 -> buffer.getInt() != 0;
                    case 8 -> buffer.getLong() != 0;
                    default -> throw new IOException("Unsupported integer size " + itemSize + ": " + path);
                };
            }
            case 'f' -> {
                return switch (itemSize) {
                    case 4 -> buffer.getFloat() != 0;
                    case 8 -> buffer.getDouble() != 0;
                    default -> throw new IOException("Unsupported float size " + itemSize + ": " + path);
                };
            }
            default -> throw new IOException("Unsupported NumPy dtype kind '" + kind + "': " + path);
        }
    }

    private static int countMasked(boolean[][] mask) {
        int count = 0;
        for (boolean[] row : mask) {
            for (boolean masked : row) {
                if (masked) {
                    count++;
                }
            }
        }
        return count;
    }
}
