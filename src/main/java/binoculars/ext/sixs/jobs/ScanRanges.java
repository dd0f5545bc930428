package binoculars.ext.sixs.jobs;

import binoculars.ext.sixs.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Parses scan selections such as {@code "1-3, 7 12"} into scan numbers.
 */
public final class ScanRanges {

    private static final Pattern RANGE = Pattern.compile("(\\d+)(?:-(\\d+))?");

    /**
     * Largest number of scans a single {@code a-b} token may expand to.
     */
    static final int MAX_RANGE_LENGTH = 100_000;

    private ScanRanges() {
    }

    /**
     * Tokens are separated by commas or whitespace; {@code a-b} is an inclusive range.
     * Duplicates are dropped, first occurrence order is kept.
     *
     * @return scan numbers, empty for a null or blank selection
     * @throws ConfigurationException for a malformed token, a descending range or a range
     *         longer than {@link #MAX_RANGE_LENGTH}
     */
    public static List<Integer> parse(String selection) {
        if (selection == null || selection.isBlank()) {
            return Collections.emptyList();
        }
        Set<Integer> scans = new LinkedHashSet<>();
        for (String token : selection.trim().split("[,\\s]+")) {
            if (token.isEmpty()) {
                continue;
            }
            Matcher matcher = RANGE.matcher(token);
            if (!matcher.matches()) {
                throw new ConfigurationException("Invalid scan selection '" + token + "' in: " + selection);
            }
            int first = parseScan(matcher.group(1), selection);
            int last = matcher.group(2) == null ? first : parseScan(matcher.group(2), selection);
            if (last < first) {
                throw new ConfigurationException(String.format(
                        "Descending scan range '%s' in: %s", token, selection));
            }
            if ((long) last - first + 1 > MAX_RANGE_LENGTH) {
                throw new ConfigurationException(String.format(
                        "Scan range '%s' spans more than %d scans in: %s", token, MAX_RANGE_LENGTH, selection));
            }
            IntStream.rangeClosed(first, last).forEach(scans::add);
        }
        return new ArrayList<>(scans);
    }

    /**
     * Values for naming output files after a scan selection.
     *
     * @return {@code first} (lowest scan), {@code last} (highest scan) and {@code range}
     *         (comma-joined scans); empty when there are no scans
     */
    public static Map<String, String> destinationOptions(List<Integer> scans) {
        if (scans == null || scans.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> options = new LinkedHashMap<>();
        options.put("first", String.valueOf(Collections.min(scans)));
        options.put("last", String.valueOf(Collections.max(scans)));
        options.put("range", scans.stream().map(String::valueOf).collect(Collectors.joining(",")));
        return options;
    }

    private static int parseScan(String digits, String selection) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Scan number out of range '" + digits + "' in: " + selection, e);
        }
    }
}
