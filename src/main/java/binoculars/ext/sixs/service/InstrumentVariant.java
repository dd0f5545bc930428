package binoculars.ext.sixs.service;

import binoculars.ext.sixs.config.ConfigurationException;
import binoculars.ext.sixs.geometry.DiffractometerType;
import binoculars.ext.sixs.geometry.KinematicChain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Beamline acquisition setups. Each maps the logical channel names used by the backend
 * (the image and one per stage) to the physical data channels of its scan files.
 */
public enum InstrumentVariant {

    FLY_SCAN_UHV("FlyScanUHV", DiffractometerType.ZAXIS, channels(
            "image", "xpad_image",
            "mu", "UHV_MU",
            "omega", "UHV_OMEGA",
            "delta", "UHV_DELTA",
            "gamma", "UHV_GAMMA")),

    FLY_SCAN_UHV2("FlyScanUHV2", DiffractometerType.ZAXIS, channels(
            "image", "xpad_image",
            "mu", "mu",
            "omega", "omega",
            "delta", "delta",
            "gamma", "gamma")),

    SBS_MED_H("SBSMedH", DiffractometerType.SOLEIL_SIXS_MED1_2, channels(
            "image", "data_03",
            "pitch", "data_22",
            "mu", "data_18",
            "gamma", "data_20",
            "delta", "data_19"));

    public static final String IMAGE = "image";

    private final String configName;
    private final DiffractometerType expectedDiffractometer;
    private final Map<String, String> channels;

    InstrumentVariant(String configName, DiffractometerType expectedDiffractometer, Map<String, String> channels) {
        this.configName = configName;
        this.expectedDiffractometer = expectedDiffractometer;
        this.channels = channels;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Diffractometer the scan files of this setup are expected to declare.
     */
    public DiffractometerType getExpectedDiffractometer() {
        return expectedDiffractometer;
    }

    public String imageChannel() {
        return channels.get(IMAGE);
    }

    /**
     * Physical channel of a logical name.
     *
     * @throws ConfigurationException if this setup has no such channel
     */
    public String channel(String logicalName) {
        String physical = channels.get(logicalName);
        if (physical == null) {
            throw new ConfigurationException(String.format(
                    "Instrument %s has no channel for '%s', known channels: %s",
                    configName, logicalName, channels.keySet()));
        }
        return physical;
    }

    /**
     * Physical channels of every stage of a chain, in chain order.
     *
     * @throws ConfigurationException if a stage has no channel
     */
    public List<String> channelsFor(KinematicChain chain) {
        List<String> result = new ArrayList<>();
        for (String axis : chain.names()) {
            result.add(channel(axis));
        }
        return result;
    }

    /**
     * Looks up a variant by its configuration name, case-insensitively.
     *
     * @throws ConfigurationException for an unknown name
     */
    public static InstrumentVariant fromConfigName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (InstrumentVariant variant : values()) {
                if (variant.configName.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return variant;
                }
            }
        }
        throw new ConfigurationException(String.format("Unknown instrument '%s', known instruments: %s",
                name, Arrays.stream(values()).map(InstrumentVariant::getConfigName).toList()));
    }

    private static Map<String, String> channels(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
