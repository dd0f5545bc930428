package binoculars.ext.sixs.service;

import binoculars.ext.sixs.model.ArrayShapes;
import binoculars.ext.sixs.model.Diffractometer;
import binoculars.ext.sixs.model.PixelGeometry;
import binoculars.ext.sixs.model.Sample;
import binoculars.ext.sixs.model.Source;
import binoculars.ext.sixs.projection.Projection;

import java.util.List;
import java.util.Optional;

/**
 * Everything that stays fixed while the frames of one scan are processed.
 *
 * @param scan scan number
 * @param instrument channel mapping of the scan files
 * @param diffractometer diffractometer with UB and resolved chains
 * @param sample sample lattice
 * @param source X-ray source
 * @param pixels lab-frame pixel geometry
 * @param mask combined hardware and user mask, true where masked
 * @param projection projection applied to each frame
 * @param detectorRoll detector roll about the beam axis in degrees, if configured
 */
public record ScanContext(int scan,
                          InstrumentVariant instrument,
                          Diffractometer diffractometer,
                          Sample sample,
                          Source source,
                          PixelGeometry pixels,
                          boolean[][] mask,
                          Projection projection,
                          Optional<Double> detectorRoll) {

    public ScanContext {
        if (!ArrayShapes.hasShape(mask, pixels.rows(), pixels.columns())) {
            throw new IllegalArgumentException(String.format("Mask of %s does not match the %dx%d detector",
                    ArrayShapes.describe(mask), pixels.rows(), pixels.columns()));
        }
        mask = ArrayShapes.copy(mask);
    }

    /**
     * Combines the hardware bad-pixel mask with an optional user mask (logical OR).
     *
     * @throws IllegalArgumentException if the shapes differ
     */
    public static boolean[][] combineMasks(boolean[][] hardware, boolean[][] user) {
        if (user == null) {
            return ArrayShapes.copy(hardware);
        }
        if (!ArrayShapes.hasShape(user, hardware.length, hardware[0].length)) {
            throw new IllegalArgumentException(String.format("User mask of %s does not match the detector mask of %s",
                    ArrayShapes.describe(user), ArrayShapes.describe(hardware)));
        }
        boolean[][] combined = new boolean[hardware.length][hardware[0].length];
        for (int i = 0; i < hardware.length; i++) {
            for (int j = 0; j < hardware[i].length; j++) {
                combined[i][j] = hardware[i][j] || user[i][j];
            }
        }
        return combined;
    }

    public List<String> sampleChannels() {
        return instrument.channelsFor(diffractometer.axes().sample());
    }

    public List<String> detectorChannels() {
        return instrument.channelsFor(diffractometer.axes().detector());
    }

    boolean isMasked(int row, int col) {
        return mask[row][col];
    }
}
