package binoculars.ext.sixs.geometry;

/**
 * Resolved stage chains of one diffractometer type.
 *
 * @param type the diffractometer type
 * @param sample chain from the reference root to the sample mount
 * @param detector chain from the reference root to the detector mount
 * @param graph the read-only stage graph both chains were resolved from
 */
public record InstrumentAxes(DiffractometerType type,
                             KinematicChain sample,
                             KinematicChain detector,
                             KinematicGraph graph) {
}
