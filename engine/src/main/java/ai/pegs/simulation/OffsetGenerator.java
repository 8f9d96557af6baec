package ai.pegs.simulation;

import ai.pegs.game.Offset;

/**
 * Source of scan offsets for a single simulation.
 * <p>
 * Each simulation owns its generator; implementations are not expected to be thread-safe.
 */
public interface OffsetGenerator {

    /**
     * Draws the offset for the next scan.
     *
     * @return the next offset in this generator's sequence
     */
    Offset next();
}
