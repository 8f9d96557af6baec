package ai.pegs.simulation;

/**
 * Lifecycle of a {@link Simulation}.
 */
public enum SimulationState {
    /** A move may still be available; keep stepping. */
    RUNNING,
    /** The last scan found no move. Terminal. */
    HALTED
}
