package ai.pegs.simulation;

import ai.pegs.game.Board;
import ai.pegs.game.Move;

/**
 * Receives the progress of a single simulation for display.
 * <p>
 * Boards handed to a presenter are snapshots; presenters may keep them.
 */
public interface Presenter {

    /** Presenter that shows nothing, used for headless runs. */
    Presenter NONE = new Presenter() {
    };

    /**
     * Called once before the first move.
     */
    default void started(long seed, Board board) {
    }

    /**
     * Called after every applied move with the resulting board.
     */
    default void moved(Move move, Board board) {
    }

    /**
     * Called once the simulation has halted.
     */
    default void finished(SimulationResult result) {
    }
}
