package ai.pegs.simulation;

import ai.pegs.game.Move;
import java.util.List;

/**
 * Outcome of one finished simulation.
 *
 * @param seed  seed the run was started from
 * @param score pegs left on the board when no move remained
 * @param moves every move played, in order
 */
public record SimulationResult(long seed, int score, List<Move> moves) {

    public SimulationResult {
        moves = List.copyOf(moves);
    }

    public int moveCount() {
        return moves.size();
    }

    /**
     * A run is won when a single peg remains.
     */
    public boolean isWon() {
        return score == 1;
    }
}
