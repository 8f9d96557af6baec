package ai.pegs.simulation;

import ai.pegs.game.Board;
import ai.pegs.game.Move;
import ai.pegs.game.Offset;
import ai.pegs.moves.MoveFinder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One playthrough of peg solitaire, driven step by step.
 *
 * <p>The simulation owns its board and its {@link OffsetGenerator}. Each {@link #step()} draws one
 * offset, asks the {@link MoveFinder} for the first jump in that rotated scan, and applies it.
 * When a scan finds nothing the simulation moves to {@link SimulationState#HALTED} and stays
 * there.
 *
 * <p>The score is tracked incrementally: every jump removes exactly one peg.
 */
public class Simulation {
    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private final long seed;
    private final Board board;
    private final OffsetGenerator offsets;
    private final MoveFinder moveFinder;
    private final List<Move> history = new ArrayList<>();
    private SimulationState state = SimulationState.RUNNING;
    private int score;

    /**
     * Starts a simulation on a fresh board of the given size, with offsets drawn from a
     * {@link RandomOffsetGenerator} seeded by {@code seed}.
     */
    public static Simulation start(long seed, int boardSize) {
        return new Simulation(seed, Board.create(boardSize), new RandomOffsetGenerator(seed), new MoveFinder());
    }

    public Simulation(long seed, Board board, OffsetGenerator offsets, MoveFinder moveFinder) {
        this.seed = seed;
        this.board = Objects.requireNonNull(board, "board");
        this.offsets = Objects.requireNonNull(offsets, "offsets");
        this.moveFinder = Objects.requireNonNull(moveFinder, "moveFinder");
        this.score = board.score();
    }

    /**
     * Plays at most one move.
     *
     * @return true if a move was applied, false if the simulation is (now) halted
     */
    public boolean step() {
        if (state == SimulationState.HALTED) {
            return false;
        }
        Offset offset = offsets.next();
        Optional<Move> found = moveFinder.findMove(board, offset);
        if (found.isEmpty()) {
            state = SimulationState.HALTED;
            if (log.isDebugEnabled()) {
                log.debug("Seed {} halted after {} moves with score {}", seed, history.size(), score);
            }
            return false;
        }
        Move move = found.get();
        board.apply(move);
        history.add(move);
        score--;
        if (log.isDebugEnabled()) {
            log.debug("Seed {} move {}: {} (offset {}, score {})", seed, history.size(), move, offset, score);
        }
        return true;
    }

    /**
     * Steps until halted.
     *
     * @return the final result
     */
    public SimulationResult run() {
        while (step()) {
            // keep going
        }
        return result();
    }

    /**
     * Snapshot of the current outcome; final once the simulation has halted.
     */
    public SimulationResult result() {
        return new SimulationResult(seed, score, history);
    }

    public long seed() {
        return seed;
    }

    public SimulationState state() {
        return state;
    }

    /** Incrementally tracked peg count. */
    public int score() {
        return score;
    }

    public List<Move> history() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Returns the most recent move, or null before the first move.
     */
    public Move lastMove() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    /**
     * Returns a copy of the board; the live board never leaves the simulation.
     */
    public Board board() {
        return board.copy();
    }
}
