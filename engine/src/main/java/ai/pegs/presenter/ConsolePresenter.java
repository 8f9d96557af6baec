package ai.pegs.presenter;

import ai.pegs.config.SimulationProperties;
import ai.pegs.game.Board;
import ai.pegs.game.Move;
import ai.pegs.simulation.BatchReport;
import ai.pegs.simulation.Presenter;
import ai.pegs.simulation.SearchListener;
import ai.pegs.simulation.SearchOutcome;
import ai.pegs.simulation.SimulationResult;
import java.io.PrintStream;
import java.time.Duration;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Prints simulations and search progress to the console.
 * <p>
 * A simulation is animated frame by frame: the screen is cleared, the board printed, and the
 * presenter waits {@code simulation.frame-delay} before the next frame. At the end it prints the
 * seed, the score and the full move list.
 */
@Component
public class ConsolePresenter implements Presenter, SearchListener {
    private static final Logger log = LoggerFactory.getLogger(ConsolePresenter.class);

    /** ANSI: cursor home, then erase the whole screen. */
    private static final String CLEAR_SCREEN = "\u001B[H\u001B[2J";
    private static final String MOVE_SEPARATOR = " ; ";

    private final PrintStream out;
    private final Duration frameDelay;
    private final boolean clearScreen;

    @Autowired
    public ConsolePresenter(SimulationProperties properties) {
        this(System.out, properties.getFrameDelay(), properties.isClearScreen());
    }

    public ConsolePresenter(PrintStream out, Duration frameDelay, boolean clearScreen) {
        this.out = out;
        this.frameDelay = frameDelay;
        this.clearScreen = clearScreen;
    }

    @Override
    public void started(long seed, Board board) {
        drawFrame(board);
    }

    @Override
    public void moved(Move move, Board board) {
        pause();
        drawFrame(board);
    }

    @Override
    public void finished(SimulationResult result) {
        out.println(summary(result));
    }

    @Override
    public void batchFinished(BatchReport report) {
        out.println("best score in " + report.runs() + " runs is " + report.bestScore()
                + " for seed " + report.bestSeed());
    }

    @Override
    public void searchFinished(SearchOutcome outcome) {
        if (outcome.won()) {
            out.println("* * * winning seed is: " + outcome.winningSeed());
        } else {
            out.println("no winning seed in " + outcome.totalRuns() + " runs");
        }
    }

    /**
     * Builds the end-of-run text: seed, score, move count and every move.
     */
    static String summary(SimulationResult result) {
        String moves = result.moves().stream()
                .map(Move::toString)
                .collect(Collectors.joining(MOVE_SEPARATOR));
        return "Using seed " + result.seed() + ".\n"
                + "Ended with " + result.score() + " pegs remaining. Took " + result.moveCount() + " moves:\n"
                + moves;
    }

    private void drawFrame(Board board) {
        if (clearScreen) {
            out.print(CLEAR_SCREEN);
        }
        out.print(board);
        out.flush();
    }

    private void pause() {
        if (frameDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(frameDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (log.isDebugEnabled()) {
                log.debug("Frame delay interrupted; continuing without pause");
            }
        }
    }
}
