package ai.pegs;

import ai.pegs.cli.Command;
import ai.pegs.cli.CommandParser;
import ai.pegs.cli.UsageException;
import ai.pegs.presenter.ConsolePresenter;
import ai.pegs.simulation.SearchOutcome;
import ai.pegs.simulation.SeedGenerator;
import ai.pegs.simulation.SeedSearch;
import ai.pegs.simulation.SimulationResult;
import ai.pegs.simulation.Simulator;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point.
 * <ul>
 *   <li>{@code find}: search seeds until one leaves a single peg, print it, exit 0.</li>
 *   <li>{@code simulate <seed>}: animate one game; seed 0 picks a fresh seed.</li>
 * </ul>
 * Anything else prints the usage text and exits 1. A bounded {@code find} that runs out of
 * batches exits 2.
 */
@SpringBootApplication
public class PegSolitaire implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(PegSolitaire.class);
    /** Exit status of {@code find} when {@code search.max-batches} ran out without a winner. */
    static final int EXIT_NO_WINNER = 2;

    private final Simulator simulator;
    private final SeedSearch seedSearch;
    private final ConsolePresenter presenter;
    private PrintStream err = System.err;
    private int exitCode;

    public PegSolitaire(Simulator simulator, SeedSearch seedSearch, ConsolePresenter presenter) {
        this.simulator = simulator;
        this.seedSearch = seedSearch;
        this.presenter = presenter;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PegSolitaire.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setBannerMode(Banner.Mode.OFF);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public void run(String... args) {
        Command command;
        try {
            command = CommandParser.parse(args);
        } catch (UsageException e) {
            log.debug("Rejected command line", e);
            err.println(e.getMessage());
            err.println(CommandParser.USAGE);
            exitCode = 1;
            return;
        }

        switch (command.type()) {
            case FIND -> find();
            case SIMULATE -> simulate(command);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    void setErr(PrintStream err) {
        this.err = err;
    }

    private void simulate(Command command) {
        long seed = command.seed();
        if (command.wantsFreshSeed()) {
            seed = SeedGenerator.fromClock().nextSeed();
            log.info("Drew fresh seed {}", seed);
        }
        SimulationResult result = simulator.simulate(seed, presenter);
        if (log.isDebugEnabled()) {
            log.debug("Seed {} finished with score {} after {} moves", seed, result.score(), result.moveCount());
        }
        exitCode = 0;
    }

    private void find() {
        SearchOutcome outcome = seedSearch.search(presenter);
        if (log.isDebugEnabled()) {
            log.debug("Search finished: {}", outcome);
        }
        exitCode = outcome.won() ? 0 : EXIT_NO_WINNER;
    }
}
