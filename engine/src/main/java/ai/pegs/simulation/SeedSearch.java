package ai.pegs.simulation;

import ai.pegs.config.SearchProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Searches for a seed whose simulation ends with a single peg.
 *
 * <p>Seeds are drawn from a {@link SeedGenerator} and simulated headless, batch after batch.
 * Within a batch the lowest score and its seed are tracked; when the batch completes it is
 * reported to the {@link SearchListener}, tracking is reset and the seed generator is re-seeded
 * from the clock. The search stops as soon as any run scores exactly 1.
 *
 * <p><b>Threads:</b> with {@code search.threads > 1} a batch is split across a fixed pool. Each
 * worker owns its seed generator and its simulations; the {@link BatchTracker} and the winner
 * slot are the only shared state.
 *
 * <p><b>Termination:</b> unbounded unless {@code search.max-batches} is set. Nothing guarantees a
 * winning seed exists in a given stream.
 */
@Component
public class SeedSearch {
    private static final Logger log = LoggerFactory.getLogger(SeedSearch.class);

    /** Seeds are never 0, so 0 marks "no winner yet". */
    private static final long NO_WINNER = 0L;

    private final Simulator simulator;
    private final SearchProperties properties;
    private final LongSupplier clock;

    @Autowired
    public SeedSearch(Simulator simulator, SearchProperties properties) {
        this(simulator, properties, System::nanoTime);
    }

    SeedSearch(Simulator simulator, SearchProperties properties, LongSupplier clock) {
        this.simulator = simulator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs batches until a winning seed is found or the batch limit is reached.
     *
     * @param listener receives batch reports and the final outcome
     * @return the outcome of the search
     * @throws IllegalStateException if the search thread is interrupted
     */
    public SearchOutcome search(SearchListener listener) {
        int threads = properties.getThreads();
        int maxBatches = properties.getMaxBatches();
        ExecutorService pool = threads > 1 ? Executors.newFixedThreadPool(threads) : null;
        AtomicLong winner = new AtomicLong(NO_WINNER);
        long totalRuns = 0;
        int batch = 0;
        try {
            while (maxBatches == 0 || batch < maxBatches) {
                batch++;
                SeedGenerator seeds = new SeedGenerator(clock.getAsLong());
                BatchTracker tracker = new BatchTracker();
                if (pool == null) {
                    runWorker(seeds, properties.getBatchSize(), tracker, winner);
                } else {
                    runParallel(pool, threads, seeds, tracker, winner);
                }
                totalRuns += tracker.runs();

                long winningSeed = winner.get();
                if (winningSeed != NO_WINNER) {
                    log.info("Seed {} ends with a single peg (batch {}, {} runs in total)", winningSeed, batch, totalRuns);
                    SearchOutcome outcome = SearchOutcome.won(winningSeed, totalRuns, batch);
                    listener.searchFinished(outcome);
                    return outcome;
                }
                BatchReport report = tracker.report(batch);
                log.info("Batch {} finished: best score {} for seed {}", batch, report.bestScore(), report.bestSeed());
                listener.batchFinished(report);
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
        log.info("No winning seed after {} batches ({} runs)", batch, totalRuns);
        SearchOutcome outcome = SearchOutcome.exhausted(totalRuns, batch);
        listener.searchFinished(outcome);
        return outcome;
    }

    private void runParallel(ExecutorService pool, int threads, SeedGenerator seeds, BatchTracker tracker, AtomicLong winner) {
        int batchSize = properties.getBatchSize();
        List<Future<?>> futures = new ArrayList<>(threads);
        for (int i = 0; i < threads; i++) {
            int runs = batchSize / threads + (i < batchSize % threads ? 1 : 0);
            SeedGenerator workerSeeds = new SeedGenerator(seeds.nextSeed());
            futures.add(pool.submit(() -> runWorker(workerSeeds, runs, tracker, winner)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Seed search interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("Seed search worker failed", cause);
            }
        }
    }

    private void runWorker(SeedGenerator seeds, int runs, BatchTracker tracker, AtomicLong winner) {
        for (int i = 0; i < runs && winner.get() == NO_WINNER; i++) {
            long seed = seeds.nextSeed();
            SimulationResult result = simulator.simulate(seed);
            tracker.record(result);
            if (result.isWon()) {
                winner.compareAndSet(NO_WINNER, seed);
            }
        }
    }
}
