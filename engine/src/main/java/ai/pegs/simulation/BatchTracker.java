package ai.pegs.simulation;

/**
 * Tracks the lowest score and its seed within one batch.
 * <p>
 * Shared by every search worker, so all access is synchronized.
 */
class BatchTracker {
    private long runs;
    private int bestScore = Integer.MAX_VALUE;
    private long bestSeed;

    synchronized void record(SimulationResult result) {
        if (result.score() < 1) {
            throw new IllegalStateException("Seed " + result.seed() + " ended with impossible score " + result.score());
        }
        runs++;
        if (result.score() < bestScore) {
            bestScore = result.score();
            bestSeed = result.seed();
        }
    }

    synchronized long runs() {
        return runs;
    }

    synchronized BatchReport report(int batch) {
        return new BatchReport(batch, runs, bestScore, bestSeed);
    }
}
