package ai.pegs.simulation;

/**
 * Final outcome of a {@link SeedSearch}.
 *
 * @param won          whether a seed scoring exactly 1 was found
 * @param winningSeed  the winning seed; 0 when {@code won} is false
 * @param totalRuns    simulations completed across all batches
 * @param batches      batches started, the last one possibly cut short by the winner
 */
public record SearchOutcome(boolean won, long winningSeed, long totalRuns, int batches) {

    public static SearchOutcome won(long winningSeed, long totalRuns, int batches) {
        return new SearchOutcome(true, winningSeed, totalRuns, batches);
    }

    public static SearchOutcome exhausted(long totalRuns, int batches) {
        return new SearchOutcome(false, 0L, totalRuns, batches);
    }
}
