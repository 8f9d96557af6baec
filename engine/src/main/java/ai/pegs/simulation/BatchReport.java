package ai.pegs.simulation;

/**
 * Best result seen within one search batch.
 *
 * @param batch     1-based batch number
 * @param runs      simulations completed in the batch
 * @param bestScore lowest score seen in the batch
 * @param bestSeed  seed that produced {@code bestScore}
 */
public record BatchReport(int batch, long runs, int bestScore, long bestSeed) {
}
