package ai.pegs.simulation;

/**
 * Progress callbacks for {@link SeedSearch}.
 */
public interface SearchListener {

    SearchListener NONE = new SearchListener() {
    };

    /**
     * Called when a batch completes without producing a winning seed.
     */
    default void batchFinished(BatchReport report) {
    }

    /**
     * Called once when the search stops, whether or not a winning seed was found.
     */
    default void searchFinished(SearchOutcome outcome) {
    }
}
