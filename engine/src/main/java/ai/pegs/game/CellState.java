package ai.pegs.game;

/**
 * State of a single cell on the peg solitaire board.
 * <p>
 * Each state carries the symbol used when the board is rendered to the console.
 */
public enum CellState {
    /** Outside the playable cross; never holds a peg. */
    UNUSABLE(' '),
    /** Playable hole without a peg. */
    EMPTY('.'),
    /** Playable hole holding a peg. */
    OCCUPIED('@');

    private final char symbol;

    CellState(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the console symbol for this state.
     *
     * @return a single display character
     */
    public char symbol() {
        return symbol;
    }
}
