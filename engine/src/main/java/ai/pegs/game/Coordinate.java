package ai.pegs.game;

/**
 * Zero-based (row, column) position on the board.
 */
public record Coordinate(int row, int column) {

    /**
     * Returns the coordinate {@code steps} cells away in the given direction.
     *
     * @param rowDirection    row delta per step (-1, 0 or 1)
     * @param columnDirection column delta per step (-1, 0 or 1)
     * @param steps           number of steps to take
     * @return the shifted coordinate; may lie outside the board
     */
    public Coordinate shift(int rowDirection, int columnDirection, int steps) {
        return new Coordinate(row + rowDirection * steps, column + columnDirection * steps);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
