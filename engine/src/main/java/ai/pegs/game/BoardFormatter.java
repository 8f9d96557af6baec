package ai.pegs.game;

import java.util.Objects;

/**
 * Renders a {@link Board} as plain text for the console.
 * <p>
 * One line per row, one character per cell: a space for unusable cells, {@code .} for empty
 * holes and {@code @} for pegs. Every line, the last included, ends with a newline.
 */
public class BoardFormatter {

    /** Board being rendered. */
    private final Board board;

    /**
     * @param board the board to format; must not be null
     * @throws NullPointerException if board is null
     */
    public BoardFormatter(Board board) {
        this.board = Objects.requireNonNull(board, "board");
    }

    /**
     * Renders every row of the board.
     *
     * @return the multi-line board text
     */
    public String format() {
        int size = board.size();
        StringBuilder sb = new StringBuilder(size * (size + 1));
        for (int row = 0; row < size; row++) {
            for (int column = 0; column < size; column++) {
                int r = row;
                int c = column;
                CellState cell = board.read(row, column)
                        .orElseThrow(() -> new IllegalStateException("No cell at (" + r + ", " + c + ")"));
                sb.append(cell.symbol());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
