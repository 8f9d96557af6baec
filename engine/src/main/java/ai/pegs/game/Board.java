package ai.pegs.game;

import java.util.Arrays;
import java.util.Optional;

/**
 * Square peg solitaire board with a cross-shaped playing area.
 * <p>
 * The board is an odd-sized grid whose corners are cut away, leaving a plus shape:
 * <ul>
 *   <li>rows {@code 0} and {@code size-1}: columns {@code 0, 1, size-2, size-1} are unusable;</li>
 *   <li>rows {@code 1} and {@code size-2}: columns {@code 0, size-1} are unusable;</li>
 *   <li>the center cell starts empty and every other cell starts with a peg.</li>
 * </ul>
 * <p>
 * <strong>Ownership:</strong> a board is mutable and belongs to exactly one simulation. Hand
 * {@link #copy()} to anything that outlives the current move (presenters, tests).
 */
public class Board {
    /** Number of cells removed by the four corner cut-outs. */
    public static final int UNUSABLE_CELLS = 12;

    /** Smallest size at which the corner cut-outs do not overlap. */
    public static final int MIN_SIZE = 5;

    private final int size;
    private final CellState[][] cells;

    private Board(int size, CellState[][] cells) {
        this.size = size;
        this.cells = cells;
    }

    /**
     * Builds the starting cross-shaped board.
     *
     * @param size side length; must be odd and at least {@link #MIN_SIZE}
     * @return a new board with every playable cell filled except the center
     * @throws IllegalArgumentException if {@code size} is even or too small
     */
    public static Board create(int size) {
        if (size % 2 == 0) {
            throw new IllegalArgumentException("Board size must be odd: " + size);
        }
        if (size < MIN_SIZE) {
            throw new IllegalArgumentException("Board size must be at least " + MIN_SIZE + ": " + size);
        }
        CellState[][] cells = new CellState[size][size];
        for (CellState[] row : cells) {
            Arrays.fill(row, CellState.OCCUPIED);
        }
        for (int row : new int[]{0, size - 1}) {
            cells[row][0] = CellState.UNUSABLE;
            cells[row][1] = CellState.UNUSABLE;
            cells[row][size - 2] = CellState.UNUSABLE;
            cells[row][size - 1] = CellState.UNUSABLE;
        }
        for (int row : new int[]{1, size - 2}) {
            cells[row][0] = CellState.UNUSABLE;
            cells[row][size - 1] = CellState.UNUSABLE;
        }
        cells[size / 2][size / 2] = CellState.EMPTY;
        return new Board(size, cells);
    }

    /**
     * Creates an independent copy of this board.
     *
     * @return a board with identical cells that shares no state with this one
     */
    public Board copy() {
        CellState[][] clone = new CellState[size][];
        for (int row = 0; row < size; row++) {
            clone[row] = cells[row].clone();
        }
        return new Board(size, clone);
    }

    public int size() {
        return size;
    }

    /**
     * Reads a cell without ever throwing.
     * <p>
     * Coordinates off the edge of the grid are a normal outcome while looking for jumps and come
     * back as an empty {@link Optional}.
     *
     * @param row    row index, may be negative or too large
     * @param column column index, may be negative or too large
     * @return the cell state, or empty when the position lies outside the grid
     */
    public Optional<CellState> read(int row, int column) {
        if (row < 0 || column < 0 || row >= size || column >= size) {
            return Optional.empty();
        }
        return Optional.of(cells[row][column]);
    }

    /**
     * Reads a cell by coordinate.
     *
     * @see #read(int, int)
     */
    public Optional<CellState> read(Coordinate coordinate) {
        return read(coordinate.row(), coordinate.column());
    }

    /**
     * Executes a jump.
     * <p>
     * The origin must hold a peg, the captured midpoint must hold a peg and the destination must
     * be empty. A move that breaks any of these rules means the move finder produced something
     * illegal, so it is reported as an {@link IllegalStateException} and the board is left as it
     * was.
     *
     * @param move the jump to execute; must not be null
     * @throws IllegalStateException if the move is not legal on this board
     */
    public void apply(Move move) {
        Coordinate from = move.from();
        Coordinate over = move.captured();
        Coordinate to = move.to();
        require(from, CellState.OCCUPIED, move);
        require(over, CellState.OCCUPIED, move);
        require(to, CellState.EMPTY, move);

        cells[from.row()][from.column()] = CellState.EMPTY;
        cells[over.row()][over.column()] = CellState.EMPTY;
        cells[to.row()][to.column()] = CellState.OCCUPIED;
    }

    /**
     * Counts the pegs left on the board.
     *
     * @return number of {@link CellState#OCCUPIED} cells
     */
    public int score() {
        return count(CellState.OCCUPIED);
    }

    /**
     * Counts the cells holding the given state.
     */
    public int count(CellState state) {
        int total = 0;
        for (CellState[] row : cells) {
            for (CellState cell : row) {
                if (cell == state) {
                    total++;
                }
            }
        }
        return total;
    }

    /**
     * Renders the board through {@link BoardFormatter}.
     */
    @Override
    public String toString() {
        return new BoardFormatter(this).format();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        Board that = (Board) other;
        return size == that.size && Arrays.deepEquals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    private void require(Coordinate at, CellState expected, Move move) {
        CellState actual = read(at).orElseThrow(
                () -> new IllegalStateException("Move " + move + " leaves the board at " + at));
        if (actual != expected) {
            throw new IllegalStateException(
                    "Illegal move " + move + ": expected " + expected + " at " + at + " but found " + actual);
        }
    }
}
