package ai.pegs.moves;

import ai.pegs.game.Board;
import ai.pegs.game.CellState;
import ai.pegs.game.Coordinate;
import ai.pegs.game.Move;
import ai.pegs.game.Offset;
import java.util.Optional;

/**
 * Finds the next jump to play by scanning the board in a rotated row-major order.
 * <p>
 * The scan visits every cell once, row by row, after shifting both indices by the given
 * {@link Offset} modulo the board size (wrapping around like a torus). For each peg it tries the
 * four directions in a fixed order and returns the first legal jump it meets. The scan is fully
 * deterministic: the same board and offset always yield the same move. Variation between runs
 * comes only from callers drawing a different offset for each call.
 * <p>
 * Changing the scan order or the direction order changes which move is chosen when several are
 * legal, and with it the outcome of every seeded run.
 */
public class MoveFinder {

    /** Direction order tried for each peg: right, down, up, left. */
    private static final int[][] DIRECTIONS = {{0, 1}, {1, 0}, {-1, 0}, {0, -1}};

    /**
     * Returns the first legal jump in rotated scan order.
     *
     * @param board  board to inspect; not modified
     * @param offset scan rotation
     * @return the chosen move, or empty when no jump is possible anywhere on the board
     * @throws IllegalStateException if a rotated index falls outside the board
     */
    public Optional<Move> findMove(Board board, Offset offset) {
        int size = board.size();
        for (int row = 0; row < size; row++) {
            for (int column = 0; column < size; column++) {
                int rotatedRow = rotate(row, offset.row(), size);
                int rotatedColumn = rotate(column, offset.column(), size);
                CellState cell = board.read(rotatedRow, rotatedColumn).orElseThrow(
                        () -> new IllegalStateException(
                                "Rotated scan left the board at (" + rotatedRow + ", " + rotatedColumn + ")"));
                if (cell != CellState.OCCUPIED) {
                    continue;
                }
                Optional<Move> move = jumpFrom(board, new Coordinate(rotatedRow, rotatedColumn));
                if (move.isPresent()) {
                    return move;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first legal jump for the peg at {@code from}, trying directions in fixed order.
     */
    Optional<Move> jumpFrom(Board board, Coordinate from) {
        for (int[] direction : DIRECTIONS) {
            Coordinate over = from.shift(direction[0], direction[1], 1);
            if (board.read(over).orElse(CellState.UNUSABLE) != CellState.OCCUPIED) {
                continue;
            }
            Coordinate to = from.shift(direction[0], direction[1], 2);
            if (board.read(to).orElse(CellState.UNUSABLE) != CellState.EMPTY) {
                continue;
            }
            return Optional.of(new Move(from, to));
        }
        return Optional.empty();
    }

    /**
     * Shifts {@code index} by {@code offset} and wraps into {@code [0, size)}.
     * Computed in {@code long} so large offsets cannot overflow.
     */
    static int rotate(int index, int offset, int size) {
        return (int) Math.floorMod((long) index + offset, (long) size);
    }
}
