package ai.pegs.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.pegs.game.Board;
import ai.pegs.game.CellState;
import ai.pegs.game.Move;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Board construction, bounds-checked reads, move application and scoring.
 */
@DisplayName("Board")
class BoardTest {

    @Nested
    @DisplayName("Construction")
    class CreateTests {

        @Test
        void nineByNineHasCrossLayout() {
            Board board = Board.create(9);
            assertEquals(9, board.size());
            assertEquals(1, board.count(CellState.EMPTY));
            assertEquals(12, board.count(CellState.UNUSABLE));
            assertEquals(68, board.count(CellState.OCCUPIED));
            assertEquals(Optional.of(CellState.EMPTY), board.read(4, 4));
        }

        @Test
        void everyOddSizeHasOneHoleAndTwelveCutouts() {
            for (int size = 5; size <= 21; size += 2) {
                Board board = Board.create(size);
                assertEquals(1, board.count(CellState.EMPTY), "size " + size);
                assertEquals(Board.UNUSABLE_CELLS, board.count(CellState.UNUSABLE), "size " + size);
                assertEquals(size * size - 1 - 12, board.count(CellState.OCCUPIED), "size " + size);
                assertEquals(Optional.of(CellState.EMPTY), board.read(size / 2, size / 2), "size " + size);
            }
        }

        @Test
        void cornersAreCutAway() {
            Board board = Board.create(9);
            int[][] unusable = {
                    {0, 0}, {0, 1}, {0, 7}, {0, 8},
                    {8, 0}, {8, 1}, {8, 7}, {8, 8},
                    {1, 0}, {1, 8}, {7, 0}, {7, 8}
            };
            for (int[] cell : unusable) {
                assertEquals(Optional.of(CellState.UNUSABLE), board.read(cell[0], cell[1]),
                        "(" + cell[0] + ", " + cell[1] + ")");
            }
            assertEquals(Optional.of(CellState.OCCUPIED), board.read(1, 1));
            assertEquals(Optional.of(CellState.OCCUPIED), board.read(0, 2));
        }

        @Test
        void evenSizeIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> Board.create(8));
            assertThrows(IllegalArgumentException.class, () -> Board.create(10));
        }

        @Test
        void sizeTooSmallForCutoutsIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> Board.create(3));
            assertThrows(IllegalArgumentException.class, () -> Board.create(1));
        }

        @Test
        void rendersFiveByFiveCross() {
            String expected = ""
                    + "  @  \n"
                    + " @@@ \n"
                    + "@@.@@\n"
                    + " @@@ \n"
                    + "  @  \n";
            assertEquals(expected, Board.create(5).toString());
        }
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        void offBoardReadsAreEmpty() {
            Board board = Board.create(9);
            assertTrue(board.read(-1, 4).isEmpty());
            assertTrue(board.read(4, -1).isEmpty());
            assertTrue(board.read(9, 4).isEmpty());
            assertTrue(board.read(4, 9).isEmpty());
            assertTrue(board.read(Integer.MIN_VALUE, Integer.MAX_VALUE).isEmpty());
        }

        @Test
        void edgeCellsAreReadable() {
            Board board = Board.create(9);
            assertEquals(Optional.of(CellState.UNUSABLE), board.read(8, 8));
            assertEquals(Optional.of(CellState.OCCUPIED), board.read(8, 4));
        }
    }

    @Nested
    @DisplayName("Applying moves")
    class ApplyTests {

        @Test
        void jumpMovesPegAndRemovesCapturedPeg() {
            Board board = Board.create(9);
            board.apply(Move.of(2, 4, 4, 4));

            assertEquals(Optional.of(CellState.EMPTY), board.read(2, 4));
            assertEquals(Optional.of(CellState.EMPTY), board.read(3, 4));
            assertEquals(Optional.of(CellState.OCCUPIED), board.read(4, 4));
        }

        @Test
        void everyJumpLowersScoreByOne() {
            Board board = Board.create(9);
            int before = board.score();
            board.apply(Move.of(4, 6, 4, 4));
            assertEquals(before - 1, board.score());
            board.apply(Move.of(4, 3, 4, 5));
            assertEquals(before - 2, board.score());
        }

        @Test
        void scoreIsTheOccupiedCount() {
            Board board = Board.create(9);
            board.apply(Move.of(2, 4, 4, 4));
            board.apply(Move.of(5, 4, 3, 4));
            assertEquals(66, board.score());
            assertEquals(board.count(CellState.OCCUPIED), board.score());
            assertEquals(3, board.count(CellState.EMPTY));
        }

        @Test
        void occupiedDestinationIsAnInvariantViolation() {
            Board board = Board.create(9);
            Board before = board.copy();
            assertThrows(IllegalStateException.class, () -> board.apply(Move.of(0, 2, 2, 2)));
            assertEquals(before, board, "failed move must not touch the board");
        }

        @Test
        void emptyOriginIsAnInvariantViolation() {
            Board board = Board.create(9);
            assertThrows(IllegalStateException.class, () -> board.apply(Move.of(4, 4, 4, 2)));
        }

        @Test
        void emptyMidpointIsAnInvariantViolation() {
            Board board = Board.create(9);
            board.apply(Move.of(4, 2, 4, 4));
            // (4, 3) is now empty, so jumping from (4, 4) back over it is illegal.
            assertThrows(IllegalStateException.class, () -> board.apply(Move.of(4, 4, 4, 2)));
        }

        @Test
        void jumpOffTheBoardIsAnInvariantViolation() {
            Board board = Board.create(9);
            assertThrows(IllegalStateException.class, () -> board.apply(Move.of(0, 3, -2, 3)));
        }
    }

    @Test
    void copyIsIndependent() {
        Board board = Board.create(9);
        Board copy = board.copy();
        board.apply(Move.of(2, 4, 4, 4));

        assertNotEquals(board, copy);
        assertEquals(68, copy.score());
        assertEquals(67, board.score());
    }
}
