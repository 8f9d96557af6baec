package ai.pegs.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.pegs.game.Coordinate;
import ai.pegs.game.Move;
import org.junit.jupiter.api.Test;

class MoveTest {

    @Test
    void capturedPegIsTheMidpoint() {
        assertEquals(new Coordinate(3, 4), Move.of(2, 4, 4, 4).captured());
        assertEquals(new Coordinate(4, 5), Move.of(4, 6, 4, 4).captured());
    }

    @Test
    void rendersAsArrow() {
        assertEquals("(2, 4) ~> (4, 4)", Move.of(2, 4, 4, 4).toString());
    }

    @Test
    void rejectsShapesThatAreNotTwoCellJumps() {
        assertThrows(IllegalArgumentException.class, () -> Move.of(0, 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> Move.of(0, 0, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> Move.of(0, 0, 0, 3));
        assertThrows(IllegalArgumentException.class, () -> Move.of(2, 2, 2, 2));
        assertThrows(IllegalArgumentException.class, () -> Move.of(0, 0, 2, 2));
    }

    @Test
    void rejectsNullCoordinates() {
        assertThrows(NullPointerException.class, () -> new Move(null, new Coordinate(0, 2)));
    }
}
