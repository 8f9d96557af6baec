package ai.pegs.game;

import java.util.Objects;

/**
 * A single orthogonal jump: the peg at {@link #from()} hops over the neighbouring peg and lands
 * on {@link #to()}.
 *
 * <p>Only the shape is validated here (exactly two cells apart on one axis). Whether the cells
 * hold the right states is checked by {@link Board#apply(Move)}.
 */
public record Move(Coordinate from, Coordinate to) {

    public Move {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        int rowDistance = Math.abs(from.row() - to.row());
        int columnDistance = Math.abs(from.column() - to.column());
        boolean horizontal = rowDistance == 0 && columnDistance == 2;
        boolean vertical = rowDistance == 2 && columnDistance == 0;
        if (!horizontal && !vertical) {
            throw new IllegalArgumentException("Not an orthogonal jump: " + from + " ~> " + to);
        }
    }

    /**
     * Convenience factory taking raw indices.
     */
    public static Move of(int fromRow, int fromColumn, int toRow, int toColumn) {
        return new Move(new Coordinate(fromRow, fromColumn), new Coordinate(toRow, toColumn));
    }

    /**
     * Returns the cell between origin and destination, i.e. the peg removed by this jump.
     *
     * @return the midpoint coordinate
     */
    public Coordinate captured() {
        return new Coordinate((from.row() + to.row()) / 2, (from.column() + to.column()) / 2);
    }

    /**
     * Renders the move as {@code (fromRow, fromColumn) ~> (toRow, toColumn)}.
     */
    @Override
    public String toString() {
        return from + " ~> " + to;
    }
}
