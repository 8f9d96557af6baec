package ai.pegs.game;

/**
 * Rotation applied to the row-major board scan.
 * <p>
 * Both components are arbitrary integers (negative values included); they only choose where the
 * toroidal scan starts and carry no weighting.
 */
public record Offset(int row, int column) {

    /** No rotation: the scan starts at (0, 0). */
    public static final Offset NONE = new Offset(0, 0);
}
