package ai.pegs.cli;

/**
 * A parsed command line.
 *
 * @param type what to run
 * @param seed seed for {@link Type#SIMULATE}; 0 asks for a fresh seed. Always 0 for {@link Type#FIND}.
 */
public record Command(Type type, long seed) {

    public enum Type {
        /** Search seeds until one ends with a single peg. */
        FIND,
        /** Animate one simulation. */
        SIMULATE
    }

    public static Command find() {
        return new Command(Type.FIND, 0L);
    }

    public static Command simulate(long seed) {
        return new Command(Type.SIMULATE, seed);
    }

    /**
     * True when the caller left the seed choice to the application.
     */
    public boolean wantsFreshSeed() {
        return type == Type.SIMULATE && seed == 0L;
    }
}
