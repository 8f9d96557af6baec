package ai.pegs.simulation;

import java.util.Random;

/**
 * Draws simulation seeds.
 * <p>
 * Seeds are always in {@code [1, Integer.MAX_VALUE]}: zero is reserved on the command line for
 * "pick a fresh seed", so a drawn seed can always be replayed with {@code simulate <seed>}.
 */
public class SeedGenerator {
    private final Random random;

    public SeedGenerator(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Creates a generator seeded from the high-resolution clock.
     */
    public static SeedGenerator fromClock() {
        return new SeedGenerator(System.nanoTime());
    }

    public long nextSeed() {
        return 1L + random.nextInt(Integer.MAX_VALUE);
    }
}
