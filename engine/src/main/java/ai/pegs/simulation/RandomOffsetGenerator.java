package ai.pegs.simulation;

import ai.pegs.game.Offset;
import java.util.Random;

/**
 * {@link OffsetGenerator} backed by a seeded {@link Random}.
 * <p>
 * Every offset consumes two draws from the stream, row first and then column. The algorithm of
 * {@link Random} is fixed by the platform, so a given seed produces the same offsets on every JVM.
 */
public class RandomOffsetGenerator implements OffsetGenerator {
    private final Random random;

    public RandomOffsetGenerator(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public Offset next() {
        int row = random.nextInt();
        int column = random.nextInt();
        return new Offset(row, column);
    }
}
