package utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

/**
 * Seedable source of every random decision taken while building test cases.
 * Two instances created with the same seed produce the same stream.
 */
public class Randomness {
    private final Random random;
    private final long seed;

    public Randomness() {
        this(Config.SEED != null ? Config.SEED : System.nanoTime());
    }

    public Randomness(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    /**
     * @return a uniform value in [0, 1)
     */
    public double nextFloat() {
        return random.nextDouble();
    }

    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    /**
     * @return a uniform value in [lower, upper)
     */
    public int nextInt(int lower, int upper) {
        return (int) nextLong(lower, upper);
    }

    /**
     * @return a uniform value in [lower, upper); the width of the range must
     * fit in a long
     */
    public long nextLong(long lower, long upper) {
        long range = upper - lower;
        if (upper <= lower || range <= 0) {
            throw new IllegalArgumentException("Empty or too wide range [" + lower + ", " + upper + ")");
        }
        if (range <= Integer.MAX_VALUE) {
            return lower + random.nextInt((int) range);
        }
        long offset = (long) (random.nextDouble() * range);
        return lower + Math.min(offset, range - 1);
    }

    public boolean nextBoolean() {
        return random.nextBoolean();
    }

    public double nextGaussian() {
        return random.nextGaussian();
    }

    /* printable ASCII only */
    public char nextChar() {
        return (char) nextInt(32, 127);
    }

    public <T> T choice(List<T> elements) {
        if (elements == null || elements.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty sequence");
        }
        return elements.get(random.nextInt(elements.size()));
    }

    public <T> T choice(Collection<T> elements) {
        if (elements instanceof List) {
            return choice((List<T>) elements);
        }
        return choice(new ArrayList<>(elements));
    }
}
