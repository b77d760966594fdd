package pokeai.engine;

/**
 * SplitMix64 generator. Its whole state is one long, stored in the battle state after each
 * advance so a persisted battle resumes with the same sequence.
 */
public final class BattleRandom {
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private long state;

    public BattleRandom(long seed) {
        this.state = seed;
    }

    public long getState() {
        return state;
    }

    public long nextLong() {
        long z = (state += GOLDEN_GAMMA);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /** Uniform in [0, 1). */
    public double nextDouble() {
        return (nextLong() >>> 11) * 0x1.0p-53;
    }

    /** Uniform in [0, bound). */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) ((nextLong() >>> 33) % bound);
    }

    /** Uniform in [min, max]. */
    public int nextInt(int min, int max) {
        return min + nextInt(max - min + 1);
    }

    /** True with probability {@code p}; never draws for certain or impossible events. */
    public boolean chance(double p) {
        if (p >= 1.0) {
            return true;
        }
        if (p <= 0.0) {
            return false;
        }
        return nextDouble() < p;
    }
}
