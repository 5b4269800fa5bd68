package ch.xavier.retirementsim.returns;

/**
 * Small 32-bit mixing generator (mulberry32). Same seed, same sequence, on every JVM. Not thread-safe: each
 * simulation path owns its instances.
 */
public class SeededRandom {

    private int state;

    public SeededRandom(int seed) {
        this.state = seed;
    }

    /**
     * @return a uniform double in [0, 1)
     */
    public double nextDouble() {
        state += 0x6D2B79F5;
        int r = (state ^ (state >>> 15)) * (1 | state);
        r ^= r + (r ^ (r >>> 7)) * (61 | r);
        return ((r ^ (r >>> 14)) & 0xFFFFFFFFL) / 4294967296.0;
    }

    public int nextInt(int bound) {
        return (int) Math.floor(nextDouble() * bound);
    }
}
