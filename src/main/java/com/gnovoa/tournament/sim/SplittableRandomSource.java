package com.gnovoa.tournament.sim;

import java.security.SecureRandom;
import java.util.SplittableRandom;

/**
 * {@link RandomSource} over a single {@link SplittableRandom}. A fixed seed replays the same
 * simulated results; calls are serialized so the shared bean can serve concurrent simulations.
 */
public final class SplittableRandomSource implements RandomSource {

    private final SplittableRandom random;

    public SplittableRandomSource(long seed) {
        this.random = new SplittableRandom(seed);
    }

    /** Seeded from {@link SecureRandom}, so every run differs. */
    public static SplittableRandomSource unseeded() {
        return new SplittableRandomSource(new SecureRandom().nextLong());
    }

    @Override
    public synchronized int nextIntInclusive(int fromInclusive, int toInclusive) {
        return random.nextInt(fromInclusive, toInclusive + 1);
    }

    @Override
    public synchronized double nextDouble() {
        return random.nextDouble();
    }
}
