package com.gnovoa.tournament.sim;

/** Randomness behind simulated results. */
public interface RandomSource {
    int nextIntInclusive(int fromInclusive, int toInclusive);
    double nextDouble();
}
