package org.pcfgstego.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.pcfgstego.spi.IRandomProvider;

import java.security.SecureRandom;

/**
 * Default {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * Not thread-safe; create one per encoder.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    /**
     * Creates a provider whose sequence is fully determined by the seed.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    /**
     * @return A provider seeded from system entropy.
     */
    public static SeededRandomProvider fromEntropy() {
        return new SeededRandomProvider(new SecureRandom().nextLong());
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }
}
