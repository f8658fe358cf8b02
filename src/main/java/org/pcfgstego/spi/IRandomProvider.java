package org.pcfgstego.spi;

/**
 * Source of randomness for the weighted fallback choices of the encoder.
 * <p>
 * Implementations seeded with a fixed value must produce the same sequence on every run, so that a
 * derivation can be reproduced exactly in tests.
 */
public interface IRandomProvider {

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();
}
