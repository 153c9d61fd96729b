package com.fxhedge.core.engine;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Creates seeded random streams for the simulation. Tests swap in their own factory to get
 * fully controlled sequences.
 */
@FunctionalInterface
public interface RandomStreamFactory {

    RandomGenerator create(long seed);
}
