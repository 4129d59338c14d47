package com.gridfolio.engine.service.simulation;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Independent generators keyed by (seed, realization, stream). Every realization owns
 * its generators, so results do not depend on which thread runs it or in what order.
 */
public final class RandomStreams {

    public static final int PARAMETRIC = 1;
    public static final int WEATHER = 2;
    public static final int TEMPERATURE = 3;
    public static final int PRICE = 4;
    public static final int LOAD = 5;

    private RandomStreams() {
    }

    public static RandomGenerator generator(long seed, int realization, int stream) {
        return new Well19937c(streamSeed(seed, realization, stream));
    }

    static long streamSeed(long seed, int realization, int stream) {
        long mixed = mix(seed);
        mixed = mix(mixed ^ (0x9E3779B97F4A7C15L * (realization + 1L)));
        return mix(mixed ^ (0xC2B2AE3D27D4EB4FL * (stream + 1L)));
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
