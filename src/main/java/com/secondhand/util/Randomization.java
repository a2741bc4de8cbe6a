package com.secondhand.util;

import javax.inject.Singleton;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random draws used by the market engine.
 * Every roll (generation class, damage, seller response, buyer offer) goes through
 * one instance so a session can be replayed from a fixed seed.
 */
@Singleton
public class Randomization {

    private final Random random;

    public Randomization() {
        this.random = ThreadLocalRandom.current();
    }

    /**
     * Constructor with seeded random for deterministic testing.
     *
     * @param seed the random seed
     */
    public Randomization(long seed) {
        this.random = new Random(seed);
    }

    // ========================================================================
    // Gaussian (Normal) Distribution
    // ========================================================================

    /**
     * Generate a random value from a Gaussian (normal) distribution.
     *
     * @param mean   the mean (μ) of the distribution
     * @param stdDev the standard deviation (σ) of the distribution
     * @return a random value from N(mean, stdDev²)
     */
    public double gaussianRandom(double mean, double stdDev) {
        return mean + random.nextGaussian() * stdDev;
    }

    /**
     * Generate a bounded random value from a Gaussian distribution.
     * Values are clamped to [min, max] range.
     *
     * @param mean   the mean (μ) of the distribution
     * @param stdDev the standard deviation (σ) of the distribution
     * @param min    the minimum allowed value
     * @param max    the maximum allowed value
     * @return a random value from N(mean, stdDev²) clamped to [min, max]
     */
    public double gaussianRandom(double mean, double stdDev, double min, double max) {
        return clamp(gaussianRandom(mean, stdDev), min, max);
    }

    // ========================================================================
    // Uniform Distribution
    // ========================================================================

    /**
     * Draw a value in [0, 1). Callers that split one roll across several
     * outcome bands use this rather than repeated {@link #chance(double)} calls.
     *
     * @return a random double in [0, 1)
     */
    public double roll() {
        return random.nextDouble();
    }

    /**
     * Generate a random double uniformly distributed in [min, max).
     *
     * @param min the minimum value (inclusive)
     * @param max the maximum value (exclusive)
     * @return a random double in [min, max)
     */
    public double uniformRandom(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    /**
     * Generate a random integer uniformly distributed in [min, max].
     *
     * @param min the minimum value (inclusive)
     * @param max the maximum value (inclusive)
     * @return a random integer in [min, max]
     */
    public int uniformRandomInt(int min, int max) {
        if (min >= max) {
            return min;
        }
        return min + random.nextInt(max - min + 1);
    }

    // ========================================================================
    // Weighted Selection
    // ========================================================================

    /**
     * Select an index based on weighted probabilities.
     * Weights do not need to sum to 1.0; they are normalized internally.
     *
     * @param weights array of weights for each index
     * @return the selected index
     */
    public int weightedChoice(double[] weights) {
        if (weights == null || weights.length == 0) {
            throw new IllegalArgumentException("Weights array cannot be null or empty");
        }

        double totalWeight = 0;
        for (double w : weights) {
            if (w < 0) {
                throw new IllegalArgumentException("Weights cannot be negative");
            }
            totalWeight += w;
        }

        if (totalWeight <= 0) {
            return random.nextInt(weights.length);
        }

        double randomValue = random.nextDouble() * totalWeight;
        double cumulative = 0;

        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (randomValue < cumulative) {
                return i;
            }
        }

        return weights.length - 1;
    }

    /**
     * Select an item from a list based on weighted probabilities.
     *
     * @param items   the list of items to choose from
     * @param weights the weights corresponding to each item
     * @param <T>     the type of items
     * @return the selected item
     */
    public <T> T weightedChoiceItem(List<T> items, double[] weights) {
        if (items.size() != weights.length) {
            throw new IllegalArgumentException("Items and weights must have the same length");
        }
        return items.get(weightedChoice(weights));
    }

    // ========================================================================
    // Probability Checks
    // ========================================================================

    /**
     * Check if an event with given probability should occur.
     *
     * @param probability the probability (0.0 to 1.0)
     * @return true if the event should occur
     */
    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }

    // ========================================================================
    // Utility Methods
    // ========================================================================

    /**
     * Clamp a value to the specified range.
     *
     * @param value the value to clamp
     * @param min   the minimum allowed value
     * @param max   the maximum allowed value
     * @return the clamped value
     */
    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Clamp an integer value to the specified range.
     */
    public static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Round a currency amount down to a multiple of {@code step}.
     *
     * @param amount the amount
     * @param step   rounding step, must be positive
     * @return the rounded amount
     */
    public static long floorTo(double amount, long step) {
        long whole = (long) Math.floor(amount);
        return (whole / step) * step;
    }
}
