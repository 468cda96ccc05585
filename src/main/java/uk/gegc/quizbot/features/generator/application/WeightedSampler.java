package uk.gegc.quizbot.features.generator.application;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Draws items without replacement, with or without weights, from a shared {@link Random}.
 */
public class WeightedSampler {

    private final Random random;

    public WeightedSampler(Random random) {
        this.random = random;
    }

    public <T> List<T> sampleUniform(List<T> items, int size) {
        List<T> pool = new ArrayList<>(items);
        int n = Math.min(size, pool.size());
        List<T> picked = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            picked.add(pool.remove(random.nextInt(pool.size())));
        }
        return picked;
    }

    /**
     * Draws {@code min(size, items.size())} items one after another; each draw is proportional to the
     * weights of the items still in the pool. Once only zero-weight items remain they are drawn uniformly.
     */
    public <T> List<T> sample(List<T> items, double[] weights, int size) {
        if (items.size() != weights.length) {
            throw new IllegalArgumentException("Got " + weights.length + " weights for " + items.size() + " items");
        }
        List<T> pool = new ArrayList<>(items);
        List<Double> poolWeights = new ArrayList<>(weights.length);
        for (double w : weights) {
            if (w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
                throw new IllegalArgumentException("Weights must be finite and non-negative: " + w);
            }
            poolWeights.add(w);
        }

        int n = Math.min(size, pool.size());
        List<T> picked = new ArrayList<>(n);
        for (int draw = 0; draw < n; draw++) {
            int index = pickIndex(poolWeights);
            picked.add(pool.remove(index));
            poolWeights.remove(index);
        }
        return picked;
    }

    /**
     * Scales the weights to sum to one; all-zero weights become a uniform distribution.
     */
    public static double[] normalize(double[] weights) {
        double total = 0;
        for (double w : weights) {
            total += w;
        }
        double[] result = new double[weights.length];
        if (total <= 0) {
            if (weights.length > 0) {
                Arrays.fill(result, 1.0 / weights.length);
            }
            return result;
        }
        for (int i = 0; i < weights.length; i++) {
            result[i] = weights[i] / total;
        }
        return result;
    }

    private int pickIndex(List<Double> weights) {
        double total = 0;
        for (double w : weights) {
            total += w;
        }
        if (total <= 0) {
            return random.nextInt(weights.size());
        }
        double target = random.nextDouble() * total;
        double cumulative = 0;
        int lastPositive = -1;
        for (int i = 0; i < weights.size(); i++) {
            double w = weights.get(i);
            if (w <= 0) {
                continue;
            }
            cumulative += w;
            lastPositive = i;
            if (target < cumulative) {
                return i;
            }
        }
        // rounding can leave target just above the running sum
        return lastPositive;
    }
}
