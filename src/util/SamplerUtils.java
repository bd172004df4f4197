package util;

import java.util.Random;

/**
 *
 * Sampling from unnormalized discrete distributions.
 */
public class SamplerUtils {

    /**
     * Sample an index from an array of unnormalized probabilities.
     *
     * @param rand Random source
     * @param distribution Non-negative weights, at least one positive
     */
    public static int scaleSample(Random rand, double[] distribution) {
        double sum = 0.0;
        for (double weight : distribution) {
            sum += weight;
        }
        if (!(sum > 0.0) || Double.isInfinite(sum)) {
            throw new NumericException("Cannot sample from weights summing to " + sum);
        }
        double u = rand.nextDouble() * sum;
        int index = 0;
        double cumm = distribution[0];
        while (cumm <= u && index < distribution.length - 1) {
            index++;
            cumm += distribution[index];
        }
        // skip trailing zero weights picked up by rounding
        while (distribution[index] == 0.0 && index > 0) {
            index--;
        }
        return index;
    }

    /**
     * Sample an index from an array of unnormalized log probabilities. The
     * maximum is subtracted before exponentiating.
     *
     * @param rand Random source
     * @param logDistribution Log weights, at least one finite
     */
    public static int logMaxRescaleSample(Random rand, double[] logDistribution) {
        double max = StatisticsUtils.max(logDistribution);
        if (Double.isNaN(max) || max == Double.NEGATIVE_INFINITY) {
            throw new NumericException("Cannot sample from log weights with max " + max);
        }
        double[] distribution = new double[logDistribution.length];
        for (int i = 0; i < logDistribution.length; i++) {
            distribution[i] = Math.exp(logDistribution[i] - max);
        }
        return scaleSample(rand, distribution);
    }

    /**
     * Bernoulli draw.
     */
    public static boolean flip(Random rand, double prob) {
        return rand.nextDouble() < prob;
    }
}
