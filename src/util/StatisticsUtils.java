package util;

import org.apache.commons.math3.special.Gamma;

/**
 *
 * Numeric helpers shared by the restaurants, the parameter sampler and the
 * model.
 */
public class StatisticsUtils {

    public static final double LOG_ZERO = Double.NEGATIVE_INFINITY;

    /**
     * Log of the Kramp symbol (a)_{n, d} = a (a + d) (a + 2d) ... (a + (n - 1)d).
     * Returns 0 for n <= 0.
     *
     * @param a Base
     * @param d Increment
     * @param n Number of factors
     */
    public static double logKramp(double a, double d, int n) {
        if (n <= 0) {
            return 0.0;
        }
        if (d == 0.0) {
            return n * Math.log(a);
        }
        if (a > 0 && d > 0 && n > 16) {
            // (a)_{n,d} = d^n Gamma(a/d + n) / Gamma(a/d)
            double ratio = a / d;
            return n * Math.log(d) + Gamma.logGamma(ratio + n) - Gamma.logGamma(ratio);
        }
        double llh = 0.0;
        for (int i = 0; i < n; i++) {
            llh += Math.log(a + i * d);
        }
        return llh;
    }

    /**
     * log(exp(x) + exp(y)) without overflow.
     */
    public static double logAdd(double x, double y) {
        if (x == LOG_ZERO) {
            return y;
        }
        if (y == LOG_ZERO) {
            return x;
        }
        if (x > y) {
            return x + Math.log1p(Math.exp(y - x));
        } else {
            return y + Math.log1p(Math.exp(x - y));
        }
    }

    public static double max(double[] array) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : array) {
            if (value > max) {
                max = value;
            }
        }
        return max;
    }

    /**
     * Index of the largest value. Ties go to the lowest index.
     */
    public static int argmax(double[] array) {
        int maxIdx = -1;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < array.length; i++) {
            if (maxIdx == -1 || array[i] > max) {
                max = array[i];
                maxIdx = i;
            }
        }
        return maxIdx;
    }

    /**
     * Checks that a value can be used as a probability and returns it.
     *
     * @param prob The value
     * @param msg Context for the error message
     */
    public static double checkProbability(double prob, String msg) {
        if (Double.isNaN(prob) || Double.isInfinite(prob) || prob < 0.0) {
            throw new NumericException(msg + ". Invalid probability " + prob);
        }
        return prob;
    }
}
