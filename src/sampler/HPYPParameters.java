package sampler;

import gnu.trove.list.array.TDoubleArrayList;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.GammaDistribution;
import sampling.util.ContextNode;
import util.ConfigurationException;
import util.MiscUtils;

/**
 * Discount and concentration of every depth of the context tree. Depths past
 * the configured values share the last configured pair until they are set
 * (or resampled) individually.
 * <p>
 * Resampling uses slice sampling of each depth's discount d, with a Beta(1, 1)
 * prior, and of theta = a + d, with a Gamma(1, 1) prior, under the collapsed
 * likelihood of the seating counts at that depth.
 */
public class HPYPParameters {

    public static final double[] DEFAULT_DISCOUNTS = {0.62, 0.69, 0.74, 0.80, 0.95};
    public static final double[] DEFAULT_CONCENTRATIONS = {0.0};
    public static final double MAX_DISCOUNT = 1.0 - 1e-6;
    public static final double MIN_STRENGTH = 1e-8;
    protected double stepSize = 0.1;
    protected int numSliceSamples = 10;
    private TDoubleArrayList discounts;
    private TDoubleArrayList concentrations;
    private ArrayList<ArrayList<Double>> sampledParams;
    private final BetaDistribution discountPrior;
    private final GammaDistribution strengthPrior;

    public HPYPParameters() {
        this(DEFAULT_DISCOUNTS, DEFAULT_CONCENTRATIONS);
    }

    public HPYPParameters(double[] discounts, double[] concentrations) {
        if (discounts == null || discounts.length == 0
                || concentrations == null || concentrations.length == 0) {
            throw new ConfigurationException("At least one discount and one "
                    + "concentration must be given");
        }
        this.discounts = new TDoubleArrayList(discounts);
        this.concentrations = new TDoubleArrayList(concentrations);
        this.sampledParams = new ArrayList<ArrayList<Double>>();
        this.discountPrior = new BetaDistribution(1.0, 1.0);
        this.strengthPrior = new GammaDistribution(1.0, 1.0);
        int numDepths = Math.max(discounts.length, concentrations.length);
        for (int k = 0; k < numDepths; k++) {
            checkPair(k, getDiscount(k), getConcentration(k));
        }
    }

    public void setSliceSampling(double stepSize, int numSliceSamples) {
        if (stepSize <= 0 || numSliceSamples < 1) {
            throw new ConfigurationException("Invalid slice sampling configuration "
                    + stepSize + ", " + numSliceSamples);
        }
        this.stepSize = stepSize;
        this.numSliceSamples = numSliceSamples;
    }

    /**
     * Number of depths with their own configured values.
     */
    public int getNumDepths() {
        return Math.max(discounts.size(), concentrations.size());
    }

    public double getDiscount(int depth) {
        checkDepth(depth);
        if (depth < discounts.size()) {
            return discounts.get(depth);
        }
        return discounts.get(discounts.size() - 1);
    }

    public double getConcentration(int depth) {
        checkDepth(depth);
        if (depth < concentrations.size()) {
            return concentrations.get(depth);
        }
        return concentrations.get(concentrations.size() - 1);
    }

    /**
     * Discounts of the nodes of a path, indexed like the path.
     */
    public double[] getDiscounts(List<ContextNode> path) {
        double[] ds = new double[path.size()];
        for (int i = 0; i < ds.length; i++) {
            ds[i] = getDiscount(path.get(i).getDepth());
        }
        return ds;
    }

    public double[] getConcentrations(List<ContextNode> path) {
        double[] as = new double[path.size()];
        for (int i = 0; i < as.length; i++) {
            as[i] = getConcentration(path.get(i).getDepth());
        }
        return as;
    }

    public void setDiscount(int depth, double discount) {
        checkDepth(depth);
        checkPair(depth, discount, getConcentration(depth));
        extend(discounts, depth);
        discounts.set(depth, discount);
    }

    public void setConcentration(int depth, double concentration) {
        checkDepth(depth);
        checkPair(depth, getDiscount(depth), concentration);
        extend(concentrations, depth);
        concentrations.set(depth, concentration);
    }

    private void setPair(int depth, double discount, double concentration) {
        checkPair(depth, discount, concentration);
        extend(discounts, depth);
        extend(concentrations, depth);
        discounts.set(depth, discount);
        concentrations.set(depth, concentration);
    }

    private static void extend(TDoubleArrayList values, int depth) {
        double last = values.get(values.size() - 1);
        while (values.size() <= depth) {
            values.add(last);
        }
    }

    private static void checkDepth(int depth) {
        if (depth < 0) {
            throw new ConfigurationException("Negative depth " + depth);
        }
    }

    private static void checkPair(int depth, double discount, double concentration) {
        if (!(discount >= 0 && discount < 1)) {
            throw new ConfigurationException("Discount at depth " + depth
                    + " must be in [0, 1). Got " + discount);
        }
        if (!(concentration > -discount) || Double.isInfinite(concentration)) {
            throw new ConfigurationException("Concentration at depth " + depth
                    + " must be greater than " + (-discount) + ". Got " + concentration);
        }
    }

    /**
     * Resample the discount and concentration of every depth that has
     * statistics, and record the new values.
     *
     * @param stats Seating statistics, one entry per depth (null or empty
     * entries are skipped)
     * @param rand Random source
     */
    public void resample(List<DepthStatistics> stats, Random rand) {
        for (int k = 0; k < stats.size(); k++) {
            DepthStatistics depthStats = stats.get(k);
            if (depthStats == null || depthStats.isEmpty()) {
                continue;
            }
            double d = getDiscount(k);
            double theta = getConcentration(k) + d;
            for (int s = 0; s < numSliceSamples; s++) {
                d = sliceSampleDiscount(depthStats, d, theta, rand);
                theta = sliceSampleStrength(depthStats, d, theta, rand);
            }
            setPair(k, d, theta - d);
        }

        ArrayList<Double> sparams = new ArrayList<Double>();
        for (int k = 0; k < getNumDepths(); k++) {
            sparams.add(getDiscount(k));
            sparams.add(getConcentration(k));
        }
        this.sampledParams.add(sparams);
    }

    private double getDiscountLogPosterior(DepthStatistics stats, double d, double theta) {
        return discountPrior.logDensity(d) + stats.getLogLikelihood(d, theta - d);
    }

    private double getStrengthLogPosterior(DepthStatistics stats, double d, double theta) {
        return strengthPrior.logDensity(theta) + stats.getLogNodeLikelihood(d, theta - d);
    }

    /**
     * One slice sampling step for the discount with theta = a + d held fixed.
     */
    private double sliceSampleDiscount(DepthStatistics stats, double cur, double theta,
            Random rand) {
        double curLlh = getDiscountLogPosterior(stats, cur, theta);
        double logUPrime = Math.log(rand.nextDouble()) + curLlh;
        double left = cur - rand.nextDouble() * stepSize;
        double right = left + stepSize;
        // a > -d holds for every d since theta > 0
        left = Math.max(left, 0.0);
        right = Math.min(right, MAX_DISCOUNT);

        while (true) {
            double next = rand.nextDouble() * (right - left) + left;
            double newLlh = getDiscountLogPosterior(stats, next, theta);
            if (newLlh > logUPrime) {
                return next;
            }
            if (next < cur) {
                left = next;
            } else {
                right = next;
            }
            if (right - left < 1e-12) {
                return cur;
            }
        }
    }

    /**
     * One slice sampling step for theta = a + d with the discount held fixed.
     */
    private double sliceSampleStrength(DepthStatistics stats, double d, double cur,
            Random rand) {
        double curLlh = getStrengthLogPosterior(stats, d, cur);
        double logUPrime = Math.log(rand.nextDouble()) + curLlh;
        double left = cur - rand.nextDouble() * stepSize;
        double right = left + stepSize;
        if (left < 0) {
            left = 0;
        }

        // step out to the right, the left side is bounded by 0
        int numSteps = 0;
        while (getStrengthLogPosterior(stats, d, right) > logUPrime && numSteps < 100) {
            right += stepSize;
            numSteps++;
        }

        while (true) {
            double next = rand.nextDouble() * (right - left) + left;
            if (next > MIN_STRENGTH) {
                double newLlh = getStrengthLogPosterior(stats, d, next);
                if (newLlh > logUPrime) {
                    return next;
                }
            }
            if (next < cur) {
                left = next;
            } else {
                right = next;
            }
            if (right - left < 1e-12) {
                return cur;
            }
        }
    }

    /**
     * Values after each call to {@link #resample}: discount and concentration
     * of depth 0, then depth 1, and so on.
     */
    public ArrayList<ArrayList<Double>> getSampledHistory() {
        return this.sampledParams;
    }

    /**
     * Take over the values of another parameter set. The sampled history is
     * kept.
     */
    public void copyFrom(HPYPParameters other) {
        this.discounts = new TDoubleArrayList(other.discounts);
        this.concentrations = new TDoubleArrayList(other.concentrations);
    }

    public void output(DataOutputStream out) throws IOException {
        out.writeInt(discounts.size());
        for (int k = 0; k < discounts.size(); k++) {
            out.writeDouble(discounts.get(k));
        }
        out.writeInt(concentrations.size());
        for (int k = 0; k < concentrations.size(); k++) {
            out.writeDouble(concentrations.get(k));
        }
    }

    public static HPYPParameters input(DataInputStream in) throws IOException {
        double[] ds = readArray(in);
        double[] as = readArray(in);
        try {
            return new HPYPParameters(ds, as);
        } catch (ConfigurationException e) {
            throw new IOException("Invalid parameters. " + e.getMessage(), e);
        }
    }

    private static double[] readArray(DataInputStream in) throws IOException {
        int size = in.readInt();
        if (size <= 0 || size > in.available() / 8) {
            throw new IOException("Invalid number of values " + size);
        }
        double[] values = new double[size];
        for (int k = 0; k < size; k++) {
            values[k] = in.readDouble();
        }
        return values;
    }

    @Override
    public String toString() {
        return "discounts = " + MiscUtils.arrayToString(discounts.toArray())
                + ", concentrations = " + MiscUtils.arrayToString(concentrations.toArray());
    }
}
