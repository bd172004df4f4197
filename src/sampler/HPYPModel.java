package sampler;

import core.AbstractSampler;
import gnu.trove.map.hash.TIntObjectHashMap;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import sampling.restaurant.AbstractCompactRestaurant;
import sampling.restaurant.AbstractRestaurant;
import sampling.restaurant.RestaurantFactory;
import sampling.restaurant.RestaurantType;
import sampling.util.ContextNode;
import sampling.util.HPYPSerializer;
import sampling.util.NodeManager;
import sampling.util.SparseCount;
import sampling.util.StirlingTable;
import util.ConfigurationException;
import util.MiscUtils;
import util.MismatchRuntimeException;
import util.NumericException;
import util.SamplerUtils;
import util.SerializationException;
import util.StatisticsUtils;
import util.StructuralInconsistencyException;

/**
 * Hierarchical Pitman-Yor process model of a symbol sequence. Every position i
 * of the sequence is a customer of the restaurant of its context, the symbols
 * preceding it, and the restaurants of shorter contexts receive a customer
 * whenever a table is opened below them.
 * <p>
 * The sequence is referenced, not copied, and must not change while the
 * model uses it.
 */
public class HPYPModel extends AbstractSampler {

    public static enum ModelState {

        SEEDED, TRAINING, READY
    }
    public static final int UNSEATED = -1;
    public static final double PROB_TOLERANCE = 1e-6;
    private final int[] seq;
    private final NodeManager nodeManager;
    private final RestaurantFactory factory;
    private final HPYPParameters params;
    private final int numTypes;
    private double[] baseDistribution;
    private int[] seatedFrom; // context start of each seated position, UNSEATED otherwise
    private int numSeated;
    private ModelState state;

    public HPYPModel(int[] seq, NodeManager nodeManager, RestaurantFactory factory,
            HPYPParameters params, int numTypes) {
        if (seq == null || nodeManager == null || factory == null || params == null) {
            throw new ConfigurationException("Sequence, node manager, factory and "
                    + "parameters must all be given");
        }
        if (numTypes < 1) {
            throw new ConfigurationException("Number of types must be positive. Got "
                    + numTypes);
        }
        for (int i = 0; i < seq.length; i++) {
            if (seq[i] < 0 || seq[i] >= numTypes) {
                throw new ConfigurationException("Symbol " + seq[i] + " at position " + i
                        + " is outside [0, " + numTypes + ")");
            }
        }
        if (nodeManager.getFactory().getType() != factory.getType()) {
            throw new ConfigurationException("Node manager uses "
                    + nodeManager.getFactory().getType() + " restaurants but the model "
                    + "was given a " + factory.getType() + " factory");
        }
        this.seq = seq;
        this.nodeManager = nodeManager;
        this.factory = factory;
        this.params = params;
        this.numTypes = numTypes;
        this.baseDistribution = new double[numTypes];
        Arrays.fill(this.baseDistribution, 1.0 / numTypes);
        this.seatedFrom = new int[seq.length];
        Arrays.fill(this.seatedFrom, UNSEATED);
        this.numSeated = 0;
        this.state = ModelState.SEEDED;
        this.logLikelihoods = new ArrayList<Double>();
        this.name = "HPYP_" + factory.getType() + "_D-" + nodeManager.getMaxDepth();
        this.verbose = false;
    }

    /**
     * Reset the random sources of the model and of the restaurants.
     */
    public static void setRandomSeed(long seed) {
        AbstractSampler.setSeed(seed);
        AbstractRestaurant.setSeed(seed + 1);
    }

    public void configure(String folder, boolean paramOpt,
            int burnin, int maxiter, int samplelag, int repInt) {
        if (verbose) {
            logln("Configuring ...");
        }
        this.folder = folder;
        this.paramOptimized = paramOpt;
        this.setSamplerConfiguration(burnin, maxiter, samplelag, repInt);

        if (verbose) {
            logln("--- folder\t" + folder);
            logln("--- restaurant:\t" + factory.getType());
            logln("--- max depth:\t" + nodeManager.getMaxDepth());
            logln("--- # types:\t" + numTypes);
            logln("--- sequence length:\t" + seq.length);
            logln("--- " + params);
            logln("--- burn-in:\t" + BURN_IN);
            logln("--- max iter:\t" + MAX_ITER);
            logln("--- sample lag:\t" + LAG);
            logln("--- paramopt:\t" + paramOptimized);
        }
    }

    public int[] getSequence() {
        return this.seq;
    }

    public NodeManager getNodeManager() {
        return this.nodeManager;
    }

    public RestaurantFactory getFactory() {
        return this.factory;
    }

    public HPYPParameters getParameters() {
        return this.params;
    }

    public int getNumTypes() {
        return this.numTypes;
    }

    public ModelState getState() {
        return this.state;
    }

    public boolean isSeated(int position) {
        return this.seatedFrom[position] != UNSEATED;
    }

    public int getNumSeated() {
        return this.numSeated;
    }

    public double[] getBaseDistribution() {
        return this.baseDistribution.clone();
    }

    /**
     * Replace the uniform base measure at the root.
     */
    public void setBaseDistribution(double[] base) {
        if (base == null || base.length != numTypes) {
            throw new ConfigurationException("Base distribution must have "
                    + numTypes + " entries");
        }
        double sum = 0.0;
        for (double p : base) {
            if (!(p >= 0) || Double.isInfinite(p)) {
                throw new ConfigurationException("Invalid base probability " + p);
            }
            sum += p;
        }
        if (Math.abs(sum - 1.0) > PROB_TOLERANCE) {
            throw new ConfigurationException("Base distribution sums to " + sum);
        }
        this.baseDistribution = base.clone();
    }

    /**
     * Declare training finished. Further sweeps are still allowed.
     */
    public void finishTraining() {
        this.state = ModelState.READY;
    }

    // ------------------------------------------------------------------------
    // seating
    // ------------------------------------------------------------------------
    /**
     * Probabilities of a dish along a path: entry 0 is the base measure,
     * entry i + 1 the predictive probability at path node i.
     */
    private double[] computeProbabilityPath(List<ContextNode> path, int dish) {
        double[] probs = new double[path.size() + 1];
        probs[0] = baseDistribution[dish];
        for (int i = 0; i < path.size(); i++) {
            ContextNode node = path.get(i);
            int depth = node.getDepth();
            probs[i + 1] = node.getRestaurant().computeProbability(dish, probs[i],
                    params.getDiscount(depth), params.getConcentration(depth));
        }
        return probs;
    }

    /**
     * Seat a customer at the last node of the path and propagate new tables
     * towards the root.
     *
     * @return Predictive probability of the dish before it was seated
     */
    protected double addCustomer(List<ContextNode> path, int dish) {
        double[] probs = computeProbabilityPath(path, dish);
        double fraction = 1.0;
        for (int i = path.size() - 1; i >= 0; i--) {
            ContextNode node = path.get(i);
            int depth = node.getDepth();
            fraction = node.getRestaurant().addCustomer(dish, probs[i],
                    params.getDiscount(depth), params.getConcentration(depth), fraction);
            if (fraction == 0.0) {
                break;
            }
        }
        return probs[path.size()];
    }

    /**
     * Remove a customer from the last node of the path and propagate closed
     * tables towards the root.
     */
    protected void removeCustomer(List<ContextNode> path, int dish) {
        double fraction = 1.0;
        for (int i = path.size() - 1; i >= 0; i--) {
            ContextNode node = path.get(i);
            fraction = node.getRestaurant().removeCustomer(dish,
                    params.getDiscount(node.getDepth()), fraction);
            if (fraction == 0.0) {
                break;
            }
        }
    }

    private void discardTransientState(List<ContextNode> path, int dish) {
        for (ContextNode node : path) {
            node.getRestaurant().discardTransientState(dish);
        }
    }

    private void seat(int position, int contextStart) {
        List<ContextNode> path = nodeManager.resolvePath(seq, contextStart, position);
        addCustomer(path, seq[position]);
        this.seatedFrom[position] = contextStart;
        this.numSeated++;
    }

    /**
     * Take a position out of the model and prune the nodes left empty.
     */
    public void unseat(int position) {
        if (!isSeated(position)) {
            throw new StructuralInconsistencyException("Position " + position
                    + " is not seated");
        }
        List<ContextNode> path = nodeManager.findLongestSuffix(seq,
                seatedFrom[position], position);
        if (path.size() - 1 != nodeManager.getContextDepth(seatedFrom[position], position)) {
            throw new StructuralInconsistencyException("Missing context node for seated position "
                    + position);
        }
        removeCustomer(path, seq[position]);
        discardTransientState(path, seq[position]);
        this.seatedFrom[position] = UNSEATED;
        this.numSeated--;
        nodeManager.pruneEmptyLeaves(path);
    }

    // ------------------------------------------------------------------------
    // training
    // ------------------------------------------------------------------------
    /**
     * Seat every position that is not seated yet, in order, each one predicted
     * from the positions seated before it.
     */
    @Override
    public void initialize() {
        if (verbose) {
            logln("Initializing ...");
        }
        this.state = ModelState.TRAINING;
        for (int i = 0; i < seq.length; i++) {
            if (!isSeated(i)) {
                seat(i, 0);
            }
        }
        if (debug) {
            validate("Initialized");
        }
    }

    /**
     * One Gibbs sweep over all positions: each seated position is removed
     * from its path and seated again from the current predictive
     * distribution. Positions not seated yet are seated.
     *
     * @param resampleHyperparameters Whether to resample the discounts and
     * concentrations after the sweep
     */
    public void runGibbsSampler(boolean resampleHyperparameters) {
        this.state = ModelState.TRAINING;
        for (int i = 0; i < seq.length; i++) {
            if (isSeated(i)) {
                List<ContextNode> path = nodeManager.resolvePath(seq, seatedFrom[i], i);
                removeCustomer(path, seq[i]);
                addCustomer(path, seq[i]);
                discardTransientState(path, seq[i]);
            } else {
                seat(i, 0);
            }
        }
        if (resampleHyperparameters) {
            updateHyperparameters();
        }
    }

    protected void updateHyperparameters() {
        if (verbose) {
            logln("*** *** Optimizing hyperparameters by slice sampling ...");
            logln("*** *** cur param: " + params);
            logln("*** *** cur llh = " + MiscUtils.formatDouble(computeLogJoint()));
        }
        params.resample(collectStatistics(), rand);
        if (verbose) {
            logln("*** *** new param: " + params);
            logln("*** *** new llh = " + MiscUtils.formatDouble(computeLogJoint()));
        }
    }

    /**
     * Sweep over all nodes and resample the seating of each node's customers.
     *
     * @param directGibbs If true, resample table counts directly from their
     * conditional distribution (compact representations only). Otherwise
     * every customer of each dish with more than one customer is removed and
     * seated again.
     */
    public void runNodeSampler(boolean directGibbs) {
        if (directGibbs && !isCompact()) {
            throw new ConfigurationException("Direct table count resampling needs a "
                    + "compact representation. Got " + factory.getType());
        }
        this.state = ModelState.TRAINING;
        for (ContextNode node : nodeManager.getNodesDFS()) {
            AbstractRestaurant restaurant = node.getRestaurant();
            if (directGibbs) {
                for (int dish : restaurant.getDishes()) {
                    sampleTableCount(node, dish);
                }
            } else {
                List<ContextNode> path = nodeManager.getPathToRoot(node);
                for (int dish : restaurant.getDishes()) {
                    int cw = restaurant.getCustomerCount(dish);
                    if (cw <= 1) {
                        continue;
                    }
                    for (int j = 0; j < cw; j++) {
                        removeCustomer(path, dish);
                        addCustomer(path, dish);
                    }
                    discardTransientState(path, dish);
                }
            }
        }
    }

    public boolean isCompact() {
        RestaurantType type = factory.getType();
        return type == RestaurantType.STIRLING_COMPACT
                || type == RestaurantType.REINSTANTIATING_COMPACT;
    }

    /**
     * Resample the number of tables of a dish at a node given everything
     * else. The parent's customer count of the dish follows the new table
     * count; the parent's own tables are left to its turn in the sweep.
     */
    private void sampleTableCount(ContextNode node, int dish) {
        AbstractCompactRestaurant restaurant = (AbstractCompactRestaurant) node.getRestaurant();
        int cw = restaurant.getCustomerCount(dish);
        int curTw = restaurant.getTableCount(dish);
        if (cw <= 1) {
            return;
        }
        int depth = node.getDepth();
        double d = params.getDiscount(depth);
        double a = params.getConcentration(depth);
        int otherTables = restaurant.getTotalTables() - curTw;
        double[] logStirling = StirlingTable.getShared(d).getLogRow(cw, cw);

        ContextNode parent = nodeManager.getParent(node);
        AbstractCompactRestaurant parentRestaurant = null;
        int parentBaseCw = 0;
        int parentTw = 0;
        int parentOtherCustomers = 0;
        double parentA = 0.0;
        double[] parentLogStirling = null;
        if (parent != null) {
            parentRestaurant = (AbstractCompactRestaurant) parent.getRestaurant();
            parentBaseCw = parentRestaurant.getCustomerCount(dish) - curTw;
            parentTw = parentRestaurant.getTableCount(dish);
            parentOtherCustomers = parentRestaurant.getTotalCustomers() - curTw;
            parentA = params.getConcentration(parent.getDepth());
            // S_{d_p}(parentBaseCw + t, parentTw) for t = 1..cw
            parentLogStirling = StirlingTable.getShared(params.getDiscount(parent.getDepth()))
                    .getLogColumn(parentTw, parentBaseCw + 1, parentBaseCw + cw);
        }

        double[] logprobs = new double[cw];
        for (int t = 1; t <= cw; t++) {
            double llh = StatisticsUtils.logKramp(a + d, d, otherTables + t - 1)
                    + logStirling[t];
            if (parent == null) {
                llh += t * Math.log(baseDistribution[dish]);
            } else if (parentBaseCw + t < parentTw) {
                llh = StatisticsUtils.LOG_ZERO;
            } else {
                llh += parentLogStirling[t - 1]
                        - StatisticsUtils.logKramp(parentA + 1, 1, parentOtherCustomers + t - 1);
            }
            logprobs[t - 1] = llh;
        }
        int sampledTw = SamplerUtils.logMaxRescaleSample(rand, logprobs) + 1;
        if (sampledTw == curTw) {
            return;
        }
        restaurant.setTableCount(dish, sampledTw);
        if (parentRestaurant != null) {
            parentRestaurant.setCustomerCount(dish, parentBaseCw + sampledTw);
        }
    }

    @Override
    public void iterate() {
        if (verbose) {
            logln("Iterating ...");
        }
        logLikelihoods = new ArrayList<Double>();

        for (iter = 0; iter < MAX_ITER; iter++) {
            boolean resample = paramOptimized && iter >= BURN_IN && iter % LAG == 0;
            runGibbsSampler(resample);

            if (debug) {
                validate("Iter " + iter);
            }

            if (iter % REP_INTERVAL != 0) {
                continue;
            }
            double loglikelihood = this.getLogLikelihood();
            logLikelihoods.add(loglikelihood);

            if (isReporting()) {
                String str = "Iter " + iter
                        + ". llh = " + MiscUtils.formatDouble(loglikelihood)
                        + ". # nodes = " + nodeManager.getNumNodes()
                        + ". loss = " + MiscUtils.formatDouble(computeLosses(0, seq.length));
                if (iter < BURN_IN) {
                    logln("--- Burning in. " + str);
                } else {
                    logln("--- Sampling. " + str);
                }
            }
        }
    }

    // ------------------------------------------------------------------------
    // losses and prediction
    // ------------------------------------------------------------------------
    /**
     * Sum of -ln p(seq[i] | seq[start, i)) over i in [start, end) under the
     * current seating. The model is not changed; the deepest existing node of
     * each context is used.
     */
    public double computeLosses(int start, int end) {
        checkRange(start, end);
        double loss = 0.0;
        for (int i = start; i < end; i++) {
            double prob = predictProbability(start, i, seq[i]);
            if (prob <= 0) {
                throw new NumericException("Zero probability for symbol " + seq[i]
                        + " at position " + i);
            }
            loss -= Math.log(prob);
        }
        return loss;
    }

    /**
     * Predict each position of [start, stop) from the positions before it,
     * then seat it, and return the log2 losses. Positions that were already
     * seated are taken out first.
     */
    public double[] computeOnlineLosses(int start, int stop) {
        return computeLossesWithDeletion(start, stop, 0);
    }

    /**
     * Like {@link #computeOnlineLosses}, but the position lag steps back is
     * unseated after every insertion, so at most lag positions are seated at
     * a time. A lag of 0 keeps every position.
     */
    public double[] computeLossesWithDeletion(int start, int stop, int lag) {
        checkRange(start, stop);
        if (lag < 0) {
            throw new ConfigurationException("Negative lag " + lag);
        }
        this.state = ModelState.TRAINING;
        double[] losses = new double[stop - start];
        for (int i = start; i < stop; i++) {
            if (isSeated(i)) {
                unseat(i);
            }
            List<ContextNode> path = nodeManager.resolvePath(seq, start, i);
            double prob = addCustomer(path, seq[i]);
            this.seatedFrom[i] = start;
            this.numSeated++;
            StatisticsUtils.checkProbability(prob, "Position " + i);
            if (prob <= 0) {
                throw new NumericException("Zero probability for symbol " + seq[i]
                        + " at position " + i);
            }
            losses[i - start] = -Math.log(prob) / Math.log(2);

            if (lag > 0 && i - lag >= start && isSeated(i - lag)) {
                unseat(i - lag);
            }
        }
        return losses;
    }

    /**
     * Predictive distribution of the symbol following seq[contextStart,
     * contextEnd).
     */
    public double[] predictiveDistribution(int contextStart, int contextEnd) {
        checkRange(contextStart, contextEnd);
        return computePredictive(nodeManager.findLongestSuffix(seq, contextStart, contextEnd));
    }

    /**
     * Predictive distribution of the symbol following an arbitrary context,
     * oldest symbol first.
     */
    public double[] predictiveDistribution(int[] context) {
        for (int symbol : context) {
            if (symbol < 0 || symbol >= numTypes) {
                throw new ConfigurationException("Invalid context symbol " + symbol);
            }
        }
        return computePredictive(nodeManager.findLongestSuffix(context, 0, context.length));
    }

    /**
     * Predictive distribution mixed along the context path: weights[0] goes
     * to the base measure, weights[k] to the predictive of the node at depth
     * k - 1, and whatever weight is left to the deepest node of the context.
     * Weights past the end of the path are ignored.
     *
     * @param weights Non-negative mixing weights summing to at most 1
     */
    public double[] predictiveDistributionWithMixing(int contextStart, int contextEnd,
            double[] weights) {
        checkRange(contextStart, contextEnd);
        if (weights == null) {
            throw new ConfigurationException("Mixing weights must be given");
        }
        double total = 0.0;
        for (double weight : weights) {
            if (!(weight >= 0) || Double.isInfinite(weight)) {
                throw new ConfigurationException("Invalid mixing weight " + weight);
            }
            total += weight;
        }
        if (total > 1.0 + PROB_TOLERANCE) {
            throw new ConfigurationException("Mixing weights sum to " + total);
        }

        List<ContextNode> path = nodeManager.findLongestSuffix(seq, contextStart, contextEnd);
        double[] dist = new double[numTypes];
        double sum = 0.0;
        for (int w = 0; w < numTypes; w++) {
            double[] probs = computeProbabilityPath(path, w);
            int numMixed = Math.min(weights.length, probs.length);
            double prob = 0.0;
            double mixed = 0.0;
            for (int j = 0; j < numMixed; j++) {
                prob += weights[j] * probs[j];
                mixed += weights[j];
            }
            prob += (1.0 - mixed) * probs[path.size()];
            dist[w] = StatisticsUtils.checkProbability(prob, "Symbol " + w);
            sum += dist[w];
        }
        if (Math.abs(sum - 1.0) > PROB_TOLERANCE) {
            throw new NumericException("Mixed predictive distribution sums to " + sum);
        }
        return dist;
    }

    private double[] computePredictive(List<ContextNode> path) {
        double[] dist = new double[numTypes];
        double sum = 0.0;
        for (int w = 0; w < numTypes; w++) {
            double[] probs = computeProbabilityPath(path, w);
            dist[w] = StatisticsUtils.checkProbability(probs[path.size()], "Symbol " + w);
            sum += dist[w];
        }
        if (Math.abs(sum - 1.0) > PROB_TOLERANCE) {
            throw new NumericException("Predictive distribution sums to " + sum);
        }
        return dist;
    }

    /**
     * Most probable next symbol. Ties go to the smallest symbol.
     */
    public int predict(int contextStart, int contextEnd) {
        return StatisticsUtils.argmax(predictiveDistribution(contextStart, contextEnd));
    }

    public int predict(int[] context) {
        return StatisticsUtils.argmax(predictiveDistribution(context));
    }

    public int samplePrediction(int contextStart, int contextEnd) {
        return SamplerUtils.scaleSample(rand, predictiveDistribution(contextStart, contextEnd));
    }

    public double predictProbability(int contextStart, int contextEnd, int symbol) {
        checkRange(contextStart, contextEnd);
        if (symbol < 0 || symbol >= numTypes) {
            throw new ConfigurationException("Invalid symbol " + symbol);
        }
        List<ContextNode> path = nodeManager.findLongestSuffix(seq, contextStart, contextEnd);
        double[] probs = computeProbabilityPath(path, symbol);
        return StatisticsUtils.checkProbability(probs[path.size()], "Symbol " + symbol);
    }

    /**
     * Probability of every symbol in [start, stop) given the symbols from
     * start up to it.
     */
    public double[] predictSequence(int start, int stop) {
        checkRange(start, stop);
        double[] probs = new double[stop - start];
        for (int i = start; i < stop; i++) {
            probs[i - start] = predictProbability(start, i, seq[i]);
        }
        return probs;
    }

    private void checkRange(int start, int end) {
        if (start < 0 || end < start || end > seq.length) {
            throw new ConfigurationException("Invalid range [" + start + ", " + end
                    + ") for a sequence of length " + seq.length);
        }
    }

    // ------------------------------------------------------------------------
    // likelihood and consistency
    // ------------------------------------------------------------------------
    /**
     * Seating counts of all nodes, grouped by depth.
     */
    public List<DepthStatistics> collectStatistics() {
        ArrayList<DepthStatistics> stats = new ArrayList<DepthStatistics>();
        for (int k = 0; k <= nodeManager.getMaxDepth(); k++) {
            stats.add(new DepthStatistics(k));
        }
        for (ContextNode node : nodeManager.getNodesDFS()) {
            stats.get(node.getDepth()).addRestaurant(node.getRestaurant());
        }
        return stats;
    }

    /**
     * Log probability of the seating of all restaurants and of the root's
     * tables under the base measure. Representations that keep table sizes
     * contribute their arrangement, the others their counts with the sizes
     * summed out.
     */
    public double computeLogJoint() {
        double llh = 0.0;
        for (ContextNode node : nodeManager.getNodesDFS()) {
            AbstractRestaurant restaurant = node.getRestaurant();
            if (restaurant.isEmpty()) {
                continue;
            }
            int depth = node.getDepth();
            double d = params.getDiscount(depth);
            double a = params.getConcentration(depth);
            llh += StatisticsUtils.logKramp(a + d, d, restaurant.getTotalTables() - 1)
                    - StatisticsUtils.logKramp(a + 1, 1, restaurant.getTotalCustomers() - 1);
            for (int dish : restaurant.getDishes()) {
                llh += restaurant.computeLogDishLikelihood(dish, d);
                if (node.isRoot()) {
                    llh += restaurant.getTableCount(dish) * Math.log(baseDistribution[dish]);
                }
            }
        }
        return llh;
    }

    @Override
    public double getLogLikelihood() {
        return computeLogJoint();
    }

    /**
     * Check every restaurant, the tree structure, and that each restaurant
     * has as many customers of a dish as its children have tables for it plus
     * the seated positions whose context ends there.
     */
    public void checkConsistency() {
        validate("Consistency check");
    }

    @Override
    public void validate(String msg) {
        validate(nodeManager, seatedFrom, msg);
    }

    private void validate(NodeManager manager, int[] seated, String msg) {
        manager.validate(msg);
        TIntObjectHashMap<SparseCount> direct = new TIntObjectHashMap<SparseCount>();
        for (int i = 0; i < seq.length; i++) {
            if (seated[i] == UNSEATED) {
                continue;
            }
            ContextNode leaf = manager.getNode(seq, seated[i], i);
            if (leaf == null) {
                throw new StructuralInconsistencyException(msg
                        + ". Missing context node for seated position " + i);
            }
            SparseCount counts = direct.get(leaf.getId());
            if (counts == null) {
                counts = new SparseCount();
                direct.put(leaf.getId(), counts);
            }
            counts.increment(seq[i]);
        }

        boolean exact = factory.getType() != RestaurantType.FRACTIONAL;
        for (ContextNode node : manager.getNodesDFS()) {
            AbstractRestaurant restaurant = node.getRestaurant();
            restaurant.validate(msg + ". Node " + node.getId());

            SparseCount counts = direct.get(node.getId());
            TIntObjectHashMap<double[]> expected = new TIntObjectHashMap<double[]>();
            if (counts != null) {
                for (int dish : counts.getIndices()) {
                    expected.put(dish, new double[]{counts.getCount(dish)});
                }
            }
            for (ContextNode child : manager.getChildren(node)) {
                AbstractRestaurant childRestaurant = child.getRestaurant();
                for (int dish : childRestaurant.getDishes()) {
                    double[] e = expected.get(dish);
                    if (e == null) {
                        e = new double[1];
                        expected.put(dish, e);
                    }
                    e[0] += childRestaurant.getTableWeight(dish);
                }
            }

            for (int dish : restaurant.getDishes()) {
                if (!expected.containsKey(dish)) {
                    expected.put(dish, new double[1]);
                }
            }
            for (int dish : expected.keys()) {
                double actual = restaurant.getCustomerWeight(dish);
                double e = expected.get(dish)[0];
                if (exact) {
                    if ((int) actual != (int) Math.round(e)) {
                        throw new MismatchRuntimeException(msg + ". Customers of dish "
                                + dish + " at node " + node.getId(),
                                (int) Math.round(e), (int) actual);
                    }
                } else if (Math.abs(actual - e) > PROB_TOLERANCE * Math.max(1.0, e)) {
                    throw new StructuralInconsistencyException(msg + ". Customers of dish "
                            + dish + " at node " + node.getId() + ": " + actual
                            + " vs. expected " + e);
                }
            }
        }
    }

    // ------------------------------------------------------------------------
    // persistence
    // ------------------------------------------------------------------------
    @Override
    public void outputState(String filepath) throws IOException {
        if (verbose) {
            logln("--- Outputing current state to " + filepath);
        }
        new HPYPSerializer(new File(filepath)).saveNodesAndPayloads(nodeManager, factory, params);
    }

    /**
     * Replace the seating with a saved one. Every position of the sequence is
     * then taken to be seated with its full context, which the saved tree
     * must agree with; otherwise the current seating is kept and a
     * SerializationException is thrown.
     */
    @Override
    public void inputState(String filepath) throws IOException {
        if (verbose) {
            logln("--- Reading state from " + filepath);
        }
        NodeManager staged = new NodeManager(factory, nodeManager.getMaxDepth());
        HPYPParameters stagedParams = new HPYPParameters();
        new HPYPSerializer(new File(filepath)).loadNodesAndPayloads(staged, factory, stagedParams);

        int[] stagedSeatedFrom = new int[seq.length]; // all seated from 0
        try {
            validate(staged, stagedSeatedFrom, "Reading state from " + filepath);
        } catch (StructuralInconsistencyException e) {
            throw new SerializationException("Saved state in " + filepath
                    + " does not match the sequence. " + e.getMessage(), e);
        }

        nodeManager.adopt(staged);
        params.copyFrom(stagedParams);
        this.seatedFrom = stagedSeatedFrom;
        this.numSeated = seq.length;
        this.state = ModelState.READY;
    }

    @Override
    public String getCurrentState() {
        return "Iter " + iter + ". # nodes = " + nodeManager.getNumNodes()
                + ". # seated = " + numSeated + ". state = " + state;
    }

    /**
     * One line per node in pre-order, indented by depth, with the node's
     * context (most recent symbol first) and its seating.
     */
    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        for (ContextNode node : nodeManager.getNodesDFS()) {
            for (int k = 0; k < node.getDepth(); k++) {
                str.append("  ");
            }
            List<ContextNode> path = nodeManager.getPathToRoot(node);
            int[] context = new int[path.size() - 1];
            for (int i = 1; i < path.size(); i++) {
                context[i - 1] = path.get(i).getKey();
            }
            str.append(MiscUtils.arrayToString(context))
                    .append(" ").append(node.getRestaurant().toString())
                    .append("\n");
        }
        return str.toString();
    }
}
