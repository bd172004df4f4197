package sampler;

import gnu.trove.iterator.TLongIntIterator;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TLongIntHashMap;
import sampling.restaurant.AbstractRestaurant;
import sampling.util.StirlingTable;
import util.StatisticsUtils;

/**
 * Seating counts of all restaurants at one depth, which is everything the
 * collapsed likelihood of that depth's discount and concentration depends on.
 */
public class DepthStatistics {

    private final int depth;
    private TIntArrayList nodeCustomers;
    private TIntArrayList nodeTables;
    private TLongIntHashMap dishCounts; // (c_w, t_w) -> number of occurrences
    private int maxDishCustomers;

    public DepthStatistics(int depth) {
        this.depth = depth;
        this.nodeCustomers = new TIntArrayList();
        this.nodeTables = new TIntArrayList();
        this.dishCounts = new TLongIntHashMap();
        this.maxDishCustomers = 0;
    }

    public int getDepth() {
        return this.depth;
    }

    public int getNumNodes() {
        return this.nodeCustomers.size();
    }

    public boolean isEmpty() {
        return this.nodeCustomers.isEmpty();
    }

    public int getMaxDishCustomers() {
        return this.maxDishCustomers;
    }

    /**
     * Number of dishes seen with exactly c_w customers at t_w tables.
     */
    public int getDishCount(int cw, int tw) {
        return this.dishCounts.get(pairKey(cw, tw));
    }

    public void addRestaurant(AbstractRestaurant restaurant) {
        if (restaurant.isEmpty()) {
            return;
        }
        int[] dishes = restaurant.getDishes();
        int customers = 0;
        int tables = 0;
        for (int dish : dishes) {
            int cw = restaurant.getCustomerCount(dish);
            int tw = restaurant.getTableCount(dish);
            addDish(cw, tw);
            customers += cw;
            tables += tw;
        }
        addNode(customers, tables);
    }

    public void addNode(int customers, int tables) {
        this.nodeCustomers.add(customers);
        this.nodeTables.add(tables);
    }

    public void addDish(int cw, int tw) {
        this.dishCounts.adjustOrPutValue(pairKey(cw, tw), 1, 1);
        this.maxDishCustomers = Math.max(this.maxDishCustomers, cw);
    }

    private static long pairKey(int cw, int tw) {
        return ((long) cw << 32) | (tw & 0xffffffffL);
    }

    /**
     * Terms that depend on both discount and concentration:
     * sum over nodes of log (a + d)_{t - 1, d} - log (a + 1)_{c - 1, 1}.
     */
    public double getLogNodeLikelihood(double discount, double concentration) {
        double llh = 0.0;
        for (int i = 0; i < nodeCustomers.size(); i++) {
            llh += StatisticsUtils.logKramp(concentration + discount, discount,
                    nodeTables.get(i) - 1);
            llh -= StatisticsUtils.logKramp(concentration + 1, 1, nodeCustomers.get(i) - 1);
        }
        return llh;
    }

    /**
     * Terms that depend on the discount only: sum over dishes of log
     * S_d(c_w, t_w).
     */
    public double getLogSeatingLikelihood(double discount) {
        if (dishCounts.isEmpty()) {
            return 0.0;
        }
        // trial discounts stay out of the shared cache, and rows are not kept
        StirlingTable stirling = new StirlingTable(discount, 2);
        int[] cws = new int[dishCounts.size()];
        int[] tws = new int[dishCounts.size()];
        int[] occurrences = new int[dishCounts.size()];
        int i = 0;
        TLongIntIterator it = dishCounts.iterator();
        while (it.hasNext()) {
            it.advance();
            cws[i] = (int) (it.key() >>> 32);
            tws[i] = (int) it.key();
            occurrences[i] = it.value();
            i++;
        }
        double[] logStirling = stirling.getLogValues(cws, tws);
        double llh = 0.0;
        for (i = 0; i < logStirling.length; i++) {
            llh += occurrences[i] * logStirling[i];
        }
        return llh;
    }

    public double getLogLikelihood(double discount, double concentration) {
        return getLogNodeLikelihood(discount, concentration)
                + getLogSeatingLikelihood(discount);
    }
}
