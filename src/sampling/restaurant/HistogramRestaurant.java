package sampling.restaurant;

import gnu.trove.iterator.TIntIntIterator;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import sampling.util.SparseCount;
import util.MismatchRuntimeException;
import util.SamplerUtils;
import util.StatisticsUtils;
import util.StructuralInconsistencyException;

/**
 * Exact seating arrangement where tables of the same dish are grouped by
 * size: for every dish the restaurant keeps how many tables have 1, 2, 3, ...
 * customers. Frequent dishes with many equally sized tables take much less
 * memory than with {@link FullRestaurant}, and the seating distribution is
 * the same.
 */
public class HistogramRestaurant extends AbstractRestaurant {

    private TIntObjectHashMap<TIntIntHashMap> histograms; // dish -> (size -> # tables)
    private SparseCount customers;
    private SparseCount tableCounts;

    public HistogramRestaurant() {
        this.histograms = new TIntObjectHashMap<TIntIntHashMap>();
        this.customers = new SparseCount();
        this.tableCounts = new SparseCount();
    }

    @Override
    public RestaurantType getType() {
        return RestaurantType.HISTOGRAM;
    }

    @Override
    public int getCustomerCount(int dish) {
        return this.customers.getCount(dish);
    }

    @Override
    public int getTableCount(int dish) {
        return this.tableCounts.getCount(dish);
    }

    @Override
    public int getTotalCustomers() {
        return this.customers.getCountSum();
    }

    @Override
    public int getTotalTables() {
        return this.tableCounts.getCountSum();
    }

    @Override
    public int[] getDishes() {
        return this.customers.getIndices();
    }

    /**
     * Number of tables of the dish that seat exactly the given number of
     * customers.
     */
    public int getNumTablesOfSize(int dish, int size) {
        TIntIntHashMap histogram = this.histograms.get(dish);
        return histogram == null ? 0 : histogram.get(size);
    }

    @Override
    public double computeLogDishLikelihood(int dish, double discount) {
        TIntIntHashMap histogram = this.histograms.get(dish);
        double llh = 0.0;
        if (histogram != null) {
            TIntIntIterator it = histogram.iterator();
            while (it.hasNext()) {
                it.advance();
                llh += it.value() * StatisticsUtils.logKramp(1 - discount, 1, it.key() - 1);
            }
        }
        return llh;
    }

    @Override
    public double addCustomer(int dish, double parentProbability,
            double discount, double concentration, double fraction) {
        checkDish(dish);
        TIntIntHashMap histogram = this.histograms.get(dish);
        if (histogram == null) {
            histogram = new TIntIntHashMap();
            this.histograms.put(dish, histogram);
        }

        int[] sizes = histogram.keys();
        Arrays.sort(sizes);
        double[] weights = new double[sizes.length + 1];
        for (int i = 0; i < sizes.length; i++) {
            weights[i] = histogram.get(sizes[i]) * (sizes[i] - discount);
        }
        weights[sizes.length] = Math.max(0.0,
                (concentration + discount * getTotalTables()) * parentProbability);

        int sampled = sizes.length == 0 ? 0 : SamplerUtils.scaleSample(rand, weights);
        this.customers.increment(dish);
        if (sampled == sizes.length) {
            histogram.adjustOrPutValue(1, 1, 1);
            this.tableCounts.increment(dish);
            return 1.0;
        }
        moveTable(histogram, sizes[sampled], sizes[sampled] + 1);
        return 0.0;
    }

    @Override
    public double removeCustomer(int dish, double discount, double fraction) {
        TIntIntHashMap histogram = this.histograms.get(dish);
        if (histogram == null || this.customers.getCount(dish) == 0) {
            throw new StructuralInconsistencyException("Removing customer of dish "
                    + dish + " from a restaurant without such customers");
        }

        int[] sizes = histogram.keys();
        Arrays.sort(sizes);
        double[] weights = new double[sizes.length];
        for (int i = 0; i < sizes.length; i++) {
            weights[i] = (double) histogram.get(sizes[i]) * sizes[i];
        }
        int size = sizes[SamplerUtils.scaleSample(rand, weights)];

        this.customers.decrement(dish);
        moveTable(histogram, size, size - 1);
        if (size > 1) {
            return 0.0;
        }
        this.tableCounts.decrement(dish);
        if (histogram.isEmpty()) {
            this.histograms.remove(dish);
        }
        return 1.0;
    }

    /**
     * Move one table from one size class to another. Size 0 means the table
     * is closed.
     */
    private static void moveTable(TIntIntHashMap histogram, int from, int to) {
        int n = histogram.get(from);
        if (n == 1) {
            histogram.remove(from);
        } else {
            histogram.put(from, n - 1);
        }
        if (to > 0) {
            histogram.adjustOrPutValue(to, 1, 1);
        }
    }

    @Override
    public void encode(DataOutputStream out) throws IOException {
        int[] dishes = getDishes();
        out.writeInt(dishes.length);
        for (int dish : dishes) {
            TIntIntHashMap histogram = this.histograms.get(dish);
            int[] sizes = histogram.keys();
            Arrays.sort(sizes);
            out.writeInt(dish);
            out.writeInt(sizes.length);
            for (int size : sizes) {
                out.writeInt(size);
                out.writeInt(histogram.get(size));
            }
        }
    }

    @Override
    public void decode(DataInputStream in) throws IOException {
        this.histograms.clear();
        this.customers = new SparseCount();
        this.tableCounts = new SparseCount();

        int numDishes = in.readInt();
        if (numDishes < 0) {
            throw new IOException("Negative number of dishes " + numDishes);
        }
        for (int i = 0; i < numDishes; i++) {
            int dish = in.readInt();
            int numSizes = in.readInt();
            if (dish < 0 || numSizes <= 0 || this.histograms.containsKey(dish)) {
                throw new IOException("Invalid dish record " + dish);
            }
            TIntIntHashMap histogram = new TIntIntHashMap();
            for (int s = 0; s < numSizes; s++) {
                int size = in.readInt();
                int numTables = in.readInt();
                if (size <= 0 || numTables <= 0 || histogram.containsKey(size)) {
                    throw new IOException("Invalid size class " + size + ":" + numTables);
                }
                histogram.put(size, numTables);
                this.customers.changeCount(dish, size * numTables);
                this.tableCounts.changeCount(dish, numTables);
            }
            this.histograms.put(dish, histogram);
        }
    }

    @Override
    public void validate(String msg) {
        this.customers.validate(msg);
        this.tableCounts.validate(msg);
        for (int dish : this.histograms.keys()) {
            TIntIntHashMap histogram = this.histograms.get(dish);
            int customerSum = 0;
            int tableSum = 0;
            for (int size : histogram.keys()) {
                int numTables = histogram.get(size);
                if (size <= 0 || numTables <= 0) {
                    throw new StructuralInconsistencyException(msg
                            + ". Invalid size class for dish " + dish);
                }
                customerSum += size * numTables;
                tableSum += numTables;
            }
            if (customerSum != this.customers.getCount(dish)) {
                throw new MismatchRuntimeException(msg + ". Customers of dish " + dish,
                        customerSum, this.customers.getCount(dish));
            }
            if (tableSum != this.tableCounts.getCount(dish)) {
                throw new MismatchRuntimeException(msg + ". Tables of dish " + dish,
                        tableSum, this.tableCounts.getCount(dish));
            }
        }
        if (this.histograms.size() != this.customers.size()) {
            throw new MismatchRuntimeException(msg + ". Number of dishes",
                    this.histograms.size(), this.customers.size());
        }
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append("[c = ").append(getTotalCustomers())
                .append(", t = ").append(getTotalTables()).append("]");
        for (int dish : getDishes()) {
            TIntIntHashMap histogram = this.histograms.get(dish);
            int[] sizes = histogram.keys();
            Arrays.sort(sizes);
            str.append(" ").append(dish).append(":{");
            for (int i = 0; i < sizes.length; i++) {
                if (i > 0) {
                    str.append(", ");
                }
                str.append(sizes[i]).append("x").append(histogram.get(sizes[i]));
            }
            str.append("}");
        }
        return str.toString();
    }
}
