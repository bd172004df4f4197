package sampling.restaurant;

import gnu.trove.list.array.TIntArrayList;
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
 * Exact seating arrangement: the size of every table is stored.
 */
public class FullRestaurant extends AbstractRestaurant {

    private TIntObjectHashMap<TIntArrayList> tables; // dish -> table sizes
    private SparseCount customers;
    private int totalTables;

    public FullRestaurant() {
        this.tables = new TIntObjectHashMap<TIntArrayList>();
        this.customers = new SparseCount();
        this.totalTables = 0;
    }

    @Override
    public RestaurantType getType() {
        return RestaurantType.FULL;
    }

    @Override
    public int getCustomerCount(int dish) {
        return this.customers.getCount(dish);
    }

    @Override
    public int getTableCount(int dish) {
        TIntArrayList sizes = this.tables.get(dish);
        return sizes == null ? 0 : sizes.size();
    }

    @Override
    public int getTotalCustomers() {
        return this.customers.getCountSum();
    }

    @Override
    public int getTotalTables() {
        return this.totalTables;
    }

    @Override
    public int[] getDishes() {
        return this.customers.getIndices();
    }

    /**
     * Sizes of the tables serving a dish. The returned list must not be
     * modified.
     */
    public TIntArrayList getTableSizes(int dish) {
        TIntArrayList sizes = this.tables.get(dish);
        return sizes == null ? new TIntArrayList() : sizes;
    }

    /**
     * Log weight of the stored arrangement: a table of s customers
     * contributes (1 - d)(2 - d)...(s - 1 - d).
     */
    @Override
    public double computeLogDishLikelihood(int dish, double discount) {
        TIntArrayList sizes = this.tables.get(dish);
        double llh = 0.0;
        if (sizes != null) {
            for (int k = 0; k < sizes.size(); k++) {
                llh += StatisticsUtils.logKramp(1 - discount, 1, sizes.get(k) - 1);
            }
        }
        return llh;
    }

    @Override
    public double addCustomer(int dish, double parentProbability,
            double discount, double concentration, double fraction) {
        checkDish(dish);
        TIntArrayList sizes = this.tables.get(dish);
        if (sizes == null) {
            sizes = new TIntArrayList();
            this.tables.put(dish, sizes);
        }

        int numTables = sizes.size();
        double[] weights = new double[numTables + 1];
        for (int k = 0; k < numTables; k++) {
            weights[k] = sizes.get(k) - discount;
        }
        weights[numTables] = (concentration + discount * totalTables) * parentProbability;

        int sampledTable;
        if (numTables == 0) {
            sampledTable = 0;
        } else if (weights[numTables] <= 0) {
            weights[numTables] = 0.0;
            sampledTable = SamplerUtils.scaleSample(rand, weights);
        } else {
            sampledTable = SamplerUtils.scaleSample(rand, weights);
        }

        this.customers.increment(dish);
        if (sampledTable == numTables) {
            sizes.add(1);
            this.totalTables++;
            return 1.0;
        }
        sizes.set(sampledTable, sizes.get(sampledTable) + 1);
        return 0.0;
    }

    @Override
    public double removeCustomer(int dish, double discount, double fraction) {
        int cw = this.customers.getCount(dish);
        TIntArrayList sizes = this.tables.get(dish);
        if (cw == 0 || sizes == null) {
            throw new StructuralInconsistencyException("Removing customer of dish "
                    + dish + " from a restaurant without such customers");
        }

        // pick a customer uniformly at random
        int u = rand.nextInt(cw);
        int k = 0;
        while (u >= sizes.get(k)) {
            u -= sizes.get(k);
            k++;
        }

        this.customers.decrement(dish);
        int newSize = sizes.get(k) - 1;
        if (newSize > 0) {
            sizes.set(k, newSize);
            return 0.0;
        }
        sizes.removeAt(k);
        this.totalTables--;
        if (sizes.isEmpty()) {
            this.tables.remove(dish);
        }
        return 1.0;
    }

    @Override
    public void encode(DataOutputStream out) throws IOException {
        int[] dishes = getDishes();
        out.writeInt(dishes.length);
        for (int dish : dishes) {
            TIntArrayList sizes = this.tables.get(dish);
            out.writeInt(dish);
            out.writeInt(sizes.size());
            for (int k = 0; k < sizes.size(); k++) {
                out.writeInt(sizes.get(k));
            }
        }
    }

    @Override
    public void decode(DataInputStream in) throws IOException {
        this.tables.clear();
        this.customers = new SparseCount();
        this.totalTables = 0;

        int numDishes = in.readInt();
        if (numDishes < 0) {
            throw new IOException("Negative number of dishes " + numDishes);
        }
        for (int i = 0; i < numDishes; i++) {
            int dish = in.readInt();
            int numTables = in.readInt();
            if (dish < 0 || numTables <= 0 || this.tables.containsKey(dish)) {
                throw new IOException("Invalid dish record " + dish + " with "
                        + numTables + " tables");
            }
            TIntArrayList sizes = new TIntArrayList(numTables);
            for (int k = 0; k < numTables; k++) {
                int size = in.readInt();
                if (size <= 0) {
                    throw new IOException("Invalid table size " + size);
                }
                sizes.add(size);
                this.customers.changeCount(dish, size);
            }
            this.tables.put(dish, sizes);
            this.totalTables += numTables;
        }
    }

    @Override
    public void validate(String msg) {
        this.customers.validate(msg);
        int tableSum = 0;
        for (int dish : this.tables.keys()) {
            TIntArrayList sizes = this.tables.get(dish);
            if (sizes.isEmpty()) {
                throw new StructuralInconsistencyException(msg
                        + ". Empty table list for dish " + dish);
            }
            int sizeSum = 0;
            for (int k = 0; k < sizes.size(); k++) {
                if (sizes.get(k) <= 0) {
                    throw new StructuralInconsistencyException(msg
                            + ". Empty table for dish " + dish);
                }
                sizeSum += sizes.get(k);
            }
            if (sizeSum != this.customers.getCount(dish)) {
                throw new MismatchRuntimeException(msg + ". Dish " + dish,
                        sizeSum, this.customers.getCount(dish));
            }
            tableSum += sizes.size();
        }
        if (this.tables.size() != this.customers.size()) {
            throw new MismatchRuntimeException(msg + ". Number of dishes",
                    this.tables.size(), this.customers.size());
        }
        if (tableSum != this.totalTables) {
            throw new MismatchRuntimeException(msg + ". Total tables",
                    tableSum, this.totalTables);
        }
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append("[c = ").append(getTotalCustomers())
                .append(", t = ").append(totalTables).append("]");
        for (int dish : getDishes()) {
            int[] sizes = this.tables.get(dish).toArray();
            Arrays.sort(sizes);
            str.append(" ").append(dish).append(":").append(Arrays.toString(sizes));
        }
        return str.toString();
    }
}
