package sampling.restaurant;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import sampling.util.SparseCount;
import util.MismatchRuntimeException;
import util.StructuralInconsistencyException;

/**
 * Seating stored only as per-dish customer and table counts (c_w, t_w). Table
 * sizes are integrated out, so adding a customer only needs the counts. The
 * two subclasses differ in how they remove customers.
 * <p>
 * Because the counts are all that is stored, the table counts of a compact
 * hierarchy can also be resampled directly, node by node.
 */
public abstract class AbstractCompactRestaurant extends AbstractRestaurant {

    protected SparseCount customers;
    protected SparseCount tables;

    public AbstractCompactRestaurant() {
        this.customers = new SparseCount();
        this.tables = new SparseCount();
    }

    @Override
    public int getCustomerCount(int dish) {
        return this.customers.getCount(dish);
    }

    @Override
    public int getTableCount(int dish) {
        return this.tables.getCount(dish);
    }

    @Override
    public int getTotalCustomers() {
        return this.customers.getCountSum();
    }

    @Override
    public int getTotalTables() {
        return this.tables.getCountSum();
    }

    @Override
    public int[] getDishes() {
        return this.customers.getIndices();
    }

    /**
     * Set the number of tables of a dish, keeping its customers. Used when
     * table counts are resampled directly.
     */
    public void setTableCount(int dish, int numTables) {
        int cw = this.customers.getCount(dish);
        if (numTables < 0 || numTables > cw || (cw > 0 && numTables == 0)) {
            throw new StructuralInconsistencyException("Cannot seat " + cw
                    + " customers of dish " + dish + " at " + numTables + " tables");
        }
        this.tables.setCount(dish, numTables);
        discardTransientState();
    }

    /**
     * Set the number of customers of a dish, keeping its tables. Used when the
     * table count of a child restaurant changes during direct resampling.
     */
    public void setCustomerCount(int dish, int numCustomers) {
        int tw = this.tables.getCount(dish);
        if (numCustomers < tw || (numCustomers > 0 && tw == 0)) {
            throw new StructuralInconsistencyException("Cannot seat " + numCustomers
                    + " customers of dish " + dish + " at " + tw + " tables");
        }
        this.customers.setCount(dish, numCustomers);
        discardTransientState();
    }

    @Override
    public double addCustomer(int dish, double parentProbability,
            double discount, double concentration, double fraction) {
        checkDish(dish);
        int cw = this.customers.getCount(dish);
        int tw = this.tables.getCount(dish);
        double joinWeight = cw - discount * tw;
        double newWeight = (concentration + discount * getTotalTables()) * parentProbability;
        boolean newTable = cw == 0 || sampleNewTable(joinWeight, newWeight);
        onAdd(dish, newTable);
        this.customers.increment(dish);
        if (newTable) {
            this.tables.increment(dish);
            return 1.0;
        }
        return 0.0;
    }

    /**
     * Called before the counts are updated for an arriving customer.
     */
    protected void onAdd(int dish, boolean newTable) {
    }

    protected void checkRemovable(int dish) {
        if (!this.customers.containsIndex(dish)) {
            throw new StructuralInconsistencyException("Removing customer of dish "
                    + dish + " from a restaurant without such customers");
        }
    }

    /**
     * Take one customer of the dish away, and one table as well if requested.
     *
     * @return 1 if a table was closed, 0 otherwise
     */
    protected double takeCustomer(int dish, boolean closeTable) {
        this.customers.decrement(dish);
        if (closeTable) {
            this.tables.decrement(dish);
            return 1.0;
        }
        return 0.0;
    }

    @Override
    public void encode(DataOutputStream out) throws IOException {
        int[] dishes = getDishes();
        out.writeInt(dishes.length);
        for (int dish : dishes) {
            out.writeInt(dish);
            out.writeInt(this.customers.getCount(dish));
            out.writeInt(this.tables.getCount(dish));
        }
    }

    @Override
    public void decode(DataInputStream in) throws IOException {
        this.customers = new SparseCount();
        this.tables = new SparseCount();
        discardTransientState();

        int numDishes = in.readInt();
        if (numDishes < 0) {
            throw new IOException("Negative number of dishes " + numDishes);
        }
        for (int i = 0; i < numDishes; i++) {
            int dish = in.readInt();
            int cw = in.readInt();
            int tw = in.readInt();
            if (dish < 0 || tw <= 0 || cw < tw || this.customers.containsIndex(dish)) {
                throw new IOException("Invalid dish record " + dish + ": "
                        + cw + " customers at " + tw + " tables");
            }
            this.customers.setCount(dish, cw);
            this.tables.setCount(dish, tw);
        }
    }

    @Override
    public void validate(String msg) {
        this.customers.validate(msg);
        this.tables.validate(msg);
        if (this.customers.size() != this.tables.size()) {
            throw new MismatchRuntimeException(msg + ". Number of dishes",
                    this.customers.size(), this.tables.size());
        }
        for (int dish : this.customers.getIndices()) {
            int cw = this.customers.getCount(dish);
            int tw = this.tables.getCount(dish);
            if (tw <= 0 || tw > cw) {
                throw new StructuralInconsistencyException(msg + ". Dish " + dish
                        + " has " + cw + " customers at " + tw + " tables");
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append("[c = ").append(getTotalCustomers())
                .append(", t = ").append(getTotalTables()).append("]");
        for (int dish : getDishes()) {
            str.append(" ").append(dish).append(":")
                    .append(customers.getCount(dish)).append("/")
                    .append(tables.getCount(dish));
        }
        return str.toString();
    }
}
