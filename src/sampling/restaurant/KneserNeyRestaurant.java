package sampling.restaurant;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import sampling.util.SparseCount;
import util.StatisticsUtils;
import util.StructuralInconsistencyException;

/**
 * Interpolated Kneser-Ney: every dish present in the restaurant sits at
 * exactly one table. A customer opens a table (and is passed on to the parent)
 * only when it is the first of its dish, and the table closes when the last
 * one leaves. No randomness is involved.
 */
public class KneserNeyRestaurant extends AbstractRestaurant {

    private SparseCount customers;

    public KneserNeyRestaurant() {
        this.customers = new SparseCount();
    }

    @Override
    public RestaurantType getType() {
        return RestaurantType.KNESER_NEY;
    }

    @Override
    public int getCustomerCount(int dish) {
        return this.customers.getCount(dish);
    }

    @Override
    public int getTableCount(int dish) {
        return this.customers.containsIndex(dish) ? 1 : 0;
    }

    @Override
    public int getTotalCustomers() {
        return this.customers.getCountSum();
    }

    @Override
    public int getTotalTables() {
        return this.customers.size();
    }

    @Override
    public int[] getDishes() {
        return this.customers.getIndices();
    }

    @Override
    public double addCustomer(int dish, double parentProbability,
            double discount, double concentration, double fraction) {
        checkDish(dish);
        boolean newTable = !this.customers.containsIndex(dish);
        this.customers.increment(dish);
        return newTable ? 1.0 : 0.0;
    }

    /**
     * log S_d(c_w, 1) = log (1 - d)(2 - d)...(c_w - 1 - d).
     */
    @Override
    public double computeLogDishLikelihood(int dish, double discount) {
        int cw = this.customers.getCount(dish);
        return cw == 0 ? 0.0 : StatisticsUtils.logKramp(1 - discount, 1, cw - 1);
    }

    @Override
    public double removeCustomer(int dish, double discount, double fraction) {
        if (!this.customers.containsIndex(dish)) {
            throw new StructuralInconsistencyException("Removing customer of dish "
                    + dish + " from a restaurant without such customers");
        }
        this.customers.decrement(dish);
        return this.customers.containsIndex(dish) ? 0.0 : 1.0;
    }

    @Override
    public void encode(DataOutputStream out) throws IOException {
        SparseCount.output(customers, out);
    }

    @Override
    public void decode(DataInputStream in) throws IOException {
        this.customers = SparseCount.input(in);
    }

    @Override
    public void validate(String msg) {
        this.customers.validate(msg);
    }

    @Override
    public String toString() {
        return "[c = " + getTotalCustomers() + ", t = " + getTotalTables() + "] "
                + customers.toString();
    }
}
