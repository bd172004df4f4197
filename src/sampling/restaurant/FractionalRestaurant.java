package sampling.restaurant;

import gnu.trove.map.hash.TIntDoubleHashMap;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import util.MiscUtils;
import util.StructuralInconsistencyException;

/**
 * Mean-field seating: the restaurant stores the expected number of customers
 * and tables per dish instead of a sampled arrangement.
 * <p>
 * A customer of weight f arriving for dish w opens f * pi new tables, where
 * pi = (a + d t) p / ((c_w - d t_w) + (a + d t) p) is the probability that a
 * sampled seating would have opened a table. The same amount is passed on to
 * the parent as a fractional customer. Removing f customers removes the
 * proportional share f * t_w / c_w of the tables, which keeps the
 * tables-per-customer ratio of the dish unchanged.
 */
public class FractionalRestaurant extends AbstractRestaurant {

    public static final double EPS = 1e-10;
    private TIntDoubleHashMap customers;
    private TIntDoubleHashMap tables;
    private double totalCustomers;
    private double totalTables;

    public FractionalRestaurant() {
        this.customers = new TIntDoubleHashMap();
        this.tables = new TIntDoubleHashMap();
        this.totalCustomers = 0.0;
        this.totalTables = 0.0;
    }

    @Override
    public RestaurantType getType() {
        return RestaurantType.FRACTIONAL;
    }

    @Override
    public double getCustomerWeight(int dish) {
        return this.customers.get(dish);
    }

    @Override
    public double getTableWeight(int dish) {
        return this.tables.get(dish);
    }

    public double getExpectedTotalCustomers() {
        return this.totalCustomers;
    }

    public double getExpectedTotalTables() {
        return this.totalTables;
    }

    /**
     * Expected customer count rounded to the nearest integer, at least 1 for
     * dishes that are present.
     */
    @Override
    public int getCustomerCount(int dish) {
        double cw = this.customers.get(dish);
        if (cw <= 0) {
            return 0;
        }
        return Math.max(1, (int) Math.round(cw));
    }

    /**
     * Expected table count rounded to the nearest integer and clamped to
     * [1, getCustomerCount(dish)] for dishes that are present.
     */
    @Override
    public int getTableCount(int dish) {
        int cw = getCustomerCount(dish);
        if (cw == 0) {
            return 0;
        }
        int tw = (int) Math.round(this.tables.get(dish));
        return Math.min(cw, Math.max(1, tw));
    }

    @Override
    public int getTotalCustomers() {
        int sum = 0;
        for (int dish : this.customers.keys()) {
            sum += getCustomerCount(dish);
        }
        return sum;
    }

    @Override
    public int getTotalTables() {
        int sum = 0;
        for (int dish : this.customers.keys()) {
            sum += getTableCount(dish);
        }
        return sum;
    }

    @Override
    public int[] getDishes() {
        int[] dishes = this.customers.keys();
        Arrays.sort(dishes);
        return dishes;
    }

    @Override
    public boolean isEmpty() {
        return this.customers.isEmpty();
    }

    @Override
    public double computeProbability(int dish, double parentProbability,
            double discount, double concentration) {
        return interpolate(customers.get(dish), tables.get(dish),
                totalCustomers, totalTables,
                parentProbability, discount, concentration);
    }

    @Override
    public double addCustomer(int dish, double parentProbability,
            double discount, double concentration, double fraction) {
        checkDish(dish);
        if (!(fraction > 0)) {
            throw new IllegalArgumentException("Invalid customer weight " + fraction);
        }
        double cw = this.customers.get(dish);
        double tw = this.tables.get(dish);
        double joinWeight = Math.max(0.0, cw - discount * tw);
        double newWeight = Math.max(0.0,
                (concentration + discount * totalTables) * parentProbability);

        double pi;
        if (cw <= 0 || joinWeight + newWeight <= 0) {
            pi = 1.0;
        } else {
            pi = newWeight / (joinWeight + newWeight);
        }
        double newTables = fraction * pi;

        this.customers.put(dish, cw + fraction);
        this.tables.put(dish, tw + newTables);
        this.totalCustomers += fraction;
        this.totalTables += newTables;
        return newTables;
    }

    @Override
    public double removeCustomer(int dish, double discount, double fraction) {
        double cw = this.customers.get(dish);
        if (cw <= 0) {
            throw new StructuralInconsistencyException("Removing customer of dish "
                    + dish + " from a restaurant without such customers");
        }
        double tw = this.tables.get(dish);
        double removed = Math.min(fraction, cw);
        double removedTables;
        if (cw - removed < EPS) {
            removedTables = tw;
            this.customers.remove(dish);
            this.tables.remove(dish);
            this.totalCustomers -= cw;
        } else {
            removedTables = removed * tw / cw;
            this.customers.put(dish, cw - removed);
            this.tables.put(dish, tw - removedTables);
            this.totalCustomers -= removed;
        }
        this.totalTables -= removedTables;
        if (this.customers.isEmpty()) {
            // clear accumulated rounding error
            this.totalCustomers = 0.0;
            this.totalTables = 0.0;
        }
        return removedTables;
    }

    @Override
    public void encode(DataOutputStream out) throws IOException {
        int[] dishes = getDishes();
        out.writeInt(dishes.length);
        for (int dish : dishes) {
            out.writeInt(dish);
            out.writeDouble(this.customers.get(dish));
            out.writeDouble(this.tables.get(dish));
        }
        out.writeDouble(this.totalCustomers);
        out.writeDouble(this.totalTables);
    }

    @Override
    public void decode(DataInputStream in) throws IOException {
        this.customers.clear();
        this.tables.clear();
        int numDishes = in.readInt();
        if (numDishes < 0) {
            throw new IOException("Negative number of dishes " + numDishes);
        }
        for (int i = 0; i < numDishes; i++) {
            int dish = in.readInt();
            double cw = in.readDouble();
            double tw = in.readDouble();
            if (dish < 0 || !(cw > 0) || !(tw > 0) || tw > cw + EPS
                    || this.customers.containsKey(dish)) {
                throw new IOException("Invalid dish record " + dish + ": " + cw + ", " + tw);
            }
            this.customers.put(dish, cw);
            this.tables.put(dish, tw);
        }
        // totals are stored as accumulated so that predictions are reproduced exactly
        this.totalCustomers = in.readDouble();
        this.totalTables = in.readDouble();
    }

    @Override
    public void validate(String msg) {
        double customerSum = 0.0;
        double tableSum = 0.0;
        for (int dish : this.customers.keys()) {
            double cw = this.customers.get(dish);
            double tw = this.tables.get(dish);
            if (!(cw > 0) || !(tw > 0) || tw > cw + EPS) {
                throw new StructuralInconsistencyException(msg + ". Dish " + dish
                        + " has " + cw + " customers at " + tw + " tables");
            }
            customerSum += cw;
            tableSum += tw;
        }
        if (this.tables.size() != this.customers.size()) {
            throw new StructuralInconsistencyException(msg
                    + ". Dishes with tables but no customers");
        }
        double tol = 1e-6 * Math.max(1.0, customerSum);
        if (Math.abs(customerSum - totalCustomers) > tol
                || Math.abs(tableSum - totalTables) > tol) {
            throw new StructuralInconsistencyException(msg + ". Totals mismatch. "
                    + customerSum + " vs. " + totalCustomers + ", "
                    + tableSum + " vs. " + totalTables);
        }
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append("[c = ").append(MiscUtils.formatDouble(totalCustomers))
                .append(", t = ").append(MiscUtils.formatDouble(totalTables)).append("]");
        for (int dish : getDishes()) {
            str.append(" ").append(dish).append(":")
                    .append(MiscUtils.formatDouble(customers.get(dish))).append("/")
                    .append(MiscUtils.formatDouble(tables.get(dish)));
        }
        return str.toString();
    }
}
