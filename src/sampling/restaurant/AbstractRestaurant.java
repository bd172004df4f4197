package sampling.restaurant;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Random;
import sampling.util.StirlingTable;
import util.SamplerUtils;

/**
 * Seating arrangement of one context node in the hierarchy. Customers are
 * observations, grouped into tables that each serve one dish (a symbol in
 * [0, numTypes)).
 * <p>
 * A restaurant never holds a reference to its parent. The model walks the
 * node path itself: it computes the probability of a dish from the base
 * measure down to the leaf, then adds (or removes) a customer at the leaf and
 * keeps going towards the root for as long as the restaurant reports that a
 * table was opened (or closed).
 */
public abstract class AbstractRestaurant {

    public static final long RANDOM_SEED = 1123581321L;
    protected static Random rand = new Random(RANDOM_SEED);

    public static void setSeed(long seed) {
        rand = new Random(seed);
    }

    public abstract RestaurantType getType();

    public abstract int getCustomerCount(int dish);

    public abstract int getTableCount(int dish);

    public abstract int getTotalCustomers();

    public abstract int getTotalTables();

    /**
     * Dishes with at least one customer, in ascending order.
     */
    public abstract int[] getDishes();

    /**
     * Seat a customer of the given dish.
     *
     * @param dish The dish
     * @param parentProbability Predictive probability of the dish under the
     * parent restaurant (or the base measure at the root)
     * @param discount Discount of this restaurant's depth
     * @param concentration Concentration of this restaurant's depth
     * @param fraction Weight of the incoming customer; 1 except for the
     * fractional representation
     * @return Amount of new table opened, which becomes a customer of the
     * parent. 0 stops the upward walk.
     */
    public abstract double addCustomer(int dish, double parentProbability,
            double discount, double concentration, double fraction);

    /**
     * Remove a customer of the given dish.
     *
     * @param dish The dish
     * @param discount Discount of this restaurant's depth
     * @param fraction Weight of the customer to remove
     * @return Amount of table closed, which must be removed from the parent. 0
     * stops the upward walk.
     */
    public abstract double removeCustomer(int dish, double discount, double fraction);

    public abstract void encode(DataOutputStream out) throws IOException;

    public abstract void decode(DataInputStream in) throws IOException;

    /**
     * Throws a StructuralInconsistencyException if the seating is not
     * consistent.
     */
    public abstract void validate(String msg);

    /**
     * Drop any table detail reconstructed on demand.
     */
    public void discardTransientState() {
    }

    /**
     * Drop the table detail reconstructed on demand for one dish.
     */
    public void discardTransientState(int dish) {
    }

    /**
     * Log weight of the seating of a dish's customers at its tables. With
     * only the counts kept this is log S_d(c_w, t_w), the table sizes summed
     * out.
     */
    public double computeLogDishLikelihood(int dish, double discount) {
        return StirlingTable.getShared(discount).getLog(getCustomerCount(dish),
                getTableCount(dish));
    }

    public boolean isEmpty() {
        return this.getTotalCustomers() == 0;
    }

    /**
     * Amount of customers of a dish. Equals the customer count except for
     * representations that store expected counts.
     */
    public double getCustomerWeight(int dish) {
        return getCustomerCount(dish);
    }

    public double getTableWeight(int dish) {
        return getTableCount(dish);
    }

    /**
     * Predictive probability of a dish given the parent's predictive
     * probability.
     */
    public double computeProbability(int dish, double parentProbability,
            double discount, double concentration) {
        return interpolate(getCustomerCount(dish), getTableCount(dish),
                getTotalCustomers(), getTotalTables(),
                parentProbability, discount, concentration);
    }

    protected static double interpolate(double cw, double tw, double c, double t,
            double parentProbability, double discount, double concentration) {
        if (c <= 0) {
            return parentProbability;
        }
        double denom = c + concentration;
        double own = Math.max(0.0, cw - discount * tw);
        return (own + (concentration + discount * t) * parentProbability) / denom;
    }

    /**
     * Decide between joining an existing table of the dish and opening a new
     * one.
     *
     * @param joinWeight Total weight of the existing tables, c_w - d t_w
     * @param newWeight Weight of a new table, (a + d t) p
     */
    protected static boolean sampleNewTable(double joinWeight, double newWeight) {
        if (joinWeight <= 0) {
            return true;
        }
        if (newWeight <= 0) {
            return false;
        }
        return SamplerUtils.flip(rand, newWeight / (joinWeight + newWeight));
    }

    protected static void checkDish(int dish) {
        if (dish < 0) {
            throw new IllegalArgumentException("Negative dish " + dish);
        }
    }
}
