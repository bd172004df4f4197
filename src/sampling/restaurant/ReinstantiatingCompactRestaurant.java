package sampling.restaurant;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntObjectHashMap;
import sampling.util.StirlingTable;
import util.MismatchRuntimeException;
import util.SamplerUtils;

/**
 * Compact seating that, to remove a customer, draws the table sizes of the
 * dish from their distribution given (c_w, t_w) and then removes a uniformly
 * chosen customer from them. The drawn sizes are kept and updated by later
 * arrivals and departures until they are discarded: by the caller once it is
 * done with the dish, or whenever the counts are changed from outside or the
 * discount changes.
 */
public class ReinstantiatingCompactRestaurant extends AbstractCompactRestaurant {

    private TIntObjectHashMap<TIntArrayList> instantiated;
    private double instantiatedDiscount;
    private double addDiscount;

    public ReinstantiatingCompactRestaurant() {
        super();
        this.instantiated = new TIntObjectHashMap<TIntArrayList>();
        this.instantiatedDiscount = Double.NaN;
        this.addDiscount = Double.NaN;
    }

    @Override
    public RestaurantType getType() {
        return RestaurantType.REINSTANTIATING_COMPACT;
    }

    @Override
    public void discardTransientState() {
        if (this.instantiated != null) {
            this.instantiated.clear();
        }
    }

    @Override
    public void discardTransientState(int dish) {
        this.instantiated.remove(dish);
    }

    /**
     * Number of dishes whose table sizes are currently instantiated.
     */
    public int getNumInstantiatedDishes() {
        return this.instantiated.size();
    }

    @Override
    public double addCustomer(int dish, double parentProbability,
            double discount, double concentration, double fraction) {
        this.addDiscount = discount;
        return super.addCustomer(dish, parentProbability, discount, concentration, fraction);
    }

    @Override
    protected void onAdd(int dish, boolean newTable) {
        if (this.addDiscount != this.instantiatedDiscount) {
            discardTransientState();
            return;
        }
        TIntArrayList sizes = this.instantiated.get(dish);
        if (sizes == null) {
            return;
        }
        if (newTable) {
            sizes.add(1);
            return;
        }
        double[] weights = new double[sizes.size()];
        for (int k = 0; k < sizes.size(); k++) {
            weights[k] = sizes.get(k) - instantiatedDiscount;
        }
        int k = SamplerUtils.scaleSample(rand, weights);
        sizes.set(k, sizes.get(k) + 1);
    }

    @Override
    public double removeCustomer(int dish, double discount, double fraction) {
        checkRemovable(dish);
        int cw = this.customers.getCount(dish);
        int tw = this.tables.getCount(dish);
        if (discount != this.instantiatedDiscount) {
            discardTransientState();
            this.instantiatedDiscount = discount;
        }
        TIntArrayList sizes = this.instantiated.get(dish);
        if (sizes == null) {
            sizes = StirlingTable.getShared(discount).sampleTableSizes(cw, tw, rand);
            this.instantiated.put(dish, sizes);
        }

        int u = rand.nextInt(cw);
        int k = 0;
        while (u >= sizes.get(k)) {
            u -= sizes.get(k);
            k++;
        }
        int newSize = sizes.get(k) - 1;
        boolean closeTable = newSize == 0;
        if (closeTable) {
            sizes.removeAt(k);
        } else {
            sizes.set(k, newSize);
        }
        if (cw == 1) {
            this.instantiated.remove(dish);
        }
        return takeCustomer(dish, closeTable);
    }

    @Override
    public void validate(String msg) {
        super.validate(msg);
        for (int dish : this.instantiated.keys()) {
            TIntArrayList sizes = this.instantiated.get(dish);
            if (sizes.size() != this.tables.getCount(dish)
                    || sizes.sum() != this.customers.getCount(dish)) {
                throw new MismatchRuntimeException(msg
                        + ". Instantiated tables of dish " + dish,
                        sizes.sum(), this.customers.getCount(dish));
            }
        }
    }
}
