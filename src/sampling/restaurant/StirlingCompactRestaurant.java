package sampling.restaurant;

import sampling.util.StirlingTable;
import util.SamplerUtils;

/**
 * Compact seating that removes customers without instantiating tables. The
 * departing customer sat alone with probability S_d(c_w - 1, t_w - 1) /
 * S_d(c_w, t_w), in which case its table closes.
 */
public class StirlingCompactRestaurant extends AbstractCompactRestaurant {

    @Override
    public RestaurantType getType() {
        return RestaurantType.STIRLING_COMPACT;
    }

    @Override
    public double removeCustomer(int dish, double discount, double fraction) {
        checkRemovable(dish);
        int cw = this.customers.getCount(dish);
        int tw = this.tables.getCount(dish);
        boolean closeTable;
        if (tw == cw) {
            closeTable = true;
        } else if (tw == 1) {
            closeTable = false;
        } else {
            double prob = Math.exp(StirlingTable.getShared(discount).getLogNewTableRatio(cw, tw));
            closeTable = SamplerUtils.flip(rand, prob);
        }
        return takeCustomer(dish, closeTable);
    }
}
