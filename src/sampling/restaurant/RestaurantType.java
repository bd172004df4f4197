package sampling.restaurant;

/**
 * The available seating representations. The tag identifies the variant in
 * saved model files.
 */
public enum RestaurantType {

    FULL((byte) 1) {
        @Override
        AbstractRestaurant newRestaurant() {
            return new FullRestaurant();
        }
    },
    FRACTIONAL((byte) 2) {
        @Override
        AbstractRestaurant newRestaurant() {
            return new FractionalRestaurant();
        }
    },
    HISTOGRAM((byte) 3) {
        @Override
        AbstractRestaurant newRestaurant() {
            return new HistogramRestaurant();
        }
    },
    KNESER_NEY((byte) 4) {
        @Override
        AbstractRestaurant newRestaurant() {
            return new KneserNeyRestaurant();
        }
    },
    REINSTANTIATING_COMPACT((byte) 5) {
        @Override
        AbstractRestaurant newRestaurant() {
            return new ReinstantiatingCompactRestaurant();
        }
    },
    STIRLING_COMPACT((byte) 6) {
        @Override
        AbstractRestaurant newRestaurant() {
            return new StirlingCompactRestaurant();
        }
    };
    private final byte tag;

    RestaurantType(byte tag) {
        this.tag = tag;
    }

    public byte getTag() {
        return this.tag;
    }

    abstract AbstractRestaurant newRestaurant();

    /**
     * @return The type with the given tag, or null if there is none
     */
    public static RestaurantType fromTag(byte tag) {
        for (RestaurantType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        return null;
    }
}
