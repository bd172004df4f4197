package sampling.restaurant;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import sampling.util.ContextNode;
import util.ConfigurationException;
import util.SerializationException;

/**
 * Creates empty restaurants of one representation and converts them to and
 * from bytes. A hierarchy uses a single factory, so all of its restaurants
 * share the same representation.
 */
public class RestaurantFactory {

    private final RestaurantType type;

    public RestaurantFactory(RestaurantType type) {
        if (type == null) {
            throw new ConfigurationException("Restaurant type must be specified");
        }
        this.type = type;
    }

    public RestaurantType getType() {
        return this.type;
    }

    public AbstractRestaurant create() {
        return this.type.newRestaurant();
    }

    /**
     * Create the restaurant for a node. The representation does not depend on
     * the node; the node is accepted so that callers can attach restaurants
     * lazily.
     */
    public AbstractRestaurant create(ContextNode node) {
        return create();
    }

    public byte[] encode(AbstractRestaurant restaurant) throws SerializationException {
        if (restaurant.getType() != this.type) {
            throw new SerializationException("Cannot encode a " + restaurant.getType()
                    + " restaurant with a " + this.type + " factory");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            DataOutputStream out = new DataOutputStream(bytes);
            restaurant.encode(out);
            out.flush();
        } catch (IOException e) {
            throw new SerializationException("Error encoding restaurant", e);
        }
        return bytes.toByteArray();
    }

    public AbstractRestaurant decode(byte[] payload) throws SerializationException {
        AbstractRestaurant restaurant = create();
        DataInputStream in = new DataInputStream(new ByteArrayInputStream(payload));
        try {
            restaurant.decode(in);
            if (in.available() > 0) {
                throw new SerializationException("Trailing " + in.available()
                        + " bytes in " + this.type + " payload");
            }
        } catch (EOFException e) {
            throw new SerializationException("Truncated " + this.type + " payload", e);
        } catch (SerializationException e) {
            throw e;
        } catch (IOException e) {
            throw new SerializationException("Malformed " + this.type + " payload. "
                    + e.getMessage(), e);
        }
        return restaurant;
    }
}
