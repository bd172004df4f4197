package util;

/**
 * Signals a violated seating or tree invariant, or a request that cannot be
 * carried out on the current seating, such as removing a customer of a dish
 * the restaurant does not serve.
 */
public class StructuralInconsistencyException extends RuntimeException {

    private static final long serialVersionUID = 1123581321L;

    public StructuralInconsistencyException(String msg) {
        super(msg);
    }
}
