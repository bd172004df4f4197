package util;

/**
 * A probability came out as NaN, infinite or non-positive where a proper
 * probability was required.
 */
public class NumericException extends ArithmeticException {

    private static final long serialVersionUID = 1123581321L;

    public NumericException(String msg) {
        super(msg);
    }
}
