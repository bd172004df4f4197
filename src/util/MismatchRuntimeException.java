package util;

/**
 * Count mismatch between two quantities that must agree.
 */
public class MismatchRuntimeException extends StructuralInconsistencyException {

    private static final long serialVersionUID = 1123581321L;

    public MismatchRuntimeException(int observed, int expected) {
        super("Mismatch. " + observed + " vs. " + expected);
    }

    public MismatchRuntimeException(String msg, int observed, int expected) {
        super(msg + ". Mismatch. " + observed + " vs. " + expected);
    }
}
