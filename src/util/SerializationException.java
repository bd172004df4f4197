package util;

import java.io.IOException;

/**
 * A saved model could not be read back: the file is truncated or corrupt, or
 * it was written by a different restaurant variant than the one configured.
 * The in-memory model is left untouched when this is thrown.
 */
public class SerializationException extends IOException {

    private static final long serialVersionUID = 1123581321L;

    public SerializationException(String msg) {
        super(msg);
    }

    public SerializationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
