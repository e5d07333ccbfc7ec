package org.collabstore.exceptions;

/**
 * Base unchecked exception of the collaborative store.
 * <p>
 * Raised when replicated state is found in a shape no operation can produce, for example metadata whose identifier
 * count does not match the length of the value it describes. These are invariant breaks, not recoverable conditions:
 * the replica holding the state must be discarded and rebuilt.
 * </p>
 *
 * @since 1.0
 */
public class CollabStoreException extends RuntimeException {

    public CollabStoreException(String msg) {
        super(msg);
    }

    public CollabStoreException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public static CollabStoreException invariant(String format, Object... args) {
        return new CollabStoreException("invariant violated: " + String.format(format, args));
    }
}
