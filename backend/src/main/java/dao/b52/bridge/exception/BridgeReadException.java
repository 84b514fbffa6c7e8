package dao.b52.bridge.exception;

/**
 * Settlement chain could not be read (timeout, connection refused, RPC error).
 * Transient: callers on the block path log it and retry on a later block.
 */
public class BridgeReadException extends RuntimeException {

    public BridgeReadException(String message) {
        super(message);
    }

    public BridgeReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
