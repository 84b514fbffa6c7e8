package dao.b52.bridge.exception;

import lombok.Getter;

/**
 * Rejection of an entry-point call. Thrown before or during a transaction; the host chain reverts any
 * state the transaction touched.
 */
@Getter
public class BridgeException extends RuntimeException {

    private final String code;

    public BridgeException(String code, String message) {
        super(message);
        this.code = code;
    }
}
