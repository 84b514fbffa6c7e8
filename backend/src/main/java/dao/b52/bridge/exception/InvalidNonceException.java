package dao.b52.bridge.exception;

public class InvalidNonceException extends BridgeException {

    public InvalidNonceException(String message) {
        super("invalid_nonce", message);
    }
}
