package dao.b52.bridge.exception;

public class InvalidSignerKeyException extends BridgeException {

    public InvalidSignerKeyException(String message) {
        super("invalid_signer_key", message);
    }
}
