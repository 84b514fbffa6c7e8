package dao.b52.bridge.exception;

public class InvalidIndexException extends BridgeException {

    public InvalidIndexException(String message) {
        super("invalid_index", message);
    }
}
