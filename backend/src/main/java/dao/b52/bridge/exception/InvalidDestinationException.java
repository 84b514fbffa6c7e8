package dao.b52.bridge.exception;

public class InvalidDestinationException extends BridgeException {

    public InvalidDestinationException(String message) {
        super("invalid_destination", message);
    }
}
