package dao.b52.bridge.exception;

public class InvalidAddressException extends BridgeException {

    public InvalidAddressException(String message) {
        super("invalid_address", message);
    }
}
