package dao.b52.bridge.exception;

public class InvalidAmountException extends BridgeException {

    public InvalidAmountException(String message) {
        super("invalid_amount", message);
    }
}
