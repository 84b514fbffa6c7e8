package dao.b52.bridge.exception;

public class InsufficientFundsException extends BridgeException {

    public InsufficientFundsException(String message) {
        super("insufficient_funds", message);
    }
}
