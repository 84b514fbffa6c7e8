package dao.b52.bridge.exception;

public class DepositNotFoundException extends BridgeException {

    public DepositNotFoundException(String message) {
        super("deposit_not_found", message);
    }
}
