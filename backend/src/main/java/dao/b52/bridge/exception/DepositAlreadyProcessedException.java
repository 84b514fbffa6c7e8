package dao.b52.bridge.exception;

public class DepositAlreadyProcessedException extends BridgeException {

    public DepositAlreadyProcessedException(String message) {
        super("deposit_already_processed", message);
    }
}
