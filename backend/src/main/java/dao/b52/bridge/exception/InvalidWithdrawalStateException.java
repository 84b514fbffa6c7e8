package dao.b52.bridge.exception;

public class InvalidWithdrawalStateException extends BridgeException {

    public InvalidWithdrawalStateException(String message) {
        super("invalid_withdrawal_state", message);
    }
}
