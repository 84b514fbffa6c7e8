package dao.b52.bridge.exception;

public class WithdrawalNotFoundException extends BridgeException {

    public WithdrawalNotFoundException(String message) {
        super("withdrawal_not_found", message);
    }
}
