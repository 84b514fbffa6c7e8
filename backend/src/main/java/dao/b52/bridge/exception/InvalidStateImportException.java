package dao.b52.bridge.exception;

public class InvalidStateImportException extends BridgeException {

    public InvalidStateImportException(String message) {
        super("invalid_state_import", message);
    }
}
