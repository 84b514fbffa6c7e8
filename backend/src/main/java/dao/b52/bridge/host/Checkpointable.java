package dao.b52.bridge.host;

/**
 * State that the host chain can roll back when a transaction fails.
 */
public interface Checkpointable {

    /**
     * Capture the current state. Reverting the returned checkpoint restores it exactly.
     */
    Checkpoint checkpoint();

    @FunctionalInterface
    interface Checkpoint {
        void revert();
    }
}
