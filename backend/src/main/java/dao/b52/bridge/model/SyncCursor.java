package dao.b52.bridge.model;

/**
 * Progress of the deposit ingestion engine.
 *
 * Only the engine writes it, once per handled index. Every write bumps the version.
 */
public record SyncCursor(
        long lastProcessedIndex,
        long lastExternalHeight,
        long version
) {

    public static final SyncCursor INITIAL = new SyncCursor(0L, 0L, 0L);

    public long nextIndex() {
        return lastProcessedIndex + 1;
    }

    public SyncCursor advance(long index, long externalHeight) {
        if (index < lastProcessedIndex) {
            throw new IllegalArgumentException("Cursor cannot move back: " + lastProcessedIndex + " -> " + index);
        }
        long height = Math.max(lastExternalHeight, externalHeight);
        return new SyncCursor(index, height, version + 1);
    }

    public SyncCursor advanceIndex(long index) {
        if (index < lastProcessedIndex) {
            throw new IllegalArgumentException("Cursor cannot move back: " + lastProcessedIndex + " -> " + index);
        }
        return new SyncCursor(index, lastExternalHeight, version + 1);
    }
}
