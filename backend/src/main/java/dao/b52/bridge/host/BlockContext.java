package dao.b52.bridge.host;

import dao.b52.bridge.model.BridgeEvent;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution context of one block hook or transaction. Height and time come from the host block header, so
 * every validator sees the same values. Events are buffered here and published only if the execution commits.
 */
@Getter
public class BlockContext {

    private final long height;
    /** Host block time, unix seconds. */
    private final long blockTime;
    private final List<BridgeEvent> events = new ArrayList<>();

    public BlockContext(long height, long blockTime) {
        this.height = height;
        this.blockTime = blockTime;
    }

    public static BlockContext of(long height, long blockTime) {
        return new BlockContext(height, blockTime);
    }

    /**
     * @param keyValues alternating attribute names and values
     */
    public void emit(String type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Event attributes must be key/value pairs");
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            attributes.put(String.valueOf(keyValues[i]), String.valueOf(keyValues[i + 1]));
        }
        events.add(new BridgeEvent(type, height, blockTime, Collections.unmodifiableMap(attributes)));
    }

    public List<BridgeEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<BridgeEvent> eventsOfType(String type) {
        return events.stream().filter(e -> e.type().equals(type)).toList();
    }

    void discardEvents() {
        events.clear();
    }

    void truncateEvents(int size) {
        while (events.size() > size) {
            events.remove(events.size() - 1);
        }
    }
}
