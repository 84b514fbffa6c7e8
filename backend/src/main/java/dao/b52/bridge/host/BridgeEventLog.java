package dao.b52.bridge.host;

import dao.b52.bridge.config.HostChainProperties;
import dao.b52.bridge.model.BridgeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded log of committed bridge events, newest last.
 */
@Slf4j
@Component
public class BridgeEventLog {

    private final int capacity;
    private final Deque<BridgeEvent> events = new ArrayDeque<>();

    public BridgeEventLog(HostChainProperties hostProps) {
        this.capacity = Math.max(1, hostProps.getEventLogCapacity());
    }

    public synchronized void publish(List<BridgeEvent> committed) {
        for (BridgeEvent event : committed) {
            log.info("event {} height={} {}", event.type(), event.blockHeight(), event.attributes());
            events.addLast(event);
            while (events.size() > capacity) {
                events.removeFirst();
            }
        }
    }

    public synchronized List<BridgeEvent> recent(int limit) {
        List<BridgeEvent> all = new ArrayList<>(events);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    public synchronized List<BridgeEvent> ofType(String type) {
        return events.stream().filter(e -> e.type().equals(type)).toList();
    }

    public synchronized int size() {
        return events.size();
    }
}
