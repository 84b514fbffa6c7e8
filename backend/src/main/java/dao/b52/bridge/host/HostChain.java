package dao.b52.bridge.host;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Stand-in for the replicated state machine: serializes every state mutation (transactions and end-block
 * hooks) behind one monitor, and gives transactions all-or-nothing semantics over the registered state.
 */
@Slf4j
@Component
public class HostChain {

    private final List<Checkpointable> state;
    private final List<EndBlocker> endBlockers;
    private final BridgeEventLog eventLog;

    private long height;
    private long blockTime;

    public HostChain(List<Checkpointable> state, List<EndBlocker> endBlockers, BridgeEventLog eventLog) {
        this.state = new ArrayList<>(state);
        this.endBlockers = new ArrayList<>(endBlockers);
        this.eventLog = eventLog;
    }

    /**
     * Run a transaction against the current block. On any exception every registered state is reverted,
     * buffered events are dropped and the exception is rethrown.
     */
    public synchronized <T> T executeTx(String name, Function<BlockContext, T> tx) {
        BlockContext ctx = new BlockContext(height, blockTime);
        List<Checkpointable.Checkpoint> checkpoints = checkpointAll();
        try {
            T result = tx.apply(ctx);
            eventLog.publish(ctx.getEvents());
            return result;
        } catch (RuntimeException e) {
            revertAll(checkpoints);
            ctx.discardEvents();
            log.info("tx {} reverted at height {}: {}", name, height, e.getMessage());
            throw e;
        }
    }

    /**
     * Close a block: advance height and time, then run the end blockers. A hook that throws is reverted on its
     * own and the block still commits.
     */
    public synchronized BlockContext produceBlock(long newBlockTime) {
        height = height + 1;
        // host block time never goes backwards
        blockTime = Math.max(blockTime, newBlockTime);
        BlockContext ctx = new BlockContext(height, blockTime);

        for (EndBlocker endBlocker : endBlockers) {
            List<Checkpointable.Checkpoint> checkpoints = checkpointAll();
            int eventsBefore = ctx.getEvents().size();
            try {
                endBlocker.endBlock(ctx);
            } catch (RuntimeException e) {
                revertAll(checkpoints);
                ctx.truncateEvents(eventsBefore);
                log.error("end blocker {} failed at height {}, state reverted", endBlocker.getClass().getSimpleName(), height, e);
            }
        }
        eventLog.publish(ctx.getEvents());
        return ctx;
    }

    public synchronized long currentHeight() {
        return height;
    }

    public synchronized long currentBlockTime() {
        return blockTime;
    }

    private List<Checkpointable.Checkpoint> checkpointAll() {
        List<Checkpointable.Checkpoint> checkpoints = new ArrayList<>(state.size());
        for (Checkpointable s : state) {
            checkpoints.add(s.checkpoint());
        }
        return checkpoints;
    }

    private static void revertAll(List<Checkpointable.Checkpoint> checkpoints) {
        for (Checkpointable.Checkpoint checkpoint : checkpoints) {
            checkpoint.revert();
        }
    }
}
