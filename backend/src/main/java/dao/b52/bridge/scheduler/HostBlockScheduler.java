package dao.b52.bridge.scheduler;

import dao.b52.bridge.config.HostChainProperties;
import dao.b52.bridge.host.BlockContext;
import dao.b52.bridge.host.HostChain;
import dao.b52.bridge.model.BridgeGenesis;
import dao.b52.bridge.service.BridgeGenesisService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Produces local host blocks in standalone mode. Block time is wall clock seconds.
 */
@Slf4j
@Component
public class HostBlockScheduler {

    private final HostChain hostChain;
    private final BridgeGenesisService genesisService;
    private final HostChainProperties hostProps;
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public HostBlockScheduler(HostChain hostChain,
                              BridgeGenesisService genesisService,
                              HostChainProperties hostProps) {
        this.hostChain = hostChain;
        this.genesisService = genesisService;
        this.hostProps = hostProps;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void importGenesisOnStartup() {
        String file = hostProps.getGenesisFile();
        if (file != null && !file.isBlank()) {
            // an unreadable or invalid file fails startup
            BridgeGenesis genesis = genesisService.readGenesisFile(Path.of(file));
            hostChain.executeTx("import_genesis", ctx -> {
                genesisService.importGenesis(genesis);
                return null;
            });
            log.info("Imported bridge state from {}", file);
        }
        ready.set(true);
    }

    @Scheduled(fixedDelayString = "${host.block-production.interval-ms:5000}")
    public void produceBlock() {
        if (!hostProps.getBlockProduction().isEnabled() || !ready.get()) {
            return;
        }
        long now = System.currentTimeMillis() / 1000L;
        BlockContext block = hostChain.produceBlock(now);
        log.debug("Block produced: height={}, time={}, events={}",
                block.getHeight(), block.getBlockTime(), block.getEvents().size());
    }
}
