package dao.b52.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "host")
public class HostChainProperties {

    /**
     * Bech32 human readable part of host chain account addresses.
     */
    private String addressPrefix = "b52";

    /**
     * Denomination credited on deposit and burned on withdrawal.
     */
    private String denom = "usdc";

    /**
     * Number of bridge events kept in memory for monitoring.
     */
    private int eventLogCapacity = 1000;

    /**
     * Optional bridge state export to import on startup.
     */
    private String genesisFile;

    private BlockProduction blockProduction = new BlockProduction();

    @Data
    public static class BlockProduction {
        /**
         * Produce local host blocks (standalone mode).
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Delay between two local blocks (in milliseconds)
         * Default: 5000ms
         */
        private long intervalMs = 5000;
    }
}
