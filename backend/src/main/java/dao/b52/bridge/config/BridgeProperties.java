package dao.b52.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "bridge")
@Data
public class BridgeProperties {

    /**
     * Master switch for deposit ingestion. When false the end blocker skips the engine and scanner.
     */
    private boolean enabled = true;

    /**
     * JSON-RPC endpoint of the settlement chain node
     * Example: https://mainnet.base.org
     */
    private String rpcUrl;

    /**
     * Bridge contract address on the settlement chain (0x + 40 hex)
     * Example: 0xcc391c8f1aFd6DB5D8b0e064BA81b1383b14FE5B
     */
    private String contractAddress;

    /**
     * Upper bound for a single RPC round trip.
     */
    private long rpcTimeoutMs = 5000;

    /**
     * Unix seconds of settlement chain block 0. Used to derive the external height from host block time.
     */
    private long l2GenesisTime;

    /**
     * Settlement chain block interval in seconds.
     */
    private long l2BlockIntervalSeconds = 2;

    /**
     * Blocks subtracted from the derived external height before any deposit is read.
     */
    private long finalityMargin = 64;

    /**
     * Maximum deposit records the engine handles within one host block.
     */
    private int maxDepositsPerBlock = 5;
}
