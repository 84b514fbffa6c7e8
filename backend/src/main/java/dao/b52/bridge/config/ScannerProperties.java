package dao.b52.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "scanner")
@Data
public class ScannerProperties {

    /**
     * Enable/disable the gap-filling deposit scanner
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Minimum host block time between two scanner runs, in seconds
     * Default: 600 (10 minutes)
     */
    private long checkIntervalSeconds = 600;

    /**
     * Maximum missing deposit indices looked up per run, found or not
     * Default: 10
     */
    private int maxBatch = 10;
}
