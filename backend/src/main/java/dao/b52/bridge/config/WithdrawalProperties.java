package dao.b52.bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "withdrawal")
@Data
public class WithdrawalProperties {

    /**
     * Validator signing key (hex, 64 characters, optional 0x prefix).
     * Leave empty to sign withdrawals only through the sign endpoint.
     */
    private String validatorPrivateKey;

    /**
     * Sign pending withdrawals at the end of every host block when a key is configured.
     */
    private boolean autoSign = true;
}
