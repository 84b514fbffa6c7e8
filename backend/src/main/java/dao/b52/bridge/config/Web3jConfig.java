package dao.b52.bridge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Slf4j
@Configuration
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j settlementWeb3j(BridgeProperties props) {
        String url = props.getRpcUrl();
        if (url == null || url.isBlank()) {
            log.warn("No bridge.rpc-url configured, falling back to {}", HttpService.DEFAULT_URL);
            url = HttpService.DEFAULT_URL;
        }
        log.info("Settlement chain RPC: url={}, contract={}", url, props.getContractAddress());
        return Web3j.build(new HttpService(url));
    }
}
