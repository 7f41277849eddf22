package dao.da.node.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Data
public class ChainProperties {

    /**
     * Ethereum JSON-RPC endpoint used for the current block number.
     * Empty: height is held locally, starting at initialBlockNumber.
     */
    private String rpcUrl;

    private long initialBlockNumber = 0;

    /**
     * How long a fetched height is reused.
     */
    private long heightCacheMs = 2000;
}
