package dao.da.node.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "custody")
@Data
public class CustodyProperties {

    /**
     * Blocks past the reference block a batch must be retained and served.
     * Default: 100800 (about two weeks at 12s blocks)
     */
    private long periodBlocks = 100_800;
}
