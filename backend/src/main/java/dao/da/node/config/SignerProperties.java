package dao.da.node.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "signer")
@Data
public class SignerProperties {

    /**
     * Operator attestation key (hex, 64 characters).
     * Empty means an ephemeral key is generated at startup.
     */
    private String privateKey;
}
