package dao.da.node.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "storage")
@Data
public class StorageProperties {

    public enum Backend { IN_MEMORY, ROCKSDB }

    /**
     * Key-value engine backing the chunk store.
     * Default: IN_MEMORY
     */
    private Backend backend = Backend.IN_MEMORY;

    /**
     * Database directory for ROCKSDB.
     */
    private String path = "./data/node";

    /**
     * fsync the write-ahead log before a commit is acknowledged.
     * Must stay true in production: the attestation relies on it.
     */
    private boolean sync = true;

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        /**
         * Attempts per storage operation before failing the call.
         */
        private int maxAttempts = 3;
        /**
         * Initial backoff between attempts.
         */
        private long initialBackoffMs = 50;
        /**
         * Backoff cap.
         */
        private long maxBackoffMs = 1000;
    }
}
