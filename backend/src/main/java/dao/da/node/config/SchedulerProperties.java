package dao.da.node.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private ExpiryConfig expiry = new ExpiryConfig();
    private AssignmentRefreshConfig assignmentRefresh = new AssignmentRefreshConfig();

    @Data
    public static class ExpiryConfig {
        /**
         * Enable/disable background custody reclamation
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to look for expired batches (in milliseconds)
         * Default: 60000ms
         */
        private long checkIntervalMs = 60_000;
    }

    @Data
    public static class AssignmentRefreshConfig {
        /**
         * Enable/disable periodic snapshot refresh from the assignment source
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Default: 12000ms (one block)
         */
        private long checkIntervalMs = 12_000;
    }
}
