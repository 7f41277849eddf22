package dao.da.node.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Static operator assignments, for nodes that are not wired to a registry indexer.
 *
 * Example:
 * <pre>
 * assignment:
 *   version: 1
 *   entries:
 *     - effective-block: 0
 *       quorums:
 *         - { quorum-id: 0, start-index: 0, num-chunks: 2, total-chunks: 8 }
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "assignment")
@Data
public class AssignmentProperties {

    private long version = 1;

    private List<Entry> entries = new ArrayList<>();

    @Data
    public static class Entry {
        private long effectiveBlock;
        private List<Quorum> quorums = new ArrayList<>();
    }

    @Data
    public static class Quorum {
        private int quorumId;
        private int startIndex;
        private int numChunks;
        private int totalChunks;
    }
}
