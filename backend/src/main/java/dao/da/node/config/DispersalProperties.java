package dao.da.node.config;

import dao.da.node.model.AssignmentPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "dispersal")
@Data
public class DispersalProperties {

    /**
     * Deadline for one StoreChunks call, lock wait included.
     * Default: 30000ms
     */
    private long timeoutMs = 30_000;

    /**
     * Worker threads for per-blob commitment verification.
     */
    private int verificationParallelism = 4;

    /**
     * Handling of a blob none of whose quorums are assigned to this node.
     */
    private AssignmentPolicy assignmentPolicy = AssignmentPolicy.REJECT_BATCH;

    /**
     * How far behind the node's chain view a reference block may be.
     */
    private long maxReferenceBlockAge = 600;

    /**
     * How far ahead of the node's chain view a reference block may be.
     */
    private long maxReferenceBlockLead = 5;

    /**
     * Number of lock stripes serializing store calls by batch header hash.
     */
    private int lockStripes = 64;
}
