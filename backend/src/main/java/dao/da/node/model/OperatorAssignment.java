package dao.da.node.model;

import java.util.Map;
import java.util.Optional;

/**
 * This node's quorum assignments from {@code effectiveBlock} onward, until the next entry.
 */
public record OperatorAssignment(
        long effectiveBlock,
        Map<Integer, ChunkAssignment> quorums
) {
    public OperatorAssignment {
        quorums = Map.copyOf(quorums);
    }

    public Optional<ChunkAssignment> forQuorum(int quorumId) {
        return Optional.ofNullable(quorums.get(quorumId));
    }
}
