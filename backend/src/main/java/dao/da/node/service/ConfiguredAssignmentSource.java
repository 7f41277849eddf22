package dao.da.node.service;

import dao.da.node.config.AssignmentProperties;
import dao.da.node.model.AssignmentSnapshot;
import dao.da.node.model.ChunkAssignment;
import dao.da.node.model.OperatorAssignment;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot built from the {@code assignment.*} properties.
 */
public class ConfiguredAssignmentSource implements AssignmentSource {

    private final AssignmentProperties props;

    public ConfiguredAssignmentSource(AssignmentProperties props) {
        this.props = props;
    }

    @Override
    public AssignmentSnapshot fetch() {
        List<OperatorAssignment> assignments = new ArrayList<>();
        for (AssignmentProperties.Entry entry : props.getEntries()) {
            Map<Integer, ChunkAssignment> quorums = new HashMap<>();
            for (AssignmentProperties.Quorum q : entry.getQuorums()) {
                if (q.getQuorumId() < 0 || q.getQuorumId() > 255) {
                    throw new IllegalArgumentException("Quorum id out of range: " + q.getQuorumId());
                }
                quorums.put(q.getQuorumId(),
                        new ChunkAssignment(q.getQuorumId(), q.getStartIndex(), q.getNumChunks(), q.getTotalChunks()));
            }
            assignments.add(new OperatorAssignment(entry.getEffectiveBlock(), quorums));
        }
        return new AssignmentSnapshot(props.getVersion(), assignments);
    }
}
