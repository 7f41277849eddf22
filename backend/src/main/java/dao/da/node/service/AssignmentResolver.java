package dao.da.node.service;

import dao.da.node.model.AssignmentSnapshot;
import dao.da.node.model.ChunkAssignment;
import dao.da.node.model.OperatorAssignment;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Answers "is this (block, quorum) ours, and which chunks" against an explicit snapshot.
 */
@Service
public class AssignmentResolver {

    public Optional<OperatorAssignment> resolve(AssignmentSnapshot snapshot, long referenceBlockNumber) {
        return snapshot.assignmentAt(referenceBlockNumber);
    }

    public Optional<ChunkAssignment> resolve(AssignmentSnapshot snapshot, long referenceBlockNumber, int quorumId) {
        return resolve(snapshot, referenceBlockNumber)
                .flatMap(a -> a.forQuorum(quorumId))
                .filter(c -> c.numChunks() > 0);
    }
}
