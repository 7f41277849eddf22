package dao.da.node.model;

import java.util.Map;

/**
 * A blob that passed structural and assignment checks, with the chunk ranges this node holds for it.
 * An empty assignment map means the blob is part of the batch but not custodied here.
 */
public record ValidatedBlob(
        int blobIndex,
        Blob blob,
        Map<Integer, ChunkAssignment> assignments
) {
    public ValidatedBlob {
        assignments = Map.copyOf(assignments);
    }

    public boolean custodied() {
        return !assignments.isEmpty();
    }

    public BlobHeader header() {
        return blob.getHeader();
    }

    public Bundle bundleFor(int quorumId) {
        var quorums = blob.getHeader().getQuorumHeaders();
        for (int i = 0; i < quorums.size(); i++) {
            if (quorums.get(i).getQuorumId() == quorumId) {
                return blob.getBundles().get(i);
            }
        }
        throw new IllegalArgumentException("Blob " + blobIndex + " has no quorum " + quorumId);
    }
}
