package dao.da.node.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BlobHeader {

    /** Serialized G1 point. */
    public static final int COMMITMENT_SIZE = 64;
    /** Serialized G2 point. */
    public static final int LENGTH_PROOF_SIZE = 128;

    @NotNull
    private byte[] commitment;

    @NotNull
    private byte[] lengthProof;

    /** Original blob length in field symbols. */
    private long length;

    @NotEmpty
    private List<BlobQuorumInfo> quorumHeaders;

    private String accountId;

    public Optional<BlobQuorumInfo> quorum(int quorumId) {
        if (quorumHeaders == null) return Optional.empty();
        return quorumHeaders.stream().filter(q -> q.getQuorumId() == quorumId).findFirst();
    }
}
