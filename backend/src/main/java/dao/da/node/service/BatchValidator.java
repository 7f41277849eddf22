package dao.da.node.service;

import dao.da.node.config.DispersalProperties;
import dao.da.node.exception.AssignmentException;
import dao.da.node.exception.ValidationException;
import dao.da.node.model.AssignmentPolicy;
import dao.da.node.model.AssignmentSnapshot;
import dao.da.node.model.BatchHeader;
import dao.da.node.model.Blob;
import dao.da.node.model.BlobHeader;
import dao.da.node.model.BlobQuorumInfo;
import dao.da.node.model.Bundle;
import dao.da.node.model.ChunkAssignment;
import dao.da.node.model.OperatorAssignment;
import dao.da.node.model.ValidatedBatch;
import dao.da.node.model.ValidatedBlob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural and assignment checks for an incoming batch. Failures reject the whole batch,
 * except a blob with no assigned quorum under {@link AssignmentPolicy#SKIP_BLOB}.
 */
@Slf4j
@Service
public class BatchValidator {

    private final AssignmentResolver assignmentResolver;
    private final DispersalProperties dispersalProps;

    public BatchValidator(AssignmentResolver assignmentResolver, DispersalProperties dispersalProps) {
        this.assignmentResolver = assignmentResolver;
        this.dispersalProps = dispersalProps;
    }

    public ValidatedBatch validate(BatchHeader header,
                                   byte[] batchHeaderHash,
                                   List<Blob> blobs,
                                   AssignmentSnapshot snapshot,
                                   long currentBlock) {
        if (blobs == null || blobs.isEmpty()) {
            throw new ValidationException("Batch has no blobs");
        }
        long ref = header.getReferenceBlockNumber();
        if (ref > currentBlock + dispersalProps.getMaxReferenceBlockLead()) {
            throw new ValidationException("Reference block " + ref + " is ahead of current block " + currentBlock);
        }
        if (currentBlock - ref > dispersalProps.getMaxReferenceBlockAge()) {
            throw new ValidationException("Reference block " + ref + " is too old, current block " + currentBlock);
        }

        OperatorAssignment operator = assignmentResolver.resolve(snapshot, ref)
                .orElseThrow(() -> new AssignmentException("No operator assignment in force at block " + ref));

        AssignmentPolicy policy = dispersalProps.getAssignmentPolicy();
        List<ValidatedBlob> validated = new ArrayList<>(blobs.size());
        for (int i = 0; i < blobs.size(); i++) {
            Blob blob = blobs.get(i);
            validateShape(i, blob);
            Map<Integer, ChunkAssignment> assigned = resolveAssignments(i, blob, snapshot, ref);
            if (assigned.isEmpty()) {
                if (policy == AssignmentPolicy.REJECT_BATCH) {
                    throw new AssignmentException("Blob " + i + " has no quorum assigned to this node");
                }
                log.debug("Blob {} has no quorum assigned to this node (assignments={}), skipping",
                        i, operator.quorums().keySet());
            }
            validated.add(new ValidatedBlob(i, blob, assigned));
        }

        ValidatedBatch result = new ValidatedBatch(header, batchHeaderHash, validated);
        if (result.custodied().isEmpty()) {
            throw new AssignmentException("No blob in the batch is assigned to this node");
        }
        return result;
    }

    private void validateShape(int index, Blob blob) {
        if (blob == null || blob.getHeader() == null) {
            throw new ValidationException("Blob " + index + " has no header");
        }
        BlobHeader h = blob.getHeader();
        // unset and empty account id are one value on the wire; store the canonical form
        if (h.getAccountId() == null) {
            h.setAccountId("");
        }
        if (h.getCommitment() == null || h.getCommitment().length != BlobHeader.COMMITMENT_SIZE) {
            throw new ValidationException("Blob " + index + " commitment must be " + BlobHeader.COMMITMENT_SIZE + " bytes");
        }
        if (h.getLengthProof() == null || h.getLengthProof().length != BlobHeader.LENGTH_PROOF_SIZE) {
            throw new ValidationException("Blob " + index + " length proof must be " + BlobHeader.LENGTH_PROOF_SIZE + " bytes");
        }
        if (h.getLength() <= 0 || h.getLength() > HeaderHasher.UINT32_MAX) {
            throw new ValidationException("Blob " + index + " has invalid length " + h.getLength());
        }
        List<BlobQuorumInfo> quorums = h.getQuorumHeaders();
        if (quorums == null || quorums.isEmpty()) {
            throw new ValidationException("Blob " + index + " has no quorum headers");
        }
        List<Bundle> bundles = blob.getBundles();
        if (bundles == null || bundles.size() != quorums.size()) {
            throw new ValidationException("Blob " + index + " has " + (bundles == null ? 0 : bundles.size())
                    + " bundles for " + quorums.size() + " quorums");
        }

        Set<Integer> seen = new HashSet<>();
        for (int q = 0; q < quorums.size(); q++) {
            BlobQuorumInfo info = quorums.get(q);
            int id = info.getQuorumId();
            if (id < 0 || id > 255) {
                throw new ValidationException("Blob " + index + " quorum id out of range: " + id);
            }
            if (!seen.add(id)) {
                throw new ValidationException("Blob " + index + " lists quorum " + id + " twice");
            }
            if (info.getAdversaryThreshold() < 0 || info.getAdversaryThreshold() >= info.getQuorumThreshold()
                    || info.getQuorumThreshold() > 100) {
                throw new ValidationException("Blob " + index + " quorum " + id + " has invalid thresholds");
            }
            if (info.getQuantizationFactor() < 1) {
                throw new ValidationException("Blob " + index + " quorum " + id + " has invalid quantization factor");
            }
            if (info.getEncodedBlobLength() <= 0 || info.getEncodedBlobLength() > HeaderHasher.UINT32_MAX) {
                throw new ValidationException("Blob " + index + " quorum " + id + " has invalid encoded length");
            }
            if (info.getRatelimit() < 0 || info.getRatelimit() > HeaderHasher.UINT32_MAX) {
                throw new ValidationException("Blob " + index + " quorum " + id + " has invalid ratelimit");
            }
            validateBundle(index, id, bundles.get(q));
        }
    }

    private void validateBundle(int blobIndex, int quorumId, Bundle bundle) {
        if (bundle == null || bundle.isEmpty()) return;
        int len = -1;
        for (byte[] chunk : bundle.getChunks()) {
            if (chunk == null || chunk.length == 0) {
                throw new ValidationException("Blob " + blobIndex + " quorum " + quorumId + " has an empty chunk");
            }
            if (len >= 0 && chunk.length != len) {
                throw new ValidationException("Blob " + blobIndex + " quorum " + quorumId + " has chunks of unequal length");
            }
            len = chunk.length;
        }
    }

    private Map<Integer, ChunkAssignment> resolveAssignments(int index, Blob blob, AssignmentSnapshot snapshot, long ref) {
        Map<Integer, ChunkAssignment> assigned = new HashMap<>();
        List<BlobQuorumInfo> quorums = blob.getHeader().getQuorumHeaders();
        for (int q = 0; q < quorums.size(); q++) {
            int id = quorums.get(q).getQuorumId();
            Bundle bundle = blob.getBundles().get(q);
            Optional<ChunkAssignment> assignment = assignmentResolver.resolve(snapshot, ref, id);
            if (assignment.isEmpty()) {
                if (bundle != null && !bundle.isEmpty()) {
                    throw new AssignmentException("Blob " + index + " carries chunks for quorum " + id
                            + ", which is not assigned to this node");
                }
                continue;
            }
            if (bundle == null || bundle.isEmpty()) {
                throw new ValidationException("Blob " + index + " is missing chunks for assigned quorum " + id);
            }
            assigned.put(id, assignment.get());
        }
        return assigned;
    }
}
