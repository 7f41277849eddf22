package dao.da.node.service;

import dao.da.node.crypto.PairingVerifier;
import dao.da.node.exception.CommitmentException;
import dao.da.node.model.BlobHeader;
import dao.da.node.model.BlobQuorumInfo;
import dao.da.node.model.Bundle;
import dao.da.node.model.ChunkAssignment;
import dao.da.node.model.ValidatedBlob;
import dao.da.node.util.CryptoUtil;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Checks a blob's chunks for this node against its polynomial commitment.
 * Pure over the pairing primitive; safe to call for different blobs in parallel.
 */
@Service
public class CommitmentVerifier {

    private final PairingVerifier pairingVerifier;

    public CommitmentVerifier(PairingVerifier pairingVerifier) {
        this.pairingVerifier = pairingVerifier;
    }

    public void verify(ValidatedBlob blob) {
        BlobHeader header = blob.header();
        int index = blob.blobIndex();

        if (!pairingVerifier.verifyLengthProof(header.getCommitment(), header.getLengthProof(), header.getLength())) {
            throw new CommitmentException("Blob " + index + ": length proof does not bound degree to " + header.getLength());
        }

        for (Map.Entry<Integer, ChunkAssignment> e : blob.assignments().entrySet()) {
            int quorumId = e.getKey();
            ChunkAssignment assignment = e.getValue();
            BlobQuorumInfo quorum = header.quorum(quorumId)
                    .orElseThrow(() -> new CommitmentException("Blob " + index + ": no header for quorum " + quorumId));
            long chunkLength = chunkLength(index, header.getLength(), quorum, assignment);

            Bundle bundle = blob.bundleFor(quorumId);
            if (bundle.getChunks().size() != assignment.numChunks()) {
                throw new CommitmentException("Blob " + index + " quorum " + quorumId + ": expected "
                        + assignment.numChunks() + " chunks, got " + bundle.getChunks().size());
            }
            if (!pairingVerifier.verifyChunks(header.getCommitment(), bundle.getChunks(), assignment, chunkLength)) {
                throw new CommitmentException("Blob " + index + " quorum " + quorumId + ": chunks do not open the commitment");
            }
        }
    }

    /**
     * Cross-check the declared length against the quorum's encoding parameters.
     *
     * @return symbols per chunk for this quorum
     */
    static long chunkLength(int index, long length, BlobQuorumInfo quorum, ChunkAssignment assignment) {
        long encoded = quorum.getEncodedBlobLength();
        long minEncoded = minEncodedLength(length, quorum.getQuorumThreshold(), quorum.getAdversaryThreshold());
        if (!CryptoUtil.isPowerOfTwo(encoded) || encoded < minEncoded) {
            throw new CommitmentException("Blob " + index + " quorum " + quorum.getQuorumId()
                    + ": encoded length " + encoded + " does not cover length " + length + " (need " + minEncoded + ")");
        }
        int total = assignment.totalChunks();
        if (total <= 0 || total % quorum.getQuantizationFactor() != 0) {
            throw new CommitmentException("Blob " + index + " quorum " + quorum.getQuorumId()
                    + ": " + total + " chunks is not a multiple of quantization factor " + quorum.getQuantizationFactor());
        }
        if (encoded % total != 0) {
            throw new CommitmentException("Blob " + index + " quorum " + quorum.getQuorumId()
                    + ": encoded length " + encoded + " does not split into " + total + " chunks");
        }
        if (assignment.startIndex() < 0 || assignment.startIndex() + assignment.numChunks() > total) {
            throw new CommitmentException("Blob " + index + " quorum " + quorum.getQuorumId() + ": assignment out of range");
        }
        return encoded / total;
    }

    /**
     * nextPow2(ceil(length * 100 / (quorumThreshold - adversaryThreshold)))
     */
    static long minEncodedLength(long length, int quorumThreshold, int adversaryThreshold) {
        long gap = quorumThreshold - adversaryThreshold;
        long scaled = (length * 100 + gap - 1) / gap;
        return CryptoUtil.nextPowerOfTwo(scaled);
    }
}
