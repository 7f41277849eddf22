package dao.da.node.crypto;

import dao.da.node.exception.CommitmentException;
import dao.da.node.model.ChunkAssignment;

import java.util.List;

/**
 * Stand-in when the deployment supplies no pairing backend. Fails closed: every batch is
 * rejected, so the node never attests unverified data.
 */
public class UnavailablePairingVerifier implements PairingVerifier {

    @Override
    public boolean verifyLengthProof(byte[] commitment, byte[] lengthProof, long length) {
        throw new CommitmentException("No pairing backend configured");
    }

    @Override
    public boolean verifyChunks(byte[] commitment, List<byte[]> chunks, ChunkAssignment assignment, long chunkLength) {
        throw new CommitmentException("No pairing backend configured");
    }
}
