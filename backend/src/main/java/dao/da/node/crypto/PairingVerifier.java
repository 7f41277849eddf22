package dao.da.node.crypto;

import dao.da.node.model.ChunkAssignment;

import java.util.List;

/**
 * Pairing-based checks over the polynomial commitment scheme. Implementations wrap the
 * curve library and must be thread-safe; verification of different blobs runs concurrently.
 */
public interface PairingVerifier {

    /**
     * @return true if {@code lengthProof} bounds the committed polynomial's degree to {@code length}
     */
    boolean verifyLengthProof(byte[] commitment, byte[] lengthProof, long length);

    /**
     * @param chunkLength symbols per chunk
     * @return true if every chunk is a valid multi-evaluation of the committed polynomial at the
     *         positions {@code assignment} gives this node
     */
    boolean verifyChunks(byte[] commitment, List<byte[]> chunks, ChunkAssignment assignment, long chunkLength);
}
