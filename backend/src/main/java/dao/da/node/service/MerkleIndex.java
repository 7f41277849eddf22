package dao.da.node.service;

import dao.da.node.exception.NotFoundException;
import dao.da.node.merkle.MerkleTree;
import dao.da.node.model.BlobHeader;
import dao.da.node.model.MerkleProof;
import dao.da.node.repository.ChunkStore;
import dao.da.node.util.CryptoUtil;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the inclusion-proof tree over a batch's blob headers and answers proof queries
 * against the artifact persisted with the batch.
 */
@Service
public class MerkleIndex {

    private final HeaderHasher headerHasher;
    private final ChunkStore chunkStore;

    public MerkleIndex(HeaderHasher headerHasher, ChunkStore chunkStore) {
        this.headerHasher = headerHasher;
        this.chunkStore = chunkStore;
    }

    /**
     * Leaf for a blob header. The contract hashes the header hash once more:
     * keccak256(abi.encodePacked(hashBlobHeader(blobHeader))).
     */
    public byte[] leafHash(BlobHeader header) {
        return CryptoUtil.keccak256(headerHasher.blobHeaderHash(header));
    }

    public MerkleTree build(List<BlobHeader> headersInBatchOrder) {
        List<byte[]> leaves = new ArrayList<>(headersInBatchOrder.size());
        for (BlobHeader h : headersInBatchOrder) {
            leaves.add(leafHash(h));
        }
        return MerkleTree.build(leaves);
    }

    public MerkleProof getProof(byte[] batchHeaderHash, int blobIndex) {
        MerkleTree tree = chunkStore.loadMerkleTree(batchHeaderHash)
                .orElseThrow(() -> new NotFoundException(
                        "No Merkle artifact for batch " + CryptoUtil.toHex0x(batchHeaderHash)));
        return tree.proof(blobIndex);
    }
}
