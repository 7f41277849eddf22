package dao.da.node.service;

import dao.da.node.chain.ChainHeightOracle;
import dao.da.node.config.CustodyProperties;
import dao.da.node.exception.NotFoundException;
import dao.da.node.metrics.NodeMetrics;
import dao.da.node.exception.ValidationException;
import dao.da.node.model.BlobHeader;
import dao.da.node.model.BlobHeaderProof;
import dao.da.node.model.MerkleProof;
import dao.da.node.model.StoredBatch;
import dao.da.node.repository.ChunkStore;
import dao.da.node.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only queries over custodied batches. A batch past its custody window is reported as
 * expired even if the background pass has not reclaimed it yet.
 */
@Slf4j
@Service
public class RetrievalService {

    private final ChunkStore chunkStore;
    private final MerkleIndex merkleIndex;
    private final ChainHeightOracle chainHeightOracle;
    private final CustodyProperties custodyProps;
    private final NodeMetrics metrics;

    public RetrievalService(ChunkStore chunkStore,
                            MerkleIndex merkleIndex,
                            ChainHeightOracle chainHeightOracle,
                            CustodyProperties custodyProps,
                            NodeMetrics metrics) {
        this.chunkStore = chunkStore;
        this.merkleIndex = merkleIndex;
        this.chainHeightOracle = chainHeightOracle;
        this.custodyProps = custodyProps;
        this.metrics = metrics;
    }

    public List<byte[]> retrieveChunks(byte[] batchHeaderHash, int blobIndex, int quorumId) {
        checkKey(batchHeaderHash, blobIndex, quorumId);
        try {
            requireLiveBatch(batchHeaderHash);
            List<byte[]> chunks = chunkStore.get(batchHeaderHash, blobIndex, quorumId);
            metrics.recordRetrievalHit(NodeMetrics.OP_CHUNKS);
            return chunks;
        } catch (NotFoundException e) {
            metrics.recordRetrievalMiss(NodeMetrics.OP_CHUNKS, e.getReason());
            log.debug("RetrieveChunks not found: {}", e.getMessage());
            throw e;
        }
    }

    public BlobHeaderProof getBlobHeader(byte[] batchHeaderHash, int blobIndex, int quorumId) {
        checkKey(batchHeaderHash, blobIndex, quorumId);
        try {
            requireLiveBatch(batchHeaderHash);
            BlobHeader header = chunkStore.getBlobHeader(batchHeaderHash, blobIndex);
            if (header.quorum(quorumId).isEmpty()) {
                throw new NotFoundException("Blob " + blobIndex + " of batch " + CryptoUtil.toHex0x(batchHeaderHash)
                        + " is not in quorum " + quorumId);
            }
            MerkleProof proof = merkleIndex.getProof(batchHeaderHash, blobIndex);
            metrics.recordRetrievalHit(NodeMetrics.OP_BLOB_HEADER);
            return new BlobHeaderProof(header, proof);
        } catch (NotFoundException e) {
            metrics.recordRetrievalMiss(NodeMetrics.OP_BLOB_HEADER, e.getReason());
            log.debug("GetBlobHeader not found: {}", e.getMessage());
            throw e;
        }
    }

    private void requireLiveBatch(byte[] batchHeaderHash) {
        StoredBatch batch = chunkStore.findBatch(batchHeaderHash)
                .orElseThrow(() -> new NotFoundException("Unknown batch " + CryptoUtil.toHex0x(batchHeaderHash)));
        long current = chainHeightOracle.currentBlockNumber();
        if (ChunkStore.isExpired(batch.getReferenceBlockNumber(), current, custodyProps.getPeriodBlocks())) {
            throw new NotFoundException(NotFoundException.Reason.EXPIRED, "Batch " + batch.getBatchHeaderHash()
                    + " expired: refBlock=" + batch.getReferenceBlockNumber() + ", currentBlock=" + current
                    + ", custodyPeriod=" + custodyProps.getPeriodBlocks());
        }
    }

    private static void checkKey(byte[] batchHeaderHash, int blobIndex, int quorumId) {
        if (batchHeaderHash == null || batchHeaderHash.length != CryptoUtil.HASH_LENGTH) {
            throw new ValidationException("Batch header hash must be 32 bytes");
        }
        if (blobIndex < 0) {
            throw new ValidationException("Blob index must be non-negative: " + blobIndex);
        }
        if (quorumId < 0 || quorumId > 255) {
            throw new ValidationException("Quorum id out of range [0, 255]: " + quorumId);
        }
    }
}
