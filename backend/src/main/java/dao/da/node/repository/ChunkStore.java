package dao.da.node.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dao.da.node.chain.ChainHeightOracle;
import dao.da.node.config.StorageProperties;
import dao.da.node.exception.NotFoundException;
import dao.da.node.exception.StorageException;
import dao.da.node.exception.ValidationException;
import dao.da.node.merkle.MerkleTree;
import dao.da.node.metrics.NodeMetrics;
import dao.da.node.model.BlobHeader;
import dao.da.node.model.StoredBatch;
import dao.da.node.model.ValidatedBatch;
import dao.da.node.model.ValidatedBlob;
import dao.da.node.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Custody-bounded persistence of validated bundles, blob headers and Merkle artifacts,
 * keyed by batch header hash.
 *
 * Everything for a batch is written in one atomic {@link WriteSet} and deleted in another,
 * so readers see a whole batch or nothing.
 */
@Slf4j
@Repository
public class ChunkStore {

    private static final byte[] EMPTY = new byte[0];

    private final KeyValueStore kv;
    private final ObjectMapper objectMapper;
    private final ChainHeightOracle chainHeightOracle;
    private final StorageProperties.Retry retry;
    private final NodeMetrics metrics;

    public ChunkStore(KeyValueStore kv,
                      ObjectMapper objectMapper,
                      ChainHeightOracle chainHeightOracle,
                      StorageProperties storageProps,
                      NodeMetrics metrics) {
        this.kv = kv;
        this.objectMapper = objectMapper;
        this.chainHeightOracle = chainHeightOracle;
        this.retry = storageProps.getRetry();
        this.metrics = metrics;
    }

    /**
     * Persist a fully validated batch. Per key, byte-identical content already present is left
     * alone; different content under an existing key rejects the call and writes nothing.
     *
     * @return durability acknowledgment, the only input the attestor signs against
     */
    public DurableCommit commit(ValidatedBatch batch, MerkleTree tree) {
        byte[] hash = batch.batchHeaderHash();
        List<ValidatedBlob> blobs = batch.blobs();

        int bundleCount = 0;
        for (ValidatedBlob blob : blobs) {
            bundleCount += blob.assignments().size();
        }
        final int bundles = bundleCount;

        return withRetry("commit", () -> {
            WriteSet ws = new WriteSet();

            StoredBatch record = new StoredBatch(
                    CryptoUtil.toHex0x(hash),
                    batch.header().getBatchRoot(),
                    batch.header().getReferenceBlockNumber(),
                    blobs.size(),
                    bundles,
                    System.currentTimeMillis() / 1000L);
            byte[] existingRecord = kv.get(StoreKeys.batch(hash));
            if (existingRecord == null) {
                ws.put(StoreKeys.batch(hash), toJson(record));
                ws.put(StoreKeys.custody(record.getReferenceBlockNumber(), hash), EMPTY);
            } else if (!sameBatch(fromJson(existingRecord, StoredBatch.class), record)) {
                throw conflict(hash, "batch record");
            }

            for (ValidatedBlob blob : blobs) {
                stagePut(ws, StoreKeys.blobHeader(hash, blob.blobIndex()), toJson(blob.header()), hash);
                for (Integer quorumId : blob.assignments().keySet()) {
                    put(ws, hash, blob.blobIndex(), quorumId, blob.bundleFor(quorumId).getChunks());
                }
            }
            stagePut(ws, StoreKeys.merkle(hash), tree.toBytes(), hash);

            if (ws.isEmpty()) {
                log.debug("Batch {} already stored with identical content", record.getBatchHeaderHash());
                return new DurableCommit(hash, record.getReferenceBlockNumber(), bundles, false);
            }
            kv.write(ws);
            log.info("Batch {} committed: blobs={}, bundles={}, refBlock={}",
                    record.getBatchHeaderHash(), blobs.size(), bundles, record.getReferenceBlockNumber());
            return new DurableCommit(hash, record.getReferenceBlockNumber(), bundles, true);
        });
    }

    /**
     * Stage one bundle. Identical content at the key is a no-op.
     */
    void put(WriteSet ws, byte[] hash, int blobIndex, int quorumId, List<byte[]> chunks) {
        stagePut(ws, StoreKeys.bundle(hash, blobIndex, quorumId), BundleCodec.encode(chunks), hash);
    }

    public List<byte[]> get(byte[] hash, int blobIndex, int quorumId) {
        byte[] raw = withRetry("get", () -> kv.get(StoreKeys.bundle(hash, blobIndex, quorumId)));
        if (raw == null) {
            throw new NotFoundException("No chunks for batch " + CryptoUtil.toHex0x(hash)
                    + ", blob " + blobIndex + ", quorum " + quorumId);
        }
        return BundleCodec.decode(raw);
    }

    public BlobHeader getBlobHeader(byte[] hash, int blobIndex) {
        byte[] raw = withRetry("getBlobHeader", () -> kv.get(StoreKeys.blobHeader(hash, blobIndex)));
        if (raw == null) {
            throw new NotFoundException("No blob header for batch " + CryptoUtil.toHex0x(hash) + ", blob " + blobIndex);
        }
        return fromJson(raw, BlobHeader.class);
    }

    public Optional<StoredBatch> findBatch(byte[] hash) {
        byte[] raw = withRetry("findBatch", () -> kv.get(StoreKeys.batch(hash)));
        return raw == null ? Optional.empty() : Optional.of(fromJson(raw, StoredBatch.class));
    }

    public Optional<MerkleTree> loadMerkleTree(byte[] hash) {
        byte[] raw = withRetry("loadMerkleTree", () -> kv.get(StoreKeys.merkle(hash)));
        return raw == null ? Optional.empty() : Optional.of(MerkleTree.fromBytes(raw));
    }

    public long countBatches() {
        long[] count = {0};
        kv.scan(StoreKeys.batchPrefix(), (k, v) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    public static boolean isExpired(long referenceBlockNumber, long currentBlock, long custodyPeriodBlocks) {
        return currentBlock - referenceBlockNumber > custodyPeriodBlocks;
    }

    /**
     * Remove every batch whose custody window has elapsed relative to the current chain height.
     *
     * @return number of batches removed
     */
    public int expire(long custodyPeriodBlocks) {
        long current = chainHeightOracle.currentBlockNumber();

        List<byte[]> expiredKeys = new ArrayList<>();
        kv.scan(StoreKeys.custodyPrefix(), (key, value) -> {
            if (!isExpired(StoreKeys.custodyBlock(key), current, custodyPeriodBlocks)) {
                return false; // ordered by reference block, nothing later is expired
            }
            expiredKeys.add(key);
            return true;
        });

        int removed = 0;
        for (byte[] custodyKey : expiredKeys) {
            byte[] hash = StoreKeys.custodyHash(custodyKey);
            withRetry("expire", () -> {
                WriteSet ws = new WriteSet();
                ws.delete(StoreKeys.batch(hash));
                ws.delete(StoreKeys.merkle(hash));
                ws.delete(custodyKey);
                kv.scan(StoreKeys.blobHeaderPrefix(hash), (k, v) -> {
                    ws.delete(k);
                    return true;
                });
                kv.scan(StoreKeys.bundlePrefix(hash), (k, v) -> {
                    ws.delete(k);
                    return true;
                });
                kv.write(ws);
                return null;
            });
            removed++;
            metrics.recordBatchExpired();
            log.info("Batch {} expired: refBlock={}, currentBlock={}",
                    CryptoUtil.toHex0x(hash), StoreKeys.custodyBlock(custodyKey), current);
        }
        return removed;
    }

    private void stagePut(WriteSet ws, byte[] key, byte[] value, byte[] hash) {
        byte[] existing = kv.get(key);
        if (existing == null) {
            ws.put(key, value);
        } else if (!Arrays.equals(existing, value)) {
            throw conflict(hash, "key tag " + (char) key[0]);
        }
    }

    private static boolean sameBatch(StoredBatch a, StoredBatch b) {
        return Arrays.equals(a.getBatchRoot(), b.getBatchRoot())
                && a.getReferenceBlockNumber() == b.getReferenceBlockNumber()
                && a.getBlobCount() == b.getBlobCount()
                && a.getBundleCount() == b.getBundleCount();
    }

    private static ValidationException conflict(byte[] hash, String what) {
        return new ValidationException("Batch " + CryptoUtil.toHex0x(hash)
                + " already stored with different content (" + what + ")");
    }

    /**
     * Retry backend failures with jittered exponential backoff, then surface them.
     */
    <T> T withRetry(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        long sleepMs = Math.max(1, retry.getInitialBackoffMs());
        long maxSleepMs = Math.max(sleepMs, retry.getMaxBackoffMs());
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (StorageException e) {
                attempt++;
                if (attempt >= maxAttempts) {
                    throw new StorageException("Storage " + operation + " failed after " + maxAttempts + " attempts", e);
                }
                log.warn("Storage {} failed (attempt {}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
            }
            try {
                long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1, sleepMs / 2));
                Thread.sleep(sleepMs + jitter);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new StorageException("Interrupted while retrying storage " + operation);
            }
            sleepMs = Math.min(maxSleepMs, (long) Math.ceil(sleepMs * 1.5));
        }
    }

    private byte[] toJson(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(byte[] raw, Class<T> type) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (IOException e) {
            throw new StorageException("Corrupt " + type.getSimpleName() + " record", e);
        }
    }
}
