package dao.da.node.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.da.node.BatchFixtures;
import dao.da.node.chain.ManualChainHeightOracle;
import dao.da.node.config.StorageProperties;
import dao.da.node.exception.NotFoundException;
import dao.da.node.exception.StorageException;
import dao.da.node.exception.ValidationException;
import dao.da.node.merkle.MerkleTree;
import dao.da.node.metrics.NodeMetrics;
import dao.da.node.model.BatchHeader;
import dao.da.node.model.Blob;
import dao.da.node.model.ChunkAssignment;
import dao.da.node.model.ValidatedBatch;
import dao.da.node.model.ValidatedBlob;
import dao.da.node.util.CryptoUtil;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ChunkStoreTest {

    private static final ChunkAssignment ASSIGNMENT = new ChunkAssignment(0, 0, 2, BatchFixtures.TOTAL_CHUNKS);

    private InMemoryKeyValueStore kv;
    private ManualChainHeightOracle chain;
    private StorageProperties storageProps;
    private NodeMetrics metrics;
    private ChunkStore store;

    @BeforeEach
    void setUp() {
        kv = new InMemoryKeyValueStore();
        chain = new ManualChainHeightOracle(0);
        storageProps = new StorageProperties();
        storageProps.getRetry().setInitialBackoffMs(1);
        storageProps.getRetry().setMaxBackoffMs(2);
        metrics = new NodeMetrics(new SimpleMeterRegistry());
        store = new ChunkStore(kv, new ObjectMapper(), chain, storageProps, metrics);
    }

    @Test
    void commitThenRead() {
        Blob blob = BatchFixtures.assignedBlob(1);
        ValidatedBatch batch = batch(10, blob);

        DurableCommit commit = store.commit(batch, tree(blob));

        assertTrue(commit.isNewlyWritten());
        assertEquals(1, commit.getBundleCount());
        assertEquals(10, commit.getReferenceBlockNumber());
        assertArrayEquals(batch.batchHeaderHash(), commit.getBatchHeaderHash());

        List<byte[]> chunks = store.get(batch.batchHeaderHash(), 0, 0);
        assertEquals(2, chunks.size());
        assertArrayEquals(blob.getBundles().get(0).getChunks().get(1), chunks.get(1));
        assertEquals(blob.getHeader(), store.getBlobHeader(batch.batchHeaderHash(), 0));
        assertEquals(10, store.findBatch(batch.batchHeaderHash()).orElseThrow().getReferenceBlockNumber());
        assertTrue(store.loadMerkleTree(batch.batchHeaderHash()).isPresent());
        assertEquals(1, store.countBatches());
    }

    @Test
    @DisplayName("Recommitting identical content is a no-op")
    void identicalRecommitIsNoOp() {
        Blob blob = BatchFixtures.assignedBlob(1);
        ValidatedBatch batch = batch(10, blob);
        store.commit(batch, tree(blob));
        int entries = kv.size();

        DurableCommit again = store.commit(batch, tree(blob));

        assertFalse(again.isNewlyWritten());
        assertEquals(entries, kv.size());
    }

    @Test
    @DisplayName("Different content under a stored batch hash is rejected and the original kept")
    void conflictingContentRejected() {
        Blob original = BatchFixtures.assignedBlob(1);
        ValidatedBatch batch = batch(10, original);
        store.commit(batch, tree(original));

        Blob tampered = new Blob(original.getHeader(), List.of(BatchFixtures.bundle(99, 2)));
        ValidatedBatch conflicting = new ValidatedBatch(batch.header(), batch.batchHeaderHash(),
                List.of(new ValidatedBlob(0, tampered, Map.of(0, ASSIGNMENT))));

        assertThrows(ValidationException.class, () -> store.commit(conflicting, tree(tampered)));
        assertArrayEquals(original.getBundles().get(0).getChunks().get(0),
                store.get(batch.batchHeaderHash(), 0, 0).get(0));
    }

    @Test
    void missingKeysAreNotFound() {
        byte[] hash = new byte[32];

        assertThrows(NotFoundException.class, () -> store.get(hash, 0, 0));
        assertThrows(NotFoundException.class, () -> store.getBlobHeader(hash, 0));
        assertTrue(store.findBatch(hash).isEmpty());
        assertTrue(store.loadMerkleTree(hash).isEmpty());
    }

    @Test
    @DisplayName("Expiry removes batches past custody, oldest first, and keeps the rest whole")
    void expireRemovesOnlyElapsedBatches() {
        Blob a = BatchFixtures.assignedBlob(1);
        Blob b = BatchFixtures.assignedBlob(2);
        ValidatedBatch old = batch(10, a);
        ValidatedBatch recent = batch(50, b);
        store.commit(recent, tree(b));
        store.commit(old, tree(a));

        chain.set(70);
        assertEquals(1, store.expire(30));

        assertTrue(store.findBatch(old.batchHeaderHash()).isEmpty());
        assertThrows(NotFoundException.class, () -> store.get(old.batchHeaderHash(), 0, 0));
        assertThrows(NotFoundException.class, () -> store.getBlobHeader(old.batchHeaderHash(), 0));
        assertTrue(store.loadMerkleTree(old.batchHeaderHash()).isEmpty());

        assertEquals(2, store.get(recent.batchHeaderHash(), 0, 0).size());
        assertEquals(0, store.expire(30));

        chain.set(81);
        assertEquals(1, store.expire(30));
        assertEquals(0, kv.size());
    }

    @Test
    void isExpiredIsStrict() {
        assertFalse(ChunkStore.isExpired(10, 40, 30));
        assertTrue(ChunkStore.isExpired(10, 41, 30));
    }

    @Test
    @DisplayName("Transient backend failures are retried")
    void transientFailureRetried() {
        FlakyStore flaky = new FlakyStore(kv, 2);
        ChunkStore flakyStore = new ChunkStore(flaky, new ObjectMapper(), chain, storageProps, metrics);
        Blob blob = BatchFixtures.assignedBlob(1);
        ValidatedBatch batch = batch(10, blob);
        store.commit(batch, tree(blob));

        assertEquals(2, flakyStore.get(batch.batchHeaderHash(), 0, 0).size());
        assertEquals(3, flaky.getCalls.get());
    }

    @Test
    @DisplayName("Persistent backend failures surface as StorageException")
    void persistentFailureSurfaces() {
        FlakyStore broken = new FlakyStore(kv, Integer.MAX_VALUE);
        ChunkStore brokenStore = new ChunkStore(broken, new ObjectMapper(), chain, storageProps, metrics);

        StorageException e = assertThrows(StorageException.class, () -> brokenStore.get(new byte[32], 0, 0));
        assertTrue(e.getMessage().contains("after 3 attempts"));
        assertEquals(3, broken.getCalls.get());
    }

    private static ValidatedBatch batch(long ref, Blob blob) {
        BatchHeader header = BatchFixtures.batchHeader(ref, List.of(blob));
        byte[] hash = CryptoUtil.keccak256(CryptoUtil.concat(header.getBatchRoot(), new byte[]{(byte) ref}));
        return new ValidatedBatch(header, hash, List.of(new ValidatedBlob(0, blob, Map.of(0, ASSIGNMENT))));
    }

    private static MerkleTree tree(Blob blob) {
        return MerkleTree.build(List.of(CryptoUtil.keccak256(blob.getHeader().getCommitment())));
    }

    /** Fails the first {@code failures} reads, then delegates. */
    private static final class FlakyStore implements KeyValueStore {
        private final KeyValueStore delegate;
        private final int failures;
        final AtomicInteger getCalls = new AtomicInteger();

        FlakyStore(KeyValueStore delegate, int failures) {
            this.delegate = delegate;
            this.failures = failures;
        }

        @Override
        public byte[] get(byte[] key) {
            if (getCalls.incrementAndGet() <= failures) {
                throw new StorageException("disk unavailable");
            }
            return delegate.get(key);
        }

        @Override
        public void write(WriteSet writeSet) {
            delegate.write(writeSet);
        }

        @Override
        public void scan(byte[] prefix, KeyValueHandler handler) {
            delegate.scan(prefix, handler);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
