package dao.da.node.service;

import dao.da.node.chain.ChainHeightOracle;
import dao.da.node.config.DispersalProperties;
import dao.da.node.exception.CommitmentException;
import dao.da.node.exception.DeadlineExceededException;
import dao.da.node.exception.NodeException;
import dao.da.node.exception.ValidationException;
import dao.da.node.merkle.MerkleTree;
import dao.da.node.metrics.NodeMetrics;
import dao.da.node.model.AssignmentSnapshot;
import dao.da.node.model.BatchHeader;
import dao.da.node.model.Blob;
import dao.da.node.model.ValidatedBatch;
import dao.da.node.model.ValidatedBlob;
import dao.da.node.repository.ChunkStore;
import dao.da.node.repository.DurableCommit;
import dao.da.node.util.CryptoUtil;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * StoreChunks pipeline: validate, verify, commit, then sign.
 *
 * Calls for the same batch header hash are serialized on a lock stripe, so a duplicate waits
 * and then lands on the store's idempotent path. Per-blob verification fans out to a bounded pool.
 */
@Slf4j
@Service
public class DispersalService {

    private final Attestor attestor;
    private final BatchValidator batchValidator;
    private final CommitmentVerifier commitmentVerifier;
    private final MerkleIndex merkleIndex;
    private final ChunkStore chunkStore;
    private final AssignmentSnapshotHolder snapshotHolder;
    private final ChainHeightOracle chainHeightOracle;
    private final DispersalProperties dispersalProps;
    private final NodeMetrics metrics;
    private final ExecutorService executor;
    private final ReentrantLock[] stripes;

    public DispersalService(Attestor attestor,
                            BatchValidator batchValidator,
                            CommitmentVerifier commitmentVerifier,
                            MerkleIndex merkleIndex,
                            ChunkStore chunkStore,
                            AssignmentSnapshotHolder snapshotHolder,
                            ChainHeightOracle chainHeightOracle,
                            DispersalProperties dispersalProps,
                            NodeMetrics metrics) {
        this.attestor = attestor;
        this.batchValidator = batchValidator;
        this.commitmentVerifier = commitmentVerifier;
        this.merkleIndex = merkleIndex;
        this.chunkStore = chunkStore;
        this.snapshotHolder = snapshotHolder;
        this.chainHeightOracle = chainHeightOracle;
        this.dispersalProps = dispersalProps;
        this.metrics = metrics;

        int threadSize = Math.max(1, Math.min(64, dispersalProps.getVerificationParallelism()));
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threadSize, r -> {
            Thread t = new Thread(r, "commitment-verifier-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        this.stripes = new ReentrantLock[Math.max(1, dispersalProps.getLockStripes())];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * @return attestation signature over the batch header hash
     */
    public byte[] storeChunks(BatchHeader header, List<Blob> blobs) {
        long started = System.nanoTime();
        try {
            byte[] signature = storeWithinDeadline(header, blobs, started);
            metrics.recordStore(NodeMetrics.OUTCOME_OK, System.nanoTime() - started);
            return signature;
        } catch (NodeException e) {
            metrics.recordStore(e.getCode().name(), System.nanoTime() - started);
            throw e;
        }
    }

    private byte[] storeWithinDeadline(BatchHeader header, List<Blob> blobs, long started) {
        long deadline = started + TimeUnit.MILLISECONDS.toNanos(dispersalProps.getTimeoutMs());
        byte[] hash = attestor.batchHeaderHash(header);
        String hashHex = CryptoUtil.toHex0x(hash);

        ReentrantLock lock = stripes[Math.floorMod(Arrays.hashCode(hash), stripes.length)];
        try {
            if (!lock.tryLock(remainingNanos(deadline), TimeUnit.NANOSECONDS)) {
                throw new DeadlineExceededException("Timed out waiting for in-flight store of batch " + hashHex);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException("Interrupted waiting for batch " + hashHex, e);
        }

        try {
            byte[] signature = storeLocked(header, hash, blobs, deadline);
            log.info("StoreChunks ok: batch={}, blobs={}", hashHex, blobs.size());
            return signature;
        } catch (NodeException e) {
            log.warn("StoreChunks rejected: batch={}, code={}, reason={}", hashHex, e.getCode(), e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private byte[] storeLocked(BatchHeader header, byte[] hash, List<Blob> blobs, long deadline) {
        AssignmentSnapshot snapshot = snapshotHolder.current();
        long currentBlock = chainHeightOracle.currentBlockNumber();

        ValidatedBatch batch = batchValidator.validate(header, hash, blobs, snapshot, currentBlock);

        MerkleTree tree = merkleIndex.build(batch.blobHeaders());
        if (!Arrays.equals(tree.root(), header.getBatchRoot())) {
            throw new ValidationException("Batch root " + CryptoUtil.toHex0x(header.getBatchRoot())
                    + " does not match blob headers (computed " + CryptoUtil.toHex0x(tree.root()) + ")");
        }

        verifyCommitments(batch, deadline);

        // nothing is written past the deadline; the caller has already given up
        if (remainingNanos(deadline) <= 0) {
            throw new DeadlineExceededException("Deadline exceeded before commit of batch " + CryptoUtil.toHex0x(hash));
        }

        DurableCommit commit = chunkStore.commit(batch, tree);
        return attestor.attest(commit);
    }

    private void verifyCommitments(ValidatedBatch batch, long deadline) {
        List<ValidatedBlob> custodied = batch.custodied();
        List<Future<?>> futures = new ArrayList<>(custodied.size());
        for (ValidatedBlob blob : custodied) {
            futures.add(executor.submit(() -> commitmentVerifier.verify(blob)));
        }
        try {
            for (Future<?> f : futures) {
                f.get(Math.max(0, remainingNanos(deadline)), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            throw new DeadlineExceededException("Commitment verification exceeded the deadline", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NodeException ne) {
                throw ne;
            }
            throw new CommitmentException("Commitment verification failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadlineExceededException("Interrupted during commitment verification", e);
        } finally {
            // interrupts verifications still running so they free the pool
            futures.forEach(f -> f.cancel(true));
        }
    }

    private static long remainingNanos(long deadline) {
        return deadline - System.nanoTime();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
