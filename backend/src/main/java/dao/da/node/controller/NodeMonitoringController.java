package dao.da.node.controller;

import dao.da.node.chain.ChainHeightOracle;
import dao.da.node.config.CustodyProperties;
import dao.da.node.config.DispersalProperties;
import dao.da.node.config.SchedulerProperties;
import dao.da.node.exception.ChainUnavailableException;
import dao.da.node.exception.NotFoundException;
import dao.da.node.exception.ValidationException;
import dao.da.node.model.AssignmentSnapshot;
import dao.da.node.model.StoredBatch;
import dao.da.node.repository.ChunkStore;
import dao.da.node.service.AssignmentSnapshotHolder;
import dao.da.node.service.Attestor;
import dao.da.node.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Node status for operators and scripts.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class NodeMonitoringController {

    private final ChunkStore chunkStore;
    private final ChainHeightOracle chainHeightOracle;
    private final AssignmentSnapshotHolder snapshotHolder;
    private final Attestor attestor;
    private final CustodyProperties custodyProps;
    private final DispersalProperties dispersalProps;
    private final SchedulerProperties schedulerProps;

    public NodeMonitoringController(ChunkStore chunkStore,
                                    ChainHeightOracle chainHeightOracle,
                                    AssignmentSnapshotHolder snapshotHolder,
                                    Attestor attestor,
                                    CustodyProperties custodyProps,
                                    DispersalProperties dispersalProps,
                                    SchedulerProperties schedulerProps) {
        this.chunkStore = chunkStore;
        this.chainHeightOracle = chainHeightOracle;
        this.snapshotHolder = snapshotHolder;
        this.attestor = attestor;
        this.custodyProps = custodyProps;
        this.dispersalProps = dispersalProps;
        this.schedulerProps = schedulerProps;
    }

    /**
     * GET /api/monitor/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();
        AssignmentSnapshot snapshot = snapshotHolder.current();

        response.put("status", "SUCCESS");
        response.put("signerAddress", attestor.signerAddress());
        response.put("statistics", Map.of(
                "storedBatches", chunkStore.countBatches(),
                "currentBlock", currentBlockOrMinusOne(),
                "custodyPeriodBlocks", custodyProps.getPeriodBlocks()
        ));
        response.put("assignment", Map.of(
                "snapshotVersion", snapshot.getVersion(),
                "entries", snapshot.size(),
                "policy", dispersalProps.getAssignmentPolicy().name()
        ));
        response.put("schedulers", Map.of(
                "expiry", Map.of(
                        "enabled", schedulerProps.getExpiry().isEnabled(),
                        "checkIntervalMs", schedulerProps.getExpiry().getCheckIntervalMs()
                ),
                "assignmentRefresh", Map.of(
                        "enabled", schedulerProps.getAssignmentRefresh().isEnabled(),
                        "checkIntervalMs", schedulerProps.getAssignmentRefresh().getCheckIntervalMs()
                )
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/batch/{batchHeaderHash}
     * Stored batch record plus its custody state at the current chain height.
     */
    @GetMapping("/batch/{batchHeaderHash}")
    public ResponseEntity<Map<String, Object>> getBatch(@PathVariable String batchHeaderHash) {
        byte[] hash;
        try {
            hash = CryptoUtil.fromHex(batchHeaderHash);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Batch header hash is not valid hex: " + batchHeaderHash, e);
        }
        StoredBatch batch = chunkStore.findBatch(hash)
                .orElseThrow(() -> new NotFoundException("Unknown batch " + batchHeaderHash));

        long current = currentBlockOrMinusOne();
        long expiresAfter = batch.getReferenceBlockNumber() + custodyProps.getPeriodBlocks();

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("batchHeaderHash", batch.getBatchHeaderHash());
        info.put("batchRoot", CryptoUtil.toHex0x(batch.getBatchRoot()));
        info.put("referenceBlockNumber", batch.getReferenceBlockNumber());
        info.put("blobCount", batch.getBlobCount());
        info.put("bundleCount", batch.getBundleCount());
        info.put("storedAt", batch.getStoredAt());
        info.put("expiresAfterBlock", expiresAfter);
        info.put("expired", current >= 0
                && ChunkStore.isExpired(batch.getReferenceBlockNumber(), current, custodyProps.getPeriodBlocks()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("batch", info);
        return ResponseEntity.ok(response);
    }

    private long currentBlockOrMinusOne() {
        try {
            return chainHeightOracle.currentBlockNumber();
        } catch (ChainUnavailableException e) {
            log.warn("Chain height unavailable for monitoring: {}", e.getMessage());
            return -1;
        }
    }
}
