package dao.da.node.metrics;

import dao.da.node.exception.NotFoundException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Node counters and timers, scraped through the actuator Prometheus endpoint.
 *
 * Meters are looked up per call; the registry caches them by name and tags.
 */
@Component
public class NodeMetrics {

    public static final String STORE_CHUNKS = "da.node.store.chunks";
    public static final String RETRIEVAL = "da.node.retrieval";
    public static final String BATCHES_EXPIRED = "da.node.batches.expired";

    public static final String OP_CHUNKS = "chunks";
    public static final String OP_BLOB_HEADER = "blob-header";

    public static final String OUTCOME_OK = "OK";
    public static final String OUTCOME_HIT = "HIT";

    private final MeterRegistry registry;
    private final Counter batchesExpired;

    public NodeMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.batchesExpired = Counter.builder(BATCHES_EXPIRED)
                .description("Batches reclaimed after their custody window")
                .register(registry);
    }

    /**
     * @param outcome {@link #OUTCOME_OK} or the failing error code
     */
    public void recordStore(String outcome, long elapsedNanos) {
        Timer.builder(STORE_CHUNKS)
                .description("StoreChunks calls by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRetrievalHit(String operation) {
        retrievalCounter(operation, OUTCOME_HIT).increment();
    }

    public void recordRetrievalMiss(String operation, NotFoundException.Reason reason) {
        retrievalCounter(operation, reason.name()).increment();
    }

    public void recordBatchExpired() {
        batchesExpired.increment();
    }

    private Counter retrievalCounter(String operation, String outcome) {
        return Counter.builder(RETRIEVAL)
                .description("Retrieval requests by operation and outcome")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry);
    }
}
