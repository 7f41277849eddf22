package dao.da.node.scheduler;

import dao.da.node.config.CustodyProperties;
import dao.da.node.config.SchedulerProperties;
import dao.da.node.exception.ChainUnavailableException;
import dao.da.node.exception.StorageException;
import dao.da.node.repository.ChunkStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ExpiryScheduler {

    private final ChunkStore chunkStore;
    private final CustodyProperties custodyProps;
    private final SchedulerProperties schedulerProps;

    public ExpiryScheduler(ChunkStore chunkStore,
                           CustodyProperties custodyProps,
                           SchedulerProperties schedulerProps) {
        this.chunkStore = chunkStore;
        this.custodyProps = custodyProps;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.expiry.check-interval-ms:60000}")
    public void reclaimExpiredBatches() {
        if (!schedulerProps.getExpiry().isEnabled()) {
            return;
        }
        try {
            int removed = chunkStore.expire(custodyProps.getPeriodBlocks());
            if (removed > 0) {
                log.info("Expiry pass removed {} batches (custodyPeriod={} blocks)", removed, custodyProps.getPeriodBlocks());
            }
        } catch (StorageException e) {
            log.warn("Expiry pass failed, will retry next interval: {}", e.getMessage());
        } catch (ChainUnavailableException e) {
            log.warn("Expiry pass skipped, chain height unavailable: {}", e.getMessage());
        }
    }
}
