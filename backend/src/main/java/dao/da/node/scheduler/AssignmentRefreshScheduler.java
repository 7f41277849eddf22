package dao.da.node.scheduler;

import dao.da.node.config.SchedulerProperties;
import dao.da.node.service.AssignmentSnapshotHolder;
import dao.da.node.service.AssignmentSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class AssignmentRefreshScheduler {

    private final AssignmentSource assignmentSource;
    private final AssignmentSnapshotHolder snapshotHolder;
    private final SchedulerProperties schedulerProps;

    public AssignmentRefreshScheduler(AssignmentSource assignmentSource,
                                      AssignmentSnapshotHolder snapshotHolder,
                                      SchedulerProperties schedulerProps) {
        this.assignmentSource = assignmentSource;
        this.snapshotHolder = snapshotHolder;
        this.schedulerProps = schedulerProps;
    }

    @Scheduled(fixedDelayString = "${scheduler.assignment-refresh.check-interval-ms:12000}")
    public void refreshSnapshot() {
        if (!schedulerProps.getAssignmentRefresh().isEnabled()) {
            return;
        }
        try {
            if (snapshotHolder.refresh(assignmentSource.fetch())) {
                log.debug("Assignment snapshot now at version {}", snapshotHolder.current().getVersion());
            }
        } catch (RuntimeException e) {
            log.warn("Assignment refresh failed, keeping version {}: {}",
                    snapshotHolder.current().getVersion(), e.getMessage());
        }
    }
}
