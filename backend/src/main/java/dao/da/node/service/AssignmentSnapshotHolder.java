package dao.da.node.service;

import dao.da.node.model.AssignmentSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Current assignment snapshot. Readers take {@link #current()} once per call;
 * {@link #refresh} swaps in a newer snapshot atomically and ignores stale ones.
 */
@Slf4j
@Component
public class AssignmentSnapshotHolder {

    private static final AssignmentSnapshot INITIAL = AssignmentSnapshot.empty();

    private final AtomicReference<AssignmentSnapshot> current = new AtomicReference<>(INITIAL);

    public AssignmentSnapshotHolder(AssignmentSource source) {
        refresh(source.fetch());
    }

    public AssignmentSnapshot current() {
        return current.get();
    }

    /**
     * @return true if the snapshot was installed
     */
    public boolean refresh(AssignmentSnapshot next) {
        while (true) {
            AssignmentSnapshot prev = current.get();
            if (prev != INITIAL && next.getVersion() <= prev.getVersion()) {
                return false;
            }
            if (current.compareAndSet(prev, next)) {
                log.info("Assignment snapshot installed: version={} (was {}), entries={}",
                        next.getVersion(), prev.getVersion(), next.size());
                return true;
            }
        }
    }
}
