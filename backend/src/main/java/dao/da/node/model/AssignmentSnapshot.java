package dao.da.node.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, versioned view of the operator registry: chain height to this node's assignment.
 * A store call captures one snapshot and uses it throughout, so refreshes never race it.
 */
public final class AssignmentSnapshot {

    private final long version;
    private final NavigableMap<Long, OperatorAssignment> byEffectiveBlock;

    public AssignmentSnapshot(long version, Collection<OperatorAssignment> assignments) {
        this.version = version;
        TreeMap<Long, OperatorAssignment> map = new TreeMap<>();
        for (OperatorAssignment a : assignments) {
            map.put(a.effectiveBlock(), a);
        }
        this.byEffectiveBlock = Collections.unmodifiableNavigableMap(map);
    }

    public static AssignmentSnapshot empty() {
        return new AssignmentSnapshot(0L, Collections.emptyList());
    }

    public long getVersion() {
        return version;
    }

    /**
     * Assignment in force at the given chain height.
     */
    public Optional<OperatorAssignment> assignmentAt(long blockNumber) {
        Map.Entry<Long, OperatorAssignment> e = byEffectiveBlock.floorEntry(blockNumber);
        return e == null ? Optional.empty() : Optional.of(e.getValue());
    }

    public int size() {
        return byEffectiveBlock.size();
    }
}
