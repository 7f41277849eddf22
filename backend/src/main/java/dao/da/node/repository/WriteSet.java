package dao.da.node.repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered puts and deletes applied by {@link KeyValueStore#write(WriteSet)} as one atomic unit.
 */
public final class WriteSet {

    public enum Kind { PUT, DELETE }

    public record Op(Kind kind, byte[] key, byte[] value) {}

    private final List<Op> ops = new ArrayList<>();

    public WriteSet put(byte[] key, byte[] value) {
        ops.add(new Op(Kind.PUT, key, value));
        return this;
    }

    public WriteSet delete(byte[] key) {
        ops.add(new Op(Kind.DELETE, key, null));
        return this;
    }

    public List<Op> ops() {
        return Collections.unmodifiableList(ops);
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public int size() {
        return ops.size();
    }
}
