package dao.da.node.repository;

/**
 * Persistent key-value engine the chunk store sits on.
 *
 * Implementations must make {@link #write(WriteSet)} atomic (all ops visible or none) and
 * durable on return. Backend failures surface as {@link dao.da.node.exception.StorageException}.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * @return the value, or null if absent
     */
    byte[] get(byte[] key);

    void write(WriteSet writeSet);

    /**
     * Visit entries whose key starts with {@code prefix}, in unsigned key order.
     */
    void scan(byte[] prefix, KeyValueHandler handler);

    @Override
    void close();
}
