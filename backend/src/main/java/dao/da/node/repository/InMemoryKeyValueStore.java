package dao.da.node.repository;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed store for development and tests. Write sets apply under the write lock,
 * so readers see a batch entirely or not at all.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final NavigableMap<byte[], byte[]> entries = new TreeMap<>(Arrays::compareUnsigned);
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @Override
    public byte[] get(byte[] key) {
        rwLock.readLock().lock();
        try {
            byte[] v = entries.get(key);
            return v == null ? null : v.clone();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void write(WriteSet writeSet) {
        rwLock.writeLock().lock();
        try {
            for (WriteSet.Op op : writeSet.ops()) {
                if (op.kind() == WriteSet.Kind.PUT) {
                    entries.put(op.key().clone(), op.value().clone());
                } else {
                    entries.remove(op.key());
                }
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void scan(byte[] prefix, KeyValueHandler handler) {
        // copy under the lock, call back outside it so handlers may read
        List<Map.Entry<byte[], byte[]>> matched = new ArrayList<>();
        rwLock.readLock().lock();
        try {
            for (Map.Entry<byte[], byte[]> e : entries.tailMap(prefix, true).entrySet()) {
                if (!StoreKeys.startsWith(e.getKey(), prefix)) break;
                matched.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey().clone(), e.getValue().clone()));
            }
        } finally {
            rwLock.readLock().unlock();
        }
        for (Map.Entry<byte[], byte[]> e : matched) {
            if (!handler.handle(e.getKey(), e.getValue())) return;
        }
    }

    public int size() {
        rwLock.readLock().lock();
        try {
            return entries.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            rwLock.writeLock().unlock();
        }
    }
}
