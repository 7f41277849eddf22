package dao.da.node.repository;

import dao.da.node.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.File;

/**
 * RocksDB-backed store. A {@link WriteSet} maps to one RocksDB WriteBatch, which commits
 * atomically; with {@code sync} the WAL is fsynced before {@link #write} returns.
 */
@Slf4j
public class RocksDbKeyValueStore implements KeyValueStore {

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final Options options;
    private final boolean sync;
    private final String path;

    public RocksDbKeyValueStore(String path, boolean sync) {
        this.path = path;
        this.sync = sync;
        File dir = new File(path);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new StorageException("Failed to create database directory: " + path);
        }
        this.options = new Options()
                .setCreateIfMissing(true)
                .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);
        try {
            this.db = RocksDB.open(options, path);
        } catch (RocksDBException e) {
            options.close();
            throw new StorageException("Failed to open RocksDB at " + path, e);
        }
        log.info("RocksDB opened: path={}, sync={}", path, sync);
    }

    @Override
    public byte[] get(byte[] key) {
        try {
            return db.get(key);
        } catch (RocksDBException e) {
            throw new StorageException("RocksDB get failed", e);
        }
    }

    @Override
    public void write(WriteSet writeSet) {
        if (writeSet.isEmpty()) return;
        try (WriteBatch batch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions().setSync(sync)) {
            for (WriteSet.Op op : writeSet.ops()) {
                if (op.kind() == WriteSet.Kind.PUT) {
                    batch.put(op.key(), op.value());
                } else {
                    batch.delete(op.key());
                }
            }
            db.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw new StorageException("RocksDB write failed, ops=" + writeSet.size(), e);
        }
    }

    @Override
    public void scan(byte[] prefix, KeyValueHandler handler) {
        try (RocksIterator iterator = db.newIterator()) {
            iterator.seek(prefix);
            while (iterator.isValid()) {
                byte[] key = iterator.key();
                if (!StoreKeys.startsWith(key, prefix)) break;
                if (!handler.handle(key, iterator.value())) break;
                iterator.next();
            }
        }
    }

    @Override
    public void close() {
        db.close();
        options.close();
        log.info("RocksDB closed: path={}", path);
    }
}
