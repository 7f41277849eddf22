package dao.da.node.repository;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Key layout. Every key for a batch embeds the 32-byte batch header hash right after the tag,
 * except the custody index, which leads with the big-endian reference block so a prefix
 * scan visits batches oldest first.
 *
 * <pre>
 * 'B' hash                  -> StoredBatch (json)
 * 'H' hash blobIndex        -> BlobHeader (json)
 * 'C' hash blobIndex quorum -> bundle (BundleCodec)
 * 'M' hash                  -> Merkle artifact
 * 'E' refBlock hash         -> empty
 * </pre>
 */
public final class StoreKeys {
    private StoreKeys() {}

    static final byte BATCH = 'B';
    static final byte HEADER = 'H';
    static final byte BUNDLE = 'C';
    static final byte MERKLE = 'M';
    static final byte CUSTODY = 'E';

    public static byte[] batch(byte[] hash) {
        return ByteBuffer.allocate(1 + hash.length).put(BATCH).put(hash).array();
    }

    public static byte[] blobHeader(byte[] hash, int blobIndex) {
        return ByteBuffer.allocate(1 + hash.length + 4).put(HEADER).put(hash).putInt(blobIndex).array();
    }

    public static byte[] blobHeaderPrefix(byte[] hash) {
        return ByteBuffer.allocate(1 + hash.length).put(HEADER).put(hash).array();
    }

    public static byte[] bundle(byte[] hash, int blobIndex, int quorumId) {
        return ByteBuffer.allocate(1 + hash.length + 5)
                .put(BUNDLE).put(hash).putInt(blobIndex).put((byte) quorumId).array();
    }

    public static byte[] bundlePrefix(byte[] hash) {
        return ByteBuffer.allocate(1 + hash.length).put(BUNDLE).put(hash).array();
    }

    public static byte[] merkle(byte[] hash) {
        return ByteBuffer.allocate(1 + hash.length).put(MERKLE).put(hash).array();
    }

    public static byte[] custody(long referenceBlockNumber, byte[] hash) {
        return ByteBuffer.allocate(1 + 8 + hash.length).put(CUSTODY).putLong(referenceBlockNumber).put(hash).array();
    }

    public static byte[] custodyPrefix() {
        return new byte[]{ CUSTODY };
    }

    public static byte[] batchPrefix() {
        return new byte[]{ BATCH };
    }

    static long custodyBlock(byte[] custodyKey) {
        return ByteBuffer.wrap(custodyKey, 1, 8).getLong();
    }

    static byte[] custodyHash(byte[] custodyKey) {
        return Arrays.copyOfRange(custodyKey, 9, custodyKey.length);
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
