package dao.da.node.repository;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Bundle wire form: [count:int][chunkLength:int][chunk bytes...]. Chunks are equal-length.
 */
final class BundleCodec {
    private BundleCodec() {}

    static byte[] encode(List<byte[]> chunks) {
        int chunkLength = chunks.isEmpty() ? 0 : chunks.get(0).length;
        ByteBuffer buf = ByteBuffer.allocate(8 + chunks.size() * chunkLength);
        buf.putInt(chunks.size());
        buf.putInt(chunkLength);
        for (byte[] chunk : chunks) {
            if (chunk.length != chunkLength) {
                throw new IllegalArgumentException("Chunks in a bundle must have equal length");
            }
            buf.put(chunk);
        }
        return buf.array();
    }

    static List<byte[]> decode(byte[] data) {
        ByteBuffer buf = ByteBuffer.wrap(data);
        int count = buf.getInt();
        int chunkLength = buf.getInt();
        if (count < 0 || chunkLength < 0 || data.length != 8 + (long) count * chunkLength) {
            throw new IllegalArgumentException("Corrupt bundle encoding");
        }
        List<byte[]> chunks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[] chunk = new byte[chunkLength];
            buf.get(chunk);
            chunks.add(chunk);
        }
        return chunks;
    }
}
