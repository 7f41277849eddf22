package dao.da.node.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKeyValueStoreTest {

    private final InMemoryKeyValueStore kv = new InMemoryKeyValueStore();

    @Test
    void writeSetAppliesPutsAndDeletes() {
        kv.write(new WriteSet().put(key(1, 1), value(1)).put(key(1, 2), value(2)));
        kv.write(new WriteSet().delete(key(1, 1)).put(key(1, 3), value(3)));

        assertNull(kv.get(key(1, 1)));
        assertArrayEquals(value(2), kv.get(key(1, 2)));
        assertArrayEquals(value(3), kv.get(key(1, 3)));
        assertEquals(2, kv.size());
    }

    @Test
    @DisplayName("Scan visits only the prefix, in unsigned key order")
    void scanIsPrefixBoundedAndUnsignedOrdered() {
        kv.write(new WriteSet()
                .put(key(1, 0x80), value(1))
                .put(key(1, 0x01), value(2))
                .put(key(1, 0x7f), value(3))
                .put(key(2, 0x00), value(4))
                .put(key(0, 0xff), value(5)));

        List<Integer> seen = new ArrayList<>();
        kv.scan(new byte[]{1}, (k, v) -> {
            seen.add(k[1] & 0xff);
            return true;
        });

        assertEquals(List.of(0x01, 0x7f, 0x80), seen);
    }

    @Test
    void scanStopsWhenHandlerReturnsFalse() {
        kv.write(new WriteSet().put(key(1, 1), value(1)).put(key(1, 2), value(2)).put(key(1, 3), value(3)));

        List<Integer> seen = new ArrayList<>();
        kv.scan(new byte[]{1}, (k, v) -> {
            seen.add((int) k[1]);
            return seen.size() < 2;
        });

        assertEquals(List.of(1, 2), seen);
    }

    @Test
    @DisplayName("Stored values are isolated from caller mutation")
    void valuesAreCopied() {
        byte[] v = value(7);
        kv.write(new WriteSet().put(key(1, 1), v));
        v[0] = 0;
        kv.get(key(1, 1))[0] = 0;

        assertArrayEquals(value(7), kv.get(key(1, 1)));
    }

    static byte[] key(int tag, int id) {
        return new byte[]{(byte) tag, (byte) id};
    }

    static byte[] value(int v) {
        return new byte[]{(byte) v, (byte) (v + 1)};
    }
}
