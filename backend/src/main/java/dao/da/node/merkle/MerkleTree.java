package dao.da.node.merkle;

import dao.da.node.exception.BlobIndexOutOfRangeException;
import dao.da.node.model.MerkleProof;
import dao.da.node.util.CryptoUtil;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static dao.da.node.util.CryptoUtil.HASH_LENGTH;

/**
 * Binary Merkle tree over a batch's blob header leaves, stored as an index-addressed arena.
 *
 * Layout: {@code nodes[1]} is the root, node {@code i} has children {@code 2i} and {@code 2i+1},
 * leaves sit at {@code width + index} where {@code width} is the leaf count rounded up to a power
 * of two. Padding leaves are 32 zero bytes.
 *
 * IMPORTANT: parents are keccak256(left || right) with positional (unsorted) ordering. This MUST
 * match the on-chain verifyInclusionKeccak root recomputation, which takes the side from the
 * index bits.
 */
public final class MerkleTree {

    private static final byte[] EMPTY_LEAF = new byte[HASH_LENGTH];

    private final int leafCount;
    private final int width;
    private final byte[][] nodes;

    private MerkleTree(int leafCount, int width, byte[][] nodes) {
        this.leafCount = leafCount;
        this.width = width;
        this.nodes = nodes;
    }

    public static MerkleTree build(List<byte[]> leaves) {
        if (leaves == null || leaves.isEmpty()) {
            throw new IllegalArgumentException("No leaves");
        }
        int width = (int) CryptoUtil.nextPowerOfTwo(leaves.size());
        byte[][] nodes = new byte[2 * width][];

        for (int i = 0; i < width; i++) {
            if (i < leaves.size()) {
                byte[] leaf = leaves.get(i);
                if (leaf == null || leaf.length != HASH_LENGTH) {
                    throw new IllegalArgumentException("Each leaf must be 32 bytes");
                }
                nodes[width + i] = leaf.clone();
            } else {
                nodes[width + i] = EMPTY_LEAF;
            }
        }
        for (int i = width - 1; i >= 1; i--) {
            nodes[i] = CryptoUtil.keccak256(nodes[2 * i], nodes[2 * i + 1]);
        }
        return new MerkleTree(leaves.size(), width, nodes);
    }

    public byte[] root() {
        return nodes[1].clone();
    }

    public int leafCount() {
        return leafCount;
    }

    /**
     * Sibling hashes from the leaf level up to (excluding) the root.
     */
    public MerkleProof proof(int index) {
        checkIndex(index);
        List<byte[]> siblings = new ArrayList<>();
        for (int pos = width + index; pos > 1; pos >>= 1) {
            siblings.add(nodes[pos ^ 1].clone());
        }
        return new MerkleProof(siblings, index);
    }

    /**
     * Recompute the root from a leaf and its proof the way the on-chain verifier does.
     */
    public static boolean verify(MerkleProof proof, byte[] leaf, byte[] root) {
        if (proof == null || leaf == null || root == null) return false;
        long idx = proof.index();
        int depth = proof.hashes().size();
        // index must address a leaf of a tree this deep
        if (idx < 0 || depth >= Long.SIZE - 1 || idx >= (1L << depth)) return false;
        byte[] computed = leaf;
        for (byte[] sibling : proof.hashes()) {
            if (sibling == null || sibling.length != HASH_LENGTH) return false;
            computed = (idx % 2 == 0)
                    ? CryptoUtil.keccak256(computed, sibling)
                    : CryptoUtil.keccak256(sibling, computed);
            idx /= 2;
        }
        return idx == 0 && Arrays.equals(computed, root);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= leafCount) {
            throw new BlobIndexOutOfRangeException(index, leafCount);
        }
    }

    // Persisted artifact: [leafCount:int][width:int][nodes 1..2w-1, 32 bytes each]

    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(8 + (2 * width - 1) * HASH_LENGTH);
        buf.putInt(leafCount);
        buf.putInt(width);
        for (int i = 1; i < 2 * width; i++) {
            buf.put(nodes[i]);
        }
        return buf.array();
    }

    public static MerkleTree fromBytes(byte[] data) {
        ByteBuffer buf = ByteBuffer.wrap(data);
        int leafCount = buf.getInt();
        int width = buf.getInt();
        if (leafCount < 1 || width < leafCount || !CryptoUtil.isPowerOfTwo(width)
                || data.length != 8 + (2 * width - 1) * HASH_LENGTH) {
            throw new IllegalArgumentException("Corrupt Merkle artifact");
        }
        byte[][] nodes = new byte[2 * width][];
        for (int i = 1; i < 2 * width; i++) {
            nodes[i] = new byte[HASH_LENGTH];
            buf.get(nodes[i]);
        }
        return new MerkleTree(leafCount, width, nodes);
    }
}
