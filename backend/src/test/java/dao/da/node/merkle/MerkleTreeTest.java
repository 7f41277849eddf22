package dao.da.node.merkle;

import dao.da.node.exception.BlobIndexOutOfRangeException;
import dao.da.node.model.MerkleProof;
import dao.da.node.util.CryptoUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Root and proof shape must match the on-chain verifyInclusionKeccak recomputation.
 */
class MerkleTreeTest {

    private static final byte[] ZERO = new byte[32];

    @Test
    @DisplayName("Single leaf: root is the leaf, proof is empty")
    void singleLeaf() {
        byte[] leaf = leaf(7);
        MerkleTree tree = MerkleTree.build(List.of(leaf));

        assertArrayEquals(leaf, tree.root());
        MerkleProof proof = tree.proof(0);
        assertTrue(proof.hashes().isEmpty());
        assertTrue(MerkleTree.verify(proof, leaf, tree.root()));
    }

    @Test
    @DisplayName("Parents hash left || right by position, odd levels pad with zero leaves")
    void positionalHashingWithZeroPadding() {
        byte[] a = leaf(1), b = leaf(2), c = leaf(3);

        byte[] two = MerkleTree.build(List.of(a, b)).root();
        assertArrayEquals(CryptoUtil.keccak256(a, b), two);

        byte[] three = MerkleTree.build(List.of(a, b, c)).root();
        byte[] expected = CryptoUtil.keccak256(CryptoUtil.keccak256(a, b), CryptoUtil.keccak256(c, ZERO));
        assertArrayEquals(expected, three);

        assertFalse(Arrays.equals(two, MerkleTree.build(List.of(b, a)).root()));
    }

    @Test
    @DisplayName("Every proof verifies for sizes 1 through 9, and only at its own index")
    void proofsVerifyForAllSizes() {
        for (int n = 1; n <= 9; n++) {
            List<byte[]> leaves = leaves(n);
            MerkleTree tree = MerkleTree.build(leaves);
            byte[] root = tree.root();

            for (int i = 0; i < n; i++) {
                MerkleProof proof = tree.proof(i);
                assertEquals(Integer.numberOfTrailingZeros((int) CryptoUtil.nextPowerOfTwo(n)), proof.hashes().size());
                assertTrue(MerkleTree.verify(proof, leaves.get(i), root), "n=" + n + " i=" + i);

                if (n > 1) {
                    MerkleProof moved = new MerkleProof(proof.hashes(), i ^ 1);
                    assertFalse(MerkleTree.verify(moved, leaves.get(i), root), "moved n=" + n + " i=" + i);
                }
                assertFalse(MerkleTree.verify(proof, leaf(1000 + i), root));
            }
        }
    }

    @Test
    @DisplayName("Index beyond the tree width does not verify")
    void indexBeyondWidthRejected() {
        List<byte[]> leaves = leaves(4);
        MerkleTree tree = MerkleTree.build(leaves);
        MerkleProof proof = tree.proof(1);

        assertFalse(MerkleTree.verify(new MerkleProof(proof.hashes(), 1 + 4), leaves.get(1), tree.root()));
    }

    @Test
    @DisplayName("Negative index does not verify, even where it would reduce like an odd index")
    void negativeIndexRejected() {
        List<byte[]> leaves = leaves(2);
        MerkleTree tree = MerkleTree.build(leaves);
        MerkleProof proof = tree.proof(1);

        assertTrue(MerkleTree.verify(proof, leaves.get(1), tree.root()));
        assertFalse(MerkleTree.verify(new MerkleProof(proof.hashes(), -1), leaves.get(1), tree.root()));
        assertFalse(MerkleTree.verify(new MerkleProof(List.of(), -1), leaves.get(0), leaves.get(0)));
    }

    @Test
    @DisplayName("Proof for a padding position or negative index is out of range")
    void outOfRange() {
        MerkleTree tree = MerkleTree.build(leaves(3));

        assertThrows(BlobIndexOutOfRangeException.class, () -> tree.proof(3));
        assertThrows(BlobIndexOutOfRangeException.class, () -> tree.proof(-1));
    }

    @Test
    @DisplayName("Persisted artifact reproduces root and proofs")
    void artifactRestores() {
        MerkleTree tree = MerkleTree.build(leaves(5));
        MerkleTree restored = MerkleTree.fromBytes(tree.toBytes());

        assertArrayEquals(tree.root(), restored.root());
        assertEquals(5, restored.leafCount());
        MerkleProof a = tree.proof(4);
        MerkleProof b = restored.proof(4);
        assertEquals(a.hashes().size(), b.hashes().size());
        for (int i = 0; i < a.hashes().size(); i++) {
            assertArrayEquals(a.hashes().get(i), b.hashes().get(i));
        }
    }

    @Test
    void corruptArtifactRejected() {
        byte[] bytes = MerkleTree.build(leaves(2)).toBytes();
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 1);

        assertThrows(IllegalArgumentException.class, () -> MerkleTree.fromBytes(truncated));
    }

    @Test
    void emptyOrMalformedLeavesRejected() {
        assertThrows(IllegalArgumentException.class, () -> MerkleTree.build(List.of()));
        assertThrows(IllegalArgumentException.class, () -> MerkleTree.build(List.of(new byte[31])));
    }

    private static List<byte[]> leaves(int n) {
        List<byte[]> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(leaf(i));
        }
        return out;
    }

    private static byte[] leaf(int i) {
        return CryptoUtil.keccak256(new byte[]{(byte) (i >> 8), (byte) i});
    }
}
