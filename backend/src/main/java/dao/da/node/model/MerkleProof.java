package dao.da.node.model;

import java.util.List;

/**
 * Inclusion evidence: sibling hashes bottom-up, and the leaf index they apply to.
 */
public record MerkleProof(
        List<byte[]> hashes,
        int index
) {}
