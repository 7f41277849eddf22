package dao.da.node.model;

public record BlobHeaderProof(
        BlobHeader blobHeader,
        MerkleProof proof
) {}
