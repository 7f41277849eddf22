package dao.da.node.model;

/**
 * @param signature attestation over the batch header hash, r || s || v
 */
public record StoreChunksReply(byte[] signature) {
}
