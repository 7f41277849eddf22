package dao.da.node.model;

/**
 * Chunk range of one quorum that this node is responsible for.
 * Chunks [startIndex, startIndex + numChunks) out of totalChunks for the quorum.
 */
public record ChunkAssignment(
        int quorumId,
        int startIndex,
        int numChunks,
        int totalChunks
) {}
