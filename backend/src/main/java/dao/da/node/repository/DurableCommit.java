package dao.da.node.repository;

/**
 * Acknowledgment that a batch is durably held. Only {@link ChunkStore} can mint one, and the
 * attestor only signs against one, which fixes the write-then-sign order.
 */
public final class DurableCommit {

    private final byte[] batchHeaderHash;
    private final long referenceBlockNumber;
    private final int bundleCount;
    private final boolean newlyWritten;

    DurableCommit(byte[] batchHeaderHash, long referenceBlockNumber, int bundleCount, boolean newlyWritten) {
        this.batchHeaderHash = batchHeaderHash.clone();
        this.referenceBlockNumber = referenceBlockNumber;
        this.bundleCount = bundleCount;
        this.newlyWritten = newlyWritten;
    }

    public byte[] getBatchHeaderHash() {
        return batchHeaderHash.clone();
    }

    public long getReferenceBlockNumber() {
        return referenceBlockNumber;
    }

    public int getBundleCount() {
        return bundleCount;
    }

    /** False when the batch was already stored with identical content. */
    public boolean isNewlyWritten() {
        return newlyWritten;
    }
}
