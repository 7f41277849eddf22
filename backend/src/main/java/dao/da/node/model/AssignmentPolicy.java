package dao.da.node.model;

/**
 * What happens to a batch containing a blob none of whose quorums are assigned to this node.
 */
public enum AssignmentPolicy {
    /** Reject the whole batch with an assignment error. */
    REJECT_BATCH,
    /** Keep the blob for the Merkle tree but store nothing for it. */
    SKIP_BLOB
}
