package dao.da.node.chain;

/**
 * Source of the node's current view of chain height. Custody and drift are measured against it.
 */
public interface ChainHeightOracle {

    long currentBlockNumber();
}
