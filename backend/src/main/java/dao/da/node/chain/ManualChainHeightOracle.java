package dao.da.node.chain;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Height set by the operator (or a test). Used when no RPC endpoint is configured.
 */
public class ManualChainHeightOracle implements ChainHeightOracle {

    private final AtomicLong height;

    public ManualChainHeightOracle(long initialHeight) {
        this.height = new AtomicLong(initialHeight);
    }

    @Override
    public long currentBlockNumber() {
        return height.get();
    }

    public void set(long blockNumber) {
        height.set(blockNumber);
    }

    public long advance(long blocks) {
        return height.addAndGet(blocks);
    }
}
