package dao.da.node.chain;

import dao.da.node.exception.ChainUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.http.HttpService;

import java.io.IOException;

/**
 * eth_blockNumber over JSON-RPC, cached for {@code cacheMillis} so retrieval traffic
 * does not turn into RPC traffic.
 */
@Slf4j
public class Web3jChainHeightOracle implements ChainHeightOracle {

    private final Web3j web3j;
    private final long cacheMillis;

    private volatile long cachedHeight = -1L;
    private volatile long cachedAt = 0L;

    public Web3jChainHeightOracle(String rpcUrl, long cacheMillis) {
        this(Web3j.build(new HttpService(rpcUrl)), cacheMillis);
        log.info("Chain height oracle initialized: rpc={}", rpcUrl);
    }

    Web3jChainHeightOracle(Web3j web3j, long cacheMillis) {
        this.web3j = web3j;
        this.cacheMillis = cacheMillis;
    }

    @Override
    public long currentBlockNumber() {
        long now = System.currentTimeMillis();
        if (cachedHeight >= 0 && now - cachedAt < cacheMillis) {
            return cachedHeight;
        }
        String failure;
        Throwable cause = null;
        try {
            EthBlockNumber resp = web3j.ethBlockNumber().send();
            if (!resp.hasError()) {
                long height = resp.getBlockNumber().longValueExact();
                cachedHeight = height;
                cachedAt = now;
                return height;
            }
            failure = resp.getError().getMessage();
        } catch (IOException e) {
            failure = e.getMessage();
            cause = e;
        }
        if (cachedHeight >= 0) {
            log.warn("eth_blockNumber failed, using cached height {}: {}", cachedHeight, failure);
            return cachedHeight;
        }
        throw new ChainUnavailableException("Chain height unavailable: " + failure, cause);
    }

    public void shutdown() {
        web3j.shutdown();
    }
}
