package dao.da.node.config;

import dao.da.node.chain.ChainHeightOracle;
import dao.da.node.chain.ManualChainHeightOracle;
import dao.da.node.chain.Web3jChainHeightOracle;
import dao.da.node.crypto.AttestationSigner;
import dao.da.node.crypto.EcdsaAttestationSigner;
import dao.da.node.crypto.PairingVerifier;
import dao.da.node.crypto.UnavailablePairingVerifier;
import dao.da.node.repository.InMemoryKeyValueStore;
import dao.da.node.repository.KeyValueStore;
import dao.da.node.repository.RocksDbKeyValueStore;
import dao.da.node.service.AssignmentSource;
import dao.da.node.service.ConfiguredAssignmentSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wiring of the node's external collaborators. Each bean backs off when the deployment
 * defines its own.
 */
@Slf4j
@Configuration
public class NodeConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore(StorageProperties storageProps) {
        if (storageProps.getBackend() == StorageProperties.Backend.ROCKSDB) {
            return new RocksDbKeyValueStore(storageProps.getPath(), storageProps.isSync());
        }
        log.warn("Using in-memory storage; custodied data will not survive a restart.");
        return new InMemoryKeyValueStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainHeightOracle chainHeightOracle(ChainProperties chainProps) {
        String rpcUrl = chainProps.getRpcUrl();
        if (rpcUrl == null || rpcUrl.isBlank()) {
            log.warn("No chain.rpc-url configured. Chain height is local, starting at {}.", chainProps.getInitialBlockNumber());
            return new ManualChainHeightOracle(chainProps.getInitialBlockNumber());
        }
        return new Web3jChainHeightOracle(rpcUrl, chainProps.getHeightCacheMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public AttestationSigner attestationSigner(SignerProperties signerProps) {
        return new EcdsaAttestationSigner(signerProps.getPrivateKey());
    }

    @Bean
    @ConditionalOnMissingBean
    public PairingVerifier pairingVerifier() {
        log.warn("No PairingVerifier bean provided. All StoreChunks calls will fail commitment verification.");
        return new UnavailablePairingVerifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public AssignmentSource assignmentSource(AssignmentProperties assignmentProps) {
        return new ConfiguredAssignmentSource(assignmentProps);
    }
}
