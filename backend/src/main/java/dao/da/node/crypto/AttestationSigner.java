package dao.da.node.crypto;

public interface AttestationSigner {

    /**
     * Sign a 32-byte digest. Must be deterministic: the same digest yields the same signature.
     */
    byte[] sign(byte[] digest);

    /**
     * Identity the aggregator checks the signature against.
     */
    String signerAddress();
}
