package dao.da.node.crypto;

import dao.da.node.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.ECDSASignature;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * secp256k1 signer over the raw digest (no message prefix). Nonces are RFC 6979 deterministic,
 * so a retried store of the same batch gets the same signature.
 * Output is 65 bytes: r (32) || s (32) || v (1).
 */
@Slf4j
public class EcdsaAttestationSigner implements AttestationSigner {

    private final ECKeyPair keyPair;
    private final String address;

    public EcdsaAttestationSigner(String privateKeyHex) {
        if (privateKeyHex == null || privateKeyHex.isBlank()) {
            log.warn("No signer private key configured. Using an ephemeral key; attestations will not be accepted by the aggregator.");
            this.keyPair = ECKeyPair.create(CryptoUtil.randomBytes32());
        } else {
            this.keyPair = ECKeyPair.create(Numeric.toBigInt(privateKeyHex.trim()));
        }
        this.address = Numeric.prependHexPrefix(Keys.getAddress(keyPair));
        log.info("Attestation signer initialized: address={}", address);
    }

    @Override
    public byte[] sign(byte[] digest) {
        if (digest == null || digest.length != CryptoUtil.HASH_LENGTH) {
            throw new IllegalArgumentException("Digest must be 32 bytes");
        }
        Sign.SignatureData sig = Sign.signMessage(digest, keyPair, false);
        return CryptoUtil.concat(sig.getR(), sig.getS(), sig.getV());
    }

    @Override
    public String signerAddress() {
        return address;
    }

    /**
     * Recover the signer of a 65-byte signature and compare it with {@code expectedAddress}.
     */
    public static boolean verify(byte[] digest, byte[] signature, String expectedAddress) {
        if (signature == null || signature.length != 65) return false;
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, 32));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, 32, 64));
        int recId = (signature[64] & 0xff) - 27;
        if (recId < 0 || recId > 3) return false;
        BigInteger publicKey = Sign.recoverFromSignature(recId, new ECDSASignature(r, s), digest);
        if (publicKey == null) return false;
        return Numeric.prependHexPrefix(Keys.getAddress(publicKey)).equalsIgnoreCase(expectedAddress);
    }
}
