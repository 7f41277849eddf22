package dao.da.node.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.web3j.utils.Numeric;

import java.security.SecureRandom;

/**
 * Cryptographic utilities shared by the hashing, Merkle and signing code.
 *
 * IMPORTANT:
 * - All digests are keccak256, matching the on-chain verifier.
 * - Hex strings are 0x-prefixed on output; input accepts both forms.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    public static final int HASH_LENGTH = 32;

    private static final SecureRandom RNG = new SecureRandom();

    public static byte[] randomBytes32() {
        byte[] salt = new byte[HASH_LENGTH];
        RNG.nextBytes(salt);
        return salt;
    }

    public static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    public static byte[] keccak256(byte[] left, byte[] right) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(left, 0, left.length);
        digest.update(right, 0, right.length);
        return digest.digest();
    }

    public static byte[] concat(byte[]... parts) {
        int len = 0;
        for (byte[] p : parts) len += p.length;
        byte[] out = new byte[len];
        int pos = 0;
        for (byte[] p : parts) {
            System.arraycopy(p, 0, out, pos, p.length);
            pos += p.length;
        }
        return out;
    }

    public static String toHex0x(byte[] bytes) {
        return Numeric.toHexString(bytes);
    }

    /**
     * @throws IllegalArgumentException if the input is not an even-length hex string
     */
    public static byte[] fromHex(String hex) {
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() % 2 != 0 || !clean.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("Invalid hex string");
        }
        return Numeric.hexStringToByteArray(clean);
    }

    public static boolean isPowerOfTwo(long v) {
        return v > 0 && (v & (v - 1)) == 0;
    }

    /**
     * Smallest power of two that is >= v (v >= 1).
     */
    public static long nextPowerOfTwo(long v) {
        if (v <= 1) return 1;
        return Long.highestOneBit(v - 1) << 1;
    }
}
