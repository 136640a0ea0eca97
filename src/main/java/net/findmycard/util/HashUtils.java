package net.findmycard.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing used for derived identity keys and content-addressed image blobs.
 */
public final class HashUtils {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes the SHA-256 digest of raw bytes.
     *
     * @param data bytes to hash
     * @return the 32-byte digest
     * @throws NoSuchAlgorithmException if SHA-256 is not available
     */
    public static byte[] computeSha256(byte[] data) throws NoSuchAlgorithmException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        MessageDigest digest = MessageDigest.getInstance("SHA-256");
        return digest.digest(data);
    }

    /**
     * Computes the SHA-256 digest of a string's UTF-8 bytes as lowercase hex.
     *
     * <pre>{@code
     * String key = HashUtils.sha256Hex("https://cards.example/img/abc.jpg");
     * }</pre>
     *
     * @param data string to hash
     * @return 64 lowercase hex characters
     * @throws NoSuchAlgorithmException if SHA-256 is not available
     */
    public static String sha256Hex(String data) throws NoSuchAlgorithmException {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        return bytesToHex(computeSha256(data.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Hex digest that rethrows a missing algorithm as an unchecked error.
     * Every JDK ships SHA-256, so callers on hot paths use this variant.
     *
     * @param data string to hash
     * @param length number of hex characters to keep, capped at 64
     */
    public static String sha256HexPrefix(String data, int length) {
        try {
            String hex = sha256Hex(data);
            return hex.substring(0, Math.max(1, Math.min(length, hex.length())));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest unavailable", ex);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int value = bytes[i] & 0xFF;
            out[i * 2] = HEX[value >>> 4];
            out[i * 2 + 1] = HEX[value & 0x0F];
        }
        return new String(out);
    }
}
