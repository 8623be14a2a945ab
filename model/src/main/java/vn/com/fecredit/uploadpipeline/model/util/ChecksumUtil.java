package vn.com.fecredit.uploadpipeline.model.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class for generating and validating chunk checksums.
 *
 * <p>
 * Two hex-encoded formats are recognised:
 * <ul>
 * <li>32 hex characters: MD5</li>
 * <li>64 hex characters: SHA-256</li>
 * </ul>
 * Any other value is treated as an opaque client token and is not verified.
 */
public final class ChecksumUtil {

    public static final String SHA_256 = "SHA-256";
    public static final String MD5 = "MD5";

    private static final Pattern MD5_HEX = Pattern.compile("\\A[a-fA-F0-9]{32}\\z");
    private static final Pattern SHA_256_HEX = Pattern.compile("\\A[a-fA-F0-9]{64}\\z");

    private ChecksumUtil() {
        // Utility class, no instances allowed
    }

    /**
     * Generates a hex checksum of the given bytes with the given algorithm.
     */
    public static String generateChecksum(byte[] data, String algorithm) {
        return toHex(newDigest(algorithm).digest(data));
    }

    /**
     * Resolves the digest algorithm a client checksum was produced with.
     *
     * @return the algorithm name, or {@code null} when the value is not a recognised hex digest
     */
    public static String detectAlgorithm(String checksum) {
        if (checksum == null) {
            return null;
        }
        if (MD5_HEX.matcher(checksum).matches()) {
            return MD5;
        }
        if (SHA_256_HEX.matcher(checksum).matches()) {
            return SHA_256;
        }
        return null;
    }

    /**
     * Verifies the data against a client-supplied checksum.
     *
     * @return {@code true} when the checksum matches or is not a recognised digest format
     */
    public static boolean matches(byte[] data, String checksum) {
        String algorithm = detectAlgorithm(checksum);
        if (algorithm == null) {
            return true;
        }
        return generateChecksum(data, algorithm).equals(checksum.toLowerCase(Locale.ROOT));
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " digest is not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1)
                hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
