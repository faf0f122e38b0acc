package io.tradehybrid.brokerlink.broker.codec;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * HMAC helpers used for request signing.
 */
public final class HmacSigner {

    public static final String HMAC_SHA256 = "HmacSHA256";
    public static final String HMAC_SHA1 = "HmacSHA1";

    /**
     * HMAC-SHA256 of {@code message} keyed with {@code secret}, as lower-case hex.
     */
    public static String sha256Hex(String secret, String message) {
        return toHex(hmac(HMAC_SHA256, secret, message));
    }

    /**
     * HMAC-SHA1 of {@code message} keyed with {@code key}, as Base64.
     */
    public static String sha1Base64(String key, String message) {
        return Base64.getEncoder().encodeToString(hmac(HMAC_SHA1, key, message));
    }

    static byte[] hmac(String algorithm, String key, String message) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), algorithm));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC failure (" + algorithm + "): " + e.getMessage(), e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            hex.append(String.format("%02x", b & 0xff));
        }
        return hex.toString();
    }

    private HmacSigner() {}
}
