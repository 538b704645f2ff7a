package com.rafaeldiaz.spread_sentinel.utils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

public class SignatureUtil {

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String HMAC_SHA512 = "HmacSHA512";

    // Cache de Mac por hilo (cada loop firma en su propio hilo)
    private static final ThreadLocal<Mac> MAC_256 = ThreadLocal.withInitial(() -> newMac(HMAC_SHA256));
    private static final ThreadLocal<Mac> MAC_512 = ThreadLocal.withInitial(() -> newMac(HMAC_SHA512));

    private SignatureUtil() {}

    /**
     * Firma HMAC-SHA256 en BASE64 (OKX).
     */
    public static String hmacSha256Base64(String secret, String message) {
        byte[] bytes = calculateHmac(MAC_256.get(), secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256,
                message.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * Firma HMAC-SHA512 en BASE64 con clave binaria (Kraken usa el secret decodificado).
     */
    public static String hmacSha512Base64(byte[] key, byte[] message) {
        return Base64.getEncoder().encodeToString(calculateHmac(MAC_512.get(), key, HMAC_SHA512, message));
    }

    public static byte[] sha256(String message) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(message.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 no disponible", e);
        }
    }

    private static byte[] calculateHmac(Mac mac, byte[] key, String algorithm, byte[] message) {
        try {
            mac.init(new SecretKeySpec(key, algorithm));
            return mac.doFinal(message);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException("Clave inválida", e);
        }
    }

    private static Mac newMac(String algorithm) {
        try {
            return Mac.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " no disponible", e);
        }
    }
}
