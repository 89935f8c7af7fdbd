package com.example.librarysync.common.util;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES/GCM helper for catalog credentials. Output is base64 of {@code iv || ciphertext}; a fresh
 * IV is drawn per call, so encrypting the same secret twice gives different strings.
 */
public final class AesCryptoUtil {

    private static final int GCM_TAG_LENGTH_BIT = 128;
    private static final int GCM_IV_LENGTH_BYTE = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    private AesCryptoUtil() {
    }

    public static String encrypt(String plainText, String key) {
        try {
            validateKey(key);
            byte[] iv = new byte[GCM_IV_LENGTH_BYTE];
            RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, keySpec(key), new GCMParameterSpec(GCM_TAG_LENGTH_BIT, iv));
            byte[] encrypted = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    public static String decrypt(String cipherText, String key) {
        try {
            validateKey(key);
            byte[] combined = Base64.getDecoder().decode(cipherText);
            if (combined.length < GCM_IV_LENGTH_BYTE) {
                throw new IllegalArgumentException("Malformed credential cipher text");
            }

            byte[] iv = new byte[GCM_IV_LENGTH_BYTE];
            byte[] encrypted = new byte[combined.length - GCM_IV_LENGTH_BYTE];
            System.arraycopy(combined, 0, iv, 0, GCM_IV_LENGTH_BYTE);
            System.arraycopy(combined, GCM_IV_LENGTH_BYTE, encrypted, 0, encrypted.length);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, keySpec(key), new GCMParameterSpec(GCM_TAG_LENGTH_BIT, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential decryption failed", e);
        }
    }

    /**
     * Decrypts and encrypts again under a new IV, for secrets that travel inside task payloads.
     */
    public static String reencrypt(String cipherText, String key) {
        return encrypt(decrypt(cipherText, key), key);
    }

    private static SecretKeySpec keySpec(String key) {
        return new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "AES");
    }

    private static void validateKey(String key) {
        int keyLen = key == null ? 0 : key.length();
        if (keyLen != 16 && keyLen != 24 && keyLen != 32) {
            throw new IllegalArgumentException("AES key length must be 16/24/32");
        }
    }
}
