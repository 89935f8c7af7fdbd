package com.example.librarysync.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.List;

public final class HashUtil {

    private static final String FINGERPRINT_SEPARATOR = "::";

    private HashUtil() {
    }

    /**
     * Order-sensitive fingerprint of a page of record ids: MD5 of the ids joined by {@code "::"},
     * URL-safe base64 encoded.
     */
    public static String batchFingerprint(List<String> recordIds) {
        String joined = String.join(FINGERPRINT_SEPARATOR, recordIds);
        return Base64.getUrlEncoder().encodeToString(md5(joined));
    }

    /**
     * Fingerprint of one delivered page. Pages with records use {@link #batchFingerprint(List)};
     * an empty page has no ids to tell it apart, so it is keyed by {@code runId#batchNum} instead.
     */
    public static String batchFingerprint(List<String> recordIds, String runId, int batchNum) {
        if (recordIds == null || recordIds.isEmpty()) {
            return Base64.getUrlEncoder().encodeToString(md5(runId + "#" + batchNum));
        }
        return batchFingerprint(recordIds);
    }

    private static byte[] md5(String text) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("MD5");
            return messageDigest.digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }
}
