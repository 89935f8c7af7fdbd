package com.example.librarysync.application.service;

import java.util.List;
import java.util.Map;

/**
 * Field access on raw catalog records. Numbers may arrive as JSON numbers or as strings.
 */
final class CatalogRecords {

    static final String ID = "id";
    static final String DELETED = "deleted";
    static final String LAST_MODIFIED = "lastModifiedTimestamp";
    static final String DURATION = "durationMillis";

    private CatalogRecords() {
    }

    static String id(Map<String, Object> record) {
        Object value = record.get(ID);
        return value == null ? null : String.valueOf(value);
    }

    static boolean isDeleted(Map<String, Object> record) {
        Object value = record.get(DELETED);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(String.valueOf(value).trim());
    }

    /**
     * @return the value as a long, or null when the key is missing or the value is not an integer
     */
    static Long longValue(Map<String, Object> record, String key) {
        Object value = record.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String text(Map<String, Object> record, String key) {
        Object value = record.get(key);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Reads {@code record[key][0].url}, the shape art references come in.
     */
    @SuppressWarnings("unchecked")
    static String firstRefUrl(Map<String, Object> record, String key) {
        Object value = record.get(key);
        if (!(value instanceof List) || ((List<?>) value).isEmpty()) {
            return null;
        }
        Object first = ((List<?>) value).get(0);
        if (!(first instanceof Map)) {
            return null;
        }
        Object url = ((Map<String, Object>) first).get("url");
        return url == null ? null : String.valueOf(url);
    }
}
