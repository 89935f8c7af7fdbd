package com.example.librarysync.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.librarysync.common.exception.MalformedRecordException;
import com.example.librarysync.domain.model.ClassifiedBatch;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordClassifierTest {

    private final RecordClassifier classifier = new RecordClassifier();

    @Test
    void shouldSplitPageIntoDisjointBuckets() {
        List<Map<String, Object>> page = Arrays.asList(
                record("t1", 100L, false),
                record("t2", 500L, true),
                record("t3", 300L, false),
                record("t4", 50L, false));

        ClassifiedBatch batch = classifier.classify(page, 200L);

        assertEquals(Arrays.asList("t1", "t2", "t3", "t4"), batch.getAllIds());
        assertEquals(1, batch.getNumDeletes());
        assertEquals("t2", batch.getDeletes().get(0).get("id"));
        assertEquals(1, batch.getNumMerges());
        assertEquals("t3", batch.getMerges().get(0).get("id"));
        assertEquals(2, batch.getNumSkips());
        assertEquals("t1", batch.getSkips().get(0).get("id"));
        assertEquals("t4", batch.getSkips().get(1).get("id"));
        assertEquals(3, batch.getNumRetained());
    }

    @Test
    void shouldMergeEverythingLiveWithoutWatermark() {
        List<Map<String, Object>> page = Arrays.asList(
                record("t1", 1L, false),
                record("t2", 2L, true),
                record("t3", 3L, false));

        ClassifiedBatch batch = classifier.classify(page, null);

        assertEquals(2, batch.getNumMerges());
        assertEquals(1, batch.getNumDeletes());
        assertEquals(0, batch.getNumSkips());
    }

    @Test
    void shouldMergeRecordModifiedExactlyAtWatermark() {
        ClassifiedBatch batch = classifier.classify(Collections.singletonList(record("t1", 200L, false)), 200L);

        assertEquals(1, batch.getNumMerges());
        assertEquals(0, batch.getNumSkips());
    }

    @Test
    void shouldReturnEmptyBucketsForEmptyPage() {
        ClassifiedBatch batch = classifier.classify(Collections.emptyList(), 200L);

        assertTrue(batch.getAllIds().isEmpty());
        assertEquals(0, batch.getNumDeletes());
        assertEquals(0, batch.getNumMerges());
        assertEquals(0, batch.getNumSkips());
    }

    @Test
    void shouldAcceptStringEncodedValues() {
        Map<String, Object> deleted = record("t1", 0L, false);
        deleted.put("deleted", "true");
        Map<String, Object> changed = record("t2", 0L, false);
        changed.put("lastModifiedTimestamp", "1700000000000000");

        ClassifiedBatch batch = classifier.classify(Arrays.asList(deleted, changed), 1600000000000000L);

        assertEquals(1, batch.getNumDeletes());
        assertEquals(1, batch.getNumMerges());
    }

    @Test
    void shouldFailOnRecordWithoutId() {
        Map<String, Object> record = record("t1", 1L, false);
        record.remove("id");

        assertThrows(MalformedRecordException.class,
                () -> classifier.classify(Collections.singletonList(record), null));
    }

    private Map<String, Object> record(String id, long lastModified, boolean deleted) {
        Map<String, Object> record = new HashMap<>();
        record.put("id", id);
        record.put("lastModifiedTimestamp", lastModified);
        record.put("deleted", deleted);
        return record;
    }
}
