package com.example.librarysync.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class HashUtilTest {

    @Test
    void shouldProduceUrlSafeMd5OfJoinedIds() {
        // md5("") = d41d8cd98f00b204e9800998ecf8427e
        assertEquals("1B2M2Y8AsgTpgAmY7PhCfg==", HashUtil.batchFingerprint(Collections.emptyList()));
    }

    @Test
    void shouldBeStableForTheSamePage() {
        String first = HashUtil.batchFingerprint(Arrays.asList("t-1", "t-2", "t-3"));
        String second = HashUtil.batchFingerprint(Arrays.asList("t-1", "t-2", "t-3"));

        assertEquals(first, second);
        assertTrue(first.matches("[A-Za-z0-9_\\-=]+"));
    }

    @Test
    void shouldDependOnOrderAndSeparator() {
        String ordered = HashUtil.batchFingerprint(Arrays.asList("a", "b"));

        assertNotEquals(ordered, HashUtil.batchFingerprint(Arrays.asList("b", "a")));
        assertNotEquals(ordered, HashUtil.batchFingerprint(Collections.singletonList("ab")));
        assertEquals(HashUtil.batchFingerprint(Collections.singletonList("a::b")), ordered);
    }

    @Test
    void shouldKeyEmptyPageByRunAndBatchNumber() {
        String second = HashUtil.batchFingerprint(Collections.emptyList(), "run-1", 2);

        assertEquals(second, HashUtil.batchFingerprint(Collections.emptyList(), "run-1", 2));
        assertNotEquals(second, HashUtil.batchFingerprint(Collections.emptyList(), "run-1", 3));
        assertNotEquals(second, HashUtil.batchFingerprint(Collections.emptyList(), "run-2", 2));
        assertNotEquals(second, HashUtil.batchFingerprint(Collections.emptyList()));
        assertEquals(HashUtil.batchFingerprint(Arrays.asList("a", "b")),
                HashUtil.batchFingerprint(Arrays.asList("a", "b"), "run-1", 2));
    }
}
