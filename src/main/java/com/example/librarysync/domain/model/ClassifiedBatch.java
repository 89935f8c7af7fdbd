package com.example.librarysync.domain.model;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One page split into disjoint delete / merge / skip buckets, each in page order.
 */
@Getter
@AllArgsConstructor
public class ClassifiedBatch {

    private final List<String> allIds;

    private final List<Map<String, Object>> deletes;

    private final List<Map<String, Object>> merges;

    private final List<Map<String, Object>> skips;

    public int getNumDeletes() {
        return deletes.size();
    }

    public int getNumMerges() {
        return merges.size();
    }

    public int getNumSkips() {
        return skips.size();
    }

    /**
     * Records that remain in the library after this page is applied.
     */
    public int getNumRetained() {
        return merges.size() + skips.size();
    }
}
