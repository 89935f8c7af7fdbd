package com.example.librarysync.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.Getter;

@Getter
public class CatalogPage {

    private final List<Map<String, Object>> records;

    /** Null once the catalog is exhausted. */
    private final String nextToken;

    public CatalogPage(List<Map<String, Object>> records, String nextToken) {
        this.records = records == null ? Collections.emptyList() : records;
        this.nextToken = nextToken;
    }

    public boolean isLast() {
        return nextToken == null;
    }
}
