package com.example.librarysync.infrastructure.catalog;

import com.example.librarysync.domain.model.CatalogCredentials;
import com.example.librarysync.domain.model.CatalogPage;
import com.example.librarysync.domain.model.CatalogSession;

/**
 * Remote music catalog. Every {@link #openSession} must be paired with {@link #closeSession} in a
 * finally block; sessions are never handed from one task to another.
 */
public interface CatalogClient {

    CatalogSession openSession(CatalogCredentials credentials);

    /**
     * Fetches one page of records.
     *
     * @param continuationToken null for the first page
     * @return the page; its next token is null once the catalog is exhausted
     */
    CatalogPage fetchPage(CatalogSession session, String continuationToken, int pageSize);

    /**
     * Logs out. Failures are logged, never thrown.
     */
    void closeSession(CatalogSession session);
}
