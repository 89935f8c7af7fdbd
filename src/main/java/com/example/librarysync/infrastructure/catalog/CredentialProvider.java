package com.example.librarysync.infrastructure.catalog;

import com.example.librarysync.domain.model.CatalogCredentials;

public interface CredentialProvider {

    /**
     * Resolves the catalog credentials of an account from an encrypted password carried in a task.
     */
    CatalogCredentials credentialsFor(Long accountId, String passwordEnc);
}
