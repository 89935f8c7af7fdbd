package com.example.librarysync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CatalogCredentials {

    private final String username;

    private final String password;

    @Override
    public String toString() {
        return "CatalogCredentials(username=" + username + ", password=***)";
    }
}
