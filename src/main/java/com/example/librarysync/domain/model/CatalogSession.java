package com.example.librarysync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * An authenticated catalog session. Valid only inside the task invocation that opened it.
 */
@Getter
@AllArgsConstructor
public class CatalogSession {

    private final String username;

    private final String token;
}
