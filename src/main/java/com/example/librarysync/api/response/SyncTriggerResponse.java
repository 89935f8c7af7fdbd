package com.example.librarysync.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncTriggerResponse {

    /** Set for a single-account trigger. */
    private Long accountId;

    /** STARTED, ALREADY_SYNCING or DISABLED for a single account; null for a bulk trigger. */
    private String result;

    private int startedCount;
}
