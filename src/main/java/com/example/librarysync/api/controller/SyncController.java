package com.example.librarysync.api.controller;

import com.example.librarysync.api.response.ApiResponse;
import com.example.librarysync.api.response.SyncStatusResponse;
import com.example.librarysync.api.response.SyncTriggerResponse;
import com.example.librarysync.application.service.LibrarySyncService;
import com.example.librarysync.domain.enumtype.SyncStartResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sync")
public class SyncController {

    private final LibrarySyncService librarySyncService;

    public SyncController(LibrarySyncService librarySyncService) {
        this.librarySyncService = librarySyncService;
    }

    @PostMapping("/accounts/{id}")
    public ApiResponse<SyncTriggerResponse> startSync(@PathVariable("id") Long accountId) {
        SyncStartResult result = librarySyncService.startSync(accountId);
        int started = result == SyncStartResult.STARTED ? 1 : 0;
        return ApiResponse.success(new SyncTriggerResponse(accountId, result.name(), started));
    }

    @PostMapping("/accounts")
    public ApiResponse<SyncTriggerResponse> startAll() {
        return ApiResponse.success(new SyncTriggerResponse(null, null, librarySyncService.startAllEligible()));
    }

    @GetMapping("/accounts/{id}")
    public ApiResponse<SyncStatusResponse> status(@PathVariable("id") Long accountId) {
        return ApiResponse.success(librarySyncService.getStatus(accountId));
    }
}
