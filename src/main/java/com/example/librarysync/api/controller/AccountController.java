package com.example.librarysync.api.controller;

import com.example.librarysync.api.request.CreateAccountRequest;
import com.example.librarysync.api.response.AccountResponse;
import com.example.librarysync.api.response.ApiResponse;
import com.example.librarysync.application.service.AccountService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @PostMapping
    public ApiResponse<AccountResponse> register(@Valid @RequestBody CreateAccountRequest request) {
        return ApiResponse.success(accountService.register(request));
    }
}
