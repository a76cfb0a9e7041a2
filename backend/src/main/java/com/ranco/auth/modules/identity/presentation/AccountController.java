package com.ranco.auth.modules.identity.presentation;

import com.ranco.auth.global.security.SecurityUtils;
import com.ranco.auth.global.tx.ExecutionContextFactory;
import com.ranco.auth.modules.identity.application.IdentityService;
import com.ranco.auth.modules.identity.presentation.dto.AccountProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/accounts")
public class AccountController {

    private final IdentityService identityService;
    private final ExecutionContextFactory executionContextFactory;

    public AccountController(IdentityService identityService, ExecutionContextFactory executionContextFactory) {
        this.identityService = identityService;
        this.executionContextFactory = executionContextFactory;
    }

    @Operation(summary = "Current account")
    @GetMapping("/me")
    public ResponseEntity<AccountProfileResponse> me() {
        return ResponseEntity.ok(identityService.currentAccount(
                executionContextFactory.forRequest(), SecurityUtils.getCurrentAccountId()));
    }
}
