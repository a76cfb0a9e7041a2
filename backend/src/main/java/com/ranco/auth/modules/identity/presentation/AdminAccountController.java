package com.ranco.auth.modules.identity.presentation;

import java.util.UUID;

import com.ranco.auth.global.tx.ExecutionContextFactory;
import com.ranco.auth.modules.identity.application.AccountAdminService;
import com.ranco.auth.modules.identity.presentation.dto.AccountSummaryResponse;
import com.ranco.auth.modules.identity.presentation.dto.ChangeStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/accounts")
public class AdminAccountController {

    private final AccountAdminService accountAdminService;
    private final ExecutionContextFactory executionContextFactory;

    public AdminAccountController(AccountAdminService accountAdminService, ExecutionContextFactory executionContextFactory) {
        this.accountAdminService = accountAdminService;
        this.executionContextFactory = executionContextFactory;
    }

    @Operation(summary = "Change account status", description = "Banning or deleting an account revokes its sessions.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "403", description = "Admin role required"),
            @ApiResponse(responseCode = "404", description = "Unknown account"),
            @ApiResponse(responseCode = "409", description = "Transition not allowed")
    })
    @PatchMapping("/{accountId}/status")
    public ResponseEntity<AccountSummaryResponse> changeStatus(
            @PathVariable("accountId") UUID accountId,
            @Valid @RequestBody ChangeStatusRequest request
    ) {
        return ResponseEntity.ok(accountAdminService.changeStatus(
                executionContextFactory.forRequest(), accountId, request.status()));
    }
}
