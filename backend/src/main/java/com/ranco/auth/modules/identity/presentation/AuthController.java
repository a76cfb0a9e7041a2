package com.ranco.auth.modules.identity.presentation;

import java.util.Locale;

import com.ranco.auth.global.security.SecurityUtils;
import com.ranco.auth.global.tx.ExecutionContextFactory;
import com.ranco.auth.global.web.ClientMetaResolver;
import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.identity.application.IdentityService;
import com.ranco.auth.modules.identity.presentation.dto.AccessTokenResponse;
import com.ranco.auth.modules.identity.presentation.dto.CodeRequest;
import com.ranco.auth.modules.identity.presentation.dto.EmailRequest;
import com.ranco.auth.modules.identity.presentation.dto.LoginCodeResponse;
import com.ranco.auth.modules.identity.presentation.dto.LoginResponse;
import com.ranco.auth.modules.identity.presentation.dto.LogoutRequest;
import com.ranco.auth.modules.identity.presentation.dto.ProviderLoginRequest;
import com.ranco.auth.modules.identity.presentation.dto.RefreshRequest;
import com.ranco.auth.modules.identity.presentation.dto.RegisterResponse;
import com.ranco.auth.modules.identity.presentation.dto.VerifyResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final IdentityService identityService;
    private final ExecutionContextFactory executionContextFactory;
    private final ClientMetaResolver clientMetaResolver;

    public AuthController(
            IdentityService identityService,
            ExecutionContextFactory executionContextFactory,
            ClientMetaResolver clientMetaResolver
    ) {
        this.identityService = identityService;
        this.executionContextFactory = executionContextFactory;
        this.clientMetaResolver = clientMetaResolver;
    }

    @Operation(summary = "Register with an email address", description = "Creates a pending account and mails a verification code.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created, verification pending"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Invalid email")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody EmailRequest request) {
        RegisterResponse response = identityService.register(
                executionContextFactory.forRequest(), AuthProvider.EMAIL, normalizeEmail(request.email()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Verify an email address", description = "Consumes the registration code and activates the account.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Account activated"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired code"),
            @ApiResponse(responseCode = "404", description = "Unknown account"),
            @ApiResponse(responseCode = "409", description = "Account is not pending verification")
    })
    @PostMapping("/verify")
    public ResponseEntity<VerifyResponse> verify(@Valid @RequestBody CodeRequest request, HttpServletRequest httpRequest) {
        VerifyResponse response = identityService.verifyCode(
                executionContextFactory.forRequest(),
                AuthProvider.EMAIL,
                normalizeEmail(request.email()),
                request.code(),
                clientMetaResolver.resolve(httpRequest)
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Request a login code")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Code issued"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "403", description = "Account not active")
    })
    @PostMapping("/login/code")
    public ResponseEntity<LoginCodeResponse> requestLoginCode(@Valid @RequestBody EmailRequest request) {
        LoginCodeResponse response = identityService.requestLoginCode(
                executionContextFactory.forRequest(), AuthProvider.EMAIL, normalizeEmail(request.email()));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Log in with a code", description = "Starts a new session and revokes any previous one.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired code"),
            @ApiResponse(responseCode = "403", description = "Account not active")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody CodeRequest request, HttpServletRequest httpRequest) {
        LoginResponse response = identityService.completeLogin(
                executionContextFactory.forRequest(),
                AuthProvider.EMAIL,
                normalizeEmail(request.email()),
                request.code(),
                clientMetaResolver.resolve(httpRequest)
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Log in with a provider assertion", description = "First sign-in registers the account.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged in"),
            @ApiResponse(responseCode = "401", description = "Assertion rejected"),
            @ApiResponse(responseCode = "403", description = "Account not active")
    })
    @PostMapping("/oauth/{provider}")
    public ResponseEntity<LoginResponse> providerLogin(
            @PathVariable("provider") String provider,
            @Valid @RequestBody ProviderLoginRequest request,
            HttpServletRequest httpRequest
    ) {
        LoginResponse response = identityService.providerLogin(
                executionContextFactory.forRequest(),
                parseProvider(provider),
                request.assertion(),
                clientMetaResolver.resolve(httpRequest)
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Mint a new access token from a refresh token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Access token issued"),
            @ApiResponse(responseCode = "401", description = "Refresh token invalid"),
            @ApiResponse(responseCode = "403", description = "Account not active")
    })
    @PostMapping("/refresh")
    public ResponseEntity<AccessTokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(identityService.refreshAccess(executionContextFactory.forRequest(), request.refreshToken()));
    }

    @Operation(summary = "End the current session")
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        identityService.logout(executionContextFactory.forRequest(), request.refreshToken());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "End every session of the caller")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Sessions revoked"),
            @ApiResponse(responseCode = "401", description = "Access token required")
    })
    @PostMapping("/logout/all")
    public ResponseEntity<Void> logoutAll() {
        identityService.globalLogout(executionContextFactory.forRequest(), SecurityUtils.getCurrentAccountId());
        return ResponseEntity.noContent().build();
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static AuthProvider parseProvider(String provider) {
        try {
            return AuthProvider.fromCode(provider);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "UNKNOWN_PROVIDER", ex);
        }
    }
}
