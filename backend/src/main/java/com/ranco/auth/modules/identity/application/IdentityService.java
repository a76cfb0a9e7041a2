package com.ranco.auth.modules.identity.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.ranco.auth.global.error.ErrorKind;
import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.global.tx.ExecutionContext;
import com.ranco.auth.global.tx.TransactionCoordinator;
import com.ranco.auth.global.tx.UnitOfWork;
import com.ranco.auth.modules.account.application.AccountLifecycle;
import com.ranco.auth.modules.account.domain.Account;
import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;
import com.ranco.auth.modules.authmethod.application.AuthMethodBinding;
import com.ranco.auth.modules.authmethod.domain.AuthMethod;
import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.identity.domain.IdentityEvent;
import com.ranco.auth.modules.identity.presentation.dto.AccessTokenResponse;
import com.ranco.auth.modules.identity.presentation.dto.AccountProfileResponse;
import com.ranco.auth.modules.identity.presentation.dto.AccountSummaryResponse;
import com.ranco.auth.modules.identity.presentation.dto.LoginCodeResponse;
import com.ranco.auth.modules.identity.presentation.dto.LoginResponse;
import com.ranco.auth.modules.identity.presentation.dto.RegisterResponse;
import com.ranco.auth.modules.identity.presentation.dto.TokenPairResponse;
import com.ranco.auth.modules.identity.presentation.dto.VerifyResponse;
import com.ranco.auth.modules.session.application.SessionManager;
import com.ranco.auth.modules.session.application.TokenIssuer;
import com.ranco.auth.modules.session.application.TokenIssuer.AccessClaims;
import com.ranco.auth.modules.session.application.TokenIssuer.SignedAccessToken;
import com.ranco.auth.modules.session.domain.ClientMeta;
import com.ranco.auth.modules.session.domain.IssuedSession;
import com.ranco.auth.modules.verification.application.VerificationCodeEngine;
import com.ranco.auth.modules.verification.domain.CodeVerdict;
import com.ranco.auth.modules.verification.domain.IssuedCode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Identity flows. Each flow is one unit of work on the {@link TransactionCoordinator}; events
 * and code delivery happen only after it committed.
 *
 * <p>Flows whose failure must still persist an attempt increment return an outcome from the
 * unit of work and throw after the commit.
 */
@Service
public class IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final TransactionCoordinator transactionCoordinator;
    private final AccountLifecycle accountLifecycle;
    private final AuthMethodBinding authMethodBinding;
    private final VerificationCodeEngine verificationCodeEngine;
    private final SessionManager sessionManager;
    private final TokenIssuer tokenIssuer;
    private final IdentityEventDispatcher eventDispatcher;
    private final Map<AuthProvider, ProviderAssertionVerifier> assertionVerifiers;
    private final Clock clock;
    private final Duration codeTtl;
    private final boolean verifyIssuesSession;

    public IdentityService(
            TransactionCoordinator transactionCoordinator,
            AccountLifecycle accountLifecycle,
            AuthMethodBinding authMethodBinding,
            VerificationCodeEngine verificationCodeEngine,
            SessionManager sessionManager,
            TokenIssuer tokenIssuer,
            IdentityEventDispatcher eventDispatcher,
            List<ProviderAssertionVerifier> assertionVerifiers,
            Clock clock,
            @Value("${app.identity.code-ttl:PT5M}") Duration codeTtl,
            @Value("${app.identity.verify-issues-session:true}") boolean verifyIssuesSession
    ) {
        this.transactionCoordinator = transactionCoordinator;
        this.accountLifecycle = accountLifecycle;
        this.authMethodBinding = authMethodBinding;
        this.verificationCodeEngine = verificationCodeEngine;
        this.sessionManager = sessionManager;
        this.tokenIssuer = tokenIssuer;
        this.eventDispatcher = eventDispatcher;
        this.assertionVerifiers = new EnumMap<>(AuthProvider.class);
        for (ProviderAssertionVerifier verifier : assertionVerifiers) {
            this.assertionVerifiers.put(verifier.provider(), verifier);
        }
        this.clock = clock;
        this.codeTtl = codeTtl;
        this.verifyIssuesSession = verifyIssuesSession;
    }

    public RegisterResponse register(ExecutionContext context, AuthProvider provider, String externalId) {
        Registration registration;
        try {
            registration = transactionCoordinator.runAtomic(context, uow -> {
                if (authMethodBinding.findByProvider(uow, provider, externalId).isPresent()) {
                    throw IdentityException.conflict(IdentityException.ACCOUNT_ALREADY_EXISTS);
                }
                return registerWithin(uow, provider, externalId);
            });
        } catch (IdentityException ex) {
            throw asAlreadyExists(ex);
        }

        Account account = registration.account();
        log.info("Registered account {} via {}", account.getId(), provider);
        eventDispatcher.emit(IdentityEvent.ACCOUNT_REGISTERED, account.getId(), Map.of("provider", provider.name()));
        if (registration.code() != null) {
            eventDispatcher.deliverCode(account.getId(), provider, externalId, registration.code());
        }
        return new RegisterResponse(
                account.getId(),
                account.getStatus(),
                registration.code() != null,
                registration.code() != null ? registration.code().expiresAt() : null
        );
    }

    public VerifyResponse verifyCode(ExecutionContext context, AuthProvider provider, String externalId,
                                     String code, ClientMeta clientMeta) {
        Authentication outcome = transactionCoordinator.runAtomic(context, uow -> {
            AuthMethod method = authMethodBinding.findByProvider(uow, provider, externalId)
                    .orElseThrow(() -> IdentityException.notFound(IdentityException.ACCOUNT_NOT_FOUND));
            Account account = accountLifecycle.get(uow, method.getAccountId());
            if (account.getStatus() != AccountStatus.PENDING) {
                throw IdentityException.conflict(IdentityException.INVALID_ACCOUNT_STATE);
            }
            CodeVerdict verdict = verificationCodeEngine.validate(uow, method.getId(), code);
            if (!verdict.isAccepted()) {
                return Authentication.rejected(account, verdict);
            }
            authMethodBinding.markVerified(uow, method.getId());
            Account activated = accountLifecycle.setStatus(uow, account.getId(), AccountStatus.ACTIVE);
            if (!verifyIssuesSession) {
                return Authentication.accepted(activated, null, null);
            }
            return startAuthenticatedSession(uow, method, activated, clientMeta);
        });

        Account account = outcome.account();
        if (!outcome.verdict().isAccepted()) {
            log.info("Verification rejected for account {}: {}", account.getId(), outcome.verdict());
            throw IdentityException.invalidOrExpiredCode();
        }
        log.info("Verified account {}", account.getId());
        eventDispatcher.emit(IdentityEvent.ACCOUNT_VERIFIED, account.getId(), Map.of("provider", provider.name()));
        if (outcome.session() != null) {
            eventDispatcher.emit(IdentityEvent.SESSION_STARTED, account.getId(), sessionAttributes(outcome.session(), clientMeta));
        }
        return new VerifyResponse(AccountSummaryResponse.from(account), toTokenPair(outcome));
    }

    public LoginCodeResponse requestLoginCode(ExecutionContext context, AuthProvider provider, String externalId) {
        IssuedLoginCode issued = transactionCoordinator.runAtomic(context, uow -> {
            AuthMethod method = authMethodBinding.findByProvider(uow, provider, externalId)
                    .filter(candidate -> candidate.getProvider().usesVerificationCode())
                    .filter(AuthMethod::isVerified)
                    .orElseThrow(IdentityException::invalidCredentials);
            Account account = accountLifecycle.get(uow, method.getAccountId());
            if (!account.isActive()) {
                throw IdentityException.invalidAccountState();
            }
            return new IssuedLoginCode(account.getId(), verificationCodeEngine.issue(uow, method.getId(), codeTtl));
        });

        log.info("Issued login code for account {}", issued.accountId());
        eventDispatcher.deliverCode(issued.accountId(), provider, externalId, issued.code());
        eventDispatcher.emit(IdentityEvent.LOGIN_CODE_REQUESTED, issued.accountId(), Map.of("provider", provider.name()));
        long expiresIn = Math.max(0L, Duration.between(OffsetDateTime.now(clock), issued.code().expiresAt()).getSeconds());
        return new LoginCodeResponse(expiresIn, issued.code().expiresAt());
    }

    public LoginResponse completeLogin(ExecutionContext context, AuthProvider provider, String externalId,
                                       String code, ClientMeta clientMeta) {
        Authentication outcome = transactionCoordinator.runAtomic(context, uow -> {
            AuthMethod method = authMethodBinding.findByProvider(uow, provider, externalId)
                    .orElseThrow(IdentityException::invalidOrExpiredCode);
            Account account = accountLifecycle.get(uow, method.getAccountId());
            if (!account.isActive()) {
                throw IdentityException.invalidAccountState();
            }
            CodeVerdict verdict = verificationCodeEngine.validate(uow, method.getId(), code);
            if (!verdict.isAccepted()) {
                return Authentication.rejected(account, verdict);
            }
            return startAuthenticatedSession(uow, method, account, clientMeta);
        });

        Account account = outcome.account();
        if (!outcome.verdict().isAccepted()) {
            log.info("Login rejected for account {}: {}", account.getId(), outcome.verdict());
            throw IdentityException.invalidOrExpiredCode();
        }
        log.info("Completed login for account {}", account.getId());
        eventDispatcher.emit(IdentityEvent.SESSION_STARTED, account.getId(), sessionAttributes(outcome.session(), clientMeta));
        return new LoginResponse(toTokenPair(outcome), AccountSummaryResponse.from(account));
    }

    /**
     * Sign-in through an OAuth-class provider. A subject seen for the first time is registered
     * on the spot, already active and verified.
     */
    public LoginResponse providerLogin(ExecutionContext context, AuthProvider provider, String assertion,
                                       ClientMeta clientMeta) {
        ProviderAssertionVerifier verifier = assertionVerifiers.get(provider);
        if (provider.usesVerificationCode() || verifier == null) {
            throw IdentityException.invalidCredentials();
        }
        String subject = verifier.verifySubject(assertion);

        ProviderSignIn signIn;
        try {
            signIn = transactionCoordinator.runAtomic(context, uow -> providerSignInWithin(uow, provider, subject, clientMeta));
        } catch (IdentityException ex) {
            if (ex.getKind() != ErrorKind.CONFLICT) {
                throw ex;
            }
            // a concurrent first sign-in bound the subject; it exists now
            log.debug("Retrying provider sign-in after concurrent registration");
            signIn = transactionCoordinator.runAtomic(context, uow -> providerSignInWithin(uow, provider, subject, clientMeta));
        }

        Authentication outcome = signIn.authentication();
        UUID accountId = outcome.account().getId();
        if (signIn.registered()) {
            log.info("Registered account {} via {}", accountId, provider);
            eventDispatcher.emit(IdentityEvent.ACCOUNT_REGISTERED, accountId, Map.of("provider", provider.name()));
        }
        log.info("Completed {} login for account {}", provider, accountId);
        eventDispatcher.emit(IdentityEvent.SESSION_STARTED, accountId, sessionAttributes(outcome.session(), clientMeta));
        return new LoginResponse(toTokenPair(outcome), AccountSummaryResponse.from(outcome.account()));
    }

    /**
     * Mints a new access credential for a live session. The refresh secret is not rotated.
     */
    public AccessTokenResponse refreshAccess(ExecutionContext context, String refreshToken) {
        SignedAccessToken access = transactionCoordinator.runReadOnly(context, uow -> {
            UUID accountId = sessionManager.validate(uow, refreshToken);
            Account account = uow.accounts().findById(accountId).orElseThrow(IdentityException::invalidToken);
            if (!account.isActive()) {
                throw IdentityException.invalidAccountState();
            }
            return tokenIssuer.signAccessToken(new AccessClaims(account.getId(), account.getRole(), account.getStatus()));
        });
        return new AccessTokenResponse(
                access.token(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                access.expiresInSeconds(),
                access.issuedAt()
        );
    }

    /**
     * Unknown, expired or already revoked tokens are ignored so the response does not reveal
     * whether a token was live.
     */
    public void logout(ExecutionContext context, String refreshToken) {
        Optional<UUID> revokedFor;
        try {
            revokedFor = transactionCoordinator.runAtomic(context, uow -> sessionManager.findActive(uow, refreshToken)
                    .map(token -> {
                        sessionManager.revoke(uow, token.getId());
                        return token.getAccountId();
                    }));
        } catch (IdentityException ex) {
            if (!SessionManager.SESSION_NOT_FOUND.equals(ex.getCode())) {
                throw ex;
            }
            revokedFor = Optional.empty();
        }

        if (revokedFor.isEmpty()) {
            log.debug("Logout with an inactive refresh token");
            return;
        }
        log.info("Logged out account {}", revokedFor.get());
        eventDispatcher.emit(IdentityEvent.SESSION_REVOKED, revokedFor.get(), Map.of());
    }

    public int globalLogout(ExecutionContext context, UUID accountId) {
        int revoked = transactionCoordinator.runAtomic(context, uow -> {
            accountLifecycle.get(uow, accountId);
            return sessionManager.revokeAll(uow, accountId);
        });
        log.info("Revoked {} session(s) of account {}", revoked, accountId);
        eventDispatcher.emit(IdentityEvent.SESSION_REVOKED_ALL, accountId, Map.of("revoked", String.valueOf(revoked)));
        return revoked;
    }

    public AccountProfileResponse currentAccount(ExecutionContext context, UUID accountId) {
        return transactionCoordinator.runReadOnly(context, uow -> {
            Account account = accountLifecycle.get(uow, accountId);
            Optional<AuthMethod> method = authMethodBinding.findByAccount(uow, accountId);
            return new AccountProfileResponse(
                    account.getId(),
                    account.getRole(),
                    account.getStatus(),
                    method.map(AuthMethod::getProvider).orElse(null),
                    method.map(AuthMethod::isVerified).orElse(false),
                    method.map(AuthMethod::getLastLoginAt).orElse(null),
                    account.getCreatedAt()
            );
        });
    }

    private Registration registerWithin(UnitOfWork uow, AuthProvider provider, String externalId) {
        boolean codeVerified = provider.usesVerificationCode();
        Account account = accountLifecycle.create(uow, AccountRole.USER,
                codeVerified ? AccountStatus.PENDING : AccountStatus.ACTIVE);
        AuthMethod method = authMethodBinding.create(uow, account.getId(), provider, externalId, !codeVerified);
        IssuedCode code = codeVerified ? verificationCodeEngine.issue(uow, method.getId(), codeTtl) : null;
        return new Registration(account, method, code);
    }

    private ProviderSignIn providerSignInWithin(UnitOfWork uow, AuthProvider provider, String subject,
                                                ClientMeta clientMeta) {
        Optional<AuthMethod> existing = authMethodBinding.findByProvider(uow, provider, subject);
        AuthMethod method;
        Account account;
        if (existing.isPresent()) {
            method = existing.get();
            account = accountLifecycle.get(uow, method.getAccountId());
        } else {
            Registration registration = registerWithin(uow, provider, subject);
            method = registration.method();
            account = registration.account();
        }
        if (!account.isActive()) {
            throw IdentityException.invalidAccountState();
        }
        return new ProviderSignIn(startAuthenticatedSession(uow, method, account, clientMeta), existing.isEmpty());
    }

    private Authentication startAuthenticatedSession(UnitOfWork uow, AuthMethod method, Account account,
                                                     ClientMeta clientMeta) {
        authMethodBinding.recordLogin(uow, method.getId(), OffsetDateTime.now(clock));
        IssuedSession session = sessionManager.startSession(uow, account.getId(), clientMeta);
        SignedAccessToken access = tokenIssuer.signAccessToken(
                new AccessClaims(account.getId(), account.getRole(), account.getStatus()));
        return Authentication.accepted(account, session, access);
    }

    private static IdentityException asAlreadyExists(IdentityException ex) {
        if (ex.getKind() != ErrorKind.CONFLICT || IdentityException.ACCOUNT_ALREADY_EXISTS.equals(ex.getCode())) {
            return ex;
        }
        return IdentityException.conflict(IdentityException.ACCOUNT_ALREADY_EXISTS, ex);
    }

    private static TokenPairResponse toTokenPair(Authentication outcome) {
        if (outcome.session() == null) {
            return null;
        }
        SignedAccessToken access = outcome.access();
        return new TokenPairResponse(
                access.token(),
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                access.expiresInSeconds(),
                outcome.session().refreshToken(),
                outcome.session().expiresAt(),
                access.issuedAt()
        );
    }

    private static Map<String, String> sessionAttributes(IssuedSession session, ClientMeta clientMeta) {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("sessionId", session.tokenId().toString());
        if (clientMeta != null && clientMeta.ipAddress() != null) {
            attributes.put("ipAddress", clientMeta.ipAddress());
        }
        return attributes;
    }

    private record Registration(Account account, AuthMethod method, IssuedCode code) {
    }

    private record IssuedLoginCode(UUID accountId, IssuedCode code) {
    }

    private record ProviderSignIn(Authentication authentication, boolean registered) {
    }

    private record Authentication(Account account, CodeVerdict verdict, IssuedSession session, SignedAccessToken access) {

        static Authentication accepted(Account account, IssuedSession session, SignedAccessToken access) {
            return new Authentication(account, CodeVerdict.ACCEPTED, session, access);
        }

        static Authentication rejected(Account account, CodeVerdict verdict) {
            return new Authentication(account, verdict, null, null);
        }
    }
}
