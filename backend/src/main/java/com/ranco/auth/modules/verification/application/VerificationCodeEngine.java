package com.ranco.auth.modules.verification.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.ranco.auth.global.crypto.CredentialHasher;
import com.ranco.auth.global.crypto.SecretGenerator;
import com.ranco.auth.global.tx.UnitOfWork;
import com.ranco.auth.modules.verification.domain.CodeVerdict;
import com.ranco.auth.modules.verification.domain.IssuedCode;
import com.ranco.auth.modules.verification.domain.VerificationCode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Issues and checks one-time codes.
 *
 * <p>At most one unconsumed code exists per auth method: {@link #issue} supersedes every open
 * code before inserting, and the store backs this with a partial unique index. Expired codes
 * are rejected before any hash comparison and are never auto-consumed. A code whose attempts
 * reached {@code app.identity.max-attempts} is unusable until a new one is issued.
 */
@Component
public class VerificationCodeEngine {

    private static final Logger log = LoggerFactory.getLogger(VerificationCodeEngine.class);

    private final CredentialHasher credentialHasher;
    private final SecretGenerator secretGenerator;
    private final Clock clock;
    private final int codeLength;
    private final int maxAttempts;

    public VerificationCodeEngine(
            CredentialHasher credentialHasher,
            SecretGenerator secretGenerator,
            Clock clock,
            @Value("${app.identity.code-length:6}") int codeLength,
            @Value("${app.identity.max-attempts:5}") int maxAttempts
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("app.identity.max-attempts must be positive");
        }
        if (codeLength < SecretGenerator.MIN_CODE_LENGTH || codeLength > SecretGenerator.MAX_CODE_LENGTH) {
            throw new IllegalArgumentException("app.identity.code-length must be between "
                    + SecretGenerator.MIN_CODE_LENGTH + " and " + SecretGenerator.MAX_CODE_LENGTH);
        }
        this.credentialHasher = credentialHasher;
        this.secretGenerator = secretGenerator;
        this.clock = clock;
        this.codeLength = codeLength;
        this.maxAttempts = maxAttempts;
    }

    public IssuedCode issue(UnitOfWork uow, UUID authMethodId, Duration ttl) {
        Objects.requireNonNull(authMethodId, "authMethodId is required");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int superseded = uow.verificationCodes().supersedeOpenCodes(authMethodId, now);
        if (superseded > 0) {
            log.debug("Superseded {} open code(s) for auth method {}", superseded, authMethodId);
        }

        String plaintext = secretGenerator.numericCode(codeLength);
        OffsetDateTime expiresAt = now.plus(ttl);
        VerificationCode saved = uow.verificationCodes()
                .saveAndFlush(new VerificationCode(authMethodId, credentialHasher.hash(plaintext), expiresAt));
        return new IssuedCode(saved.getId(), plaintext, expiresAt);
    }

    /**
     * Checks {@code supplied} against the active code. Callers that need the attempt increment
     * of a {@link CodeVerdict#REJECTED} verdict to survive must commit before failing.
     */
    public CodeVerdict validate(UnitOfWork uow, UUID authMethodId, String supplied) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<VerificationCode> active = uow.verificationCodes().findActive(authMethodId, now);
        if (active.isEmpty()) {
            return CodeVerdict.NO_ACTIVE_CODE;
        }
        VerificationCode code = active.get();
        if (code.getAttempts() >= maxAttempts) {
            log.warn("Verification code {} exhausted after {} attempts", code.getId(), code.getAttempts());
            return CodeVerdict.ATTEMPTS_EXHAUSTED;
        }
        if (supplied == null || !credentialHasher.matches(supplied, code.getCodeHash())) {
            // 0 rows: another validation used the last attempt first
            if (uow.verificationCodes().incrementAttempts(code.getId(), maxAttempts) == 0) {
                return CodeVerdict.ATTEMPTS_EXHAUSTED;
            }
            return CodeVerdict.REJECTED;
        }
        // a concurrent validation may have consumed it between the read and this update
        if (uow.verificationCodes().consume(code.getId(), now) == 0) {
            return CodeVerdict.NO_ACTIVE_CODE;
        }
        return CodeVerdict.ACCEPTED;
    }
}
