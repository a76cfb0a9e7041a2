package com.ranco.auth.modules.identity.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.ranco.auth.global.tx.ExecutionContext;
import com.ranco.auth.global.tx.TransactionCoordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Purges refresh tokens and verification codes that can never become active again.
 */
@Service
public class CredentialRetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(CredentialRetentionScheduler.class);

    private final TransactionCoordinator transactionCoordinator;
    private final Clock clock;
    private final Duration refreshTokenRetention;
    private final Duration verificationCodeRetention;

    public CredentialRetentionScheduler(
            TransactionCoordinator transactionCoordinator,
            Clock clock,
            @Value("${app.identity.retention.refresh-token-retention:P30D}") Duration refreshTokenRetention,
            @Value("${app.identity.retention.verification-code-retention:P7D}") Duration verificationCodeRetention
    ) {
        this.transactionCoordinator = transactionCoordinator;
        this.clock = clock;
        this.refreshTokenRetention = refreshTokenRetention;
        this.verificationCodeRetention = verificationCodeRetention;
    }

    @Scheduled(cron = "${app.identity.retention.cron:0 17 * * * *}")
    public void purgeInertCredentials() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PurgeResult result = transactionCoordinator.runAtomic(ExecutionContext.background(), uow -> new PurgeResult(
                uow.refreshTokens().deleteInert(now.minus(refreshTokenRetention)),
                uow.verificationCodes().deleteInert(now.minus(verificationCodeRetention))
        ));
        if (result.refreshTokens() > 0 || result.verificationCodes() > 0) {
            log.info("Purged {} refresh token(s) and {} verification code(s)",
                    result.refreshTokens(), result.verificationCodes());
        }
    }

    record PurgeResult(int refreshTokens, int verificationCodes) {
    }
}
