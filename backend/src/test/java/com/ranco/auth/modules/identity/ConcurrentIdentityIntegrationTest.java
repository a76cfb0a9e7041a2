package com.ranco.auth.modules.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.ranco.auth.global.crypto.CredentialHasher;
import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.global.tx.ExecutionContext;
import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.identity.application.IdentityService;
import com.ranco.auth.modules.session.domain.ClientMeta;
import com.ranco.auth.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;

@SpringBootTest
class ConcurrentIdentityIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final int THREADS = 6;
    private static final int MAX_ATTEMPTS = 5;

    @Autowired
    private IdentityService identityService;

    @SpyBean
    private CredentialHasher credentialHasher;

    @Test
    void concurrentLoginCodeRequestsLeaveAtMostOneOpenCode() throws Exception {
        String email = "carol@example.com";
        identityService.register(ExecutionContext.background(), AuthProvider.EMAIL, email);
        identityService.verifyCode(ExecutionContext.background(), AuthProvider.EMAIL, email,
                codeSender.lastCodeFor(email).orElseThrow(), ClientMeta.unknown());

        List<Outcome> outcomes = runConcurrently(() -> {
            identityService.requestLoginCode(ExecutionContext.background(), AuthProvider.EMAIL, email);
            return null;
        });

        assertThat(outcomes).anyMatch(Outcome::succeeded);
        assertThat(outcomes).filteredOn(outcome -> !outcome.succeeded())
                .allMatch(outcome -> outcome.failure() instanceof IdentityException);
        Long open = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM verification_codes WHERE consumed_at IS NULL", Long.class);
        assertThat(open).isEqualTo(1L);
    }

    @Test
    void concurrentWrongCodesNeverCompareMoreThanTheAttemptLimit() throws Exception {
        String email = "erin@example.com";
        identityService.register(ExecutionContext.background(), AuthProvider.EMAIL, email);
        identityService.verifyCode(ExecutionContext.background(), AuthProvider.EMAIL, email,
                codeSender.lastCodeFor(email).orElseThrow(), ClientMeta.unknown());
        identityService.requestLoginCode(ExecutionContext.background(), AuthProvider.EMAIL, email);
        String code = codeSender.lastCodeFor(email).orElseThrow();
        String wrong = wrongCode(code);
        clearInvocations(credentialHasher);

        List<Outcome> outcomes = runConcurrently(() -> {
            for (int i = 0; i < 2; i++) {
                assertThatThrownBy(() -> identityService.completeLogin(
                        ExecutionContext.background(), AuthProvider.EMAIL, email, wrong, ClientMeta.unknown()))
                        .isInstanceOfSatisfying(IdentityException.class, ex -> assertThat(ex.getCode())
                                .isEqualTo(IdentityException.INVALID_OR_EXPIRED_CODE));
            }
            return null;
        });

        assertThat(outcomes).allMatch(Outcome::succeeded);
        verify(credentialHasher, atMost(MAX_ATTEMPTS)).matches(anyString(), anyString());
        Integer attempts = jdbcTemplate.queryForObject(
                "SELECT attempts FROM verification_codes WHERE consumed_at IS NULL", Integer.class);
        assertThat(attempts).isEqualTo(MAX_ATTEMPTS);
        assertThatThrownBy(() -> identityService.completeLogin(
                ExecutionContext.background(), AuthProvider.EMAIL, email, code, ClientMeta.unknown()))
                .isInstanceOf(IdentityException.class);
        Long sessions = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM refresh_tokens WHERE revoked_at IS NULL", Long.class);
        assertThat(sessions).isEqualTo(1L);
    }

    @Test
    void concurrentRegistrationsCreateOneAccount() throws Exception {
        String email = "dave@example.com";

        List<Outcome> outcomes = runConcurrently(() -> {
            identityService.register(ExecutionContext.background(), AuthProvider.EMAIL, email);
            return null;
        });

        assertThat(outcomes).filteredOn(Outcome::succeeded).hasSize(1);
        assertThat(outcomes).filteredOn(outcome -> !outcome.succeeded())
                .allSatisfy(outcome -> assertThat(((IdentityException) outcome.failure()).getCode())
                        .isEqualTo(IdentityException.ACCOUNT_ALREADY_EXISTS));
        assertThat(countRows("accounts")).isEqualTo(1);
        assertThat(countRows("auth_methods")).isEqualTo(1);
    }

    @Test
    void concurrentLoginsLeaveOneActiveSession() throws Exception {
        String subject = "valid:google-sub-race";
        identityService.providerLogin(ExecutionContext.background(), AuthProvider.GOOGLE, subject, ClientMeta.unknown());

        List<Outcome> outcomes = runConcurrently(() -> {
            identityService.providerLogin(ExecutionContext.background(), AuthProvider.GOOGLE, subject, ClientMeta.unknown());
            return null;
        });

        assertThat(outcomes).anyMatch(Outcome::succeeded);
        Long active = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM refresh_tokens WHERE revoked_at IS NULL", Long.class);
        assertThat(active).isEqualTo(1L);
    }

    private List<Outcome> runConcurrently(Callable<Void> task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Void>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Void> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    outcomes.add(new Outcome(null));
                } catch (ExecutionException ex) {
                    outcomes.add(new Outcome(ex.getCause()));
                } catch (TimeoutException ex) {
                    throw new IllegalStateException("Concurrent task did not finish", ex);
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static String wrongCode(String code) {
        char last = code.charAt(code.length() - 1);
        return code.substring(0, code.length() - 1) + (last == '9' ? '0' : (char) (last + 1));
    }

    private record Outcome(Throwable failure) {

        boolean succeeded() {
            return failure == null;
        }
    }
}
