package com.ranco.auth.modules.session.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import com.ranco.auth.global.crypto.SecretGenerator;
import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;
import com.ranco.auth.modules.session.application.TokenIssuer.AccessClaims;
import com.ranco.auth.modules.session.application.TokenIssuer.InvalidAccessTokenException;
import com.ranco.auth.modules.session.application.TokenIssuer.SignedAccessToken;
import com.ranco.auth.modules.session.application.TokenIssuer.VerifiedAccessToken;
import com.ranco.auth.modules.session.infrastructure.jwt.JwtTokenProvider;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "cmFuY28tYXV0aC10ZXN0LXNpZ25pbmcta2V5LTAxMjM0NTY3ODlhYmNkZWY=";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final UUID ACCOUNT_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);
    private final SecretGenerator secretGenerator = new SecretGenerator();

    @Test
    void signedTokenVerifiesWithItsClaims() {
        JwtTokenService service = serviceAt(NOW);

        SignedAccessToken signed = service.signAccessToken(new AccessClaims(ACCOUNT_ID, AccountRole.ADMIN, AccountStatus.ACTIVE));
        VerifiedAccessToken verified = service.verifyAccessToken(signed.token());

        assertThat(signed.expiresInSeconds()).isEqualTo(900L);
        assertThat(verified.accountId()).isEqualTo(ACCOUNT_ID);
        assertThat(verified.role()).isEqualTo(AccountRole.ADMIN);
        assertThat(verified.status()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(verified.expiresAt().toInstant()).isEqualTo(NOW.plusSeconds(900));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = serviceAt(NOW)
                .signAccessToken(new AccessClaims(ACCOUNT_ID, AccountRole.USER, AccountStatus.ACTIVE))
                .token();

        JwtTokenService later = serviceAt(NOW.plus(Duration.ofMinutes(20)));

        assertThatThrownBy(() -> later.verifyAccessToken(token)).isInstanceOf(InvalidAccessTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-signing-key-that-is-long-enough-for-hs256"),
                secretGenerator, 900_000L, Clock.fixed(NOW, ZoneOffset.UTC));
        String foreign = other.signAccessToken(new AccessClaims(ACCOUNT_ID, AccountRole.USER, AccountStatus.ACTIVE)).token();

        assertThatThrownBy(() -> serviceAt(NOW).verifyAccessToken(foreign))
                .isInstanceOf(InvalidAccessTokenException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> serviceAt(NOW).verifyAccessToken("not-a-jwt"))
                .isInstanceOf(InvalidAccessTokenException.class);
    }

    @Test
    void refreshSecretsAreOpaqueAndDistinct() {
        JwtTokenService service = serviceAt(NOW);

        String first = service.mintRefreshSecret();
        String second = service.mintRefreshSecret();

        assertThat(first).hasSize(43).doesNotContain("=", "+", "/");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> new JwtTokenProvider("short"))
                .isInstanceOf(IllegalStateException.class);
    }

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(provider, secretGenerator, 900_000L, Clock.fixed(instant, ZoneOffset.UTC));
    }
}
