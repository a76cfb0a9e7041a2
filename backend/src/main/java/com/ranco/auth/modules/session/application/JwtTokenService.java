package com.ranco.auth.modules.session.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.ranco.auth.global.crypto.SecretGenerator;
import com.ranco.auth.modules.account.domain.AccountRole;
import com.ranco.auth.modules.account.domain.AccountStatus;
import com.ranco.auth.modules.session.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService implements TokenIssuer {

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_STATUS = "status";
    private static final int REFRESH_SECRET_BYTES = 32;

    private final JwtTokenProvider tokenProvider;
    private final SecretGenerator secretGenerator;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            SecretGenerator secretGenerator,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.secretGenerator = secretGenerator;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    @Override
    public SignedAccessToken signAccessToken(AccessClaims claims) {
        Instant now = clock.instant();
        Instant accessExpiry = now.plusMillis(accessTokenTtlMillis);

        String accessToken = Jwts.builder()
                .subject(claims.accountId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(accessExpiry))
                .claim(CLAIM_ROLE, claims.role().name())
                .claim(CLAIM_STATUS, claims.status().name())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new SignedAccessToken(
                accessToken,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    @Override
    public String mintRefreshSecret() {
        return secretGenerator.opaqueToken(REFRESH_SECRET_BYTES);
    }

    @Override
    public VerifiedAccessToken verifyAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID accountId = UUID.fromString(claims.getSubject());
            AccountRole role = AccountRole.valueOf(claims.get(CLAIM_ROLE, String.class));
            String statusClaim = claims.get(CLAIM_STATUS, String.class);
            AccountStatus status = statusClaim == null ? null : AccountStatus.valueOf(statusClaim);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new VerifiedAccessToken(
                    accountId,
                    role,
                    status,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException | NullPointerException e) {
            throw new InvalidAccessTokenException("Invalid access token", e);
        }
    }
}
