package com.ranco.auth.modules.session.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.ranco.auth.modules.session.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    /**
     * Revokes every unrevoked token of the account, expired ones included.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revokedAt = :now
             where rt.accountId = :accountId
               and rt.revokedAt is null
            """)
    int revokeOpenTokens(@Param("accountId") UUID accountId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revokedAt = :now
             where rt.id = :id
               and rt.revokedAt is null
            """)
    int revokeById(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            delete from RefreshToken rt
             where (rt.revokedAt is not null and rt.revokedAt < :cutoff)
                or rt.expiresAt < :cutoff
            """)
    int deleteInert(@Param("cutoff") OffsetDateTime cutoff);
}
