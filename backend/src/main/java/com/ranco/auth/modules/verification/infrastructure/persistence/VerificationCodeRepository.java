package com.ranco.auth.modules.verification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.ranco.auth.modules.verification.domain.VerificationCode;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VerificationCodeRepository extends JpaRepository<VerificationCode, UUID> {

    /**
     * Row-locks the open code so validations of the same code run one after another.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select vc from VerificationCode vc
             where vc.authMethodId = :authMethodId
               and vc.consumedAt is null
               and vc.expiresAt > :now
            """)
    Optional<VerificationCode> findActive(@Param("authMethodId") UUID authMethodId,
                                          @Param("now") OffsetDateTime now);

    /**
     * Marks every unconsumed code of the method as consumed, expired ones included.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            update VerificationCode vc
               set vc.consumedAt = :now
             where vc.authMethodId = :authMethodId
               and vc.consumedAt is null
            """)
    int supersedeOpenCodes(@Param("authMethodId") UUID authMethodId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            update VerificationCode vc
               set vc.attempts = vc.attempts + 1
             where vc.id = :id
               and vc.consumedAt is null
               and vc.attempts < :maxAttempts
            """)
    int incrementAttempts(@Param("id") UUID id, @Param("maxAttempts") int maxAttempts);

    @Modifying(flushAutomatically = true)
    @Query("""
            update VerificationCode vc
               set vc.consumedAt = :now
             where vc.id = :id
               and vc.consumedAt is null
            """)
    int consume(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            delete from VerificationCode vc
             where (vc.consumedAt is not null and vc.consumedAt < :cutoff)
                or vc.expiresAt < :cutoff
            """)
    int deleteInert(@Param("cutoff") OffsetDateTime cutoff);
}
