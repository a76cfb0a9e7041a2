package com.ranco.auth.modules.authmethod.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.ranco.auth.modules.authmethod.domain.AuthMethod;
import com.ranco.auth.modules.authmethod.domain.AuthProvider;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuthMethodRepository extends JpaRepository<AuthMethod, UUID> {

    Optional<AuthMethod> findByProviderAndExternalId(AuthProvider provider, String externalId);

    boolean existsByProviderAndExternalId(AuthProvider provider, String externalId);

    Optional<AuthMethod> findByAccountId(UUID accountId);

    boolean existsByAccountId(UUID accountId);
}
