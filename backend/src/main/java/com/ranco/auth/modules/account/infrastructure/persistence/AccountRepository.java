package com.ranco.auth.modules.account.infrastructure.persistence;

import java.util.UUID;

import com.ranco.auth.modules.account.domain.Account;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountRepository extends JpaRepository<Account, UUID> {
}
