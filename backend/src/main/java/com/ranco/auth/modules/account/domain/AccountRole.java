package com.ranco.auth.modules.account.domain;

public enum AccountRole {
    ADMIN,
    USER
}
