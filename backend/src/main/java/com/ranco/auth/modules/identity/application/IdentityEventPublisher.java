package com.ranco.auth.modules.identity.application;

import com.ranco.auth.modules.identity.domain.IdentityEvent;

/**
 * Best-effort outlet for committed identity changes. Only ever called after commit.
 */
public interface IdentityEventPublisher {

    void publish(IdentityEvent event);
}
