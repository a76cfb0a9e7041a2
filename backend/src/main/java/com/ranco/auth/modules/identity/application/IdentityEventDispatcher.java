package com.ranco.auth.modules.identity.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.identity.domain.IdentityEvent;
import com.ranco.auth.modules.verification.domain.IssuedCode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Post-commit side effects. A failure here is logged and dropped: the committed state change
 * stands regardless.
 */
@Component
public class IdentityEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(IdentityEventDispatcher.class);

    private final IdentityEventPublisher eventPublisher;
    private final VerificationCodeSender codeSender;
    private final Clock clock;

    public IdentityEventDispatcher(IdentityEventPublisher eventPublisher, VerificationCodeSender codeSender, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.codeSender = codeSender;
        this.clock = clock;
    }

    public void emit(String name, UUID accountId, Map<String, String> attributes) {
        IdentityEvent event = new IdentityEvent(name, accountId, OffsetDateTime.now(clock), attributes);
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} for account {}", name, accountId, ex);
        }
    }

    public void deliverCode(UUID accountId, AuthProvider provider, String externalId, IssuedCode code) {
        try {
            codeSender.send(provider, externalId, code);
        } catch (RuntimeException ex) {
            log.warn("Failed to deliver verification code {} for account {}", code.codeId(), accountId, ex);
        }
    }
}
