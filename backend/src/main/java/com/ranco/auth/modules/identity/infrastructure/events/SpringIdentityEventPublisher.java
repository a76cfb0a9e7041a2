package com.ranco.auth.modules.identity.infrastructure.events;

import com.ranco.auth.modules.identity.application.IdentityEventPublisher;
import com.ranco.auth.modules.identity.domain.IdentityEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Forwards identity events to in-process listeners.
 */
@Component
public class SpringIdentityEventPublisher implements IdentityEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SpringIdentityEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;

    public SpringIdentityEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Override
    public void publish(IdentityEvent event) {
        log.debug("Publishing {} for account {}", event.name(), event.accountId());
        applicationEventPublisher.publishEvent(event);
    }
}
