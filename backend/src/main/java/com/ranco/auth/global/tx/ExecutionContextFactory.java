package com.ranco.auth.global.tx;

import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ExecutionContextFactory {

    private final Clock clock;
    private final Duration requestTimeout;

    public ExecutionContextFactory(
            Clock clock,
            @Value("${app.identity.request-timeout:PT10S}") Duration requestTimeout
    ) {
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    public ExecutionContext forRequest() {
        return ExecutionContext.withTimeout(clock, requestTimeout);
    }
}
