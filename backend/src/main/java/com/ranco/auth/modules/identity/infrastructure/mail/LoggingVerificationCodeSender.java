package com.ranco.auth.modules.identity.infrastructure.mail;

import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.identity.application.VerificationCodeSender;
import com.ranco.auth.modules.verification.domain.IssuedCode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Development sender used while mail is disabled. Codes only show up at DEBUG.
 */
@Component
@ConditionalOnProperty(name = "app.mail.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingVerificationCodeSender implements VerificationCodeSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingVerificationCodeSender.class);

    @Override
    public void send(AuthProvider provider, String externalId, IssuedCode code) {
        log.info("Mail delivery disabled; code {} for {} not sent", code.codeId(), provider);
        if (log.isDebugEnabled()) {
            log.debug("Verification code {} is {}, expires at {}", code.codeId(), code.plaintext(), code.expiresAt());
        }
    }
}
