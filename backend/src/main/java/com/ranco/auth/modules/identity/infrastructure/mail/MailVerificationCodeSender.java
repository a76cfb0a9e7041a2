package com.ranco.auth.modules.identity.infrastructure.mail;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.identity.application.VerificationCodeSender;
import com.ranco.auth.modules.verification.domain.IssuedCode;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.mail.enabled", havingValue = "true")
public class MailVerificationCodeSender implements VerificationCodeSender {

    private final JavaMailSender mailSender;
    private final Clock clock;
    private final String sender;

    public MailVerificationCodeSender(
            JavaMailSender mailSender,
            Clock clock,
            @Value("${app.mail.sender:no-reply@ranco.app}") String sender
    ) {
        this.mailSender = mailSender;
        this.clock = clock;
        this.sender = sender;
    }

    @Override
    public void send(AuthProvider provider, String externalId, IssuedCode code) {
        if (provider != AuthProvider.EMAIL) {
            throw new IllegalArgumentException("Cannot mail a code for provider " + provider);
        }
        long minutes = Math.max(1L, Duration.between(OffsetDateTime.now(clock), code.expiresAt()).toMinutes());

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(sender);
        message.setTo(externalId);
        message.setSubject("Your verification code");
        message.setText("Your verification code is " + code.plaintext() + ". It expires in " + minutes + " minute(s).");
        mailSender.send(message);
    }
}
