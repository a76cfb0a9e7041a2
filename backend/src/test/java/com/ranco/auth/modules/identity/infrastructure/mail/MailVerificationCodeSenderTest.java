package com.ranco.auth.modules.identity.infrastructure.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.verification.domain.IssuedCode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class MailVerificationCodeSenderTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private JavaMailSender mailSender;

    private MailVerificationCodeSender sender;

    @BeforeEach
    void setUp() {
        sender = new MailVerificationCodeSender(mailSender, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC), "no-reply@ranco.app");
    }

    @Test
    void mailsCodeToTheAddress() {
        sender.send(AuthProvider.EMAIL, "alice@example.com", new IssuedCode(UUID.randomUUID(), "482913", NOW.plusMinutes(5)));

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(captor.capture());
        assertThat(captor.getValue().getTo()).containsExactly("alice@example.com");
        assertThat(captor.getValue().getFrom()).isEqualTo("no-reply@ranco.app");
        assertThat(captor.getValue().getText()).contains("482913").contains("5 minute(s)");
    }

    @Test
    void refusesNonEmailProviders() {
        IssuedCode code = new IssuedCode(UUID.randomUUID(), "482913", NOW.plusMinutes(5));

        assertThatThrownBy(() -> sender.send(AuthProvider.GOOGLE, "sub-1", code))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mailSender);
    }
}
