package com.ranco.auth.modules.identity.infrastructure.oauth;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Collections;

import com.google.api.client.googleapis.auth.oauth2.GoogleIdToken;
import com.google.api.client.googleapis.auth.oauth2.GoogleIdTokenVerifier;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.ranco.auth.global.error.ErrorKind;
import com.ranco.auth.global.error.IdentityException;
import com.ranco.auth.modules.authmethod.domain.AuthProvider;
import com.ranco.auth.modules.identity.application.ProviderAssertionVerifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * Checks Google ID tokens against the configured client id. Only registered when
 * {@code app.google.client-id} is set.
 */
@Component
@ConditionalOnExpression("!'${app.google.client-id:}'.isBlank()")
public class GoogleIdTokenAssertionVerifier implements ProviderAssertionVerifier {

    private static final Logger log = LoggerFactory.getLogger(GoogleIdTokenAssertionVerifier.class);

    private final GoogleIdTokenVerifier verifier;

    @Autowired
    public GoogleIdTokenAssertionVerifier(@Value("${app.google.client-id}") String clientId) {
        this(new GoogleIdTokenVerifier
                .Builder(new NetHttpTransport(), GsonFactory.getDefaultInstance())
                .setAudience(Collections.singletonList(clientId))
                .build());
    }

    GoogleIdTokenAssertionVerifier(GoogleIdTokenVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public AuthProvider provider() {
        return AuthProvider.GOOGLE;
    }

    @Override
    public String verifySubject(String assertion) {
        GoogleIdToken idToken;
        try {
            idToken = verifier.verify(assertion);
        } catch (GeneralSecurityException | IOException | IllegalArgumentException ex) {
            log.debug("Google ID token could not be verified", ex);
            throw new IdentityException(ErrorKind.INVALID_CREDENTIALS, IdentityException.INVALID_CREDENTIALS, ex);
        }
        if (idToken == null || idToken.getPayload().getSubject() == null) {
            throw IdentityException.invalidCredentials();
        }
        return idToken.getPayload().getSubject();
    }
}
