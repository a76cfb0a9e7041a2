package com.ranco.auth.global.web;

import com.ranco.auth.modules.session.domain.ClientMeta;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the caller's address and user agent. The first hop of {@code X-Forwarded-For} wins
 * over the socket address.
 */
@Component
public class ClientMetaResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public ClientMeta resolve(HttpServletRequest request) {
        return new ClientMeta(resolveIpAddress(request), request.getHeader(HttpHeaders.USER_AGENT));
    }

    private String resolveIpAddress(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            String firstHop = forwarded.split(",")[0].trim();
            if (!firstHop.isEmpty()) {
                return firstHop;
            }
        }
        return request.getRemoteAddr();
    }
}
