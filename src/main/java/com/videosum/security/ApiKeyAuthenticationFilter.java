package com.videosum.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;

/**
 * Authenticates the desktop UI by the shared secret it was started with.
 */
@Component
@Slf4j
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    static final String API_KEY_HEADER = "X-API-Key";
    // EventSource cannot set headers, so the event stream may pass the key as a query parameter
    static final String API_KEY_PARAM = "api_key";
    static final String EVENTS_PATH = "/api/queue/events";

    private static final Set<String> PUBLIC_PATHS = Set.of("/api/health", "/api/ping");

    private final byte[] expectedKey;

    public ApiKeyAuthenticationFilter(@Value("${api.key:}") String apiKey) {
        if (!StringUtils.hasText(apiKey) || apiKey.startsWith("${")) {
            throw new IllegalStateException(
                    "API_KEY is not set. Start the queue service with API_KEY=<shared secret of the desktop app>");
        }
        if (apiKey.length() < 32) {
            log.warn("API key has only {} characters, use at least 32", apiKey.length());
        }
        this.expectedKey = apiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return PUBLIC_PATHS.contains(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String presented = presentedKey(request);

        if (presented != null) {
            if (MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), expectedKey)) {
                SecurityContextHolder.getContext().setAuthentication(new QueueClientAuthentication());
            } else {
                log.warn("Rejected invalid API key for {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private String presentedKey(HttpServletRequest request) {
        String header = request.getHeader(API_KEY_HEADER);
        if (header != null) {
            return header;
        }
        return EVENTS_PATH.equals(request.getRequestURI()) ? request.getParameter(API_KEY_PARAM) : null;
    }

    /**
     * Carries no credentials so the key never ends up in logs or serialized contexts.
     */
    private static final class QueueClientAuthentication extends AbstractAuthenticationToken {

        QueueClientAuthentication() {
            super(AuthorityUtils.createAuthorityList("ROLE_QUEUE_CLIENT"));
            setAuthenticated(true);
        }

        @Override
        public Object getCredentials() {
            return null;
        }

        @Override
        public Object getPrincipal() {
            return "queue-client";
        }
    }
}
