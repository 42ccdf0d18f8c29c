package com.deepansh.orchestrator.api;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Bearer-token check for /v1/**.
 *
 * Accepts {@code Authorization: Bearer <token>} or {@code ?token=<token>};
 * the query form exists for EventSource clients, which cannot set headers.
 * CORS preflight requests pass through.
 */
@Component
@Slf4j
public class ApiTokenFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final String expectedToken;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ApiTokenFilter(OrchestratorProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.expectedToken = properties.getApi().getToken();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(request.getContextPath() + "/v1/")
                || HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String token = extractToken(request);
        if (token == null || !token.equals(expectedToken)) {
            log.warn("Rejected unauthenticated request [method={}, uri={}]",
                    request.getMethod(), request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(), Map.of(
                    "error", token == null ? "Missing API token" : "Invalid API token",
                    "timestamp", clock.instant().toString()));
            return;
        }
        chain.doFilter(request, response);
    }

    static String extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER)) {
            return header.substring(BEARER.length()).strip();
        }
        String query = request.getParameter("token");
        return query != null && !query.isBlank() ? query : null;
    }
}
