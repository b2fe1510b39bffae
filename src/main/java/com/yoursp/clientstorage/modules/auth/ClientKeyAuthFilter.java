package com.yoursp.clientstorage.modules.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.clientstorage.config.StorageProperties;
import com.yoursp.clientstorage.service.storage.ClientKeyGate;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client key authentication filter for the storage API.
 * <ul>
 * <li>Reads the key from the configured header (default {@code x-client-key}),
 * falling back to the {@code client} query parameter</li>
 * <li>Missing key: 400 JSON</li>
 * <li>Unknown or revoked key: 401 JSON</li>
 * <li>Valid key: sets the SecurityContext and exposes the key as request
 * attribute {@value #CLIENT_KEY_ATTRIBUTE}</li>
 * </ul>
 * Routes outside the storage API prefix are not filtered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClientKeyAuthFilter extends OncePerRequestFilter {

    public static final String CLIENT_KEY_ATTRIBUTE = "clientKey";
    public static final String CLIENT_QUERY_PARAM = "client";

    private final ClientKeyGate clientKeyGate;
    private final StorageProperties storageProperties;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        String prefix = "/" + storageProperties.getApiPrefix();
        return !(path.equals(prefix) || path.startsWith(prefix + "/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain)
            throws ServletException, IOException {

        String headerName = storageProperties.getClientHeader();
        String clientKey = extractClientKey(request, headerName);

        if (clientKey == null) {
            sendError(response, HttpStatus.BAD_REQUEST, "MISSING_CLIENT_KEY",
                    "Missing client identifier. Provide header '" + headerName + "' or query '"
                            + CLIENT_QUERY_PARAM + "'.");
            return;
        }

        if (!clientKeyGate.isAuthorized(clientKey)) {
            log.warn("Rejected client key on {} {}", request.getMethod(), request.getRequestURI());
            sendError(response, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Invalid or revoked client key");
            return;
        }

        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                clientKey,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_CLIENT")));
        SecurityContextHolder.getContext().setAuthentication(auth);

        request.setAttribute(CLIENT_KEY_ATTRIBUTE, clientKey);

        filterChain.doFilter(request, response);
    }

    private String extractClientKey(HttpServletRequest request, String headerName) {
        String key = request.getHeader(headerName);
        if (key == null || key.isBlank()) {
            key = request.getParameter(CLIENT_QUERY_PARAM);
        }
        return key == null || key.isBlank() ? null : key.trim();
    }

    private void sendError(HttpServletResponse response, HttpStatus status, String error, String message)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);

        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
