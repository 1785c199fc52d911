package com.bbms.authbroker.modules.credential;

import com.bbms.authbroker.model.entity.User;
import com.bbms.authbroker.model.entity.UserSession;
import com.bbms.authbroker.repository.UserRepository;
import com.bbms.authbroker.repository.UserSessionRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Bearer-token authentication filter.
 * <ul>
 * <li>Reads {@code Authorization: Bearer <access token>}</li>
 * <li>Resolves the session through {@link CredentialIssuer}</li>
 * <li>Sets SecurityContext and the {@code currentUser} request attribute</li>
 * <li>Returns 401 JSON, never a redirect</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthFilter extends OncePerRequestFilter {

    public static final String CURRENT_USER_ATTRIBUTE = "currentUser";
    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Public routes: biometric login, capture-surface callbacks, provider
     * webhooks and token refresh happen without a session.
     */
    private static final List<String> SKIP_PREFIXES = List.of(
            "/biometric/login/",
            "/biometric/operations/",
            "/webhooks/",
            "/auth/refresh",
            "/auth/logout",
            "/actuator/");

    private final CredentialIssuer credentialIssuer;
    private final UserSessionRepository sessionRepository;
    private final UserRepository userRepository;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return SKIP_PREFIXES.stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain)
            throws ServletException, IOException {

        String accessToken = extractBearerToken(request);
        if (accessToken == null) {
            sendUnauthorized(response, "No access token");
            return;
        }

        UserSession session;
        try {
            session = credentialIssuer.authenticate(accessToken);
        } catch (InvalidCredentialException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            sendUnauthorized(response, e.getMessage());
            return;
        }

        sessionRepository.updateLastActive(session.getId());

        Optional<User> userOpt = userRepository.findById(session.getUserId());
        if (userOpt.isEmpty() || !userOpt.get().isActiveAccount()) {
            sendUnauthorized(response, "User not found or inactive");
            return;
        }
        User user = userOpt.get();

        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                user.getId().toString(),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + (user.getRole() != null ? user.getRole() : "USER"))));
        SecurityContextHolder.getContext().setAuthentication(auth);

        request.setAttribute(CURRENT_USER_ATTRIBUTE, user);

        filterChain.doFilter(request, response);
    }

    static String extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private void sendUnauthorized(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
                "{\"status\":401,\"error\":\"Unauthorized\",\"message\":\"" + message + "\"}");
    }
}
