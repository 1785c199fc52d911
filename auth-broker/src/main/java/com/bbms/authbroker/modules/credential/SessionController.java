package com.bbms.authbroker.modules.credential;

import com.bbms.authbroker.modules.credential.dto.IssuedCredential;
import com.bbms.authbroker.modules.credential.dto.RefreshRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Session endpoints.
 * <ul>
 * <li>POST /auth/refresh: rotate tokens with a refresh token</li>
 * <li>POST /auth/logout: revoke the session behind the bearer token</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class SessionController {

    private final CredentialIssuer credentialIssuer;

    @PostMapping("/refresh")
    public ResponseEntity<IssuedCredential> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(credentialIssuer.refresh(request.getRefreshToken()));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(HttpServletRequest request) {
        String accessToken = SessionAuthFilter.extractBearerToken(request);
        if (accessToken != null) {
            credentialIssuer.revoke(accessToken);
        }
        return ResponseEntity.ok(Map.of("message", "Logged out"));
    }
}
