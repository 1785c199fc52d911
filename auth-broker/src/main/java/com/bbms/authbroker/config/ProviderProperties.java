package com.bbms.authbroker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds the {@code provider.*} YAML properties for the biometric
 * verification provider.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "provider")
public class ProviderProperties {

    /** e.g. https://id-uat.authid.ai */
    private String hostUrl;
    private String apiKeyId;
    private String apiKeyValue;

    /** Hosted capture page the user is sent to. */
    private String captureWebUrl;

    private Duration connectTimeout = Duration.ofSeconds(5);
    /** Per-call read timeout, independent of the detection budget. */
    private Duration readTimeout = Duration.ofSeconds(10);

    private Duration tokenTtl = Duration.ofMinutes(55);

    private Duration enrollmentTimeout = Duration.ofHours(1);
    private Duration authenticationTimeout = Duration.ofMinutes(5);

    private double minimumConfidence = 0.85;
    private int maximumAttempts = 3;

    /** Shared secret the provider signs webhook bodies with; webhooks are refused while unset. */
    private String webhookSecret;

    /** Convenience: operation and transaction endpoints */
    public String getAuthorizationUrl() {
        return hostUrl + "/IDCompleteBackendEngine/Default/AuthorizationServiceRest";
    }

    /** Convenience: account administration endpoints */
    public String getAdministrationUrl() {
        return hostUrl + "/IDCompleteBackendEngine/Default/AdministrationServiceRest";
    }

    /** Convenience: API-key token endpoint */
    public String getTokenUrl() {
        return hostUrl + "/IDCompleteBackendEngine/IdentityService/v1/auth/token";
    }
}
