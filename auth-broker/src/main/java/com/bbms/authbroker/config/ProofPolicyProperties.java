package com.bbms.authbroker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Score thresholds below which an otherwise clean proof goes to manual
 * review. These are this service's policy, not the provider's.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "proof")
public class ProofPolicyProperties {

    private double minMatchScore = 0.80;
    private double minConfidenceScore = 0.85;
}
