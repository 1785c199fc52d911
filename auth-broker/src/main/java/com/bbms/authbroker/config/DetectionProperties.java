package com.bbms.authbroker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Polling cadence and budget for completion detection.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    private Duration pollInterval = Duration.ofSeconds(2);
    private int maxAttempts = 120;
    private Duration maxWait = Duration.ofSeconds(240);
}
