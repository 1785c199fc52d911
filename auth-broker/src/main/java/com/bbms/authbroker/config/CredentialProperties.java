package com.bbms.authbroker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "credential")
public class CredentialProperties {

    private Duration accessTokenTtl = Duration.ofHours(24);
    private Duration refreshTokenTtl = Duration.ofDays(7);
}
