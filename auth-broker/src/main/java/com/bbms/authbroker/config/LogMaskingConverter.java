package com.bbms.authbroker.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>Bearer, access and refresh tokens: first 8 chars + "..."</li>
 * <li>Provider one-time secrets and API key values: "[REDACTED]"</li>
 * <li>E-mail addresses: first character and domain only</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.bbms.authbroker.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // access_token=..., "accessToken":"...", refresh_token / refreshToken alike
    private static final Pattern TOKEN_PATTERN = Pattern
            .compile("((?:access|refresh)_?[Tt]oken[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // OneTimeSecret, secret=..., apiKeyValue
    private static final Pattern SECRET_PATTERN = Pattern
            .compile("((?:OneTimeSecret|[Ss]ecret|apiKeyValue|ApiKeyValue)[\"=:]+\\s*[\"']?)[^\"&\\s,}]+");

    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("([A-Za-z0-9])[A-Za-z0-9._%+\\-]*(@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,})");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = SECRET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = EMAIL_PATTERN.matcher(masked).replaceAll("$1***$2");

        return masked;
    }
}
