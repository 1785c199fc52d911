package com.bbms.authbroker.modules.operation;

import com.bbms.authbroker.config.ProviderProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Manages the provider access token obtained with the API key pair.
 * <ul>
 * <li>Cached in Redis with key {@code provider_access_token}</li>
 * <li>TTL from {@code provider.token-ttl}</li>
 * <li>Evicted when the provider answers 401 so the next call re-authenticates</li>
 * <li>Circuit breaker: falls back to a possibly stale cached token</li>
 * </ul>
 */
@Slf4j
@Service
public class ProviderTokenService {

    static final String REDIS_KEY = "provider_access_token";

    private final RestTemplate restTemplate;
    private final StringRedisTemplate redisTemplate;
    private final ProviderProperties providerProperties;

    public ProviderTokenService(RestTemplate providerRestTemplate,
            StringRedisTemplate redisTemplate,
            ProviderProperties providerProperties) {
        this.restTemplate = providerRestTemplate;
        this.redisTemplate = redisTemplate;
        this.providerProperties = providerProperties;
    }

    /**
     * Get a valid provider access token. Returns cached token if available.
     */
    @CircuitBreaker(name = "providerToken", fallbackMethod = "getAccessTokenFallback")
    public String getAccessToken() {
        String cached = redisTemplate.opsForValue().get(REDIS_KEY);
        if (cached != null) {
            return cached;
        }

        log.info("Authenticating with provider at {}", providerProperties.getTokenUrl());

        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(providerProperties.getApiKeyId(), providerProperties.getApiKeyValue());

        ResponseEntity<Map> response;
        try {
            response = restTemplate.exchange(providerProperties.getTokenUrl(), HttpMethod.POST,
                    new HttpEntity<>(headers), Map.class);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Provider authentication failed", e);
        }

        Map<?, ?> body = response.getBody();
        if (body == null || !(body.get("AccessToken") instanceof String token)) {
            throw new ProviderUnavailableException("Provider authentication returned no AccessToken");
        }

        long ttl = Math.max(providerProperties.getTokenTtl().toSeconds(), 60);
        redisTemplate.opsForValue().set(REDIS_KEY, token, ttl, TimeUnit.SECONDS);
        log.info("Provider token cached for {}s", ttl);

        return token;
    }

    /** Drop the cached token after the provider rejected it. */
    public void evict() {
        redisTemplate.delete(REDIS_KEY);
        log.debug("Provider token evicted");
    }

    @SuppressWarnings("unused")
    private String getAccessTokenFallback(Throwable t) {
        log.error("Circuit breaker open, provider token fetch failed: {}", t.getMessage());
        String cached = redisTemplate.opsForValue().get(REDIS_KEY);
        if (cached != null) {
            log.warn("Returning possibly stale cached provider token");
            return cached;
        }
        throw new ProviderUnavailableException("Provider token unavailable, circuit breaker open", t);
    }
}
