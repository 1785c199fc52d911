package com.bbms.authbroker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Sliding window rate limiter on the operation-creating endpoints, using
 * Redis ZADD + ZREMRANGEBYSCORE. Every operation created costs a provider
 * call, and login initiation is reachable without a session.
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${rate-limit.enabled:true}")
    private boolean enabled;

    public RateLimitFilter(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain) throws ServletException, IOException {
        if (!enabled) {
            chain.doFilter(request, response);
            return;
        }

        String path = request.getRequestURI();
        RateLimitConfig config = resolveConfig(path);

        if (config == null) {
            chain.doFilter(request, response);
            return;
        }

        String key = "ratelimit:" + config.endpointKey + ":" + clientIp(request);

        if (isRateLimited(key, config.maxRequests, config.windowSeconds)) {
            log.warn("Rate limited: key={}, path={}", key, path);
            response.setStatus(429);
            response.setHeader("Retry-After", String.valueOf(config.windowSeconds));
            response.setContentType("application/json");
            response.getWriter().write(objectMapper.writeValueAsString(Map.of(
                    "error", "RATE_LIMITED",
                    "message", "Too many requests. Try again later.",
                    "retryAfterSeconds", config.windowSeconds)));
            return;
        }

        chain.doFilter(request, response);
    }

    private boolean isRateLimited(String key, int maxRequests, int windowSeconds) {
        try {
            double now = Instant.now().toEpochMilli();
            double windowStart = now - (windowSeconds * 1000.0);

            redisTemplate.opsForZSet().removeRangeByScore(key, 0, windowStart);

            Long count = redisTemplate.opsForZSet().zCard(key);
            if (count != null && count >= maxRequests) {
                return true;
            }

            redisTemplate.opsForZSet().add(key, String.valueOf(now), now);
            redisTemplate.expire(key, Duration.ofSeconds(windowSeconds + 10L));
            return false;
        } catch (Exception e) {
            // Fail open when Redis is down
            log.warn("Rate limit check failed (allowing request): {}", e.getMessage());
            return false;
        }
    }

    private RateLimitConfig resolveConfig(String path) {
        if (path.equals("/biometric/login/initiate")) {
            return new RateLimitConfig("bio_login", 10, 60);
        } else if (path.startsWith("/biometric/login/poll/")) {
            return new RateLimitConfig("bio_poll", 120, 60);
        } else if (path.equals("/biometric/enroll") || path.equals("/biometric/re-enroll")) {
            return new RateLimitConfig("bio_enroll", 5, 300);
        } else if (path.equals("/auth/refresh")) {
            return new RateLimitConfig("auth_refresh", 20, 60);
        }
        return null;
    }

    private String clientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private record RateLimitConfig(String endpointKey, int maxRequests, int windowSeconds) {
    }
}
