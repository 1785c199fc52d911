package com.bbms.authbroker.config;

import com.bbms.authbroker.modules.credential.SessionAuthFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * Stateless security configuration.
 * <ul>
 * <li>Rate limiting filter registered before bearer-token auth</li>
 * <li>Biometric login, capture-surface callbacks, signed provider
 * webhooks, /auth/refresh, /auth/logout and /actuator/health: permitAll</li>
 * <li>Everything else requires a bearer session</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

        @Value("${app.frontend-url:http://localhost:3000}")
        private String frontendUrl;

        @Value("${provider.capture-web-url:http://localhost:3001}")
        private String captureWebUrl;

        private final SessionAuthFilter sessionAuthFilter;
        private final RateLimitFilter rateLimitFilter;

        public SecurityConfig(SessionAuthFilter sessionAuthFilter, RateLimitFilter rateLimitFilter) {
                this.sessionAuthFilter = sessionAuthFilter;
                this.rateLimitFilter = rateLimitFilter;
        }

        @Bean
        public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(AbstractHttpConfigurer::disable)
                                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                                .headers(headers -> headers
                                                .contentTypeOptions(opt -> {
                                                })
                                                .frameOptions(frame -> frame.deny())
                                                .httpStrictTransportSecurity(hsts -> hsts
                                                                .includeSubDomains(true)
                                                                .maxAgeInSeconds(31536000))
                                                .cacheControl(cache -> {
                                                }))
                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/biometric/login/**").permitAll()
                                                .requestMatchers("/biometric/operations/**").permitAll()
                                                .requestMatchers("/webhooks/authid/**").permitAll()
                                                .requestMatchers("/auth/refresh", "/auth/logout").permitAll()
                                                .requestMatchers("/actuator/health").permitAll()
                                                .anyRequest().authenticated())
                                .addFilterBefore(rateLimitFilter, UsernamePasswordAuthenticationFilter.class)
                                .addFilterBefore(sessionAuthFilter, UsernamePasswordAuthenticationFilter.class)
                                .formLogin(AbstractHttpConfigurer::disable)
                                .httpBasic(AbstractHttpConfigurer::disable);

                return http.build();
        }

        @Bean
        public CorsConfigurationSource corsConfigurationSource() {
                CorsConfiguration config = new CorsConfiguration();
                config.setAllowedOrigins(Arrays.asList(frontendUrl, captureWebUrl));
                config.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
                config.setAllowedHeaders(List.of("*"));
                config.setAllowCredentials(true);
                config.setMaxAge(3600L);

                UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
                source.registerCorsConfiguration("/**", config);
                return source;
        }
}
