package com.example.tokenrelay.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Relay security configuration. Stateless; the relay authenticates callers itself through the
 * session cookie, so Spring Security only fences off the URL space.
 * <p>
 * PUBLIC CHAIN (@Order(1)): token endpoint, health endpoints and API docs.
 * DEFAULT CHAIN (@Order(2)): everything else is denied.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
public class SecurityConfig {

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/token",
                         "/health/**",
                         "/health",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Read-only GET endpoints, no server-side session.
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.NO_REFERRER)
                                    )
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     // Tokens must never be cached by browsers or proxies
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control",
                                          "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma",
                                          "no-cache");
                       response.setHeader("Expires",
                                          "0");
                     })
                );
  }
}
