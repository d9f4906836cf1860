package com.example.tokenrelay.config;

import com.example.tokenrelay.adapter.authserver.AuthServerClient;
import com.example.tokenrelay.cache.BoundedLruCache;
import com.example.tokenrelay.domain.entity.AuthLookup;
import com.example.tokenrelay.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Session id → auth server result cache. Each session id reaches the authentication server at
 * most once while it stays cached.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class SessionCacheConfig {

  @Bean
  public BoundedLruCache<String, AuthLookup> sessionCache(AuthServerClient authServerClient,
                                                          ApplicationProperties properties) {
    int maxSize = properties.cache().session().maxSize();
    log.info("Session cache configured with max size {}", maxSize);
    return new BoundedLruCache<>(authServerClient::fetch, maxSize);
  }
}
