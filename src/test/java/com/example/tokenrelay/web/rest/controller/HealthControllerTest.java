package com.example.tokenrelay.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.tokenrelay.cache.BoundedLruCache;
import com.example.tokenrelay.crypto.RsaKeys;
import com.example.tokenrelay.domain.entity.AuthLookup;
import com.example.tokenrelay.security.KeyMaterial;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class HealthControllerTest {

  private CircuitBreakerRegistry registry;
  private BoundedLruCache<String, AuthLookup> sessionCache;
  private HealthController controller;

  @BeforeEach
  void setUp() {
    registry = CircuitBreakerRegistry.ofDefaults();
    sessionCache = new BoundedLruCache<>(sessionId -> AuthLookup.rejected(404), 4);
    controller = new HealthController(
        new KeyMaterial(RsaKeys.RELAY.getPrivate(), RsaKeys.AUTH_SERVER.getPublic()),
        sessionCache, registry);
  }

  @Test
  void health_isUp() {
    assertThat(controller.health().getBody()).containsEntry("status", "UP");
  }

  @Test
  void readiness_closedCircuit_isReadyWithCacheStats() {
    sessionCache.get("a");
    sessionCache.get("a");

    ResponseEntity<Map<String, Object>> response = controller.readiness();

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody()).containsEntry("ready", true);
    @SuppressWarnings("unchecked")
    Map<String, Object> keys = (Map<String, Object>) response.getBody().get("keys");
    assertThat(keys)
        .containsEntry("status", "UP")
        .containsEntry("authServerKeyAlgorithm", "RSA")
        .containsEntry("maxSealableBytes", 214);
    @SuppressWarnings("unchecked")
    Map<String, Object> cache = (Map<String, Object>) response.getBody().get("sessionCache");
    assertThat(cache)
        .containsEntry("size", 1)
        .containsEntry("maxSize", 4)
        .containsEntry("hits", 1L)
        .containsEntry("misses", 1L)
        .containsEntry("sharedLoads", 0L);
  }

  @Test
  void readiness_serverKeyTooSmallForSessionIds_isNotReady() {
    HealthController smallKey = new HealthController(
        new KeyMaterial(RsaKeys.RELAY.getPrivate(), RsaKeys.generate(1024).getPublic()),
        sessionCache, registry);

    ResponseEntity<Map<String, Object>> response = smallKey.readiness();

    assertThat(response.getStatusCode().value()).isEqualTo(503);
    @SuppressWarnings("unchecked")
    Map<String, Object> keys = (Map<String, Object>) response.getBody().get("keys");
    assertThat(keys).containsEntry("status", "DOWN").containsEntry("maxSealableBytes", 86);
  }

  @Test
  void readiness_openCircuit_isNotReady() {
    registry.circuitBreaker(HealthController.AUTH_SERVER_CIRCUIT).transitionToOpenState();

    ResponseEntity<Map<String, Object>> response = controller.readiness();

    assertThat(response.getStatusCode().value()).isEqualTo(503);
    assertThat(response.getBody()).containsEntry("ready", false);
    @SuppressWarnings("unchecked")
    Map<String, Object> authServer = (Map<String, Object>) response.getBody().get("authServer");
    assertThat(authServer).containsEntry("circuit", "OPEN").containsEntry("status", "DOWN");
  }
}
