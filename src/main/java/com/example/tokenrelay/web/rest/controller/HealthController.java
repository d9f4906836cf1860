package com.example.tokenrelay.web.rest.controller;

import com.example.tokenrelay.cache.BoundedLruCache;
import com.example.tokenrelay.domain.entity.AuthLookup;
import com.example.tokenrelay.security.KeyMaterial;
import com.example.tokenrelay.util.CookieUtil;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Note: Health endpoints don't throw exceptions to GlobalErrorHandler
 * as they need to return specific status codes for monitoring tools.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  static final String AUTH_SERVER_CIRCUIT = "authServer";

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final KeyMaterial keyMaterial;
  private final BoundedLruCache<String, AuthLookup> sessionCache;
  private final CircuitBreakerRegistry circuitBreakerRegistry;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long maxMemory = runtime.maxMemory();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();

    double memoryUsagePercent = (double) usedMemory / maxMemory * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  /**
   * Ready when the server key can wrap the longest session id and the auth server circuit is
   * not open.
   */
  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    Map<String, Object> status = new HashMap<>();
    boolean isReady = true;

    boolean keysUsable = keyMaterial.canSeal(CookieUtil.MAX_SESSION_ID_BYTES);
    Map<String, Object> keyStatus = new HashMap<>();
    keyStatus.put("status", keysUsable ? STATUS_UP : STATUS_DOWN);
    keyStatus.put("privateKeyAlgorithm", keyMaterial.privateKey().getAlgorithm());
    keyStatus.put("authServerKeyAlgorithm", keyMaterial.authServerPublicKey().getAlgorithm());
    keyStatus.put("maxSealableBytes", keyMaterial.maxSealableBytes());
    status.put("keys", keyStatus);
    if (!keysUsable) {
      isReady = false;
      log.warn("Readiness check failed: auth server key wraps only {} bytes",
               keyMaterial.maxSealableBytes());
    }

    CircuitBreaker.State circuitState;
    try {
      circuitState = circuitBreakerRegistry.circuitBreaker(AUTH_SERVER_CIRCUIT).getState();
    } catch (RuntimeException e) {
      log.error("Circuit breaker lookup failed", e);
      circuitState = null;
    }

    Map<String, Object> authServerStatus = new HashMap<>();
    authServerStatus.put("circuit", circuitState == null ? "UNAVAILABLE" : circuitState.name());
    boolean circuitOpen = circuitState == null
        || circuitState == CircuitBreaker.State.OPEN
        || circuitState == CircuitBreaker.State.FORCED_OPEN;
    authServerStatus.put("status", circuitOpen ? STATUS_DOWN : STATUS_UP);
    status.put("authServer", authServerStatus);

    if (circuitOpen) {
      isReady = false;
      log.warn("Readiness check failed: auth server circuit is {}", authServerStatus.get("circuit"));
    }

    BoundedLruCache.CacheStats stats = sessionCache.stats();
    Map<String, Object> cacheStatus = new HashMap<>();
    cacheStatus.put("size", stats.size());
    cacheStatus.put("maxSize", stats.maxSize());
    cacheStatus.put("hits", stats.hits());
    cacheStatus.put("misses", stats.misses());
    cacheStatus.put("sharedLoads", stats.sharedLoads());
    cacheStatus.put("evictions", stats.evictions());
    cacheStatus.put("loadFailures", stats.loadFailures());
    status.put("sessionCache", cacheStatus);

    status.put("ready", isReady);
    status.put("timestamp", System.currentTimeMillis());

    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
