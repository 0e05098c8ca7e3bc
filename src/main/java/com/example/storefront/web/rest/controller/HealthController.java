package com.example.storefront.web.rest.controller;

import com.example.storefront.adapter.redis.client.RedisHealthClient;
import com.example.storefront.adapter.redis.dto.RedisHealthResponse;
import com.example.storefront.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Health endpoints do not throw to GlobalErrorHandler; they return the status monitoring tools expect.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final long REDIS_RESPONSE_TIME_WARNING_MS = 100L;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_DISABLED = "DISABLED";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final RedisHealthClient redisHealthClient;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", System.currentTimeMillis()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

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

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    Map<String, Object> status = new HashMap<>();
    boolean isReady = true;

    if (properties.credentials().primary().enabled()) {
      RedisHealthResponse redisHealth = redisHealthClient.checkHealth();

      Map<String, Object> redisStatus = new HashMap<>();
      redisStatus.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
      redisStatus.put("responseTimeMs", redisHealth.responseTimeMs());
      if (redisHealth.error() != null) {
        redisStatus.put("error", redisHealth.error());
      }
      status.put("redis", redisStatus);

      if (!redisHealth.healthy() || redisHealth.responseTimeMs() > REDIS_RESPONSE_TIME_WARNING_MS) {
        isReady = false;
        log.warn("Readiness check failed: Redis health={}, responseTime={}ms",
                 redisHealth.healthy(), redisHealth.responseTimeMs());
      }
    } else {
      status.put("redis", Map.of("status", STATUS_DISABLED));
    }

    status.put("ready", isReady);
    status.put("timestamp", System.currentTimeMillis());
    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
