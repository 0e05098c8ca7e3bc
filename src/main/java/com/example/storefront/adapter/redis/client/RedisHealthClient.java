package com.example.storefront.adapter.redis.client;

import com.example.storefront.adapter.redis.dto.RedisHealthResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Redis Health Check Client for the primary credential store
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisHealthClient {

  private static final String PONG = "PONG";

  private final RedisTemplate<String, String> redisTemplate;

  public RedisHealthResponse checkHealth() {
    long startTime = System.currentTimeMillis();

    try {
      String pingResponse = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      if (!PONG.equals(pingResponse)) {
        return RedisHealthResponse.unhealthy("Invalid PING response: " + pingResponse);
      }

      long responseTime = System.currentTimeMillis() - startTime;
      return RedisHealthResponse.healthy(responseTime, serverVersion());

    } catch (Exception e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.unhealthy(e.getMessage());
    }
  }

  private String serverVersion() {
    Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info("server"));
    return info == null ? "unknown" : info.getProperty("redis_version", "unknown");
  }
}
