package com.example.storefront.web.rest.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.storefront.adapter.redis.client.RedisHealthClient;
import com.example.storefront.adapter.redis.dto.RedisHealthResponse;
import com.example.storefront.properties.ApplicationProperties;
import com.example.storefront.support.TestProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

@DisplayName("HealthController")
class HealthControllerTest {

  private final RedisHealthClient redisHealthClient = mock(RedisHealthClient.class);

  @Test
  @DisplayName("Should be ready when the credential store answers quickly")
  void shouldBeReady() {
    when(redisHealthClient.checkHealth()).thenReturn(RedisHealthResponse.healthy(3, "7.2.4"));
    HealthController controller = new HealthController(redisHealthClient,
        TestProperties.forCredentialStores(null, null, null));

    ResponseEntity<Map<String, Object>> response = controller.readiness();

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody()).containsEntry("ready", true);
  }

  @Test
  @DisplayName("Should not be ready when the credential store is down")
  void shouldNotBeReadyWhenRedisDown() {
    when(redisHealthClient.checkHealth()).thenReturn(RedisHealthResponse.unhealthy("Connection refused"));
    HealthController controller = new HealthController(redisHealthClient,
        TestProperties.forCredentialStores(null, null, null));

    ResponseEntity<Map<String, Object>> response = controller.readiness();

    assertThat(response.getStatusCode().value()).isEqualTo(503);
    assertThat(response.getBody()).containsEntry("ready", false);
  }

  @Test
  @DisplayName("Should skip the Redis check when the primary store is disabled")
  void shouldSkipRedisWhenDisabled() {
    ApplicationProperties enabled = TestProperties.forCredentialStores(null, null, null);
    ApplicationProperties disabled = new ApplicationProperties(enabled.riot(), enabled.valorantApi(), enabled.http(),
        new ApplicationProperties.CredentialProperties(
            new ApplicationProperties.CredentialProperties.PrimaryStoreProperties(false, "credentials:", null),
            enabled.credentials().legacyFile()));
    HealthController controller = new HealthController(redisHealthClient, disabled);

    ResponseEntity<Map<String, Object>> response = controller.readiness();

    assertThat(response.getStatusCode().value()).isEqualTo(200);
    verifyNoInteractions(redisHealthClient);
  }
}
