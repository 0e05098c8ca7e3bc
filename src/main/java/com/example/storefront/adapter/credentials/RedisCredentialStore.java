package com.example.storefront.adapter.credentials;

import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import com.example.storefront.exception.CredentialsNotFoundException;
import com.example.storefront.exception.EncryptionException;
import com.example.storefront.properties.ApplicationProperties;
import com.example.storefront.service.EncryptionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Primary credential store: one Redis hash per user holding the encrypted cookie payload
 * and the user agent of the browser that captured it.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.credentials.primary", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RedisCredentialStore implements CredentialStore {

  public static final String FIELD_ENCRYPTED_COOKIES = "encryptedCookies";
  public static final String FIELD_USER_AGENT = "userAgent";
  public static final String FIELD_ACTIVE = "active";
  public static final String FIELD_KEY_VERSION = "keyVersion";
  public static final String FIELD_UPDATED_AT = "updatedAt";

  private final RedisTemplate<String, String> redisTemplate;
  private final EncryptionService encryptionService;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public RedisCredentialStore(RedisTemplate<String, String> redisTemplate,
                              EncryptionService encryptionService,
                              ObjectMapper objectMapper,
                              ApplicationProperties properties) {
    this.redisTemplate = redisTemplate;
    this.encryptionService = encryptionService;
    this.objectMapper = objectMapper;
    this.keyPrefix = properties.credentials().primary().keyPrefix();
  }

  @Override
  public CredentialSourceType type() {
    return CredentialSourceType.PRIMARY;
  }

  /**
   * @throws EncryptionException if the record exists but cannot be decrypted or parsed
   */
  @Override
  public CredentialBundle load(String userId) {
    HashOperations<String, String, String> hash = redisTemplate.opsForHash();
    Map<String, String> record = hash.entries(keyPrefix + userId);

    if (record == null || record.isEmpty() || "false".equalsIgnoreCase(record.get(FIELD_ACTIVE))) {
      throw new CredentialsNotFoundException("No active primary credential record for user " + userId);
    }

    Map<String, String> cookies = new HashMap<>();
    String encrypted = record.get(FIELD_ENCRYPTED_COOKIES);
    if (encrypted != null && !encrypted.isBlank()) {
      cookies.putAll(parsePayload(encryptionService.decrypt(encrypted)));
    }

    log.debug("Loaded primary credential record for user {} (keyVersion={}, updatedAt={})", userId,
              record.get(FIELD_KEY_VERSION), record.get(FIELD_UPDATED_AT));
    return CredentialNormalizer.normalize(CredentialSourceType.PRIMARY, cookies, record.get(FIELD_USER_AGENT));
  }

  private Map<String, String> parsePayload(String json) {
    try {
      JsonNode root = objectMapper.readTree(json);
      if (!root.isObject()) {
        throw new EncryptionException("Decrypted credential payload is not a JSON object");
      }
      Map<String, String> values = new HashMap<>();
      root.fields().forEachRemaining(field -> {
        if (field.getValue().isValueNode() && !field.getValue().isNull()) {
          values.put(field.getKey(), field.getValue().asText());
        }
      });
      return values;
    } catch (JsonProcessingException e) {
      throw new EncryptionException("Decrypted credential payload is not valid JSON", e);
    }
  }
}
