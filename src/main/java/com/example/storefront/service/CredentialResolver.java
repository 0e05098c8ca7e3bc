package com.example.storefront.service;

import com.example.storefront.adapter.credentials.CredentialStore;
import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import com.example.storefront.domain.entity.ResolvedCredentials;
import com.example.storefront.exception.CredentialsNotFoundException;
import com.example.storefront.exception.EncryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads every enabled credential source for a user. A missing or unreadable source is not fatal
 * as long as the other one has a record.
 */
@Slf4j
@Service
public class CredentialResolver {

  private final Map<CredentialSourceType, CredentialStore> stores = new EnumMap<>(CredentialSourceType.class);

  public CredentialResolver(List<CredentialStore> stores) {
    stores.forEach(store -> this.stores.put(store.type(), store));
    log.info("Credential sources enabled: {}", this.stores.keySet());
  }

  /**
   * @throws CredentialsNotFoundException if no enabled source has a record for the user
   */
  public ResolvedCredentials resolve(String userId) {
    CredentialBundle primary = load(CredentialSourceType.PRIMARY, userId);
    CredentialBundle legacy = load(CredentialSourceType.LEGACY, userId);
    if (primary == null && legacy == null) {
      throw new CredentialsNotFoundException("No credentials on record for user " + userId);
    }
    log.debug("Resolved credentials for user {}: primary={}, legacy={}", userId, primary, legacy);
    return new ResolvedCredentials(userId, primary, legacy);
  }

  public boolean isEnabled(CredentialSourceType type) {
    return stores.containsKey(type);
  }

  private CredentialBundle load(CredentialSourceType type, String userId) {
    CredentialStore store = stores.get(type);
    if (store == null) {
      return null;
    }
    try {
      return store.load(userId);
    } catch (CredentialsNotFoundException e) {
      log.debug("{} source has no record for user {}", type, userId);
      return null;
    } catch (EncryptionException e) {
      log.error("{} credential record for user {} could not be decrypted; source skipped", type, userId, e);
      return null;
    }
  }
}
