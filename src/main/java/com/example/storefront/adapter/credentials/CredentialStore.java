package com.example.storefront.adapter.credentials;

import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import com.example.storefront.exception.CredentialsNotFoundException;

/**
 * Read-only source of captured session credentials.
 */
public interface CredentialStore {

  CredentialSourceType type();

  /**
   * Loads and normalizes the bundle for a user.
   *
   * @throws CredentialsNotFoundException if this store has no record for the user
   */
  CredentialBundle load(String userId);
}
