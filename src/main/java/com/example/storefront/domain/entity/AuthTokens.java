package com.example.storefront.domain.entity;

import com.example.storefront.util.MaskingUtils;

/**
 * Access and identity tokens extracted from a reauthentication redirect.
 */
public record AuthTokens(String accessToken, String idToken) {

  @Override
  public String toString() {
    return "AuthTokens[accessToken=" + MaskingUtils.mask(accessToken)
        + ", idToken=" + MaskingUtils.mask(idToken) + "]";
  }
}
