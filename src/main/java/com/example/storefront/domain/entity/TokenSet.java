package com.example.storefront.domain.entity;

import com.example.storefront.util.MaskingUtils;

/**
 * Everything the storefront request needs. Lives only for one successful attempt; never persisted.
 */
public record TokenSet(
    String accessToken,
    String idToken,
    String entitlementsToken,
    String shard,
    String puuid
) {

  public boolean isComplete() {
    return notBlank(accessToken) && notBlank(idToken) && notBlank(entitlementsToken)
        && notBlank(shard) && notBlank(puuid);
  }

  @Override
  public String toString() {
    return "TokenSet[accessToken=" + MaskingUtils.mask(accessToken)
        + ", entitlementsToken=" + MaskingUtils.mask(entitlementsToken)
        + ", shard=" + shard
        + ", puuid=" + MaskingUtils.mask(puuid) + "]";
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }
}
