package com.example.storefront.adapter.riot;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import okhttp3.Response;

import java.util.List;

/**
 * Recognizes responses produced by the provider's anti-automation layer instead of the endpoint itself.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ChallengeDetector {

  static final String MITIGATED_HEADER = "cf-mitigated";
  private static final String MITIGATED_CHALLENGE = "challenge";
  private static final List<String> BODY_MARKERS = List.of(
      "cf-chl",
      "cf_chl_opt",
      "challenge-platform",
      "Just a moment...",
      "Attention Required! | Cloudflare");

  public static boolean isChallenge(Response response, String body) {
    String mitigated = response.header(MITIGATED_HEADER);
    if (mitigated != null && mitigated.trim().equalsIgnoreCase(MITIGATED_CHALLENGE)) {
      return true;
    }
    return isChallengeBody(body);
  }

  public static boolean isChallengeBody(String body) {
    if (body == null || body.isEmpty()) {
      return false;
    }
    for (String marker : BODY_MARKERS) {
      if (body.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
