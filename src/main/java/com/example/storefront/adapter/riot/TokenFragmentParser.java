package com.example.storefront.adapter.riot;

import com.example.storefront.domain.entity.AuthTokens;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Extracts {@code access_token} and {@code id_token} from the fragment of a redirect URI.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TokenFragmentParser {

  private static final String ACCESS_TOKEN = "access_token";
  private static final String ID_TOKEN = "id_token";

  /**
   * @return both tokens, or empty when the URI has no fragment or either token is missing
   */
  public static Optional<AuthTokens> parse(String uri) {
    if (uri == null) {
      return Optional.empty();
    }
    int hash = uri.indexOf('#');
    if (hash < 0 || hash == uri.length() - 1) {
      return Optional.empty();
    }

    String accessToken = null;
    String idToken = null;
    for (String pair : uri.substring(hash + 1).split("&")) {
      int eq = pair.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      String name = pair.substring(0, eq);
      String value = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      if (ACCESS_TOKEN.equals(name)) {
        accessToken = value;
      } else if (ID_TOKEN.equals(name)) {
        idToken = value;
      }
    }

    if (accessToken == null || accessToken.isBlank() || idToken == null || idToken.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new AuthTokens(accessToken, idToken));
  }
}
