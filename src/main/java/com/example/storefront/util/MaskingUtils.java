package com.example.storefront.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Masking for credential and token values that reach logs or reports.
 * Only a short prefix and suffix of long values are ever shown.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class MaskingUtils {

  public static final String NONE = "<none>";
  private static final String ELLIPSIS = "…";
  private static final String REDACTED = "****";
  private static final int VISIBLE_CHARS = 4;

  /**
   * Masks a value as {@code abcd…5678}. Values of eight characters or fewer are fully redacted,
   * since a four-and-four window would reveal them completely.
   *
   * @param value secret to mask, may be {@code null}
   * @return the masked form, or {@link #NONE} for a missing value
   */
  public static String mask(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    if (value.length() <= VISIBLE_CHARS * 2) {
      return REDACTED;
    }
    return value.substring(0, VISIBLE_CHARS) + ELLIPSIS + value.substring(value.length() - VISIBLE_CHARS);
  }
}
