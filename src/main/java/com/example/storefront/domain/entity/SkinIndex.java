package com.example.storefront.domain.entity;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup from any skin, level or chroma UUID to its display data. Keys are lower-case.
 */
public final class SkinIndex {

  private final Map<String, SkinDisplay> entries;

  public SkinIndex(Map<String, SkinDisplay> entries) {
    this.entries = Collections.unmodifiableMap(entries);
  }

  public Optional<SkinDisplay> lookup(String uuid) {
    if (uuid == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.get(uuid.toLowerCase(Locale.ROOT)));
  }

  public int size() {
    return entries.size();
  }
}
