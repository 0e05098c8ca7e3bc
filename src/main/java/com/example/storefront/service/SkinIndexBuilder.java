package com.example.storefront.service;

import com.example.storefront.adapter.valorantapi.ValorantApiClient;
import com.example.storefront.adapter.valorantapi.dto.WeaponSkinResponse;
import com.example.storefront.domain.entity.SkinDisplay;
import com.example.storefront.domain.entity.SkinIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flattens the weapon-skin feed so that a skin, each of its levels and each of its chromas
 * all resolve to the skin's display name and icon.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkinIndexBuilder {

  private final ValorantApiClient valorantApiClient;

  public SkinIndex buildIndex(String language) {
    return index(valorantApiClient.fetchSkins(language));
  }

  static SkinIndex index(List<WeaponSkinResponse.WeaponSkin> skins) {
    Map<String, SkinDisplay> entries = new HashMap<>();
    for (WeaponSkinResponse.WeaponSkin skin : skins) {
      SkinDisplay display = new SkinDisplay(skin.displayName(), iconOf(skin));
      put(entries, skin.uuid(), display);
      if (skin.levels() != null) {
        skin.levels().forEach(level -> put(entries, level.uuid(), display));
      }
      if (skin.chromas() != null) {
        skin.chromas().forEach(chroma -> put(entries, chroma.uuid(), display));
      }
    }
    log.debug("Built skin index with {} keys from {} skins", entries.size(), skins.size());
    return new SkinIndex(entries);
  }

  private static String iconOf(WeaponSkinResponse.WeaponSkin skin) {
    if (skin.displayIcon() != null && !skin.displayIcon().isBlank()) {
      return skin.displayIcon();
    }
    if (skin.levels() != null && !skin.levels().isEmpty()) {
      return skin.levels().get(0).displayIcon();
    }
    return null;
  }

  private static void put(Map<String, SkinDisplay> entries, String uuid, SkinDisplay display) {
    if (uuid != null && !uuid.isBlank()) {
      entries.put(uuid.toLowerCase(Locale.ROOT), display);
    }
  }
}
