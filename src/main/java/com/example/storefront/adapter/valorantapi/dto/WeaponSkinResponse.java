package com.example.storefront.adapter.valorantapi.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Public weapon-skin feed ({@code /v1/weapons/skins}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WeaponSkinResponse(List<WeaponSkin> data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WeaponSkin(
      String uuid,
      String displayName,
      String displayIcon,
      List<Level> levels,
      List<Chroma> chromas
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Level(String uuid, String displayIcon) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Chroma(String uuid) {}
}
