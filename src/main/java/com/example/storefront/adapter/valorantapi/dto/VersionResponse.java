package com.example.storefront.adapter.valorantapi.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Public client version feed ({@code /v1/version}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionResponse(Data data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Data(String riotClientVersion) {}
}
