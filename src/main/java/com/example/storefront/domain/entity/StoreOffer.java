package com.example.storefront.domain.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A single-item offer as returned in the storefront's skins panel.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreOffer(
    @JsonProperty("OfferID")
    String offerId,
    @JsonProperty("Cost")
    Map<String, Integer> cost,
    @JsonProperty("DiscountedCost")
    @JsonAlias("DiscountCosts")
    Map<String, Integer> discountedCost,
    @JsonProperty("Rewards")
    List<Reward> rewards
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Reward(
      @JsonProperty("ItemTypeID")
      String itemTypeId,
      @JsonProperty("ItemID")
      String itemId,
      @JsonProperty("Quantity")
      Integer quantity
  ) {}
}
