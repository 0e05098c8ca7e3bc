package com.example.storefront.service;

import com.example.storefront.domain.entity.ResolvedItem;
import com.example.storefront.domain.entity.SkinDisplay;
import com.example.storefront.domain.entity.SkinIndex;
import com.example.storefront.domain.entity.StoreOffer;
import com.example.storefront.exception.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the daily single-item offers of a storefront to named, priced items, in storefront order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemResolver {

  public static final String WEAPON_SKIN_ITEM_TYPE = "e7c63390-eda7-46e0-bb7a-a6abdacd2433";
  public static final String VP_CURRENCY_ID = "85ad13f7-3d1b-5128-9eb2-7cd8ee0b5741";

  private final ObjectMapper objectMapper;

  public List<ResolvedItem> resolveItems(JsonNode catalog, SkinIndex index) {
    JsonNode offers = catalog.path("SkinsPanelLayout").path("SingleItemStoreOffers");
    if (!offers.isArray()) {
      log.info("Storefront has no single-item offers");
      return List.of();
    }

    List<ResolvedItem> items = new ArrayList<>();
    for (JsonNode node : offers) {
      StoreOffer offer = toOffer(node);
      Optional<StoreOffer.Reward> skin = weaponSkinReward(offer);
      if (skin.isEmpty()) {
        log.debug("Offer {} has no weapon-skin reward; skipped", offer.offerId());
        continue;
      }
      String itemId = skin.get().itemId();
      Optional<SkinDisplay> display = index.lookup(itemId);
      items.add(new ResolvedItem(
          display.map(SkinDisplay::name).orElse(itemId),
          price(offer),
          display.map(SkinDisplay::icon).orElse(null)));
    }
    return List.copyOf(items);
  }

  /**
   * VP entry of the discounted cost map when that map is present, otherwise of the standard one.
   * A missing VP entry in the chosen map means the price is unknown ({@code null}).
   */
  static Integer price(StoreOffer offer) {
    return vpOf(offer.discountedCost() != null ? offer.discountedCost() : offer.cost());
  }

  private static Integer vpOf(Map<String, Integer> costs) {
    return costs == null ? null : costs.get(VP_CURRENCY_ID);
  }

  private static Optional<StoreOffer.Reward> weaponSkinReward(StoreOffer offer) {
    if (offer.rewards() == null) {
      return Optional.empty();
    }
    return offer.rewards().stream()
        .filter(reward -> reward.itemId() != null)
        .filter(reward -> WEAPON_SKIN_ITEM_TYPE.equalsIgnoreCase(reward.itemTypeId()))
        .findFirst();
  }

  private StoreOffer toOffer(JsonNode node) {
    try {
      return objectMapper.treeToValue(node, StoreOffer.class);
    } catch (JsonProcessingException e) {
      throw new UpstreamException("Storefront offer has an unexpected shape", e);
    }
  }
}
