package com.example.storefront.service;

import com.example.storefront.domain.entity.ResolvedItem;
import com.example.storefront.domain.entity.SkinIndex;
import com.example.storefront.domain.entity.TokenSet;
import com.example.storefront.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Caller entry point: reauthenticate, complete the token pipeline, fetch the storefront
 * and resolve its offers to display items.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreService {

  private final ReauthenticationEngine reauthenticationEngine;
  private final TokenPipeline tokenPipeline;
  private final StorefrontFetcher storefrontFetcher;
  private final SkinIndexBuilder skinIndexBuilder;
  private final ItemResolver itemResolver;
  private final ApplicationProperties properties;

  public List<ResolvedItem> fetchStoreItems(String userId) {
    JsonNode catalog = reauthenticationEngine.authenticate(userId, authenticated -> {
      TokenSet tokens = tokenPipeline.complete(authenticated);
      return storefrontFetcher.fetchCatalog(authenticated.session(), tokens, tokenPipeline.clientVersion());
    });

    SkinIndex index = skinIndexBuilder.buildIndex(properties.valorantApi().language());
    List<ResolvedItem> items = itemResolver.resolveItems(catalog, index);
    log.info("Resolved {} storefront items for user {}", items.size(), userId);
    return items;
  }
}
