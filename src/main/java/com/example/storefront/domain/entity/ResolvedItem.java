package com.example.storefront.domain.entity;

/**
 * Caller-facing storefront item. A {@code null} price means the price is unknown;
 * a {@code null} icon means the item could not be matched to display data.
 */
public record ResolvedItem(String name, Integer price, String icon) {

  public boolean isPriceKnown() {
    return price != null;
  }
}
