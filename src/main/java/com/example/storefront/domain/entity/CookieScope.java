package com.example.storefront.domain.entity;

/**
 * Which session cookies are placed in an attempt's cookie jar.
 */
public enum CookieScope {
  FULL,
  SSID_ONLY
}
