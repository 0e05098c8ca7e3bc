package com.example.storefront.domain.entity;

/**
 * Where a credential bundle was loaded from.
 */
public enum CredentialSourceType {
  //Encrypted Redis record written by the capture endpoint. Carries the capturing browser's user agent.
  PRIMARY,
  //Flat KEY=VALUE file kept from the first deployment. Never carries a user agent.
  LEGACY
}
