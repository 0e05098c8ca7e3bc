package com.example.storefront.domain.entity;

public enum UserAgentChoice {
  STORED,
  DEFAULT
}
