package com.example.storefront.domain.entity;

/**
 * Display data shared by a skin and all of its levels and chromas.
 */
public record SkinDisplay(String name, String icon) {}
