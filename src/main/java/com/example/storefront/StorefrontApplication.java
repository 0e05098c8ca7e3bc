package com.example.storefront;

import com.example.storefront.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Storefront Service
 *
 * Re-establishes provider sessions from captured cookies and serves the daily storefront:
 * - Encrypted Redis credential store with a legacy flat-file fallback
 * - Attempt matrix over credential source, user agent and cookie scope
 * - Entitlement, shard and identity token pipeline
 * - Storefront retrieval with endpoint generation fallback
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class StorefrontApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(StorefrontApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
