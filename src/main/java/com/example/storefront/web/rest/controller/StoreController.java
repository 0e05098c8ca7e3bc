package com.example.storefront.web.rest.controller;

import com.example.storefront.domain.entity.ResolvedItem;
import com.example.storefront.service.DiagnosticReporter;
import com.example.storefront.service.StoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Store Controller
 *
 * Failures propagate to {@code GlobalErrorHandler}, which maps each error kind to a status.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class StoreController implements StoreAPI {

  private final StoreService storeService;
  private final DiagnosticReporter diagnosticReporter;

  @Override
  public ResponseEntity<List<ResolvedItem>> getStore(String userId) {
    log.debug("Storefront requested for user {}", userId);
    return ResponseEntity.ok(storeService.fetchStoreItems(userId));
  }

  @Override
  public ResponseEntity<String> getDiagnostics(String userId) {
    log.info("Diagnostics requested for user {}", userId);
    return ResponseEntity.ok(diagnosticReporter.runDiagnostics(userId));
  }
}
