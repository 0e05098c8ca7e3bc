package com.example.storefront.web.rest.controller;

import static com.example.storefront.web.rest.ApiConstants.ApiPath.*;

import com.example.storefront.domain.entity.ResolvedItem;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

@Tag(
    name = "Store",
    description = "Daily storefront retrieval and reauthentication diagnostics"
)
@RequestMapping(value = STORE_BASE)
public interface StoreAPI {

  @Operation(
      summary = "Get the daily storefront",
      description = "Reauthenticates with the stored session cookies and returns the daily single-item offers. "
          + "A null price means the VP price is unknown."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Storefront items"),
      @ApiResponse(responseCode = "401", description = "Stored session has expired"),
      @ApiResponse(responseCode = "403", description = "Provider refused the storefront for this account"),
      @ApiResponse(responseCode = "404", description = "No credentials on record"),
      @ApiResponse(responseCode = "422", description = "Stored credentials have no ssid"),
      @ApiResponse(responseCode = "502", description = "Provider returned an unexpected response"),
      @ApiResponse(responseCode = "503", description = "Blocked by bot protection")
  })
  @GetMapping(value = USER_ID, produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<List<ResolvedItem>> getStore(
      @Parameter(description = "Caller-side user identifier") @PathVariable("userId") String userId);

  @Operation(
      summary = "Run reauthentication diagnostics",
      description = "Runs every reauthentication attempt and returns a masked plain-text report. "
          + "Read-only against both credential stores."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Diagnostic report")
  })
  @GetMapping(value = DIAGNOSTICS, produces = MediaType.TEXT_PLAIN_VALUE)
  ResponseEntity<String> getDiagnostics(
      @Parameter(description = "Caller-side user identifier") @PathVariable("userId") String userId);
}
