package com.example.storefront.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import com.example.storefront.domain.entity.ResolvedItem;
import com.example.storefront.exception.UpstreamException;
import com.example.storefront.support.Bundles;
import com.example.storefront.support.EngineFixture;
import com.example.storefront.support.FakeRiotProvider;
import com.example.storefront.support.StubCredentialStore;
import com.example.storefront.support.TestProperties;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

@DisplayName("StoreService end to end")
class StoreServiceTest {

  private static final String USER = "user-42";

  private MockWebServer server;
  private FakeRiotProvider provider;
  private StubCredentialStore primaryStore;
  private EngineFixture fixture;

  @BeforeEach
  void setUp() throws IOException {
    provider = new FakeRiotProvider();
    server = new MockWebServer();
    server.setDispatcher(provider);
    server.start();
    primaryStore = new StubCredentialStore(CredentialSourceType.PRIMARY);
    fixture = new EngineFixture(TestProperties.forServer(server), primaryStore);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  @DisplayName("Should resolve the daily offer from an ssid-only bundle through an ssid-only attempt")
  void shouldSucceedWithSsidOnlyBundle() {
    primaryStore.with(USER, Bundles.ssidOnly(CredentialSourceType.PRIMARY, "only-the-ssid-0003"));
    provider.acceptAuthorizeWhen(call -> call.ssid() != null && !call.fullJar());

    List<ResolvedItem> items = fixture.storeService.fetchStoreItems(USER);

    assertThat(items).containsExactly(
        new ResolvedItem(FakeRiotProvider.SKIN_NAME, 1775, FakeRiotProvider.SKIN_ICON));
    assertThat(provider.authCalls()).allMatch(call -> !call.fullJar());
  }

  @Test
  @DisplayName("Should skip identity resolution when the bundle already carries a puuid")
  void shouldUseKnownPuuid() throws InterruptedException {
    primaryStore.with(USER, new CredentialBundle(
        CredentialSourceType.PRIMARY, "ssid-with-puuid-0004", null, null, null, null, Bundles.KNOWN_PUUID, null));
    provider.acceptAuthorizeWhen(call -> true);

    fixture.storeService.fetchStoreItems(USER);

    List<String> paths = new ArrayList<>();
    for (int i = 0; i < server.getRequestCount(); i++) {
      paths.add(server.takeRequest().getRequestUrl().encodedPath());
    }
    assertThat(paths).noneMatch(path -> path.endsWith("/userinfo"));
    assertThat(paths).anyMatch(path -> path.endsWith("/store/v3/storefront/" + Bundles.KNOWN_PUUID));
  }

  @Test
  @DisplayName("Should fall back to the v2 storefront when v3 is not found")
  void shouldFallBackToPriorGeneration() {
    primaryStore.with(USER, Bundles.primaryFull());
    provider.acceptAuthorizeWhen(call -> true).storefrontStatuses(404, 200);

    List<ResolvedItem> items = fixture.storeService.fetchStoreItems(USER);

    assertThat(items).hasSize(1);
  }

  @Test
  @DisplayName("Should surface a storefront 403 as a forbidden upstream error after every attempt got one")
  void shouldSurfaceForbidden() {
    primaryStore.with(USER, Bundles.primaryFull());
    provider.acceptAuthorizeWhen(call -> true).storefrontStatuses(403, 200);

    assertThatThrownBy(() -> fixture.storeService.fetchStoreItems(USER))
        .isInstanceOfSatisfying(UpstreamException.class, e -> {
          assertThat(e.isForbidden()).isTrue();
          assertThat(e.getStatus()).isEqualTo(403);
        });
    // one successful reauthentication (POST A + GET A) per attempt
    assertThat(provider.authCalls()).hasSize(8);
  }
}
