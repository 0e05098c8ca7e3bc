package com.example.storefront.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.storefront.domain.entity.CredentialSourceType;
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

@DisplayName("DiagnosticReporter")
class DiagnosticReporterTest {

  private static final String USER = "user-diag";
  private static final String KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
  private static final String LONG_SSID = "abcdefgh12345678";

  private MockWebServer server;
  private FakeRiotProvider provider;
  private StubCredentialStore primaryStore;
  private StubCredentialStore legacyStore;

  @BeforeEach
  void setUp() throws IOException {
    provider = new FakeRiotProvider();
    server = new MockWebServer();
    server.setDispatcher(provider);
    server.start();
    primaryStore = new StubCredentialStore(CredentialSourceType.PRIMARY);
    legacyStore = new StubCredentialStore(CredentialSourceType.LEGACY);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private DiagnosticReporter reporter(String encryptionKey) {
    return new EngineFixture(TestProperties.forServer(server, 1, encryptionKey), primaryStore, legacyStore)
        .diagnosticReporter();
  }

  @Test
  @DisplayName("Should print the ssid masked and never in full")
  void shouldMaskSsid() {
    primaryStore.with(USER, Bundles.ssidOnly(CredentialSourceType.PRIMARY, LONG_SSID));

    String report = reporter(KEY).runDiagnostics(USER);

    assertThat(report).contains("abcd…5678").doesNotContain(LONG_SSID);
  }

  @Test
  @DisplayName("Should run every attempt and suggest re-capturing when nothing succeeds")
  void shouldReportExpiry() {
    primaryStore.with(USER, Bundles.primaryFull());
    legacyStore.with(USER, Bundles.legacyFull());

    String report = reporter(KEY).runDiagnostics(USER);

    assertThat(report).contains("#1 PRIMARY + STORED-UA + FULL").contains("#8 LEGACY + DEFAULT-UA + SSID_ONLY");
    assertThat(report.lines().filter(line -> line.endsWith("| " + DiagnosticReporter.FAIL))).hasSize(8);
    assertThat(report).contains(DiagnosticReporter.HINT_EXPIRED)
        .doesNotContain(DiagnosticReporter.HINT_NETWORK)
        .doesNotContain("Shard probe");
    assertThat(provider.authCalls()).hasSize(32);
  }

  @Test
  @DisplayName("Should suggest a different network path when every attempt is challenged")
  void shouldReportChallenge() {
    primaryStore.with(USER, Bundles.primaryFull());
    provider.challengeEverything();

    String report = reporter(KEY).runDiagnostics(USER);

    assertThat(report.lines().filter(line -> line.endsWith("| " + DiagnosticReporter.CHALLENGE))).hasSize(4);
    assertThat(report).contains(DiagnosticReporter.HINT_NETWORK).doesNotContain(DiagnosticReporter.HINT_EXPIRED);
  }

  @Test
  @DisplayName("Should flag stale secondary cookies and probe shards with the first working session")
  void shouldReportStaleSecondaryCookies() {
    primaryStore.with(USER, Bundles.primaryFull());
    provider.acceptAuthorizeWhen(call -> !call.fullJar());

    String report = reporter(KEY).runDiagnostics(USER);

    assertThat(report).contains(DiagnosticReporter.HINT_STALE_SECONDARY)
        .doesNotContain(DiagnosticReporter.HINT_STORED_AGENT)
        .contains("Shard probe (session from attempt #2 PRIMARY + STORED-UA + SSID_ONLY)")
        .contains("  discovered shard: ap")
        .contains("  storefront v2 on ap: 200")
        .contains("  storefront v2 on na: 404")
        .contains("  wallet on ap: 200");
    assertThat(report.lines().filter(line -> line.endsWith("| " + DiagnosticReporter.OK))).hasSize(2);
    assertThat(report).doesNotContain(FakeRiotProvider.ACCESS_TOKEN).doesNotContain(FakeRiotProvider.ENTITLEMENTS_TOKEN);
  }

  @Test
  @DisplayName("Should not flag secondary cookies when the bundle holds only an ssid")
  void shouldNotFlagSecondaryCookiesWithoutFullAttempt() {
    primaryStore.with(USER, Bundles.ssidOnly(CredentialSourceType.PRIMARY, LONG_SSID));
    provider.acceptAuthorizeWhen(call -> true);

    String report = reporter(KEY).runDiagnostics(USER);

    assertThat(report.lines().filter(line -> line.endsWith("| " + DiagnosticReporter.OK))).hasSize(1);
    assertThat(report).doesNotContain(DiagnosticReporter.HINT_STALE_SECONDARY)
        .doesNotContain(DiagnosticReporter.HINT_EXPIRED);
  }

  @Test
  @DisplayName("Should flag the stored agent when only stored-agent attempts succeed")
  void shouldReportStoredAgent() {
    primaryStore.with(USER, Bundles.primaryFull());
    provider.acceptAuthorizeWhen(call -> Bundles.STORED_AGENT.equals(call.userAgent()));

    String report = reporter(KEY).runDiagnostics(USER);

    assertThat(report).contains(DiagnosticReporter.HINT_STORED_AGENT)
        .doesNotContain(DiagnosticReporter.HINT_STALE_SECONDARY);
  }

  @Test
  @DisplayName("Should warn when the encryption key is missing")
  void shouldReportMissingKey() {
    legacyStore.with(USER, Bundles.legacyFull());

    String report = reporter(null).runDiagnostics(USER);

    assertThat(report).contains("WARNING: credential encryption key is not configured")
        .contains(DiagnosticReporter.HINT_KEY_MISSING);
  }

  @Test
  @DisplayName("Should report a missing record instead of failing")
  void shouldReportMissingRecord() {
    String report = reporter(KEY).runDiagnostics(USER);

    assertThat(report).contains("No credentials on record for this user.");
    assertThat(server.getRequestCount()).isZero();
  }
}
