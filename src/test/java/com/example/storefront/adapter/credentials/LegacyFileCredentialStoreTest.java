package com.example.storefront.adapter.credentials;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import com.example.storefront.exception.CredentialsNotFoundException;
import com.example.storefront.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@DisplayName("LegacyFileCredentialStore")
class LegacyFileCredentialStoreTest {

  @TempDir
  Path tempDir;

  private Path overrideDir;
  private Path userDir;
  private LegacyFileCredentialStore store;

  @BeforeEach
  void setUp() throws IOException {
    overrideDir = Files.createDirectory(tempDir.resolve("override"));
    userDir = Files.createDirectory(tempDir.resolve("user"));
    store = new LegacyFileCredentialStore(
        TestProperties.forCredentialStores(null, overrideDir.toString(), userDir.toString()));
  }

  private static void write(Path dir, String userId, String... lines) throws IOException {
    Files.write(dir.resolve(userId + ".txt"), List.of(lines), StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Should read KEY=VALUE lines into a legacy bundle")
  void shouldLoadFile() throws IOException {
    write(userDir, "player_1",
          "# captured 2024-05-01",
          "",
          "RIOT_SSID=\"legacy-ssid-value\"",
          "CLID=legacy-clid",
          "tdid=legacy-tdid",
          "user_agent=Legacy/1.0",
          "not a pair");

    CredentialBundle bundle = store.load("player_1");

    assertThat(bundle.source()).isEqualTo(CredentialSourceType.LEGACY);
    assertThat(bundle.ssid()).isEqualTo("legacy-ssid-value");
    assertThat(bundle.clid()).isEqualTo("legacy-clid");
    assertThat(bundle.tdid()).isEqualTo("legacy-tdid");
    assertThat(bundle.userAgent()).isNull();
  }

  @Test
  @DisplayName("Should prefer the override directory over the user directory")
  void shouldPreferOverrideDir() throws IOException {
    write(userDir, "player_1", "ssid=from-user-dir");
    write(overrideDir, "player_1", "ssid=from-override");

    assertThat(store.load("player_1").ssid()).isEqualTo("from-override");
  }

  @Test
  @DisplayName("Should fail with NotFound when no directory holds the file")
  void shouldFailWhenMissing() {
    assertThatThrownBy(() -> store.load("nobody")).isInstanceOf(CredentialsNotFoundException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {"../user/player_1", ".hidden", "a/b", "name with space"})
  @DisplayName("Should refuse user ids that could escape the credential directories")
  void shouldRejectUnsafeIds(String userId) throws IOException {
    write(userDir, "player_1", "ssid=x");

    assertThatThrownBy(() -> store.load(userId)).isInstanceOf(CredentialsNotFoundException.class);
  }

  @Test
  @DisplayName("Should keep the first value of a repeated key")
  void shouldKeepFirstDuplicate() {
    Map<String, String> values = LegacyFileCredentialStore.parse(List.of("ssid=first", "ssid=second", "sub=a=b"));

    assertThat(values).containsEntry("ssid", "first").containsEntry("sub", "a=b");
  }

  @Test
  @DisplayName("Should search override, user and working directories in order")
  void shouldOrderCandidateDirs() {
    List<Path> dirs = LegacyFileCredentialStore.candidateDirs(
        TestProperties.forCredentialStores(null, overrideDir.toString(), userDir.toString()).credentials().legacyFile());

    assertThat(dirs).containsExactly(overrideDir.toAbsolutePath().normalize(), userDir.toAbsolutePath().normalize(),
                                     Path.of("cookies").toAbsolutePath().normalize());
  }
}
