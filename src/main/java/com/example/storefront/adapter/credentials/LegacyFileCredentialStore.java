package com.example.storefront.adapter.credentials;

import com.example.storefront.domain.entity.CredentialBundle;
import com.example.storefront.domain.entity.CredentialSourceType;
import com.example.storefront.exception.CredentialsNotFoundException;
import com.example.storefront.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Legacy credential store: one {@code <userId>.txt} file of {@code KEY=VALUE} lines.
 * Candidate directories are searched in order; the first readable file wins.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.credentials.legacy-file", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LegacyFileCredentialStore implements CredentialStore {

  private static final String FILE_SUFFIX = ".txt";
  private static final Pattern SAFE_USER_ID = Pattern.compile("[A-Za-z0-9_.-]{1,64}");
  private static final Path DEFAULT_USER_DIR = Paths.get(System.getProperty("user.home"), ".valorant", "cookies");
  private static final Path WORKING_DIR = Paths.get("cookies");

  private final List<Path> candidateDirs;

  public LegacyFileCredentialStore(ApplicationProperties properties) {
    this.candidateDirs = candidateDirs(properties.credentials().legacyFile());
    log.info("Legacy credential files searched in: {}", candidateDirs);
  }

  @Override
  public CredentialSourceType type() {
    return CredentialSourceType.LEGACY;
  }

  @Override
  public CredentialBundle load(String userId) {
    if (userId == null || !SAFE_USER_ID.matcher(userId).matches() || userId.startsWith(".")) {
      throw new CredentialsNotFoundException("No legacy credential file for user " + userId);
    }

    for (Path dir : candidateDirs) {
      Path file = dir.resolve(userId + FILE_SUFFIX);
      if (!Files.isRegularFile(file)) {
        continue;
      }
      try {
        Map<String, String> values = parse(Files.readAllLines(file, StandardCharsets.UTF_8));
        log.debug("Loaded legacy credential file {}", file);
        return CredentialNormalizer.normalize(CredentialSourceType.LEGACY, values, null);
      } catch (IOException e) {
        log.warn("Unreadable legacy credential file {}: {}", file, e.getMessage());
      }
    }
    throw new CredentialsNotFoundException("No legacy credential file for user " + userId);
  }

  /**
   * Blank lines, {@code #} comments and lines without {@code =} are skipped.
   * A repeated key keeps its first value.
   */
  static Map<String, String> parse(List<String> lines) {
    Map<String, String> values = new HashMap<>();
    for (String line : lines) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      values.putIfAbsent(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1));
    }
    return values;
  }

  static List<Path> candidateDirs(ApplicationProperties.CredentialProperties.LegacyFileProperties props) {
    Set<Path> dirs = new LinkedHashSet<>();
    if (props.overrideDir() != null && !props.overrideDir().isBlank()) {
      dirs.add(normalize(Paths.get(props.overrideDir())));
    }
    if (props.userDir() != null && !props.userDir().isBlank()) {
      dirs.add(normalize(Paths.get(props.userDir())));
    } else {
      dirs.add(normalize(DEFAULT_USER_DIR));
    }
    dirs.add(normalize(WORKING_DIR));
    return new ArrayList<>(dirs);
  }

  private static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }
}
