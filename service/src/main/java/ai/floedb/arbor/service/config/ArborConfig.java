/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.arbor.service.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/** Startup settings read from MicroProfile Config under the {@code arbor.} prefix. */
public record ArborConfig(
    StoreKind storeKind,
    Optional<Path> storePath,
    Duration lockTimeout,
    List<String> editors,
    List<String> feedbackRecipients) {

  public static final String STORE_KIND = "arbor.store.kind";
  public static final String STORE_PATH = "arbor.store.path";
  public static final String LOCK_TIMEOUT_MS = "arbor.store.lock-timeout-ms";
  public static final String EDITORS = "arbor.permissions.editors";
  public static final String FEEDBACK_RECIPIENTS = "arbor.permissions.feedback-recipients";

  static final long DEFAULT_LOCK_TIMEOUT_MS = 30_000L;

  public enum StoreKind {
    MEMORY,
    FILE;

    static StoreKind parse(String value) {
      try {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            STORE_KIND + " must be one of memory, file: " + value, e);
      }
    }
  }

  public ArborConfig {
    if (storeKind == StoreKind.FILE && storePath.isEmpty()) {
      throw new IllegalArgumentException(STORE_PATH + " is required when " + STORE_KIND + "=file");
    }
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException(LOCK_TIMEOUT_MS + " must be positive: " + lockTimeout);
    }
    editors = List.copyOf(editors);
    feedbackRecipients = List.copyOf(feedbackRecipients);
  }

  public static ArborConfig inMemory() {
    return new ArborConfig(
        StoreKind.MEMORY,
        Optional.empty(),
        Duration.ofMillis(DEFAULT_LOCK_TIMEOUT_MS),
        List.of(),
        List.of());
  }

  public static ArborConfig load() {
    return from(ConfigProvider.getConfig());
  }

  public static ArborConfig from(Config config) {
    var kind =
        config
            .getOptionalValue(STORE_KIND, String.class)
            .filter(value -> !value.isBlank())
            .map(StoreKind::parse)
            .orElse(StoreKind.MEMORY);
    var path =
        config
            .getOptionalValue(STORE_PATH, String.class)
            .map(String::trim)
            .filter(value -> !value.isBlank())
            .map(Path::of);
    long timeoutMs =
        config.getOptionalValue(LOCK_TIMEOUT_MS, Long.class).orElse(DEFAULT_LOCK_TIMEOUT_MS);
    return new ArborConfig(
        kind,
        path,
        Duration.ofMillis(timeoutMs),
        principals(config, EDITORS),
        principals(config, FEEDBACK_RECIPIENTS));
  }

  private static List<String> principals(Config config, String key) {
    var out = new ArrayList<String>();
    for (String value : config.getOptionalValues(key, String.class).orElse(List.of())) {
      if (value == null || value.isBlank()) {
        continue;
      }
      var trimmed = value.trim();
      if (!out.contains(trimmed)) {
        out.add(trimmed);
      }
    }
    return out;
  }
}
