// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Settings of the coordinator.
///
/// @param lockDirectory     where the lock file of each application id lives
/// @param serverBacklog     pending connection queue of the leader listener
/// @param inputDrainTimeout how long a follower waits for its stdin forwarding to wind down once the result is in
public record UniqueInstanceConfig(Path lockDirectory, int serverBacklog, Duration inputDrainTimeout) {

  public static final String PROP_LOCK_DIR = "unique.instance.dir";
  public static final String PROP_BACKLOG = "unique.instance.backlog";
  public static final String PROP_DRAIN_TIMEOUT = "unique.instance.drainTimeoutMillis";

  public static final int DEFAULT_BACKLOG = 10;
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

  public UniqueInstanceConfig {
    Objects.requireNonNull(lockDirectory, "lock directory cannot be null");
    Objects.requireNonNull(inputDrainTimeout, "input drain timeout cannot be null");
    if (serverBacklog <= 0) {
      throw new IllegalArgumentException("server backlog must be positive: " + serverBacklog);
    }
    if (inputDrainTimeout.isNegative()) {
      throw new IllegalArgumentException("input drain timeout cannot be negative: " + inputDrainTimeout);
    }
  }

  public static UniqueInstanceConfig defaults() {
    return new UniqueInstanceConfig(userHome(), DEFAULT_BACKLOG, DEFAULT_DRAIN_TIMEOUT);
  }

  /// Defaults overridden by the `unique.instance.*` system properties that are set.
  public static UniqueInstanceConfig fromSystemProperties() {
    final var lockDirectory = Optional.ofNullable(System.getProperty(PROP_LOCK_DIR))
        .filter(s -> !s.isBlank())
        .map(Path::of)
        .orElseGet(UniqueInstanceConfig::userHome);
    final int backlog = longProperty(PROP_BACKLOG)
        .filter(n -> n > 0 && n <= Integer.MAX_VALUE)
        .map(Long::intValue)
        .orElse(DEFAULT_BACKLOG);
    final var drainTimeout = longProperty(PROP_DRAIN_TIMEOUT)
        .filter(n -> n >= 0)
        .map(Duration::ofMillis)
        .orElse(DEFAULT_DRAIN_TIMEOUT);
    return new UniqueInstanceConfig(lockDirectory, backlog, drainTimeout);
  }

  /// A numeric property; an unparsable value is logged and ignored.
  private static Optional<Long> longProperty(String name) {
    final var value = System.getProperty(name);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(value.strip()));
    } catch (NumberFormatException e) {
      LOGGER.warning(() -> "Ignoring " + name + "=" + value + ": not a number");
      return Optional.empty();
    }
  }

  public UniqueInstanceConfig withLockDirectory(Path lockDirectory) {
    return new UniqueInstanceConfig(lockDirectory, serverBacklog, inputDrainTimeout);
  }

  public UniqueInstanceConfig withServerBacklog(int serverBacklog) {
    return new UniqueInstanceConfig(lockDirectory, serverBacklog, inputDrainTimeout);
  }

  public UniqueInstanceConfig withInputDrainTimeout(Duration inputDrainTimeout) {
    return new UniqueInstanceConfig(lockDirectory, serverBacklog, inputDrainTimeout);
  }

  static Path userHome() {
    return Optional.ofNullable(System.getenv("HOME"))
        .or(() -> Optional.ofNullable(System.getProperty("user.home")))
        .map(Path::of)
        .orElseThrow(() -> new IllegalStateException("User home directory is unknown"));
  }
}
