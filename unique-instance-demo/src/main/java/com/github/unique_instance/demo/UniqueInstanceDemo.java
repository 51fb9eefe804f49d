// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance.demo;

import com.github.unique_instance.CommandHandler;
import com.github.unique_instance.DaemonWorkers;
import com.github.unique_instance.ProcessTerminator;
import com.github.unique_instance.UniqueInstance;
import com.github.unique_instance.UniqueInstanceConfig;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// Command line application that runs as a unique instance. The first launch keeps running and executes
/// the commands of every later launch until one of them says `stop`.
///
/// ```
/// java -Dunique.instance.demo.appId=demo -cp ... com.github.unique_instance.demo.UniqueInstanceDemo echo hello
/// ```
public class UniqueInstanceDemo {

  public static final String PROP_APP_ID = "unique.instance.demo.appId";
  public static final String DEFAULT_APP_ID = "unique-instance-demo";

  static final Duration STOP_GRACE = Duration.ofSeconds(10);

  public static void main(String[] args) throws InterruptedException {
    LoggerConfig.initialize();
    final var appId = Optional.ofNullable(System.getProperty(PROP_APP_ID)).orElse(DEFAULT_APP_ID);
    final var stopRequested = new CountDownLatch(1);
    final var workers = new DaemonWorkers("demo");
    final var instance = new UniqueInstance(UniqueInstanceConfig.fromSystemProperties(), workers, ProcessTerminator.SYSTEM_EXIT);

    instance.start(appId, CommandHandler.blocking(new DemoCommands(stopRequested::countDown)), List.of(args),
            CompletableFuture.completedFuture(null))
        .whenComplete((ignored, failure) -> {
          if (failure != null) {
            LOGGER.log(Level.WARNING, "Own command failed: " + failure.getMessage(), failure);
          }
        });

    // only the leader gets this far
    stopRequested.await();
    instance.shutdown();
    // let the connection that asked to stop get its answer
    if (!workers.awaitAll(STOP_GRACE)) {
      LOGGER.warning(() -> "Exiting with " + workers.liveCount() + " connections still running");
    }
    System.exit(0);
  }
}
