// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.*;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Leader and followers share this JVM, each follower with its own lock file handle and captured streams.
@Timeout(30)
public class UniqueInstanceTests {

  static final String APP_ID = "unique-instance-test";
  static final String NL = System.lineSeparator();

  @BeforeAll
  static void setupLogging() {
    final var logLevel = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    final Level level = Level.parse(logLevel);

    LOGGER.setLevel(level);
    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setLevel(level);
    LOGGER.addHandler(consoleHandler);
    LOGGER.setUseParentHandlers(false);
  }

  @TempDir
  Path dir;

  UniqueInstanceConfig config;
  final List<UniqueInstance> leaders = new ArrayList<>();
  final List<List<String>> seen = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setup() {
    config = UniqueInstanceConfig.defaults()
        .withLockDirectory(dir)
        .withInputDrainTimeout(Duration.ofSeconds(2));
  }

  @AfterEach
  void shutdownLeaders() {
    leaders.forEach(UniqueInstance::shutdown);
  }

  /// `exit N [text]` answers code N, `fail` throws, `none` returns no result, anything else echoes its
  /// arguments and input.
  final CommandHandler commands = CommandHandler.blocking((args, in) -> {
    seen.add(args);
    if (List.of("none").equals(args)) {
      return null;
    }
    if (!args.isEmpty() && args.get(0).equals("exit")) {
      return new CommandResult(Integer.parseInt(args.get(1)), args.size() > 2 ? args.get(2) : null);
    }
    if (!args.isEmpty() && args.get(0).equals("fail")) {
      throw new IllegalStateException("broken");
    }
    return CommandResult.success(String.join(",", args) + ":" + new String(in.readAllBytes(), StandardCharsets.UTF_8));
  });

  record Launch(int code, String out, String err) {
  }

  static final class Captured {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final ByteArrayOutputStream err = new ByteArrayOutputStream();
    final SystemStreams streams;

    Captured(String stdin) {
      streams = new SystemStreams(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
          new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    String out() {
      return out.toString(StandardCharsets.UTF_8);
    }

    String err() {
      return err.toString(StandardCharsets.UTF_8);
    }
  }

  UniqueInstance leader(List<String> args, CompletionStage<?> ready, Captured captured) throws Exception {
    final var instance = new UniqueInstance(config, new DaemonWorkers("leader"), code -> {
      throw new AssertionError("leader terminated with " + code);
    });
    final var started = instance.start(APP_ID, commands, args, ready, captured.streams);
    assertThat(instance.isLeader()).isTrue();
    leaders.add(instance);
    if (ready.toCompletableFuture().isDone()) {
      started.get(5, TimeUnit.SECONDS);
    }
    return instance;
  }

  UniqueInstance leader() throws Exception {
    return leader(List.of(), CompletableFuture.completedFuture(null), new Captured(""));
  }

  Launch follow(List<String> args, String stdin) {
    final var captured = new Captured(stdin);
    final var code = new AtomicInteger(-1);
    final var instance = new UniqueInstance(config, new DaemonWorkers("follower"), code::set);
    final CommandHandler mustNotRun = (a, in) -> {
      throw new AssertionError("follower ran a command");
    };
    instance.start(APP_ID, mustNotRun, args, CompletableFuture.completedFuture(null), captured.streams);
    assertThat(instance.isLeader()).isFalse();
    return new Launch(code.get(), captured.out(), captured.err());
  }

  int publishedPort() throws IOException {
    return ByteBuffer.wrap(Files.readAllBytes(LockFile.pathFor(dir, APP_ID))).getInt(0);
  }

  @Test
  void leaderRunsItsOwnCommand() throws Exception {
    final var captured = new Captured("local");

    leader(List.of("first"), CompletableFuture.completedFuture(null), captured);

    assertThat(captured.out()).isEqualTo("first:local" + NL);
    assertThat(Files.exists(LockFile.pathFor(dir, APP_ID))).isTrue();
  }

  @Test
  void followerForwardsArgumentsAndInput() throws Exception {
    leader();

    final var launch = follow(List.of("--flag", "value"), "hello\n");

    assertThat(launch).isEqualTo(new Launch(0, "--flag,value:hello\n" + NL, ""));
  }

  @Test
  void followerExitsWithLeaderCodeAndOutput() throws Exception {
    leader();

    final var launch = follow(List.of("exit", "3", "done"), "");

    assertThat(launch).isEqualTo(new Launch(3, "", "done" + NL));
  }

  @Test
  void followerWithoutArgumentsOrInput() throws Exception {
    leader();

    assertThat(follow(List.of(), "")).isEqualTo(new Launch(0, ":" + NL, ""));
    assertThat(seen).last().isEqualTo(List.of());
  }

  @Test
  void emptyArgumentsAreKept() throws Exception {
    leader();

    assertThat(follow(List.of("", "x", ""), "").out()).isEqualTo(",x,:" + NL);
  }

  @Test
  void failingCommandGivesCommandError() throws Exception {
    leader();

    final var launch = follow(List.of("fail"), "");

    assertThat(launch.code()).isEqualTo(CommandResult.CODE_CMD_ERROR);
    assertThat(launch.err()).contains("Failed to process arguments: broken");
  }

  @Test
  void followersWaitForLeaderCommand() throws Exception {
    final var ready = new CompletableFuture<Void>();
    leader(List.of("leader"), ready, new Captured(""));

    final var follower = CompletableFuture.supplyAsync(() -> follow(List.of("follower"), ""));
    Thread.sleep(300);
    assertThat(seen).isEmpty();
    assertThat(follower).isNotDone();

    ready.complete(null);

    assertThat(follower.get(10, TimeUnit.SECONDS).code()).isZero();
    assertThat(seen).containsExactly(List.of("leader"), List.of("follower"));
  }

  @Test
  void failedReadinessServesNobody() throws Exception {
    final var ready = new CompletableFuture<Void>();
    final var instance = new UniqueInstance(config, new DaemonWorkers("leader"), code -> {
      throw new AssertionError("leader terminated with " + code);
    });
    leaders.add(instance);
    final var started = instance.start(APP_ID, commands, List.of("never"), ready, new Captured("").streams);

    ready.completeExceptionally(new IllegalStateException("init failed"));

    assertThatThrownBy(() -> started.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);
    assertThat(seen).isEmpty();
    assertThat(instance.phase()).isEqualTo(ListenerState.Phase.PUBLISHING);
  }

  @Test
  void concurrentFollowersGetTheirOwnResults() throws Exception {
    leader();
    final int followers = 6;
    final var pool = Executors.newFixedThreadPool(followers);
    try {
      final List<Future<Launch>> launches = new ArrayList<>();
      for (int i = 0; i < followers; i++) {
        final var id = "f" + i;
        launches.add(pool.submit(() -> follow(List.of(id), "in-" + id)));
      }
      for (int i = 0; i < followers; i++) {
        assertThat(launches.get(i).get(15, TimeUnit.SECONDS))
            .isEqualTo(new Launch(0, "f" + i + ":in-f" + i + NL, ""));
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void brokenConnectionDoesNotDisturbOthers() throws Exception {
    leader();

    try (var raw = new Socket(InetAddress.getLoopbackAddress(), publishedPort())) {
      final var out = new DataOutputStream(raw.getOutputStream());
      out.writeInt(2);
      out.writeInt(10);
      out.write("abc".getBytes(StandardCharsets.UTF_8));
      out.flush();
    }

    assertThat(follow(List.of("ok"), "")).isEqualTo(new Launch(0, "ok:" + NL, ""));
  }

  @Test
  void stoppedLeaderRefusesFollowers() throws Exception {
    final var instance = leader();

    instance.stop();
    instance.stop();
    while (instance.phase() != ListenerState.Phase.STOPPED) {
      Thread.sleep(10);
    }

    assertThat(follow(List.of("late"), "").code()).isEqualTo(CommandResult.CODE_ERROR);
    assertThat(seen).doesNotContain(List.of("late"));
  }

  @Test
  void shutdownHandsOverLeadership() throws Exception {
    final var first = leader();

    first.shutdown();
    first.shutdown();
    assertThat(Files.exists(LockFile.pathFor(dir, APP_ID))).isFalse();

    final var captured = new Captured("");
    leader(List.of("second"), CompletableFuture.completedFuture(null), captured);
    assertThat(captured.out()).isEqualTo("second:" + NL);
    assertThat(follow(List.of("again"), "").code()).isZero();
  }

  @Test
  void startingTwiceIsRejected() throws Exception {
    final var instance = leader();

    assertThatThrownBy(() -> instance.start(APP_ID, commands, List.of(), CompletableFuture.completedFuture(null)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void unusableLockDirectoryTerminatesWithError() throws IOException {
    final var notADirectory = Files.createFile(dir.resolve("file"));
    final var code = new AtomicInteger(-1);
    final var instance = new UniqueInstance(config.withLockDirectory(notADirectory), new DaemonWorkers("broken"), code::set);

    final var started = instance.start(APP_ID, commands, List.of(), CompletableFuture.completedFuture(null), new Captured("").streams);

    assertThat(code.get()).isEqualTo(CommandResult.CODE_ERROR);
    assertThat(started).isCompletedExceptionally();
    assertThat(instance.isLeader()).isFalse();
  }

  @Test
  void leaderCommandWithoutResultStillServesFollowers() throws Exception {
    final var instance = new UniqueInstance(config, new DaemonWorkers("leader"), code -> {
      throw new AssertionError("leader terminated with " + code);
    });
    leaders.add(instance);
    final var captured = new Captured("");

    final var started = instance.start(APP_ID, commands, List.of("none"), CompletableFuture.completedFuture(null),
        captured.streams);

    assertThatThrownBy(() -> started.get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(IllegalStateException.class);
    assertThat(instance.phase()).isEqualTo(ListenerState.Phase.ACCEPTING);
    assertThat(captured.out()).isEmpty();
    assertThat(follow(List.of("after"), "")).isEqualTo(new Launch(0, "after:" + NL, ""));
  }

  @Test
  void followerCommandWithoutResultGetsCommandError() throws Exception {
    leader();

    final var launch = follow(List.of("none"), "");

    assertThat(launch.code()).isEqualTo(CommandResult.CODE_CMD_ERROR);
    assertThat(launch.err()).contains("Failed to process arguments: no result");
  }
}
