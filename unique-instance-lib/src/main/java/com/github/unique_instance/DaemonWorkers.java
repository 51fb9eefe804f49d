// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// One daemon thread per task. Daemon threads never hold the process up at exit: a stopping leader
/// answers failure anyway, and a follower gets the same when its socket closes unexpectedly.
public class DaemonWorkers implements Workers {

  private final String prefix;
  private final AtomicLong counter = new AtomicLong();
  private final Set<Thread> live = ConcurrentHashMap.newKeySet();

  public DaemonWorkers(String prefix) {
    this.prefix = prefix;
  }

  @Override
  public Worker spawn(String name, Runnable task) {
    final var thread = new Thread(() -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.log(Level.WARNING, "Worker " + Thread.currentThread().getName() + " failed", e);
      } finally {
        live.remove(Thread.currentThread());
      }
    }, prefix + "-" + name + "-" + counter.incrementAndGet());
    thread.setDaemon(true);
    live.add(thread);
    thread.start();
    return new ThreadWorker(thread);
  }

  @Override
  public boolean awaitAll(Duration timeout) throws InterruptedException {
    final long deadline = System.nanoTime() + timeout.toNanos();
    for (Thread thread : List.copyOf(live)) {
      final long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        break;
      }
      TimeUnit.NANOSECONDS.timedJoin(thread, remaining);
    }
    return live.isEmpty();
  }

  public int liveCount() {
    return live.size();
  }

  private record ThreadWorker(Thread thread) implements Worker {
    @Override
    public boolean await(Duration timeout) throws InterruptedException {
      thread.join(Math.max(1L, timeout.toMillis()));
      return !thread.isAlive();
    }

    @Override
    public boolean isDone() {
      return !thread.isAlive();
    }
  }
}
