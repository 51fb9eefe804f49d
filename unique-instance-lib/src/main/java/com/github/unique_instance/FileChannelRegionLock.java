// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.time.Duration;

import static com.github.unique_instance.UniqueInstanceLogger.LOGGER;

/// [ExclusiveRegionLock] over an OS advisory byte-range lock of a [FileChannel].
///
/// File locks are held on behalf of the whole JVM. A second channel of the same JVM asking for an
/// overlapping region gets an `OverlappingFileLockException` rather than blocking or failing the try.
/// That case is mapped onto the cross-process semantics: `tryAcquire` reports false and
/// `acquireBlocking` polls until the other holder lets go.
public class FileChannelRegionLock implements ExclusiveRegionLock {

  static final Duration IN_PROCESS_RETRY_DELAY = Duration.ofMillis(10);

  private final FileChannel channel;
  private final long position;
  private final long size;
  private volatile FileLock lock;

  public FileChannelRegionLock(FileChannel channel, long position, long size) {
    this.channel = channel;
    this.position = position;
    this.size = size;
  }

  @Override
  public void acquireBlocking() throws IOException {
    while (true) {
      try {
        lock = channel.lock(position, size, false);
        return;
      } catch (OverlappingFileLockException e) {
        LOGGER.finest(() -> "Region " + this + " held elsewhere in this JVM, waiting");
        try {
          Thread.sleep(IN_PROCESS_RETRY_DELAY.toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new InterruptedIOException("Interrupted while waiting for region " + this);
        }
      }
    }
  }

  @Override
  public boolean tryAcquire() throws IOException {
    try {
      lock = channel.tryLock(position, size, false);
    } catch (OverlappingFileLockException e) {
      LOGGER.finer(() -> "Region " + this + " already held within this JVM");
      lock = null;
    }
    return lock != null;
  }

  @Override
  public void release() throws IOException {
    final var held = lock;
    lock = null;
    if (held != null && held.isValid()) {
      held.release();
    }
  }

  @Override
  public boolean isHeld() {
    final var held = lock;
    return held != null && held.isValid();
  }

  @Override
  public String toString() {
    return "[" + position + "," + (position + size) + ")";
  }
}
