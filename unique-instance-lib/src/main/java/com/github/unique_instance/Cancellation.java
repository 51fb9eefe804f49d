// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation flag. Checked between blocking steps; never interrupts one.
public final class Cancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /// @return true for the call that actually cancelled
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
