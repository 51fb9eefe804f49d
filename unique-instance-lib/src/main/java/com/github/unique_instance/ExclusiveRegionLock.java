// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.io.IOException;

/// An exclusive lock over one byte range of a shared file. Other processes contend for the same range
/// through their own handle on the file.
public interface ExclusiveRegionLock {

  /// Blocks until the region is held by this handle.
  void acquireBlocking() throws IOException;

  /// Attempts to take the region without waiting.
  ///
  /// @return true when the region is now held by this handle
  boolean tryAcquire() throws IOException;

  /// Releases the region if held. Calling it again is a no-op.
  void release() throws IOException;

  boolean isHeld();
}
