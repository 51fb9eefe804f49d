// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import java.util.logging.Logger;

/// Shared logger of the library. Classes import it statically.
public interface UniqueInstanceLogger {
  Logger LOGGER = Logger.getLogger("com.github.unique_instance");
}
