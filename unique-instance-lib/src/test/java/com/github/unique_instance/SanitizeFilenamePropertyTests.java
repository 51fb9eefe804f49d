// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;

import static org.assertj.core.api.Assertions.assertThat;

public class SanitizeFilenamePropertyTests {

  @Property(tries = 500)
  void sanitizedNameIsUsableAsFileName(@ForAll String appId) {
    final var name = LockFile.sanitizeFilename(appId);

    assertThat(name).isNotBlank();
    assertThat(name).isEqualTo(name.strip());
    assertThat(name.codePoints()).noneMatch(cp -> Character.isISOControl(cp) || "\\/:*?\"<>|".indexOf(cp) >= 0);
  }

  @Property(tries = 200)
  void sanitizingTwiceChangesNothing(@ForAll String appId) {
    final var once = LockFile.sanitizeFilename(appId);

    assertThat(LockFile.sanitizeFilename(once)).isEqualTo(once);
  }
}
