// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance;

import net.jqwik.api.*;
import net.jqwik.api.constraints.Size;

import java.io.*;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// The request must arrive intact whatever the arguments contain, with the forwarded input that follows
/// it left untouched on the stream.
public class ProtocolPicklePropertyTests {

  @Property(tries = 200)
  void requestThenInputSplitExactly(@ForAll @Size(max = 8) List<@From("arguments") String> args,
                                    @ForAll @Size(max = 64) byte[] trailing) throws IOException {
    final var baos = new ByteArrayOutputStream();
    final var out = new DataOutputStream(baos);
    ProtocolPickle.writeRequest(out, new CommandRequest(args));
    out.write(trailing);
    out.flush();

    final var in = new DataInputStream(new BufferedInputStream(new ByteArrayInputStream(baos.toByteArray()), 16));
    final var request = ProtocolPickle.readRequest(in);

    assertThat(request.args()).containsExactlyElementsOf(args);
    assertThat(in.readAllBytes()).containsExactly(trailing);
  }

  @Provide
  Arbitrary<String> arguments() {
    return Arbitraries.strings()
        .all()
        .ofMaxLength(40)
        .filter(s -> s.codePoints().noneMatch(cp -> cp <= 0xFFFF && Character.isSurrogate((char) cp)));
  }
}
