// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.EchoOk;
import com.github.maelstrom_node.msg.Message;
import com.github.maelstrom_node.msg.MessageBody;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class StreamReplySinkTests {

  final Message reply = new Message("n1", "c1", new MessageBody(Optional.of(1L), Optional.of(2L), new EchoOk("line\nbreak")));

  @Test
  void writesOneTerminatedLinePerReply() throws Exception {
    final var out = new ByteArrayOutputStream();
    final var sink = new StreamReplySink(out);

    sink.send(reply);
    sink.send(reply);

    final var lines = out.toString(StandardCharsets.UTF_8).split("\n", -1);
    assertThat(lines).hasSize(3);
    assertThat(lines[2]).isEmpty();
    assertThat(JsonPickle.unpickle(lines[0])).isEqualTo(reply);
    assertThat(JsonPickle.unpickle(lines[1])).isEqualTo(reply);
  }

  @Test
  void writesJsonAndTerminatorInOneWriteThenFlushes() throws Exception {
    final List<String> calls = new ArrayList<>();
    final var sink = new StreamReplySink(new OutputStream() {
      @Override
      public void write(int b) {
        calls.add("byte");
      }

      @Override
      public void write(byte[] b, int off, int len) {
        final var text = new String(b, off, len, StandardCharsets.UTF_8);
        calls.add(text.endsWith("\n") ? "line" : "partial");
      }

      @Override
      public void flush() {
        calls.add("flush");
      }
    });

    sink.send(reply);

    assertThat(calls).containsExactly("line", "flush");
  }

  @Test
  void reportsErrorsThatAPrintStreamHides() {
    final var printStream = new PrintStream(new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("Broken pipe");
      }
    });
    final var sink = new StreamReplySink(printStream);

    assertThatThrownBy(() -> sink.send(reply))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("error state");
  }
}
