// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.Message;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.Objects;

/// Writes each reply as one line of compact JSON followed by `\n` and flushes after every reply.
public class StreamReplySink implements ReplySink {
  private static final byte NEWLINE = '\n';

  private final OutputStream out;

  public StreamReplySink(OutputStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void send(Message reply) throws IOException {
    final var json = JsonPickle.pickle(reply);
    // the JSON and the terminator go out in a single write
    final var line = new byte[json.length + 1];
    System.arraycopy(json, 0, line, 0, json.length);
    line[json.length] = NEWLINE;
    out.write(line);
    out.flush();
    // a PrintStream such as System.out never throws so we must ask it
    if (out instanceof PrintStream printStream && printStream.checkError()) {
      throw new IOException("output stream is in an error state");
    }
  }

  @Override
  public void close() throws IOException {
    out.close();
  }
}
