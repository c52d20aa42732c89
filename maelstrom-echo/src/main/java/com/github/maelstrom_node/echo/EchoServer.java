// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.echo;

import com.github.maelstrom_node.MaelstromNode;
import com.github.maelstrom_node.NodeEngine;
import com.github.maelstrom_node.StreamReplySink;

import java.io.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/// The process that Maelstrom runs. It reads messages from standard input, writes replies to standard output and
/// logs to standard error. It exits with status 0 when standard input is closed and 1 on the first failure. The log
/// level is read from the `LOG_LEVEL` environment variable.
public class EchoServer {
  private static final Logger LOGGER = Logger.getLogger(EchoServer.class.getName());

  private static final int BUFFER_SIZE = 8192;

  public static void main(String[] args) {
    LoggerConfig.initialize();
    if (args.length > 0) {
      LOGGER.warning(() -> "ignoring " + args.length + " command line arguments");
    }
    // System.out is a PrintStream that hides write errors so we write to the file descriptor
    final var stdout = new FileOutputStream(FileDescriptor.out);
    System.exit(run(System.in, stdout));
  }

  /// Runs a fresh node until the input ends or a step fails.
  ///
  /// @return the exit status for the process.
  static int run(InputStream in, OutputStream out) {
    final var sink = new StreamReplySink(new BufferedOutputStream(out, BUFFER_SIZE));
    try (NodeEngine engine = new NodeEngine(new MaelstromNode(sink))) {
      return engine.run(in);
    } catch (IOException e) {
      LOGGER.log(Level.SEVERE, "Could not close standard output: " + e.getMessage(), e);
      return NodeEngine.EXIT_FAILURE;
    }
  }
}
