// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.Message;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives a [MaelstromNode] from a stream of JSON messages. Ensures:
/// - Messages are stepped strictly in arrival order, so replies are written in the order of their requests
/// - Single-threaded access to the node via a mutex
/// - The first failed step stops processing and is reported with the number of the step that failed
///
/// It is closable to use try-with-resources to ensure that the node's [ReplySink] is closed.
public class NodeEngine implements AutoCloseable {
  static final Logger LOGGER = Logger.getLogger(NodeEngine.class.getName());

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;

  final MaelstromNode node;

  /// The Semaphore acts as a mutex with:
  /// - Non-reentrant locking
  /// - Fair queuing of threads
  private final Semaphore mutex = new Semaphore(1, true);

  /// The number of messages read so far including one that failed to decode.
  private long steps = 0;

  private StepFailure failure = null;

  public NodeEngine(MaelstromNode node) {
    this.node = Objects.requireNonNull(node, "node");
  }

  /// Steps the node with one message. This method is thread safe and allows only one thread at a time.
  ///
  /// @param input The message to process.
  /// @return the reply written or the reason for failing.
  public StepResult step(Message input) {
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted waiting to step node with " + input, e);
    }
    try {
      return node.step(input);
    } finally {
      mutex.release();
    }
  }

  /// Reads messages until the end of the stream or the first failure.
  ///
  /// @param in whitespace or newline separated JSON messages.
  /// @return [#EXIT_OK] when the stream ended cleanly else [#EXIT_FAILURE].
  public int run(InputStream in) {
    LOGGER.info("node engine started");
    try (MessageReader reader = new MessageReader(in)) {
      while (true) {
        final long stepNumber = steps + 1;
        final Optional<Message> next;
        try {
          next = reader.next();
        } catch (DeserializationException e) {
          steps = stepNumber;
          return fail(stepNumber, StepFailure.deserialization(e));
        } catch (IOException e) {
          return fail(stepNumber, StepFailure.unreadable(e));
        }
        if (next.isEmpty()) {
          break;
        }
        steps = stepNumber;
        final var result = step(next.get());
        if (result instanceof StepResult.Failed failed) {
          return fail(stepNumber, failed.failure());
        }
      }
    } catch (IOException e) {
      return fail(steps + 1, StepFailure.unreadable(e));
    }
    LOGGER.info(() -> "input ended after " + steps + " messages");
    return EXIT_OK;
  }

  private int fail(long stepNumber, StepFailure stepFailure) {
    this.failure = stepFailure;
    final var message = "step " + stepNumber + " failed with " + stepFailure.kind() + ": " + stepFailure.detail()
        + stepFailure.input().map(m -> " input=" + m).orElse("");
    LOGGER.log(Level.SEVERE, message, stepFailure.cause().orElse(null));
    return EXIT_FAILURE;
  }

  /// @return why processing stopped if it stopped on a failure.
  public Optional<StepFailure> failure() {
    return Optional.ofNullable(failure);
  }

  @TestOnly
  public long steps() {
    return steps;
  }

  @TestOnly
  public MaelstromNode node() {
    return node;
  }

  @Override
  public void close() throws IOException {
    LOGGER.info("Closing NodeEngine.");
    node.close();
  }
}
