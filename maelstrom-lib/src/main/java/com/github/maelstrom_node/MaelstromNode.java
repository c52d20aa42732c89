// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.*;
import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.maelstrom_node.ErrorStrings.CRASHED;

/// A MaelstromNode is a single node answering the Maelstrom workbench. It takes one message at a time and answers
/// every [Request] with exactly one [Reply]:
///
/// * `init` is answered with `init_ok` and the announced identity is recorded.
/// * `echo` is answered with `echo_ok` holding the same string.
/// * `generate` is answered with `generate_ok` holding an id from the [UniqueIdGenerator].
///
/// Every reply has the node's current numeric id as its `msg_id` and the request's `msg_id` (if any) as its
/// `in_reply_to`. The numeric id is incremented by one only after the reply has been written to the [ReplySink]. If the
/// write fails the step fails and the numeric id is left as it was. At `Long.MAX_VALUE` the numeric id cannot go up so
/// the step fails without writing.
///
/// A node never sends a request so receiving any reply type is a protocol violation. Any failed step marks the node
/// as crashed. After that every call to [#step(Message)] throws an [IllegalStateException] and the process must be
/// restarted.
///
/// This class logs to JUL logging. It is not thread safe. The [NodeEngine] wraps it and uses a mutex so that only one
/// thread is stepping the node at a time. Any future multi-threaded host must keep that guarantee else two replies
/// can be given the same `msg_id`.
public class MaelstromNode implements AutoCloseable {
  static final Logger LOGGER = Logger.getLogger(MaelstromNode.class.getName());

  private final ReplySink sink;

  private final UniqueIdGenerator idGenerator;

  /// The `msg_id` of the next reply and this node's part of generated ids.
  private long numericId;

  /// Set by the latest `init`.
  private NodeIdentity identity = null;

  /// Is {@link #isCrashed()}
  private volatile boolean crashed = false;

  public MaelstromNode(ReplySink sink) {
    this(sink, new UniqueIdGenerator(), 0L);
  }

  /// @param sink             where replies are written.
  /// @param idGenerator      the source of ids for `generate_ok`.
  /// @param initialNumericId the `msg_id` of the first reply. Normally zero.
  public MaelstromNode(ReplySink sink, UniqueIdGenerator idGenerator, long initialNumericId) {
    if (initialNumericId < 0) {
      throw new IllegalArgumentException("initialNumericId must be non-negative: " + initialNumericId);
    }
    this.sink = Objects.requireNonNull(sink, "sink");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    this.numericId = initialNumericId;
  }

  /// Processes one message. On success exactly one reply has been written and the numeric id has gone up by one.
  /// On failure nothing has been written, the numeric id is unchanged and the node is crashed.
  ///
  /// @param input The message to process.
  /// @return the reply that was written or why the step failed.
  /// @throws IllegalStateException if an earlier step failed. See {@link #isCrashed()}.
  public StepResult step(Message input) {
    if (crashed) {
      LOGGER.severe(CRASHED);
      throw new IllegalStateException(CRASHED);
    }
    LOGGER.finer(() -> numericId + " <~ " + input);
    final StepResult result;
    try {
      result = dispatch(input);
    } catch (RuntimeException e) {
      crashed = true;
      LOGGER.log(Level.SEVERE, ErrorStrings.CRASHING + e, e);
      throw e;
    }
    if (result instanceof StepResult.Failed failed) {
      crashed = true;
      LOGGER.severe(() -> ErrorStrings.CRASHING + failed.failure());
    }
    return result;
  }

  private StepResult dispatch(Message input) {
    final var payload = input.payload();
    return switch (payload.type()) {
      case Init -> {
        final var init = (Init) payload;
        identity = new NodeIdentity(init.nodeId(), init.nodeIds());
        LOGGER.fine(() -> "initialised as " + init.nodeId() + " in cluster " + init.nodeIds());
        yield reply(input, new InitOk());
      }
      case Echo -> reply(input, new EchoOk(((Echo) payload).echo()));
      case Generate -> reply(input, new GenerateOk(idGenerator.generate(numericId, input.destination())));
      case InitOk, EchoOk, GenerateOk ->
          new StepResult.Failed(StepFailure.protocolViolation(input, (Reply) payload));
    };
  }

  private StepResult reply(Message input, Reply payload) {
    final long nextNumericId;
    try {
      nextNumericId = Math.addExact(numericId, 1L);
    } catch (ArithmeticException e) {
      return new StepResult.Failed(StepFailure.counterExhausted(input, numericId));
    }
    final var reply = input.reply(numericId, payload);
    try {
      sink.send(reply);
    } catch (IOException e) {
      return new StepResult.Failed(StepFailure.write(input, reply, e));
    }
    // only count a reply once it has been written
    numericId = nextNumericId;
    LOGGER.finer(() -> reply.source() + " ~> " + reply);
    return new StepResult.Replied(reply);
  }

  /// A node is marked as crashed when a step fails for any reason. Every failure is terminal: the surrounding
  /// workbench restarts the process and redelivers messages if it wants to.
  public boolean isCrashed() {
    return crashed;
  }

  /// @return the identity announced by the latest `init` if there has been one.
  public Optional<NodeIdentity> identity() {
    return Optional.ofNullable(identity);
  }

  @TestOnly
  public long numericId() {
    return numericId;
  }

  @Override
  public void close() throws IOException {
    LOGGER.fine(() -> "closing node at numericId=" + numericId);
    sink.close();
  }
}

class ErrorStrings {
  static final String CRASHED = MaelstromNode.class.getCanonicalName() + " FATAL SEVERE ERROR CRASHED This node has failed a step and must be restarted.";
  static final String CRASHING = MaelstromNode.class.getCanonicalName() + " FATAL SEVERE ERROR CRASHING ";
}
