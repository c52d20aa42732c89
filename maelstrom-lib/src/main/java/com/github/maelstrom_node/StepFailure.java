// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.Message;
import com.github.maelstrom_node.msg.Reply;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/// Why a step failed.
///
/// @param kind   which kind of failure.
/// @param input  the message being processed. Empty when the input could not be decoded.
/// @param detail a human readable reason.
/// @param cause  the underlying exception if there was one.
public record StepFailure(ErrorKind kind, Optional<Message> input, String detail, Optional<Throwable> cause) {
  public StepFailure {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(detail, "detail");
    Objects.requireNonNull(cause, "cause");
  }

  public static StepFailure deserialization(DeserializationException e) {
    return new StepFailure(ErrorKind.DESERIALIZATION, Optional.empty(), e.getMessage(), Optional.of(e));
  }

  public static StepFailure unreadable(IOException e) {
    return new StepFailure(ErrorKind.DESERIALIZATION, Optional.empty(),
        "input could not be read: " + e.getMessage(), Optional.of(e));
  }

  public static StepFailure protocolViolation(Message input, Reply unexpected) {
    return new StepFailure(ErrorKind.PROTOCOL_VIOLATION, Optional.of(input),
        "received unexpected " + unexpected.type().wireName() + " message from " + input.source()
            + " but this node never sends " + unexpected.answers().wireName(),
        Optional.empty());
  }

  public static StepFailure write(Message input, Message reply, IOException e) {
    return new StepFailure(ErrorKind.WRITE, Optional.of(input),
        "failed to write " + reply.payload().type().wireName() + " reply to " + reply.destination() + ": " + e.getMessage(),
        Optional.of(e));
  }

  public static StepFailure counterExhausted(Message input, long numericId) {
    return new StepFailure(ErrorKind.COUNTER_EXHAUSTED, Optional.of(input),
        "numeric id " + numericId + " cannot be incremented so no reply was written", Optional.empty());
  }

  @Override
  public String toString() {
    return kind + " " + detail + input.map(m -> " input=" + m).orElse("");
  }
}
