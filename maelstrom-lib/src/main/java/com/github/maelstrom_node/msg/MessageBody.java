// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

import java.util.Objects;
import java.util.Optional;

/// The body of a [Message]. On the wire the payload fields sit next to `msg_id` and `in_reply_to` rather than being
/// nested under their own key.
///
/// @param msgId     the id the sender gave this message. Unique per sender. Absent on fire-and-forget messages.
/// @param inReplyTo the `msgId` of the message this one answers. Present only on replies to a request that had an id.
/// @param payload   the kind specific content.
public record MessageBody(Optional<Long> msgId, Optional<Long> inReplyTo, Payload payload) {
  public MessageBody {
    Objects.requireNonNull(msgId, "msgId");
    Objects.requireNonNull(inReplyTo, "inReplyTo");
    Objects.requireNonNull(payload, "payload");
    msgId.ifPresent(id -> requireNonNegative("msgId", id));
    inReplyTo.ifPresent(id -> requireNonNegative("inReplyTo", id));
  }

  public MessageBody(long msgId, Payload payload) {
    this(Optional.of(msgId), Optional.empty(), payload);
  }

  public MessageBody(Payload payload) {
    this(Optional.empty(), Optional.empty(), payload);
  }

  private static void requireNonNegative(String name, long id) {
    if (id < 0) throw new IllegalArgumentException(name + " must be non-negative: " + id);
  }
}
