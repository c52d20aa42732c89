// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

import java.util.Objects;
import java.util.Optional;

/// The envelope around every exchange. Written on the wire as `{"src":..,"dest":..,"body":{..}}`.
///
/// @param source      the node that sent the message.
/// @param destination the node the message is addressed to.
/// @param body        the ids and payload.
public record Message(String source, String destination, MessageBody body) {
  public Message {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(body, "body");
  }

  public Payload payload() {
    return body.payload();
  }

  /// Builds the answer to this message. Source and destination are swapped and `in_reply_to` is our `msg_id` when
  /// we have one.
  ///
  /// @param msgId   the id the replying node assigns to the reply.
  /// @param payload the reply content.
  public Message reply(long msgId, Reply payload) {
    return new Message(destination, source, new MessageBody(Optional.of(msgId), body.msgId(), payload));
  }
}
