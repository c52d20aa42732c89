// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.github.maelstrom_node.msg.*;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;

import java.util.Optional;

/// Generators shared by the property tests.
final class ArbitraryMessages {
  private ArbitraryMessages() {
  }

  /// Any text without unpaired surrogates, including control characters, whitespace and non-latin scripts.
  static Arbitrary<String> text() {
    return Arbitraries.strings()
        .withCharRange('\u0000', '\uD7FF')
        .withCharRange('\uE000', '\uFFFD')
        .ofMaxLength(40);
  }

  static Arbitrary<String> nodeIds() {
    return Arbitraries.oneOf(
        Arbitraries.integers().between(0, 20).map(i -> "n" + i),
        Arbitraries.integers().between(0, 20).map(i -> "c" + i),
        text());
  }

  static Arbitrary<Optional<Long>> ids() {
    return Arbitraries.longs().between(0, Long.MAX_VALUE).optional();
  }

  static Arbitrary<Payload> payloads() {
    return Arbitraries.oneOf(
        Combinators.combine(nodeIds(), nodeIds().list().ofMaxSize(5)).as(Init::new),
        Arbitraries.just(new InitOk()),
        text().map(Echo::new),
        text().map(EchoOk::new),
        Arbitraries.just(new Generate()),
        text().map(GenerateOk::new));
  }

  static Arbitrary<Request> requests() {
    return Arbitraries.oneOf(
        Combinators.combine(nodeIds(), nodeIds().list().ofMaxSize(5)).as(Init::new),
        text().map(Echo::new),
        Arbitraries.just(new Generate()));
  }

  static Arbitrary<Message> messages() {
    return Combinators.combine(nodeIds(), nodeIds(), ids(), ids(), payloads())
        .as((src, dest, msgId, inReplyTo, payload) ->
            new Message(src, dest, new MessageBody(msgId, inReplyTo, payload)));
  }
}
