// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.github.maelstrom_node.msg.Message;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/// Reads a sequence of JSON values separated by whitespace or newlines and decodes each one as a [Message]. Values are
/// read one at a time so that a reply can be sent before the next value has arrived.
public class MessageReader implements Closeable {
  private final MappingIterator<JsonNode> values;

  public MessageReader(InputStream in) throws IOException {
    this.values = JsonPickle.MAPPER.readerFor(JsonNode.class).readValues(in);
  }

  /// Blocks until the next value has been read.
  ///
  /// @return the next message or empty at the end of the stream.
  /// @throws DeserializationException if the next value is not valid JSON or is not a valid message.
  /// @throws IOException              if the stream itself could not be read.
  public Optional<Message> next() throws DeserializationException, IOException {
    final JsonNode tree;
    try {
      if (!values.hasNextValue()) {
        return Optional.empty();
      }
      tree = values.nextValue();
    } catch (JsonProcessingException e) {
      throw new DeserializationException("malformed JSON: " + e.getOriginalMessage(), e);
    }
    return Optional.of(JsonPickle.fromTree(tree));
  }

  @Override
  public void close() throws IOException {
    values.close();
  }
}
