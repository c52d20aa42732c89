// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.maelstrom_node.msg.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// JsonPickle maps messages to and from the JSON shape used by the Maelstrom workbench:
///
/// ```
/// {"src":"c1","dest":"n1","body":{"msg_id":1,"in_reply_to":7,"type":"echo","echo":"hello"}}
///```
///
/// The payload fields are siblings of `msg_id` and `in_reply_to`. Ids that are absent are left out rather than
/// written as `null`. Fields that a payload type does not have are never written. On input unknown fields are ignored
/// and an explicit `null` id is read as absent. A key repeated within one object is malformed. This class does things the boilerplate way with the Jackson tree model
/// so that the wire shape is visible in one place.
public class JsonPickle {
  static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
      .build();

  /// Reads exactly one value. Anything but whitespace after it is malformed.
  private static final ObjectReader SINGLE_VALUE_READER = MAPPER.reader()
      .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  static final String SRC = "src";
  static final String DEST = "dest";
  static final String BODY = "body";
  static final String MSG_ID = "msg_id";
  static final String IN_REPLY_TO = "in_reply_to";
  static final String TYPE = "type";
  static final String NODE_ID = "node_id";
  static final String NODE_IDS = "node_ids";
  static final String ECHO = "echo";
  static final String ID = "id";

  private JsonPickle() {
  }

  /// @return the compact JSON of the message without a line terminator.
  public static byte[] pickle(Message message) {
    try {
      return MAPPER.writeValueAsBytes(toTree(message));
    } catch (JsonProcessingException e) {
      // a tree of strings and longs always serializes
      throw new UncheckedIOException(e);
    }
  }

  public static String pickleToString(Message message) {
    return new String(pickle(message), StandardCharsets.UTF_8);
  }

  public static ObjectNode toTree(Message message) {
    final var root = MAPPER.createObjectNode();
    root.put(SRC, message.source());
    root.put(DEST, message.destination());
    final var body = root.putObject(BODY);
    message.body().msgId().ifPresent(id -> body.put(MSG_ID, id));
    message.body().inReplyTo().ifPresent(id -> body.put(IN_REPLY_TO, id));
    writePayload(message.payload(), body);
    return root;
  }

  private static ObjectNode writePayload(Payload payload, ObjectNode body) {
    body.put(TYPE, payload.type().wireName());
    return switch (payload.type()) {
      case Init -> {
        final var init = (Init) payload;
        body.put(NODE_ID, init.nodeId());
        final ArrayNode nodeIds = body.putArray(NODE_IDS);
        init.nodeIds().forEach(nodeIds::add);
        yield body;
      }
      case Echo -> body.put(ECHO, ((Echo) payload).echo());
      case EchoOk -> body.put(ECHO, ((EchoOk) payload).echo());
      case GenerateOk -> body.put(ID, ((GenerateOk) payload).id());
      case InitOk, Generate -> body;
    };
  }

  public static Message unpickle(byte[] bytes) throws DeserializationException {
    final JsonNode tree;
    try {
      tree = SINGLE_VALUE_READER.readTree(new ByteArrayInputStream(bytes));
    } catch (JsonProcessingException e) {
      throw new DeserializationException("malformed JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new DeserializationException("unreadable JSON: " + e.getMessage(), e);
    }
    return fromTree(tree);
  }

  public static Message unpickle(String json) throws DeserializationException {
    return unpickle(json.getBytes(StandardCharsets.UTF_8));
  }

  public static Message fromTree(JsonNode root) throws DeserializationException {
    if (root == null || !root.isObject()) {
      throw new DeserializationException("expected a message object but found " + describe(root));
    }
    final var source = requiredText(root, SRC);
    final var destination = requiredText(root, DEST);
    final var body = root.get(BODY);
    if (body == null || body.isNull()) {
      throw new DeserializationException("missing required field '" + BODY + "'");
    }
    if (!body.isObject()) {
      throw new DeserializationException("field '" + BODY + "' must be an object but found " + describe(body));
    }
    final var msgId = optionalId(body, MSG_ID);
    final var inReplyTo = optionalId(body, IN_REPLY_TO);
    final var payload = readPayload(body);
    return new Message(source, destination, new MessageBody(msgId, inReplyTo, payload));
  }

  private static Payload readPayload(JsonNode body) throws DeserializationException {
    final var typeName = requiredText(body, TYPE);
    final var type = PayloadType.fromWireName(typeName);
    if (type == null) {
      throw new DeserializationException("unknown message type '" + typeName + "'");
    }
    return switch (type) {
      case Init -> new Init(requiredText(body, NODE_ID), requiredTextArray(body, NODE_IDS));
      case InitOk -> new InitOk();
      case Echo -> new Echo(requiredText(body, ECHO));
      case EchoOk -> new EchoOk(requiredText(body, ECHO));
      case Generate -> new Generate();
      case GenerateOk -> new GenerateOk(requiredText(body, ID));
    };
  }

  static String requiredText(JsonNode node, String field) throws DeserializationException {
    final var value = node.get(field);
    if (value == null || value.isNull()) {
      throw new DeserializationException("missing required field '" + field + "'");
    }
    if (!value.isTextual()) {
      throw new DeserializationException("field '" + field + "' must be a string but found " + describe(value));
    }
    return value.textValue();
  }

  static List<String> requiredTextArray(JsonNode node, String field) throws DeserializationException {
    final var value = node.get(field);
    if (value == null || value.isNull()) {
      throw new DeserializationException("missing required field '" + field + "'");
    }
    if (!value.isArray()) {
      throw new DeserializationException("field '" + field + "' must be an array but found " + describe(value));
    }
    final var result = new ArrayList<String>(value.size());
    for (JsonNode element : value) {
      if (!element.isTextual()) {
        throw new DeserializationException("field '" + field + "' must only hold strings but found " + describe(element));
      }
      result.add(element.textValue());
    }
    return result;
  }

  static Optional<Long> optionalId(JsonNode node, String field) throws DeserializationException {
    final var value = node.get(field);
    if (value == null || value.isNull()) {
      return Optional.empty();
    }
    if (!value.isIntegralNumber() || !value.canConvertToLong()) {
      throw new DeserializationException("field '" + field + "' must be an integer but found " + describe(value));
    }
    final var id = value.longValue();
    if (id < 0) {
      throw new DeserializationException("field '" + field + "' must be non-negative but was " + id);
    }
    return Optional.of(id);
  }

  private static String describe(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return "nothing";
    }
    return node.getNodeType().name().toLowerCase() + " " + node;
  }
}
