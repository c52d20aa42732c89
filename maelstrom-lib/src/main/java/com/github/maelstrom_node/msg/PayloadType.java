// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.maelstrom_node.msg;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/// The `type` discriminator of a message body. The wire name is the snake-cased variant name.
public enum PayloadType {
  Init("init"),
  InitOk("init_ok"),

  Echo("echo"),
  EchoOk("echo_ok"),

  Generate("generate"),
  GenerateOk("generate_ok");

  private final String wireName;

  PayloadType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  static final Map<String, PayloadType> WIRE_NAME_TO_TYPE_MAP = Arrays.stream(values())
      .collect(Collectors.toMap(PayloadType::wireName, Function.identity()));

  /// @return the type with the given wire name or null if there is no such type.
  public static PayloadType fromWireName(String wireName) {
    return WIRE_NAME_TO_TYPE_MAP.get(wireName);
  }
}
