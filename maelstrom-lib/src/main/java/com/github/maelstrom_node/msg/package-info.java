/*
 * Copyright 2024 - 2025 Simon Massey
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/// The msg package contains the message types of the Maelstrom workbench protocol that this node speaks.
///
/// Every exchange is a `Message` envelope holding a `MessageBody` which holds the optional `msg_id` and
/// `in_reply_to` correlation ids and one `Payload`.
///
/// Record Types:
/// - `Init`: Handshake naming this node and every node in the cluster.
/// - `InitOk`: Acknowledges the handshake.
/// - `Echo`: Asks for a string to be sent back.
/// - `EchoOk`: The string sent back unchanged.
/// - `Generate`: Asks for a fresh identifier.
/// - `GenerateOk`: The fresh identifier.
///
/// Each request has exactly one reply type and there is no other pairing:
/// ```
/// Payload
/// ├── Request
/// │   ├── Echo
/// │   ├── Generate
/// │   └── Init
/// └── Reply
///     ├── EchoOk
///     ├── GenerateOk
///     └── InitOk
///```
package com.github.maelstrom_node.msg;
