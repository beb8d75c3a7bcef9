// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The msg package holds the records that travel between nodes.
///
/// - `MeshMessage`: an application message with its logical timestamps, remaining TTL and the route so far.
/// - `MessageType`: CHAT, STATUS, COMMAND or ALERT which fixes the outbound queue priority
///   (ALERT > COMMAND > STATUS > CHAT).
///
/// Messages are immutable. Routing derives copies with [com.github.field_mesh.msg.MeshMessage#forwarded()] and
/// [com.github.field_mesh.msg.MeshMessage#arrivedAt(com.github.field_mesh.NodeId)].
package com.github.field_mesh.msg;
