// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NodeId;
import com.github.field_mesh.msg.MessageType;

import java.util.UUID;

/// A queued message passed its deadline undelivered. The payload has been discarded.
public record MessageExpired(NodeId node, long at, UUID messageId, MessageType type, int attempts)
    implements MeshEvent {
}
