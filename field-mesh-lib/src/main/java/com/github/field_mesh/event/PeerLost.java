// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NodeId;

/// A peer went silent past the peer timeout.
public record PeerLost(NodeId node, long at, NodeId peer, long lastSeen) implements MeshEvent {
}
