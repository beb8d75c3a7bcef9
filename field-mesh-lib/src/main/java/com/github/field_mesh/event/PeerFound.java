// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NodeId;

/// A peer became reachable. `regained` is true when the peer had previously been lost.
public record PeerFound(NodeId node, long at, NodeId peer, boolean regained) implements MeshEvent {
}
