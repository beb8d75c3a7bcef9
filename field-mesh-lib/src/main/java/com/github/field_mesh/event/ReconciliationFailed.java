// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NodeId;

/// A reconciliation was refused and needs an operator. Transient disconnects are not reported this way; they are
/// retried.
public record ReconciliationFailed(NodeId node, long at, NodeId counterpart, String reason) implements MeshEvent {
}
