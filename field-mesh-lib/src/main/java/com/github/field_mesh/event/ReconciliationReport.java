// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NodeId;
import com.github.field_mesh.SyncConflict;

import java.util.List;
import java.util.OptionalLong;

/// A reconciliation completed and the node adopted the canonical chain.
///
/// @param counterpart the peer or authority reconciled with
/// @param forkIndex   where the chains diverged, empty if one was a prefix of the other
/// @param chainSize   the size of the adopted canonical chain
/// @param conflicts   competing blocks and how each was resolved
public record ReconciliationReport(NodeId node, long at, NodeId counterpart, OptionalLong forkIndex, int chainSize,
                                   List<SyncConflict> conflicts) implements MeshEvent {
  public ReconciliationReport {
    conflicts = List.copyOf(conflicts);
  }
}
