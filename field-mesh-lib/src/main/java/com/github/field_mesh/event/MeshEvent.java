// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NodeId;

/// A read-only, timestamped record published by a node agent to UI and monitoring collaborators.
public sealed interface MeshEvent permits
    BlockAppended,
    DeliveryReport,
    MessageExpired,
    NetworkStateChanged,
    PeerFound,
    PeerLost,
    ReconciliationFailed,
    ReconciliationReport {
  /// @return the node that published the event.
  NodeId node();

  /// @return wall clock millis at which the event happened.
  long at();
}
