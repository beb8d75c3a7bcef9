// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Events a node agent publishes to its listener. All events are immutable records carrying the publishing node
/// and a wall clock timestamp.
///
/// ```
/// MeshEvent
/// ├── NetworkStateChanged
/// ├── BlockAppended
/// ├── DeliveryReport (DELIVERED | QUEUED)
/// ├── MessageExpired
/// ├── PeerLost
/// ├── PeerFound
/// ├── ReconciliationReport
/// └── ReconciliationFailed
/// ```
package com.github.field_mesh.event;
