// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// A messaging mesh for field nodes that keeps working when the central authority is unreachable.
///
/// Each node runs one [com.github.field_mesh.NodeAgent]. While the [com.github.field_mesh.Authority] is reachable
/// messages go through it and are recorded in its master ledger. When it is not, nodes flood messages to their peers
/// through a TTL bounded [com.github.field_mesh.network.MeshRouter] and record them in their own hash chained
/// [com.github.field_mesh.Ledger]. When connectivity returns the [com.github.field_mesh.ReconciliationService] merges
/// divergent ledgers in the total order `(lamport, nodeId)` so that every node ends up on the same canonical chain.
///
/// ```
/// NodeAgent
/// ├── NetworkStateMachine  CENTRALIZED | P2P_FALLBACK | DEGRADED | ISOLATED
/// ├── ClockService         Lamport and vector clocks
/// ├── MeshRouter           flooding with dedup
/// ├── OutboundQueue        priority retry with backoff and expiry
/// └── Ledger               hash chain over a BlockStore
/// ```
package com.github.field_mesh;
