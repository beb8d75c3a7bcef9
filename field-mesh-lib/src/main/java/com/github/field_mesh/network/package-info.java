// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The network package holds the per-node flooding router and the transport abstraction.
///
/// - `MeshRouter`: the peer adjacency view, the dedup set and TTL bounded flooding.
/// - `PeerLink`: a directed "this node can reach that peer" observation with quality and recency.
/// - `MeshTransport`: the link a router sends through; a socket, a radio or a simulation.
/// - `PickleMessage`: the binary wire format of a message.
package com.github.field_mesh.network;
