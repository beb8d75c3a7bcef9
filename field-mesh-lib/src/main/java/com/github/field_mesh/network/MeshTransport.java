// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.network;

import com.github.field_mesh.NodeId;
import com.github.field_mesh.PeerUnreachableException;
import com.github.field_mesh.msg.MeshMessage;

import java.util.function.Consumer;

/// The mesh is agnostic to the underlying link. This interface abstracts a persistent socket, a datagram radio link
/// or a simulated channel. [PickleMessage] is the wire format implementations should use.
///
/// Sends must not block on a slow peer. An implementation should hand the bytes to a per-peer outbound buffer and
/// return; it throws only when it already knows the peer cannot be reached.
public interface MeshTransport extends AutoCloseable {

  /// Hand a message to a directly reachable peer.
  ///
  /// @throws PeerUnreachableException if the link to the peer is known to be down
  void send(NodeId to, MeshMessage message) throws PeerUnreachableException;

  /// Register the handler for messages arriving at the local node.
  void subscribe(NodeId self, Consumer<MeshMessage> handler);

  @Override
  void close();
}
