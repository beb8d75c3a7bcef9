// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MeshMessage;

import java.util.List;

/// A node's view of the central authority. A remote implementation throws [PeerUnreachableException] when the
/// authority link is down; [Authority] is the in-process implementation.
public interface Coordinator {

  NodeId id();

  /// Hand a message to the authority which records it in the master ledger. Other nodes pick it up when they next
  /// pull the master ledger.
  void submit(MeshMessage message) throws PeerUnreachableException;

  /// Merge a node's chain into the master ledger.
  ///
  /// @return the merge the authority applied; the node adopts its canonical chain
  /// @throws DivergentLedgerException if the node's chain shares no ancestor with the master ledger
  MergeResult reconcile(NodeId node, List<LedgerBlock> chain) throws PeerUnreachableException;

  /// @return a snapshot of the master ledger.
  List<LedgerBlock> masterLedger() throws PeerUnreachableException;
}
