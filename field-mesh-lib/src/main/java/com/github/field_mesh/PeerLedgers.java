// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.List;

/// The ledger exchange between two nodes during peer to peer reconciliation. The initiating node fetches the peer's
/// chain, merges and pushes the canonical chain back. Either call failing leaves both nodes on their pre-merge
/// chains.
public interface PeerLedgers {

  /// @return a snapshot of the peer's live chain.
  List<LedgerBlock> fetch(NodeId peer) throws PeerUnreachableException;

  /// Offer a canonical chain to the peer which verifies and adopts it.
  ///
  /// @param expectedTailHash the tail of the chain previously fetched from the peer
  /// @return false if the peer refused as its chain moved on since the fetch
  boolean push(NodeId peer, NodeId from, List<LedgerBlock> canonical, String expectedTailHash)
      throws PeerUnreachableException;
}
