// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.List;

/// Every ledger in a fleet starts with the same deterministic genesis block. Ledgers built from different fleet ids
/// share no common ancestor and are refused by reconciliation.
public final class Genesis {
  private Genesis() {
  }

  public static LedgerBlock block(String fleetId) {
    final var creator = new NodeId("fleet:" + fleetId);
    return BlockHashing.seal(0L, BlockHashing.GENESIS_PREV_HASH, BlockHashing.payloadHash(List.of()),
        creator, 0L, new byte[0], List.of());
  }
}
