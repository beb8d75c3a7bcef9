// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.List;
import java.util.Optional;

/// The block store is the storage layer of a [Ledger]. The ledger is the only writer and it calls the store while
/// holding its mutex so implementations need not be thread safe for writes.
///
/// Blocks are never updated in place. A reconciliation that replaces part of the chain moves the replaced blocks to
/// the superseded area where they are kept as audit evidence. Implementations must not delete superseded blocks.
///
/// If you get errors where you do not know what state the underlying store has reached you should stop the node and
/// have an operator check the chain with [Ledger#validate(java.util.List)] before restarting.
public interface BlockStore {

  /// Store a block at its index.
  ///
  /// @throws LedgerIntegrityException if a block is already stored at the index
  void write(LedgerBlock block);

  /// @return the block at the index if one is stored.
  Optional<LedgerBlock> read(long index);

  /// @return the number of live blocks including genesis.
  long size();

  /// Replace the live chain from `fromIndex` with the `replacement` blocks and record the `superseded` ones.
  void replace(long fromIndex, List<LedgerBlock> replacement, List<LedgerBlock> superseded);

  /// @return every block that a reconciliation moved out of the live chain, oldest first.
  List<LedgerBlock> superseded();

  /// Make all writes durable. See the notes on crash durability in the store implementation you choose.
  void sync();
}
