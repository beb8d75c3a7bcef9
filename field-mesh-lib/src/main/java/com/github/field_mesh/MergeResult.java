// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.List;
import java.util.OptionalLong;

/// The outcome of merging two ledgers.
///
/// @param canonical the merged chain which both sides adopt
/// @param forkIndex the lowest index where the inputs disagreed, empty if one was a prefix of the other
/// @param conflicts one entry per index both branches claimed with different blocks, in index order
public record MergeResult(List<LedgerBlock> canonical, OptionalLong forkIndex, List<SyncConflict> conflicts) {
  public MergeResult {
    canonical = List.copyOf(canonical);
    conflicts = List.copyOf(conflicts);
  }

  public LedgerBlock tail() {
    return canonical.get(canonical.size() - 1);
  }
}
