// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.Objects;

/// Two branches of a forked ledger both claimed the same index with different blocks. The block earlier in the
/// total order `(lamport, creator)` keeps its place; the other one is resolved as described by [Resolution].
///
/// @param index      the index both branches claimed
/// @param winner     the block ordered first
/// @param loser      the block ordered later
/// @param resolution what happened to the loser
/// @param rule       the rule that picked the winner
public record SyncConflict(long index, LedgerBlock winner, LedgerBlock loser, Resolution resolution, String rule) {

  public static final String TOTAL_ORDER_RULE = "superseded-by-total-order";

  public enum Resolution {
    /// The loser's content was re-appended at a later index of the canonical chain.
    REBASED,
    /// Every message of the loser was already in the canonical chain so it was not re-appended.
    SUPERSEDED
  }

  public SyncConflict {
    Objects.requireNonNull(winner, "winner required");
    Objects.requireNonNull(loser, "loser required");
    Objects.requireNonNull(resolution, "resolution required");
    Objects.requireNonNull(rule, "rule required");
  }

  @Override
  public String toString() {
    return "SyncConflict[#" + index + " winner=" + winner.creator() + "@" + winner.lamport()
        + " loser=" + loser.creator() + "@" + loser.lamport() + " " + resolution + " by " + rule + "]";
  }
}
