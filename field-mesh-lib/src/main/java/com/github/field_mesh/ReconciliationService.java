// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// Merges two ledgers that diverged during a partition into one canonical chain. The merge is a pure function of its
/// inputs and is symmetric: `merge(a, b)` and `merge(b, a)` return identical results so every node that merges the
/// same pair of chains adopts the same canonical chain without further coordination.
///
/// The canonical chain is the common prefix followed by the blocks of both branches in the total order
/// `(lamport, creator)`. A block is re-appended only if it records a message the canonical chain does not hold yet.
/// Blocks moved to a new index are rebased: same content and signature with a new link.
public class ReconciliationService {

  /// The total order with content as the last resort so that copies of one block order the same on both sides.
  static final Comparator<LedgerBlock> MERGE_ORDER = Comparator
      .<LedgerBlock>comparingLong(LedgerBlock::lamport)
      .thenComparing(LedgerBlock::creator)
      .thenComparing(LedgerBlock::payloadHash)
      .thenComparing(LedgerBlock::signature, Arrays::compare);

  private final BlockSigner signer;

  public ReconciliationService(BlockSigner signer) {
    this.signer = signer;
  }

  public ReconciliationService() {
    this(BlockSigner.UNSIGNED);
  }

  /// @throws DivergentLedgerException if the chains share no common ancestor
  /// @throws LedgerIntegrityException if either input is invalid or one creator signed two different blocks at the
  ///                                  same Lamport timestamp
  public MergeResult merge(List<LedgerBlock> local, List<LedgerBlock> remote) {
    Ledger.validate(local, signer).orThrow();
    Ledger.validate(remote, signer).orThrow();
    final var fork = Ledger.diff(local, remote);
    if (fork.isEmpty()) {
      final var longer = local.size() >= remote.size() ? local : remote;
      return new MergeResult(longer, OptionalLong.empty(), List.of());
    }
    final int forkIndex = (int) fork.getAsLong();
    if (forkIndex == 0) {
      LOGGER.severe(() -> ErrorStrings.DIVERGENT + "genesis " + local.get(0) + " vs " + remote.get(0));
      throw new DivergentLedgerException("chains disagree at genesis: " + local.get(0).hash() + " vs "
          + remote.get(0).hash());
    }

    final var ours = local.subList(forkIndex, local.size());
    final var theirs = remote.subList(forkIndex, remote.size());

    final List<LedgerBlock> candidates = new ArrayList<>(ours.size() + theirs.size());
    candidates.addAll(ours);
    candidates.addAll(theirs);
    candidates.sort(MERGE_ORDER);

    final List<LedgerBlock> canonical = new ArrayList<>(local.subList(0, forkIndex));
    final Set<UUID> present = Ledger.messageIdsOf(canonical);
    final List<LedgerBlock> appended = new ArrayList<>();
    LedgerBlock previous = null;
    for (LedgerBlock candidate : candidates) {
      if (previous != null && previous.lamport() == candidate.lamport()
          && previous.creator().equals(candidate.creator())) {
        if (previous.sameContent(candidate)) {
          continue;
        }
        LOGGER.severe(() -> ErrorStrings.INTEGRITY + candidate.creator() + " signed two blocks at lamport "
            + candidate.lamport());
        throw new LedgerIntegrityException(candidate.index(), candidate.creator()
            + " equivocated with two different blocks at lamport " + candidate.lamport());
      }
      previous = candidate;
      if (present.containsAll(candidate.messageIds()) && !candidate.messages().isEmpty()) {
        continue;
      }
      final var tail = canonical.get(canonical.size() - 1);
      final var rebased = candidate.rebase(canonical.size(), tail.hash());
      canonical.add(rebased);
      appended.add(rebased);
      present.addAll(candidate.messageIds());
    }

    final List<SyncConflict> conflicts = new ArrayList<>();
    final int contested = Math.min(ours.size(), theirs.size());
    for (int i = 0; i < contested; i++) {
      final var a = ours.get(i);
      final var b = theirs.get(i);
      if (a.sameContent(b)) {
        continue;
      }
      final boolean aFirst = ClockService.TOTAL_ORDER.compare(a, b) < 0;
      final var winner = aFirst ? a : b;
      final var loser = aFirst ? b : a;
      final var resolution = appended.stream().anyMatch(loser::sameContent)
          ? SyncConflict.Resolution.REBASED
          : SyncConflict.Resolution.SUPERSEDED;
      conflicts.add(new SyncConflict(forkIndex + i, winner, loser, resolution, SyncConflict.TOTAL_ORDER_RULE));
    }

    final var result = new MergeResult(canonical, fork, conflicts);
    LOGGER.fine(() -> "merged chains of " + local.size() + " and " + remote.size() + " blocks forked at " + forkIndex
        + " into " + canonical.size() + " blocks with " + conflicts.size() + " conflicts");
    return result;
  }

  /// Checks a canonical chain before a node adopts it: it must validate, keep the pre-merge prefix up to the fork and
  /// hold every message the node recorded before the merge.
  ///
  /// @throws LedgerIntegrityException naming the first offending index
  public void verifyAgainst(List<LedgerBlock> canonical, List<LedgerBlock> preMerge, OptionalLong forkIndex) {
    Ledger.validate(canonical, signer).orThrow();
    final long prefix = Math.min(forkIndex.orElse(preMerge.size()), preMerge.size());
    if (canonical.size() < prefix) {
      throw new LedgerIntegrityException(canonical.size(), "canonical chain is shorter than the common prefix");
    }
    for (int i = 0; i < prefix; i++) {
      if (!canonical.get(i).hash().equals(preMerge.get(i).hash())) {
        throw new LedgerIntegrityException(i, "canonical chain rewrites the common prefix");
      }
    }
    final Set<UUID> held = Ledger.messageIdsOf(canonical);
    final Set<UUID> missing = new HashSet<>(Ledger.messageIdsOf(preMerge));
    missing.removeAll(held);
    if (!missing.isEmpty()) {
      throw new LedgerIntegrityException(prefix, "canonical chain lost messages " + missing);
    }
  }
}
