// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MeshMessage;

import java.util.List;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// The central coordinator. It owns the master ledger: messages submitted while nodes are CENTRALIZED are appended
/// to it directly and nodes returning from a partition merge their chains into it. Nodes pull the master ledger to
/// catch up with messages others submitted.
///
/// Calls are serialized on this object so each reconciliation sees a stable master ledger.
public class Authority implements Coordinator {

  private final NodeId id;
  private final ClockService clock;
  private final Ledger master;
  private final ReconciliationService reconciliation;

  public Authority(NodeId id, ClockService clock, Ledger master, ReconciliationService reconciliation) {
    this.id = id;
    this.clock = clock;
    this.master = master;
    this.reconciliation = reconciliation;
  }

  @Override
  public NodeId id() {
    return id;
  }

  /// Records a message in the master ledger. A message already recorded is ignored so that resends are idempotent.
  @Override
  public synchronized void submit(MeshMessage message) {
    if (master.containsMessage(message.id())) {
      LOGGER.finer(() -> id + " ignoring resend of " + message.id());
      return;
    }
    clock.merge(new Timestamp(message.lamport(), message.vector()));
    final var block = master.append(List.of(message));
    LOGGER.fine(() -> id + " recorded " + message.id() + " from " + message.sender() + " in " + block);
  }

  @Override
  public synchronized MergeResult reconcile(NodeId node, List<LedgerBlock> chain) {
    final var preMerge = master.chain();
    final MergeResult result;
    try {
      result = reconciliation.merge(preMerge, chain);
      reconciliation.verifyAgainst(result.canonical(), preMerge, result.forkIndex());
    } catch (DivergentLedgerException | LedgerIntegrityException e) {
      LOGGER.warning(() -> id + " refusing to reconcile with " + node + ": " + e.getMessage());
      throw e;
    }
    if (!result.tail().hash().equals(preMerge.get(preMerge.size() - 1).hash())) {
      // we hold the monitor so the master tail cannot have moved
      master.adopt(result.canonical(), preMerge.get(preMerge.size() - 1).hash());
    }
    LOGGER.info(() -> id + " reconciled with " + node + " fork=" + result.forkIndex() + " master size="
        + result.canonical().size() + " conflicts=" + result.conflicts().size());
    return result;
  }

  @Override
  public List<LedgerBlock> masterLedger() {
    return master.chain();
  }

  public Ledger ledger() {
    return master;
  }
}
