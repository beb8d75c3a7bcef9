// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.field_mesh.Fixtures.chat;
import static com.github.field_mesh.Fixtures.ledger;
import static com.github.field_mesh.Fixtures.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AuthorityTest {

  static Authority authority() {
    final var hq = node("hq");
    final var clock = new ClockService(hq);
    final var master = new Ledger(hq, clock, new TestSigner(hq),
        new MVStoreBlockStore(org.h2.mvstore.MVStore.open(null), hq), Genesis.block(Fixtures.FLEET));
    return new Authority(hq, clock, master, new ReconciliationService(new TestSigner(hq)));
  }

  @Test
  public void submittedMessagesAreRecordedOnce() {
    final var authority = authority();
    final var message = chat("alpha", "report");
    authority.submit(message);
    authority.submit(message);
    assertThat(authority.masterLedger()).hasSize(2);
    final var block = authority.masterLedger().get(1);
    assertThat(block.creator()).isEqualTo(node("hq"));
    assertThat(block.lamport()).isGreaterThan(message.lamport());
  }

  @Test
  public void reconcileMergesANodeChainIntoTheMasterLedger() {
    final var authority = authority();
    authority.submit(chat("charlie", "while alpha was away"));
    final var alpha = ledger("alpha");
    alpha.append(List.of(chat("alpha", "offline")));

    final var result = authority.reconcile(node("alpha"), alpha.chain());
    assertThat(result.forkIndex()).hasValue(1);
    assertThat(authority.masterLedger()).isEqualTo(result.canonical());
    assertThat(Ledger.messageIdsOf(result.canonical())).containsAll(alpha.messageIds());

    // the node can adopt what the authority returned
    assertThat(alpha.adopt(result.canonical(), alpha.tail().hash())).isTrue();
    assertThat(alpha.chain()).isEqualTo(authority.masterLedger());
    // a second reconcile is a no-op
    assertThat(authority.reconcile(node("alpha"), alpha.chain()).conflicts()).isEmpty();
    assertThat(authority.masterLedger()).isEqualTo(alpha.chain());
  }

  @Test
  public void aForeignFleetIsRefused() {
    final var authority = authority();
    assertThatThrownBy(() -> authority.reconcile(node("zulu"), ledger("zulu", "other").chain()))
        .isInstanceOf(DivergentLedgerException.class);
    assertThat(authority.masterLedger()).hasSize(1);
  }
}
