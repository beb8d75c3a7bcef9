// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import java.util.HashSet;
import java.util.List;

import static com.github.field_mesh.Fixtures.chat;
import static com.github.field_mesh.Fixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

public class ReconciliationPropertyTests {

  final ReconciliationService service = new ReconciliationService(new TestSigner(node("hq")));

  @Property(tries = 200)
  void mergedChainsAreSymmetricCompleteAndKeepThePrefix(
      @ForAll @IntRange(max = 3) int shared,
      @ForAll @IntRange(max = 4) int alphaBlocks,
      @ForAll @IntRange(max = 4) int bravoBlocks,
      @ForAll boolean flooded
  ) {
    final var ledgers = ReconciliationServiceTest.forked(shared);
    final var alpha = ledgers[0];
    final var bravo = ledgers[1];
    for (int i = 0; i < alphaBlocks; i++) {
      final var m = chat("alpha", "a" + i);
      alpha.append(List.of(m));
      if (flooded && i == 0) {
        bravo.append(List.of(m.arrivedAt(node("bravo"))));
      }
    }
    for (int i = 0; i < bravoBlocks; i++) {
      bravo.append(List.of(chat("bravo", "b" + i)));
    }

    final var ab = service.merge(alpha.chain(), bravo.chain());
    final var ba = service.merge(bravo.chain(), alpha.chain());
    assertThat(ab).isEqualTo(ba);
    assertThat(Ledger.validate(ab.canonical(), new TestSigner(node("hq"))).valid()).isTrue();

    final var expected = new HashSet<>(alpha.messageIds());
    expected.addAll(bravo.messageIds());
    assertThat(Ledger.messageIdsOf(ab.canonical())).isEqualTo(expected);
    final int prefix = (int) ab.forkIndex().orElse(Math.min(alpha.size(), bravo.size()));
    assertThat(ab.canonical().subList(0, prefix)).isEqualTo(alpha.chain().subList(0, prefix));
    service.verifyAgainst(ab.canonical(), alpha.chain(), ab.forkIndex());
    service.verifyAgainst(ab.canonical(), bravo.chain(), ab.forkIndex());

    // merging the result again changes nothing
    assertThat(service.merge(ab.canonical(), alpha.chain()).canonical()).isEqualTo(ab.canonical());
  }
}
