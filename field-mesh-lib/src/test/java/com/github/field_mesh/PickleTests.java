// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.field_mesh.Fixtures.chat;
import static com.github.field_mesh.Fixtures.node;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class PickleTests {

  @Test
  public void testPickleGenesis() throws Exception {
    final var genesis = Genesis.block("fleet");
    assertEquals(genesis, Pickle.readBlock(Pickle.writeBlock(genesis)));
  }

  @Test
  public void testPickleBlockWithMessages() throws Exception {
    final var ledger = Fixtures.ledger("alpha");
    final var block = ledger.append(List.of(chat("alpha", "one"), chat("bravo", "two").arrivedAt(node("alpha"))));
    final var unpickled = Pickle.readBlock(Pickle.writeBlock(block));
    assertEquals(block, unpickled);
    // the stored messages hash to the stored payload hash
    assertEquals(block.payloadHash(), BlockHashing.payloadHash(unpickled.messages()));
  }
}
