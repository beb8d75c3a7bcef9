// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.f4b6a3.uuid.UuidCreator;
import com.github.field_mesh.msg.MeshMessage;
import com.github.field_mesh.msg.MessageType;
import org.h2.mvstore.MVStore;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

class Fixtures {
  static final String FLEET = "test-fleet";

  static NodeId node(String id) {
    return new NodeId(id);
  }

  static MeshMessage message(String sender, MessageType type, long lamport, String text) {
    final var from = node(sender);
    return new MeshMessage(UuidCreator.getTimeOrderedEpoch(), from, Optional.empty(), type,
        text.getBytes(StandardCharsets.UTF_8), lamport, VectorClock.EMPTY.increment(from), 3, List.of(from));
  }

  static MeshMessage chat(String sender, String text) {
    return message(sender, MessageType.CHAT, 1L, text);
  }

  static Ledger ledger(String owner) {
    return ledger(owner, FLEET);
  }

  static Ledger ledger(String owner, String fleet) {
    final var id = node(owner);
    return new Ledger(id, new ClockService(id), new TestSigner(id), new MVStoreBlockStore(MVStore.open(null), id),
        Genesis.block(fleet));
  }
}
