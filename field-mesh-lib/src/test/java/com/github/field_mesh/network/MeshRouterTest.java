// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.network;

import com.github.f4b6a3.uuid.UuidCreator;
import com.github.field_mesh.NodeId;
import com.github.field_mesh.PeerUnreachableException;
import com.github.field_mesh.VectorClock;
import com.github.field_mesh.msg.MeshMessage;
import com.github.field_mesh.msg.MessageType;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

public class MeshRouterTest {

  static final long NOW = 5_000_000L;
  static final long PEER_TIMEOUT = 60_000L;

  static final NodeId ALPHA = new NodeId("alpha");
  static final NodeId BRAVO = new NodeId("bravo");
  static final NodeId CHARLIE = new NodeId("charlie");

  static MeshMessage message(NodeId sender, int ttl) {
    return new MeshMessage(UuidCreator.getTimeOrderedEpoch(), sender, Optional.empty(), MessageType.CHAT,
        new byte[]{1, 2, 3}, 1L, VectorClock.EMPTY.increment(sender), ttl, List.of(sender));
  }

  /// Records sends and refuses peers marked down.
  static class RecordingTransport implements MeshTransport {
    final List<Map.Entry<NodeId, MeshMessage>> sent = new ArrayList<>();
    final Set<NodeId> down = new HashSet<>();

    @Override
    public void send(NodeId to, MeshMessage message) throws PeerUnreachableException {
      if (down.contains(to)) {
        throw new PeerUnreachableException(to, "down");
      }
      sent.add(Map.entry(to, message));
    }

    @Override
    public void subscribe(NodeId self, Consumer<MeshMessage> handler) {
    }

    @Override
    public void close() {
    }
  }

  @Test
  public void aSeenMessageIsProcessedOnlyOnce() {
    final var transport = new RecordingTransport();
    final var router = new MeshRouter(BRAVO, transport, PEER_TIMEOUT, 600_000, 1_000);
    router.peerSeen(CHARLIE, 1.0, NOW);
    final List<MeshMessage> delivered = new ArrayList<>();
    final var message = message(ALPHA, 3);

    assertThat(router.receive(message, NOW, delivered::add)).isEqualTo(Reception.ACCEPTED_AND_FLOODED);
    assertThat(router.receive(message, NOW + 1, delivered::add)).isEqualTo(Reception.DUPLICATE);
    assertThat(delivered).hasSize(1);
    assertThat(delivered.get(0).route()).containsExactly(ALPHA, BRAVO);
    // flooded on to charlie but never back to alpha which is on the route
    assertThat(transport.sent).extracting(Map.Entry::getKey).containsExactly(CHARLIE);
    assertThat(transport.sent.get(0).getValue().ttl()).isEqualTo(2);
    // the previous hop is now a live peer
    assertThat(router.isLive(ALPHA, NOW)).isTrue();
  }

  @Test
  public void exhaustedTtlIsProcessedButNotFlooded() {
    final var transport = new RecordingTransport();
    final var router = new MeshRouter(BRAVO, transport, PEER_TIMEOUT, 600_000, 1_000);
    router.peerSeen(CHARLIE, 1.0, NOW);
    final List<MeshMessage> delivered = new ArrayList<>();
    assertThat(router.receive(message(ALPHA, 0), NOW, delivered::add)).isEqualTo(Reception.ACCEPTED);
    assertThat(delivered).hasSize(1);
    assertThat(transport.sent).isEmpty();
  }

  @Test
  public void anUnreachablePeerDoesNotStopTheOthers() {
    final var transport = new RecordingTransport();
    final var router = new MeshRouter(ALPHA, transport, PEER_TIMEOUT, 600_000, 1_000);
    router.peerSeen(BRAVO, 1.0, NOW);
    router.peerSeen(CHARLIE, 1.0, NOW);
    transport.down.add(BRAVO);
    final var accepted = router.broadcast(message(ALPHA, 3), NOW);
    assertThat(accepted).containsExactly(CHARLIE);
  }

  @Test
  public void silentPeersExpire() {
    final var router = new MeshRouter(ALPHA, new RecordingTransport(), PEER_TIMEOUT, 600_000, 1_000);
    assertThat(router.peerSeen(BRAVO, 0.8, NOW)).isTrue();
    assertThat(router.peerSeen(BRAVO, 0.9, NOW + 10_000)).isFalse();
    assertThat(router.peerSeen(CHARLIE, 0.5, NOW + 50_000)).isTrue();
    assertThat(router.peerSeen(ALPHA, 1.0, NOW)).isFalse();

    final var lost = router.expirePeers(NOW + 70_001);
    assertThat(lost).extracting(PeerLink::to).containsExactly(BRAVO);
    assertThat(lost.get(0).lastSeen()).isEqualTo(NOW + 10_000);
    assertThat(router.livePeers(NOW + 70_001)).extracting(PeerLink::to).containsExactly(CHARLIE);
    assertThat(router.peerSeen(BRAVO, 0.9, NOW + 80_000)).isTrue();
  }

  @Test
  public void theDedupSetIsBounded() {
    final var router = new MeshRouter(ALPHA, new RecordingTransport(), PEER_TIMEOUT, 1_000, 3);
    for (int i = 0; i < 10; i++) {
      router.markSeen(UuidCreator.getTimeOrderedEpoch(), NOW);
    }
    assertThat(router.seenCount()).isLessThanOrEqualTo(3);
    router.markSeen(UuidCreator.getTimeOrderedEpoch(), NOW + 5_000);
    assertThat(router.seenCount()).isEqualTo(1);
  }

  @Test
  public void floodingOnALineStopsWhenTheTtlRunsOut() {
    final List<NodeId> line = List.of(ALPHA, BRAVO, CHARLIE, new NodeId("delta"), new NodeId("echo"));
    final Deque<Map.Entry<NodeId, MeshMessage>> wire = new ArrayDeque<>();
    final Map<NodeId, MeshRouter> routers = new HashMap<>();
    final Map<NodeId, List<MeshMessage>> delivered = new HashMap<>();
    for (NodeId id : line) {
      routers.put(id, new MeshRouter(id, new MeshTransport() {
        @Override
        public void send(NodeId to, MeshMessage message) {
          wire.add(Map.entry(to, message));
        }

        @Override
        public void subscribe(NodeId self, Consumer<MeshMessage> handler) {
        }

        @Override
        public void close() {
        }
      }, PEER_TIMEOUT, 600_000, 1_000));
      delivered.put(id, new ArrayList<>());
    }
    for (int i = 0; i + 1 < line.size(); i++) {
      routers.get(line.get(i)).peerSeen(line.get(i + 1), 1.0, NOW);
      routers.get(line.get(i + 1)).peerSeen(line.get(i), 1.0, NOW);
    }

    final var original = message(ALPHA, 3);
    routers.get(ALPHA).markSeen(original.id(), NOW);
    routers.get(ALPHA).broadcast(original, NOW);
    int hops = 0;
    while (!wire.isEmpty()) {
      final var next = wire.poll();
      routers.get(next.getKey()).receive(next.getValue(), NOW, delivered.get(next.getKey())::add);
      assertThat(++hops).isLessThan(100);
    }

    assertThat(delivered.get(CHARLIE).get(0).route()).containsExactly(ALPHA, BRAVO, CHARLIE);
    assertThat(delivered.get(new NodeId("delta"))).hasSize(1);
    assertThat(delivered.get(new NodeId("delta")).get(0).ttl()).isZero();
    assertThat(delivered.get(new NodeId("echo"))).isEmpty();
    assertThat(delivered.get(ALPHA)).isEmpty();
  }
}
