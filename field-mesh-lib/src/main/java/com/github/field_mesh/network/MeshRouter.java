// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.network;

import com.github.field_mesh.NodeId;
import com.github.field_mesh.PeerUnreachableException;
import com.github.field_mesh.msg.MeshMessage;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Consumer;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// The flooding router of one node. It keeps this node's outbound view of its directly reachable peers and a dedup
/// set of message ids. Routing is pure flooding bounded by TTL: there is no path computation as the topology changes
/// faster than path state could be maintained. The TTL bound and the route-so-far exclusion guarantee termination on
/// cyclic adjacency.
///
/// The router state is guarded by this object's monitor. Sends and the local up-call happen outside the monitor so a
/// slow transport or handler never blocks other traffic through this router.
public class MeshRouter {
  private final NodeId self;
  private final MeshTransport transport;
  private final long peerTimeoutMillis;
  private final long dedupRetentionMillis;
  private final int dedupMaxEntries;

  /// This node's view of its direct peers by peer id.
  private final Map<NodeId, PeerLink> peers = new TreeMap<>();

  /// Seen message ids in the order first seen with the time they were seen.
  private final LinkedHashMap<UUID, Long> seen = new LinkedHashMap<>();

  public MeshRouter(NodeId self, MeshTransport transport, long peerTimeoutMillis, long dedupRetentionMillis,
                    int dedupMaxEntries) {
    this.self = self;
    this.transport = transport;
    this.peerTimeoutMillis = peerTimeoutMillis;
    this.dedupRetentionMillis = dedupRetentionMillis;
    this.dedupMaxEntries = dedupMaxEntries;
  }

  public NodeId self() {
    return self;
  }

  /// Record that a peer was heard from, for example from a discovery beacon.
  ///
  /// @return true if the peer was not live before this observation
  public synchronized boolean peerSeen(NodeId peer, double quality, long now) {
    if (peer.equals(self)) {
      return false;
    }
    final var prior = peers.get(peer);
    final var link = prior == null ? new PeerLink(self, peer, quality, now) : prior.observed(quality, now);
    peers.put(peer, link);
    return prior == null || !prior.isLive(now, peerTimeoutMillis);
  }

  /// Forget peers silent past the peer timeout.
  ///
  /// @return the peers that were lost by this call, in node id order
  public synchronized List<PeerLink> expirePeers(long now) {
    final List<PeerLink> lost = new ArrayList<>();
    final Iterator<PeerLink> it = peers.values().iterator();
    while (it.hasNext()) {
      final var link = it.next();
      if (!link.isLive(now, peerTimeoutMillis)) {
        lost.add(link);
        it.remove();
      }
    }
    if (!lost.isEmpty()) {
      LOGGER.fine(() -> self + " lost peers " + lost.stream().map(PeerLink::to).toList());
    }
    return lost;
  }

  public synchronized List<PeerLink> livePeers(long now) {
    return peers.values().stream().filter(l -> l.isLive(now, peerTimeoutMillis)).toList();
  }

  public synchronized boolean isLive(NodeId peer, long now) {
    final var link = peers.get(peer);
    return link != null && link.isLive(now, peerTimeoutMillis);
  }

  /// Record a message id as seen without processing it. Used for messages this node originates so that echoes are
  /// discarded.
  public synchronized void markSeen(UUID messageId, long now) {
    pruneSeen(now);
    seen.put(messageId, now);
  }

  /// Forward a message to every live peer that is not already on its route with one less hop of TTL. A message
  /// with no hops left is not forwarded.
  ///
  /// @return the peers that accepted the message
  public Set<NodeId> broadcast(MeshMessage message, long now) {
    if (message.ttl() == 0) {
      LOGGER.finer(() -> self + " not flooding " + message.id() + " as its ttl is exhausted");
      return Set.of();
    }
    final List<NodeId> targets;
    synchronized (this) {
      targets = peers.values().stream()
          .filter(l -> l.isLive(now, peerTimeoutMillis))
          .map(PeerLink::to)
          .filter(p -> !message.route().contains(p))
          .toList();
    }
    final var forwarded = message.forwarded();
    final Set<NodeId> accepted = new LinkedHashSet<>();
    for (NodeId peer : targets) {
      try {
        transport.send(peer, forwarded);
        accepted.add(peer);
      } catch (PeerUnreachableException e) {
        LOGGER.fine(() -> self + " could not flood " + message.id() + " to " + peer + ": " + e.getMessage());
      }
    }
    LOGGER.finer(() -> self + " flooded " + message.id() + " ttl=" + forwarded.ttl() + " to " + accepted);
    return accepted;
  }

  /// Process an inbound message. A seen id is discarded silently. Otherwise the message is recorded as seen, this
  /// node is appended to its route, the previous hop is refreshed as a live peer, the local handler runs and the
  /// message is re-flooded while TTL remains.
  public Reception receive(MeshMessage message, long now, Consumer<MeshMessage> local) {
    synchronized (this) {
      pruneSeen(now);
      if (seen.containsKey(message.id())) {
        LOGGER.finer(() -> self + " discarding duplicate " + message.id());
        return Reception.DUPLICATE;
      }
      seen.put(message.id(), now);
      final var previousHop = message.lastHop();
      final var prior = peers.get(previousHop);
      peers.put(previousHop, prior == null ? new PeerLink(self, previousHop, 1.0, now) : prior.heard(now));
    }
    final var arrived = message.arrivedAt(self);
    local.accept(arrived);
    if (arrived.ttl() > 0) {
      broadcast(arrived, now);
      return Reception.ACCEPTED_AND_FLOODED;
    }
    return Reception.ACCEPTED;
  }

  private void pruneSeen(long now) {
    final Iterator<Map.Entry<UUID, Long>> it = seen.entrySet().iterator();
    while (it.hasNext()) {
      final var e = it.next();
      if (now - e.getValue() > dedupRetentionMillis || seen.size() >= dedupMaxEntries) {
        it.remove();
      } else {
        break;
      }
    }
  }

  @TestOnly
  synchronized int seenCount() {
    return seen.size();
  }
}
