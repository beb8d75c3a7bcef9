// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.f4b6a3.uuid.UuidCreator;
import com.github.field_mesh.event.BlockAppended;
import com.github.field_mesh.event.DeliveryReport;
import com.github.field_mesh.event.MeshEvent;
import com.github.field_mesh.event.MessageExpired;
import com.github.field_mesh.event.NetworkStateChanged;
import com.github.field_mesh.event.PeerFound;
import com.github.field_mesh.event.PeerLost;
import com.github.field_mesh.event.ReconciliationFailed;
import com.github.field_mesh.event.ReconciliationReport;
import com.github.field_mesh.msg.MeshMessage;
import com.github.field_mesh.msg.MessageType;
import com.github.field_mesh.network.MeshRouter;
import com.github.field_mesh.network.MeshTransport;
import com.github.field_mesh.network.PeerLink;
import com.github.field_mesh.network.Reception;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.function.Consumer;
import java.util.logging.Level;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// The per-node agent. It owns the node's network state, clocks, router, ledger and outbound queue and is the only
/// thing that touches them. Nodes share nothing and interact only through the transport, the peer ledger exchange and
/// the coordinator.
///
/// Three activities run concurrently against one agent: the transport's inbound handler calls [#receive(MeshMessage)],
/// the application calls [#submit(MessageType, byte[], Optional)] and the [MeshScheduler] calls [#tick()]. Ledger
/// appends are serialized by the ledger's own mutex. Transitions of the network state happen under this object's
/// monitor, held by [#tick()] for the whole of a reconciliation. Sends and inbound messages only read the state
/// so they never wait on that monitor.
///
/// While the authority is reachable and the node has reconciled with it (CENTRALIZED) messages go to the authority and
/// the node pulls the master ledger on every tick. Otherwise messages are recorded in the local ledger and flooded to
/// peers. When the authority comes back the node stays in its offline state with authority traffic gated until a
/// reconciliation with the authority has been adopted.
public class NodeAgent implements AutoCloseable {

  private final MeshConfig config;
  private final NodeId self;
  private final ClockService clock;
  private final Ledger ledger;
  private final MeshRouter router;
  private final MeshTransport transport;
  private final Coordinator coordinator;
  private final PeerLedgers peerLedgers;
  private final ReconciliationService reconciliation;
  private final OutboundQueue queue;
  private final Clock wallClock;
  private final Consumer<MeshEvent> listener;

  private volatile NetworkState state = NetworkState.CENTRALIZED;
  /// Authority traffic is gated until a reconciliation with the authority has been adopted.
  private volatile boolean resyncing = false;
  private boolean resynced = false;
  private volatile long lastHeartbeat;
  /// Peers lost since we last heard from them.
  private final Set<NodeId> lostPeers = new ConcurrentSkipListSet<>();
  /// Peers to reconcile with on the next tick. Also updated by peers pushing a canonical chain to us.
  private final Set<NodeId> pendingPeerSync = new ConcurrentSkipListSet<>();
  /// Counterparts whose ledgers share no ancestor with ours. Never retried automatically.
  private final Set<NodeId> escalated = new TreeSet<>();
  private volatile boolean closed = false;

  /// @param coordinator the authority; a node started without one has no authority to reach
  public NodeAgent(MeshConfig config,
                   ClockService clock,
                   Ledger ledger,
                   MeshTransport transport,
                   Coordinator coordinator,
                   PeerLedgers peerLedgers,
                   ReconciliationService reconciliation,
                   Clock wallClock,
                   Consumer<MeshEvent> listener) {
    this.config = config;
    this.self = clock.nodeId();
    this.clock = clock;
    this.ledger = ledger;
    this.transport = transport;
    this.coordinator = coordinator;
    this.peerLedgers = peerLedgers;
    this.reconciliation = reconciliation;
    this.wallClock = wallClock;
    this.listener = listener;
    this.router = new MeshRouter(self, transport, config.peerTimeout().toMillis(),
        config.dedupRetention().toMillis(), config.dedupMaxEntries());
    this.queue = new OutboundQueue(config.backoff(), config.queueExpiry().toMillis());
    // the node is brought up with the authority in reach
    this.lastHeartbeat = wallClock.millis();
    if (!ledger.owner().equals(self)) {
      throw new IllegalArgumentException("ledger of " + ledger.owner() + " handed to agent of " + self);
    }
  }

  /// Subscribe to the transport so inbound messages reach [#receive(MeshMessage)].
  public void start() {
    transport.subscribe(self, this::receive);
    LOGGER.info(() -> self + " started in " + state());
  }

  public NodeId self() {
    return self;
  }

  /// Broadcast a message to the fleet.
  public UUID submit(MessageType type, byte[] payload) {
    return submit(type, payload, Optional.empty());
  }

  /// Send a message to one node.
  public UUID submit(MessageType type, byte[] payload, NodeId destination) {
    return submit(type, payload, Optional.of(destination));
  }

  /// Send a message. The outcome is published as a [DeliveryReport]: DELIVERED when it was handed to the authority
  /// or to a reachable peer, QUEUED when it waits in the outbound queue.
  ///
  /// @return the id of the new message
  public UUID submit(MessageType type, byte[] payload, Optional<NodeId> destination) {
    if (closed) {
      throw new IllegalStateException(ErrorStrings.CLOSED);
    }
    final long now = wallClock.millis();
    final var stamp = clock.stamp();
    final var message = new MeshMessage(UuidCreator.getTimeOrderedEpoch(), self, destination, type, payload,
        stamp.lamport(), stamp.vector(), config.initialTtl(), List.of(self));
    router.markSeen(message.id(), now);
    if (deliver(message, now)) {
      publish(new DeliveryReport(self, now, message.id(), DeliveryReport.Outcome.DELIVERED));
    } else {
      queue.enqueue(message, now);
      publish(new DeliveryReport(self, now, message.id(), DeliveryReport.Outcome.QUEUED));
    }
    return message.id();
  }

  /// The inbound handler. Duplicates are discarded; a new message merges into our clocks, is recorded in our ledger
  /// and is re-flooded while it has hops left.
  public Reception receive(MeshMessage message) {
    if (closed) {
      LOGGER.finer(() -> self + " closed so dropping " + message.id());
      return Reception.CLOSED;
    }
    final long now = wallClock.millis();
    final var previousHop = message.lastHop();
    final boolean wasLive = router.isLive(previousHop, now);
    final var reception = router.receive(message, now, arrived -> {
      clock.merge(new Timestamp(arrived.lamport(), arrived.vector()));
      record(arrived, now);
    });
    if (reception != Reception.DUPLICATE && !wasLive && !previousHop.equals(self)) {
      peerFound(previousHop, now);
    }
    return reception;
  }

  /// A discovery beacon or link report from a directly reachable peer.
  public void peerSeen(NodeId peer, double quality) {
    final long now = wallClock.millis();
    if (router.peerSeen(peer, quality, now)) {
      peerFound(peer, now);
    }
  }

  /// A keepalive from the authority.
  public void onAuthorityHeartbeat() {
    lastHeartbeat = wallClock.millis();
  }

  /// One pass of the monitor: expire peers and queued messages, evaluate the network state, reconcile where needed
  /// and retry queued messages that are due.
  public synchronized void tick() {
    if (closed) {
      return;
    }
    final long now = wallClock.millis();
    for (PeerLink lost : router.expirePeers(now)) {
      lostPeers.add(lost.to());
      pendingPeerSync.remove(lost.to());
      publish(new PeerLost(self, now, lost.to(), lost.lastSeen()));
    }
    for (OutboundQueue.Entry expired : queue.expire(now)) {
      LOGGER.warning(() -> self + " dropping undelivered " + expired.message().type() + " " + expired.id()
          + " after " + expired.attempts() + " attempts");
      publish(new MessageExpired(self, now, expired.id(), expired.message().type(), expired.attempts()));
    }
    evaluateState(now);
    if (resyncing) {
      if (reconcileWithAuthority(now)) {
        resynced = true;
        evaluateState(now);
      }
    } else if (state == NetworkState.CENTRALIZED && coordinator != null) {
      catchUpWithAuthority(now);
    }
    for (NodeId peer : List.copyOf(pendingPeerSync)) {
      if (router.isLive(peer, now)) {
        reconcileWith(peer);
      }
    }
    drainQueue(now);
  }

  private void evaluateState(long now) {
    final boolean authorityAlive = coordinator != null
        && now - lastHeartbeat <= config.authorityTimeout().toMillis();
    if (!authorityAlive) {
      resynced = false;
    }
    final var live = router.livePeers(now);
    final int healthy = (int) live.stream().filter(l -> l.quality() >= config.minLinkQuality()).count();
    final var step = NetworkStateMachine.next(state,
        new NetworkStateMachine.Observation(authorityAlive, live.size(), healthy, resynced), config.minPeers());
    if (step.resyncRequired() && !resyncing) {
      LOGGER.info(() -> self + " authority is back, resyncing before going CENTRALIZED");
    }
    resyncing = step.resyncRequired();
    if (step.next() != state) {
      final var from = state;
      state = step.next();
      if (state == NetworkState.CENTRALIZED) {
        resynced = false;
      }
      LOGGER.info(() -> self + " network state " + from + " -> " + step.next() + " live=" + live.size()
          + " healthy=" + healthy);
      publish(new NetworkStateChanged(self, now, from, step.next()));
    }
  }

  /// Merge our chain into the master ledger and adopt the result.
  ///
  /// @return true if the canonical chain was adopted
  private boolean reconcileWithAuthority(long now) {
    if (escalated.contains(coordinator.id())) {
      return false;
    }
    final var preMerge = ledger.chain();
    final var preTail = preMerge.get(preMerge.size() - 1).hash();
    final MergeResult result;
    try {
      result = coordinator.reconcile(self, preMerge);
      reconciliation.verifyAgainst(result.canonical(), preMerge, result.forkIndex());
    } catch (PeerUnreachableException e) {
      LOGGER.fine(() -> self + " reconciliation with the authority aborted and will be retried: " + e.getMessage());
      return false;
    } catch (DivergentLedgerException | LedgerIntegrityException e) {
      escalate(coordinator.id(), now, e);
      return false;
    }
    return adopt(coordinator.id(), result, preMerge, preTail, now);
  }

  /// Pull blocks other nodes recorded through the authority.
  private void catchUpWithAuthority(long now) {
    final List<LedgerBlock> master;
    try {
      master = coordinator.masterLedger();
    } catch (PeerUnreachableException e) {
      LOGGER.fine(() -> self + " could not reach the authority: " + e.getMessage());
      return;
    }
    if (!master.get(master.size() - 1).hash().equals(ledger.tail().hash())) {
      reconcileWithAuthority(now);
    }
  }

  /// Reconcile our ledger with a peer's: fetch the peer's chain, merge, push the canonical chain to the peer and
  /// adopt it locally. A disconnect at any step leaves both sides on their pre-merge chains and the peer stays
  /// pending for a later tick.
  ///
  /// @return true if both sides now hold the canonical chain
  public synchronized boolean reconcileWith(NodeId peer) {
    final long now = wallClock.millis();
    if (escalated.contains(peer)) {
      return false;
    }
    pendingPeerSync.add(peer);
    final var preMerge = ledger.chain();
    final var preTail = preMerge.get(preMerge.size() - 1).hash();
    try {
      final var remote = peerLedgers.fetch(peer);
      final var result = reconciliation.merge(preMerge, remote);
      reconciliation.verifyAgainst(result.canonical(), preMerge, result.forkIndex());
      final var remoteTail = remote.get(remote.size() - 1).hash();
      if (!result.tail().hash().equals(remoteTail)
          && !peerLedgers.push(peer, self, result.canonical(), remoteTail)) {
        LOGGER.fine(() -> self + " peer " + peer + " moved on during reconciliation, will retry");
        return false;
      }
      if (adopt(peer, result, preMerge, preTail, now)) {
        pendingPeerSync.remove(peer);
        return true;
      }
      return false;
    } catch (PeerUnreachableException e) {
      LOGGER.fine(() -> self + " reconciliation with " + peer + " aborted and will be retried: " + e.getMessage());
      return false;
    } catch (DivergentLedgerException | LedgerIntegrityException e) {
      pendingPeerSync.remove(peer);
      escalate(peer, now, e);
      return false;
    }
  }

  /// The receiving side of [#reconcileWith(NodeId)]. Verifies the canonical chain against our own and adopts it if
  /// our chain did not move since the initiator fetched it.
  ///
  /// @return false if our chain moved on
  /// @throws LedgerIntegrityException if the canonical chain fails verification
  public boolean acceptCanonical(NodeId from, List<LedgerBlock> canonical, String expectedTailHash) {
    final long now = wallClock.millis();
    final var preMerge = ledger.chain();
    if (!preMerge.get(preMerge.size() - 1).hash().equals(expectedTailHash)) {
      LOGGER.fine(() -> self + " chain moved on since " + from + " fetched it, refusing its canonical chain");
      return false;
    }
    final var fork = Ledger.diff(preMerge, canonical);
    reconciliation.verifyAgainst(canonical, preMerge, fork);
    if (!ledger.adopt(canonical, expectedTailHash)) {
      return false;
    }
    pendingPeerSync.remove(from);
    publish(new ReconciliationReport(self, now, from, fork, canonical.size(), List.of()));
    return true;
  }

  private boolean adopt(NodeId counterpart, MergeResult result, List<LedgerBlock> preMerge, String preTail, long now) {
    final boolean unchanged = result.tail().hash().equals(preTail);
    if (!unchanged && !ledger.adopt(result.canonical(), preTail)) {
      LOGGER.fine(() -> self + " ledger moved on during reconciliation with " + counterpart + ", will retry");
      return false;
    }
    if (unchanged) {
      LOGGER.finer(() -> self + " already holds the canonical chain of " + counterpart);
    } else if (result.forkIndex().isEmpty()) {
      // a fast forward so report the new blocks as appended
      result.canonical().subList(preMerge.size(), result.canonical().size())
          .forEach(b -> publish(new BlockAppended(self, now, LedgerExport.of(b))));
    } else {
      result.conflicts().forEach(c -> LOGGER.info(() -> self + " resolved " + c));
    }
    publish(new ReconciliationReport(self, now, counterpart, result.forkIndex(), result.canonical().size(),
        result.conflicts()));
    return true;
  }

  private void escalate(NodeId counterpart, long now, RuntimeException e) {
    escalated.add(counterpart);
    LOGGER.log(Level.SEVERE, self + " reconciliation with " + counterpart + " needs an operator: " + e.getMessage(), e);
    publish(new ReconciliationFailed(self, now, counterpart, e.getMessage()));
  }

  private void drainQueue(long now) {
    for (OutboundQueue.Entry entry : queue.due(now)) {
      if (deliver(entry.message(), now)) {
        queue.delivered(entry.id());
        LOGGER.fine(() -> self + " delivered queued " + entry.id() + " after " + entry.attempts() + " attempts");
        publish(new DeliveryReport(self, now, entry.id(), DeliveryReport.Outcome.DELIVERED));
      } else {
        queue.failed(entry.id(), now);
      }
    }
  }

  /// One delivery attempt. Resends reuse the message id so that peers discard copies they already hold. Offline a
  /// message is delivered once any peer accepts the flood, which carries a directed message on to its destination.
  private boolean deliver(MeshMessage message, long now) {
    final boolean viaAuthority = state == NetworkState.CENTRALIZED && !resyncing && coordinator != null;
    if (viaAuthority) {
      try {
        coordinator.submit(message);
        return true;
      } catch (PeerUnreachableException e) {
        LOGGER.fine(() -> self + " authority unreachable for " + message.id() + ": " + e.getMessage());
        return false;
      }
    }
    record(message, now);
    return !router.broadcast(message, now).isEmpty();
  }

  /// Append a message to our ledger unless it is already recorded.
  private void record(MeshMessage message, long now) {
    if (ledger.containsMessage(message.id())) {
      return;
    }
    final var block = ledger.append(List.of(message));
    publish(new BlockAppended(self, now, LedgerExport.of(block)));
  }

  private void peerFound(NodeId peer, long now) {
    final boolean regained = lostPeers.remove(peer);
    LOGGER.fine(() -> self + " found peer " + peer + (regained ? " again" : ""));
    publish(new PeerFound(self, now, peer, regained));
    if (regained || state.isOffline()) {
      pendingPeerSync.add(peer);
    }
  }

  private void publish(MeshEvent event) {
    try {
      listener.accept(event);
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, self + " event listener failed on " + event + ": " + e, e);
    }
  }

  public NetworkState state() {
    return state;
  }

  public boolean isResyncing() {
    return resyncing;
  }

  public Ledger ledger() {
    return ledger;
  }

  public List<LedgerBlock> chain() {
    return ledger.chain();
  }

  public ClockService clock() {
    return clock;
  }

  public int queued() {
    return queue.size();
  }

  public List<PeerLink> livePeers() {
    return router.livePeers(wallClock.millis());
  }

  /// @return peers awaiting reconciliation.
  public Set<NodeId> pendingPeerSync() {
    return Set.copyOf(pendingPeerSync);
  }

  @TestOnly
  MeshRouter router() {
    return router;
  }

  @TestOnly
  OutboundQueue queue() {
    return queue;
  }

  @Override
  public void close() {
    closed = true;
    LOGGER.info(() -> self + " closed");
  }
}
