// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.Comparator;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// Produces and merges the logical timestamps of one node. Each node owns exactly one instance; the only state it
/// touches is the owning node's own Lamport counter and vector clock. Methods are synchronized as the inbound handler,
/// the retry drainer and the monitor all stamp events concurrently.
public class ClockService {

  /// The system wide total order over `(lamport, nodeId)`. Lamport gives the causal order for events that saw each
  /// other and the lower node id breaks ties between concurrent events.
  public static final Comparator<Stamped> TOTAL_ORDER = Comparator
      .comparingLong(Stamped::lamport)
      .thenComparing(Stamped::origin);

  /// Anything that carries a Lamport timestamp and an originating node.
  public interface Stamped {
    long lamport();

    NodeId origin();
  }

  private final NodeId nodeId;
  private long lamport;
  private VectorClock vector;

  public ClockService(NodeId nodeId) {
    this(nodeId, Timestamp.ZERO);
  }

  /// Used when reloading a node whose ledger already holds stamped blocks.
  public ClockService(NodeId nodeId, Timestamp initial) {
    this.nodeId = nodeId;
    this.lamport = initial.lamport();
    this.vector = initial.vector();
  }

  public NodeId nodeId() {
    return nodeId;
  }

  /// Increments the node's Lamport counter and its own vector entry.
  /// @return the snapshot after the increment.
  public synchronized Timestamp stamp() {
    lamport = lamport + 1;
    vector = vector.increment(nodeId);
    return new Timestamp(lamport, vector);
  }

  /// Merges an incoming timestamp into the node's own clocks.
  /// @return the snapshot after the merge.
  public synchronized Timestamp merge(Timestamp incoming) {
    final var merged = merge(vector, lamport, incoming.vector(), incoming.lamport());
    LOGGER.finer(() -> nodeId + " clock merge " + new Timestamp(lamport, vector) + " with " + incoming + " -> " + merged);
    lamport = merged.lamport();
    vector = merged.vector();
    return merged;
  }

  public synchronized Timestamp current() {
    return new Timestamp(lamport, vector);
  }

  /// The pure merge rule: `lamport' = max(local, incoming) + 1` and `vector'[k] = max(local[k], incoming[k])` for
  /// every key present in either input.
  public static Timestamp merge(VectorClock localVector, long localLamport,
                                VectorClock incomingVector, long incomingLamport) {
    return new Timestamp(Math.max(localLamport, incomingLamport) + 1, localVector.max(incomingVector));
  }
}
