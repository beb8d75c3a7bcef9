// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/// An immutable per-node counter map. It only holds entries for nodes that have been observed so a missing key
/// reads as zero.
public record VectorClock(SortedMap<NodeId, Long> counters) {

  public static final VectorClock EMPTY = new VectorClock(new TreeMap<>());

  public VectorClock {
    counters = Collections.unmodifiableSortedMap(new TreeMap<>(counters));
  }

  public long get(NodeId nodeId) {
    return counters.getOrDefault(nodeId, 0L);
  }

  public VectorClock increment(NodeId nodeId) {
    final var next = new TreeMap<>(counters);
    next.merge(nodeId, 1L, Long::sum);
    return new VectorClock(next);
  }

  /// Pointwise maximum over the union of the keys of both clocks.
  public VectorClock max(VectorClock other) {
    final var next = new TreeMap<>(counters);
    for (Map.Entry<NodeId, Long> e : other.counters.entrySet()) {
      next.merge(e.getKey(), e.getValue(), Math::max);
    }
    return new VectorClock(next);
  }

  /// Compares causal history. This is auxiliary information used to tell concurrent events from causally ordered
  /// ones; the merge order of the ledger never depends on it.
  public Causality compare(VectorClock other) {
    boolean less = false;
    boolean greater = false;
    final var keys = new TreeMap<>(counters);
    keys.putAll(other.counters);
    for (NodeId k : keys.keySet()) {
      final long a = get(k);
      final long b = other.get(k);
      if (a < b) {
        less = true;
      } else if (a > b) {
        greater = true;
      }
    }
    if (less && greater) {
      return Causality.CONCURRENT;
    } else if (less) {
      return Causality.BEFORE;
    } else if (greater) {
      return Causality.AFTER;
    }
    return Causality.EQUAL;
  }

  @Override
  public String toString() {
    return "V" + counters;
  }
}
