// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.msg;

import com.github.field_mesh.ClockService;
import com.github.field_mesh.NodeId;
import com.github.field_mesh.VectorClock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.zip.CRC32;

/// An application message as it travels between nodes. It is immutable; forwarding produces a copy with one less
/// hop of TTL and receiving produces a copy with the receiver appended to the route.
///
/// @param id          globally unique message id used for dedup
/// @param sender      the originating node
/// @param destination a single target node else empty for a broadcast
/// @param type        the declared type which fixes queue priority
/// @param payload     opaque application bytes
/// @param lamport     Lamport timestamp at creation
/// @param vector      vector clock snapshot at creation
/// @param ttl         remaining hops. A message is never re-flooded once this reaches zero.
/// @param route       the nodes traversed so far starting with the sender
public record MeshMessage(
    UUID id,
    NodeId sender,
    Optional<NodeId> destination,
    MessageType type,
    byte[] payload,
    long lamport,
    VectorClock vector,
    int ttl,
    List<NodeId> route
) implements ClockService.Stamped {

  public MeshMessage {
    Objects.requireNonNull(id, "id required");
    Objects.requireNonNull(sender, "sender required");
    Objects.requireNonNull(destination, "destination required");
    Objects.requireNonNull(type, "type required");
    Objects.requireNonNull(payload, "payload required");
    Objects.requireNonNull(vector, "vector required");
    if (ttl < 0) {
      throw new IllegalArgumentException("ttl must not be negative: " + ttl);
    }
    route = List.copyOf(route);
    if (route.isEmpty() || !route.get(0).equals(sender)) {
      throw new IllegalArgumentException("route must start with the sender: " + route);
    }
  }

  @Override
  public NodeId origin() {
    return sender;
  }

  public boolean isBroadcast() {
    return destination.isEmpty();
  }

  /// @return the number of hops travelled from the sender.
  public int hops() {
    return route.size() - 1;
  }

  /// @return the node that handed this message to the current holder.
  public NodeId lastHop() {
    return route.get(route.size() - 1);
  }

  /// The copy handed to a neighbour when forwarding.
  public MeshMessage forwarded() {
    if (ttl == 0) {
      throw new IllegalStateException("message " + id + " has no hops left");
    }
    return new MeshMessage(id, sender, destination, type, payload, lamport, vector, ttl - 1, route);
  }

  /// The copy held by a receiving node which records itself on the route.
  public MeshMessage arrivedAt(NodeId receiver) {
    final var next = new ArrayList<>(route);
    next.add(receiver);
    return new MeshMessage(id, sender, destination, type, payload, lamport, vector, ttl, next);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MeshMessage other)) {
      return false;
    }
    return lamport == other.lamport
        && ttl == other.ttl
        && id.equals(other.id)
        && sender.equals(other.sender)
        && destination.equals(other.destination)
        && type == other.type
        && Arrays.equals(payload, other.payload)
        && vector.equals(other.vector)
        && route.equals(other.route);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, sender, type, lamport, ttl, route) * 31 + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    CRC32 crc32 = new CRC32();
    crc32.update(payload);
    return String.format("MeshMessage[id=%s, %s->%s, type=%s, l=%d, ttl=%d, route=%s, payload=byte[%d]:CRC32=%d]",
        id, sender, destination.map(NodeId::id).orElse("*"), type, lamport, ttl, route, payload.length,
        crc32.getValue());
  }
}
