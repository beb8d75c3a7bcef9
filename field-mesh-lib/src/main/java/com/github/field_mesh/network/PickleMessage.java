// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.network;

import com.github.field_mesh.NodeId;
import com.github.field_mesh.VectorClock;
import com.github.field_mesh.msg.MeshMessage;
import com.github.field_mesh.msg.MessageType;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/// The transport agnostic wire format of a [MeshMessage]. The same bytes work over a socket, a datagram or a
/// simulated channel:
///
/// ```
/// version(1) id(16) sender(str) hasDestination(1) [destination(str)] type(1) payload(int+bytes)
/// lamport(8) vector(int + (str, long)*) ttl(4) route(int + str*)
/// ```
/// where `str` is a two byte length followed by UTF-8 bytes.
public class PickleMessage {
  public static final PickleMessage instance = new PickleMessage();

  static final byte VERSION = 1;

  protected PickleMessage() {
  }

  public static byte[] pickle(MeshMessage msg) {
    ByteBuffer buffer = ByteBuffer.allocate(size(msg));
    write(msg, buffer);
    return buffer.array();
  }

  public static MeshMessage unpickle(ByteBuffer buffer) {
    final byte version = buffer.get();
    if (version != VERSION) {
      throw new IllegalArgumentException("Unknown wire version: " + version);
    }
    final var id = new UUID(buffer.getLong(), buffer.getLong());
    final var sender = readNodeId(buffer);
    final Optional<NodeId> destination = buffer.get() == 1 ? Optional.of(readNodeId(buffer)) : Optional.empty();
    final var type = MessageType.fromCode(buffer.get());
    final var payload = new byte[buffer.getInt()];
    buffer.get(payload);
    final long lamport = buffer.getLong();
    final var vector = readVector(buffer);
    final int ttl = buffer.getInt();
    final int routeSize = buffer.getInt();
    final List<NodeId> route = new ArrayList<>(routeSize);
    for (int i = 0; i < routeSize; i++) {
      route.add(readNodeId(buffer));
    }
    return new MeshMessage(id, sender, destination, type, payload, lamport, vector, ttl, route);
  }

  public static void write(MeshMessage m, ByteBuffer buffer) {
    buffer.put(VERSION);
    buffer.putLong(m.id().getMostSignificantBits());
    buffer.putLong(m.id().getLeastSignificantBits());
    write(m.sender(), buffer);
    buffer.put((byte) (m.destination().isPresent() ? 1 : 0));
    m.destination().ifPresent(d -> write(d, buffer));
    buffer.put(m.type().code());
    buffer.putInt(m.payload().length);
    buffer.put(m.payload());
    buffer.putLong(m.lamport());
    write(m.vector(), buffer);
    buffer.putInt(m.ttl());
    buffer.putInt(m.route().size());
    m.route().forEach(n -> write(n, buffer));
  }

  public static int size(MeshMessage m) {
    int size = 1 + 2 * Long.BYTES;
    size += size(m.sender());
    size += 1 + m.destination().map(PickleMessage::size).orElse(0);
    size += 1 + Integer.BYTES + m.payload().length;
    size += Long.BYTES;
    size += size(m.vector());
    size += Integer.BYTES;
    size += Integer.BYTES + m.route().stream().mapToInt(PickleMessage::size).sum();
    return size;
  }

  public static void write(NodeId nodeId, ByteBuffer buffer) {
    final var bytes = nodeId.id().getBytes(StandardCharsets.UTF_8);
    buffer.putShort((short) bytes.length);
    buffer.put(bytes);
  }

  public static NodeId readNodeId(ByteBuffer buffer) {
    final var bytes = new byte[buffer.getShort()];
    buffer.get(bytes);
    return new NodeId(new String(bytes, StandardCharsets.UTF_8));
  }

  static int size(NodeId nodeId) {
    return Short.BYTES + nodeId.id().getBytes(StandardCharsets.UTF_8).length;
  }

  public static void write(VectorClock vector, ByteBuffer buffer) {
    buffer.putInt(vector.counters().size());
    for (Map.Entry<NodeId, Long> e : vector.counters().entrySet()) {
      write(e.getKey(), buffer);
      buffer.putLong(e.getValue());
    }
  }

  public static VectorClock readVector(ByteBuffer buffer) {
    final int count = buffer.getInt();
    final var counters = new TreeMap<NodeId, Long>();
    for (int i = 0; i < count; i++) {
      counters.put(readNodeId(buffer), buffer.getLong());
    }
    return new VectorClock(counters);
  }

  static int size(VectorClock vector) {
    return Integer.BYTES + vector.counters().keySet().stream()
        .mapToInt(n -> size(n) + Long.BYTES)
        .sum();
  }

  /// Write into a shared buffer positioned after earlier messages.
  public void serialize(MeshMessage object, ByteBuffer buffer) {
    write(object, buffer);
  }

  public MeshMessage deserialize(ByteBuffer buffer) {
    return unpickle(buffer);
  }

  /// @return the exact number of bytes [#serialize(MeshMessage, ByteBuffer)] writes
  public int sizeOf(MeshMessage value) {
    return size(value);
  }
}
