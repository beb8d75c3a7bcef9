// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.network;

import com.github.f4b6a3.uuid.UuidCreator;
import com.github.field_mesh.NodeId;
import com.github.field_mesh.VectorClock;
import com.github.field_mesh.msg.MeshMessage;
import com.github.field_mesh.msg.MessageType;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PickleMessageTests {

  @Test
  public void directedMessageWithRouteAndVector() {
    final var alpha = new NodeId("alpha");
    final var bravo = new NodeId("bravo");
    final var vector = VectorClock.EMPTY.increment(alpha).increment(alpha).increment(bravo);
    final var message = new MeshMessage(UuidCreator.getTimeOrderedEpoch(), alpha, Optional.of(bravo),
        MessageType.COMMAND, "advance to checkpoint".getBytes(StandardCharsets.UTF_8), 42L, vector, 2,
        List.of(alpha, new NodeId("relay-é")));
    final byte[] bytes = PickleMessage.pickle(message);
    assertThat(bytes).hasSize(PickleMessage.instance.sizeOf(message));
    assertThat(PickleMessage.unpickle(ByteBuffer.wrap(bytes))).isEqualTo(message);
  }

  @Test
  public void instanceMethodsWriteIntoASharedBuffer() {
    final var alpha = new NodeId("alpha");
    final var first = new MeshMessage(UuidCreator.getTimeOrderedEpoch(), alpha, Optional.empty(), MessageType.ALERT,
        new byte[0], 1L, VectorClock.EMPTY, 0, List.of(alpha));
    final var second = first.arrivedAt(new NodeId("bravo"));
    final var buffer = ByteBuffer.allocate(PickleMessage.instance.sizeOf(first) + PickleMessage.instance.sizeOf(second));
    PickleMessage.instance.serialize(first, buffer);
    PickleMessage.instance.serialize(second, buffer);
    buffer.flip();
    assertThat(PickleMessage.instance.deserialize(buffer)).isEqualTo(first);
    assertThat(PickleMessage.instance.deserialize(buffer)).isEqualTo(second);
  }

  @Test
  public void anUnknownVersionIsRefused() {
    assertThatThrownBy(() -> PickleMessage.unpickle(ByteBuffer.wrap(new byte[]{9, 0, 0})))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
