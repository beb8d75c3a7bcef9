// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MessageType;
import org.junit.jupiter.api.Test;

import static com.github.field_mesh.Fixtures.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OutboundQueueTest {

  static final long NOW = 1_000_000L;
  final OutboundQueue queue = new OutboundQueue(new Backoff(1_000, 60_000), 600_000);

  @Test
  public void backoffDoublesUpToTheCap() {
    final var backoff = new Backoff(1_000, 60_000);
    assertThat(backoff.delayAfter(1)).isEqualTo(1_000);
    assertThat(backoff.delayAfter(2)).isEqualTo(2_000);
    assertThat(backoff.delayAfter(6)).isEqualTo(32_000);
    assertThat(backoff.delayAfter(7)).isEqualTo(60_000);
    assertThat(backoff.delayAfter(500)).isEqualTo(60_000);
    assertThatThrownBy(() -> new Backoff(0, 10)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void retriesInPriorityOrderThenFirstInFirstOut() {
    final var chat = message("alpha", MessageType.CHAT, 1, "chat");
    final var status = message("alpha", MessageType.STATUS, 2, "status");
    final var firstAlert = message("alpha", MessageType.ALERT, 3, "alert 1");
    final var command = message("alpha", MessageType.COMMAND, 4, "command");
    final var secondAlert = message("alpha", MessageType.ALERT, 5, "alert 2");
    queue.enqueue(chat, NOW);
    queue.enqueue(status, NOW);
    queue.enqueue(firstAlert, NOW);
    queue.enqueue(command, NOW);
    queue.enqueue(secondAlert, NOW);

    assertThat(queue.due(NOW)).isEmpty();
    assertThat(queue.due(NOW + 1_000)).extracting(OutboundQueue.Entry::message)
        .containsExactly(firstAlert, secondAlert, command, status, chat);
  }

  @Test
  public void eachEntryBacksOffOnItsOwn() {
    final var slow = message("alpha", MessageType.ALERT, 1, "slow");
    final var fresh = message("alpha", MessageType.CHAT, 2, "fresh");
    queue.enqueue(slow, NOW);
    queue.failed(slow.id(), NOW + 1_000);
    queue.failed(slow.id(), NOW + 3_000);
    queue.enqueue(fresh, NOW + 3_000);

    // slow waits 4s after its third failure while fresh waits 1s
    assertThat(queue.due(NOW + 4_000)).extracting(OutboundQueue.Entry::id).containsExactly(fresh.id());
    assertThat(queue.due(NOW + 7_000)).extracting(OutboundQueue.Entry::id).containsExactly(slow.id(), fresh.id());
    assertThat(queue.due(NOW + 7_000).get(0).attempts()).isEqualTo(3);
  }

  @Test
  public void resendsKeepTheMessageIdAndDuplicatesAreIgnored() {
    final var alert = message("alpha", MessageType.ALERT, 1, "alert");
    assertThat(queue.enqueue(alert, NOW)).isTrue();
    assertThat(queue.enqueue(alert, NOW + 10)).isFalse();
    assertThat(queue.size()).isEqualTo(1);
    assertThat(queue.due(NOW + 1_000).get(0).message().id()).isEqualTo(alert.id());
    assertThat(queue.delivered(alert.id())).isTrue();
    assertThat(queue.isEmpty()).isTrue();
    assertThat(queue.delivered(alert.id())).isFalse();
  }

  @Test
  public void expiredEntriesAreRemovedAndReturned() {
    final var old = message("alpha", MessageType.COMMAND, 1, "old");
    final var young = message("alpha", MessageType.CHAT, 2, "young");
    queue.enqueue(old, NOW);
    queue.enqueue(young, NOW + 300_000);
    assertThat(queue.expire(NOW + 599_999)).isEmpty();
    final var expired = queue.expire(NOW + 600_000);
    assertThat(expired).extracting(OutboundQueue.Entry::id).containsExactly(old.id());
    assertThat(queue.contains(old.id())).isFalse();
    assertThat(queue.contains(young.id())).isTrue();
    // an expired entry is never due
    assertThat(queue.due(NOW + 900_000)).isEmpty();
  }
}
