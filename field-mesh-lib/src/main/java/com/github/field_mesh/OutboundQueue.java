// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MessageType;
import com.github.field_mesh.msg.MeshMessage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// Messages that could not be delivered yet. Entries are retried in priority order ALERT, COMMAND, STATUS then CHAT
/// and first in first out within a priority. Each entry has its own backoff so that one unreachable target never
/// delays the retries of another. Entries past their deadline are removed by [#expire(long)] and must be reported.
public class OutboundQueue {

  /// One queued message.
  ///
  /// @param attempts      delivery attempts so far
  /// @param nextAttemptAt the earliest time of the next attempt
  /// @param deadline      the time after which the message is dropped
  public record Entry(MeshMessage message, long enqueuedAt, long deadline, int attempts, long nextAttemptAt) {
    public UUID id() {
      return message.id();
    }
  }

  private static final List<MessageType> RETRY_ORDER = List.of(MessageType.values()).stream()
      .sorted(Comparator.comparingInt(MessageType::priority).reversed())
      .toList();

  private final Backoff backoff;
  private final long expiryMillis;
  private final Map<MessageType, LinkedHashMap<UUID, Entry>> byType = new EnumMap<>(MessageType.class);

  public OutboundQueue(Backoff backoff, long expiryMillis) {
    this.backoff = backoff;
    this.expiryMillis = expiryMillis;
    for (MessageType t : MessageType.values()) {
      byType.put(t, new LinkedHashMap<>());
    }
  }

  /// Queue a message after a first failed attempt. A message already queued keeps its entry.
  ///
  /// @return false if the message was already queued
  public synchronized boolean enqueue(MeshMessage message, long now) {
    final var entries = byType.get(message.type());
    if (entries.containsKey(message.id())) {
      return false;
    }
    entries.put(message.id(), new Entry(message, now, now + expiryMillis, 1, now + backoff.delayAfter(1)));
    LOGGER.fine(() -> "queued " + message.id() + " " + message.type() + " until " + (now + expiryMillis));
    return true;
  }

  /// @return the entries due for a retry at `now` in retry order.
  public synchronized List<Entry> due(long now) {
    final List<Entry> due = new ArrayList<>();
    for (MessageType t : RETRY_ORDER) {
      for (Entry e : byType.get(t).values()) {
        if (e.nextAttemptAt() <= now && e.deadline() > now) {
          due.add(e);
        }
      }
    }
    return due;
  }

  /// Remove a delivered message.
  public synchronized boolean delivered(UUID id) {
    for (var entries : byType.values()) {
      if (entries.remove(id) != null) {
        return true;
      }
    }
    return false;
  }

  /// Record another failed attempt and push the next attempt back.
  public synchronized void failed(UUID id, long now) {
    for (var entries : byType.values()) {
      final var e = entries.get(id);
      if (e != null) {
        final int attempts = e.attempts() + 1;
        entries.put(id, new Entry(e.message(), e.enqueuedAt(), e.deadline(), attempts,
            now + backoff.delayAfter(attempts)));
        return;
      }
    }
  }

  /// Remove every entry whose deadline has passed.
  ///
  /// @return the removed entries in retry order
  public synchronized List<Entry> expire(long now) {
    final List<Entry> expired = new ArrayList<>();
    for (MessageType t : RETRY_ORDER) {
      final Iterator<Entry> it = byType.get(t).values().iterator();
      while (it.hasNext()) {
        final var e = it.next();
        if (e.deadline() <= now) {
          expired.add(e);
          it.remove();
        }
      }
    }
    return expired;
  }

  public synchronized boolean contains(UUID id) {
    return byType.values().stream().anyMatch(m -> m.containsKey(id));
  }

  public synchronized int size() {
    return byType.values().stream().mapToInt(Map::size).sum();
  }

  public boolean isEmpty() {
    return size() == 0;
  }
}
