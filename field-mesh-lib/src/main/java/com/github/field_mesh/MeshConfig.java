// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import lombok.With;

import java.time.Duration;
import java.util.Properties;

/// Immutable configuration of a node agent. Start from [#DEFAULT] and use the withers to change settings or load
/// overrides from properties with [#fromProperties(Properties)].
///
/// @param fleetId           the fleet whose genesis block every ledger starts with
/// @param initialTtl        hops a new message may travel
/// @param heartbeatInterval the authority keepalive period
/// @param missedHeartbeats  beats missed before the authority is considered unreachable
/// @param peerTimeout       silence after which a peer is lost
/// @param minPeers          healthy peers needed to stay in P2P_FALLBACK rather than DEGRADED
/// @param minLinkQuality    the quality at or above which a live peer counts as healthy
/// @param backoffInitial    the first retry delay of a queued message
/// @param backoffMax        the retry delay cap
/// @param queueExpiry       how long a queued message may wait before it is dropped
/// @param dedupRetention    how long a seen message id is remembered
/// @param dedupMaxEntries   how many seen message ids are remembered
/// @param tickInterval      how often the scheduler drives the agent
@With
public record MeshConfig(
    String fleetId,
    int initialTtl,
    Duration heartbeatInterval,
    int missedHeartbeats,
    Duration peerTimeout,
    int minPeers,
    double minLinkQuality,
    Duration backoffInitial,
    Duration backoffMax,
    Duration queueExpiry,
    Duration dedupRetention,
    int dedupMaxEntries,
    Duration tickInterval
) {

  public static final String PREFIX = "field_mesh.";

  public static final MeshConfig DEFAULT = new MeshConfig(
      "default",               // fleetId
      3,                       // initialTtl
      Duration.ofSeconds(30),  // heartbeatInterval
      2,                       // missedHeartbeats
      Duration.ofSeconds(60),  // peerTimeout
      2,                       // minPeers
      0.3,                     // minLinkQuality
      Duration.ofSeconds(1),   // backoffInitial
      Duration.ofSeconds(60),  // backoffMax
      Duration.ofMinutes(10),  // queueExpiry
      Duration.ofMinutes(10),  // dedupRetention
      10_000,                  // dedupMaxEntries
      Duration.ofSeconds(1)    // tickInterval
  );

  public MeshConfig {
    if (fleetId == null || fleetId.isBlank()) throw new IllegalArgumentException("fleetId must be specified");
    if (initialTtl < 0) throw new IllegalArgumentException("initialTtl must not be negative: " + initialTtl);
    if (missedHeartbeats < 1) throw new IllegalArgumentException("missedHeartbeats must be positive");
    if (minPeers < 1) throw new IllegalArgumentException("minPeers must be positive");
    if (minLinkQuality < 0.0 || minLinkQuality > 1.0) {
      throw new IllegalArgumentException("minLinkQuality must be in [0,1]: " + minLinkQuality);
    }
    if (dedupMaxEntries < 1) throw new IllegalArgumentException("dedupMaxEntries must be positive");
  }

  /// The silence after which the authority is considered unreachable.
  public Duration authorityTimeout() {
    return heartbeatInterval.multipliedBy(missedHeartbeats);
  }

  public Backoff backoff() {
    return new Backoff(backoffInitial.toMillis(), backoffMax.toMillis());
  }

  /// Overrides settings from `field_mesh.*` keys. Durations are given in millis. Unknown keys are ignored.
  public MeshConfig withOverrides(Properties properties) {
    var c = this;
    for (String name : properties.stringPropertyNames()) {
      if (!name.startsWith(PREFIX)) {
        continue;
      }
      final var value = properties.getProperty(name).trim();
      try {
        c = switch (name.substring(PREFIX.length())) {
          case "fleet_id" -> c.withFleetId(value);
          case "initial_ttl" -> c.withInitialTtl(Integer.parseInt(value));
          case "heartbeat_interval_ms" -> c.withHeartbeatInterval(Duration.ofMillis(Long.parseLong(value)));
          case "missed_heartbeats" -> c.withMissedHeartbeats(Integer.parseInt(value));
          case "peer_timeout_ms" -> c.withPeerTimeout(Duration.ofMillis(Long.parseLong(value)));
          case "min_peers" -> c.withMinPeers(Integer.parseInt(value));
          case "min_link_quality" -> c.withMinLinkQuality(Double.parseDouble(value));
          case "backoff_initial_ms" -> c.withBackoffInitial(Duration.ofMillis(Long.parseLong(value)));
          case "backoff_max_ms" -> c.withBackoffMax(Duration.ofMillis(Long.parseLong(value)));
          case "queue_expiry_ms" -> c.withQueueExpiry(Duration.ofMillis(Long.parseLong(value)));
          case "dedup_retention_ms" -> c.withDedupRetention(Duration.ofMillis(Long.parseLong(value)));
          case "dedup_max_entries" -> c.withDedupMaxEntries(Integer.parseInt(value));
          case "tick_interval_ms" -> c.withTickInterval(Duration.ofMillis(Long.parseLong(value)));
          default -> c;
        };
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Bad value for " + name + ": " + value, e);
      }
    }
    return c;
  }

  /// The defaults overridden by properties.
  public static MeshConfig fromProperties(Properties properties) {
    return DEFAULT.withOverrides(properties);
  }
}
