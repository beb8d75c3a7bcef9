// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import static com.github.field_mesh.NetworkState.*;

/// The pure transition function of a node's network state. The node agent feeds it observations and applies the
/// returned state. There is no terminal state.
///
/// Returning to CENTRALIZED is gated by reconciliation: while the authority is reachable but the node has not yet
/// reconciled, the function keeps the offline state and reports [Step#resyncRequired()] so the agent runs the
/// RESYNCING sub-phase.
public final class NetworkStateMachine {
  private NetworkStateMachine() {
  }

  /// What the node currently observes.
  ///
  /// @param authorityAlive a heartbeat arrived within `missedHeartbeats * heartbeatInterval`
  /// @param livePeers      peers heard from within the peer timeout
  /// @param healthyPeers   live peers whose link quality meets the configured minimum
  /// @param resynced       a reconciliation with the authority completed since it became reachable
  public record Observation(boolean authorityAlive, int livePeers, int healthyPeers, boolean resynced) {
  }

  /// @param next           the state to move to, which may be the current state
  /// @param resyncRequired the authority is back but reconciliation must finish before going CENTRALIZED
  public record Step(NetworkState next, boolean resyncRequired) {
  }

  public static Step next(NetworkState current, Observation o, int minPeers) {
    if (o.authorityAlive()) {
      if (current == CENTRALIZED || o.resynced()) {
        return new Step(CENTRALIZED, false);
      }
      return new Step(current, true);
    }
    if (o.livePeers() == 0) {
      return new Step(ISOLATED, false);
    }
    final var peerState = o.healthyPeers() >= minPeers ? P2P_FALLBACK : DEGRADED;
    return switch (current) {
      // losing the authority with at least one peer alive always falls back to P2P first
      case CENTRALIZED -> new Step(P2P_FALLBACK, false);
      case P2P_FALLBACK, DEGRADED, ISOLATED -> new Step(peerState, false);
    };
  }
}
