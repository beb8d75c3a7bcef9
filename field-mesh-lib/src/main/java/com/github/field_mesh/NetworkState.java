// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// The connectivity state of one node.
public enum NetworkState {
  /// The authority is reachable. Traffic goes through it.
  CENTRALIZED,
  /// The authority is unreachable and enough healthy peers are reachable to flood.
  P2P_FALLBACK,
  /// The authority is unreachable and only some peers are reachable or the links are poor.
  DEGRADED,
  /// Neither the authority nor any peer is reachable.
  ISOLATED;

  public boolean isOffline() {
    return this != CENTRALIZED;
  }
}
