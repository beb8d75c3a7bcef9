// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.network;

import com.github.field_mesh.NodeId;

/// A directed observation that `from` can currently reach `to`. It is owned by the router of `from` only.
///
/// @param quality  link quality in `[0,1]`, for example a normalised signal strength
/// @param lastSeen the time in millis the peer was last heard from
public record PeerLink(NodeId from, NodeId to, double quality, long lastSeen) {
  public PeerLink {
    if (quality < 0.0 || quality > 1.0) {
      throw new IllegalArgumentException("quality must be in [0,1]: " + quality);
    }
  }

  public boolean isLive(long now, long timeoutMillis) {
    return now - lastSeen <= timeoutMillis;
  }

  public PeerLink observed(double newQuality, long now) {
    return new PeerLink(from, to, newQuality, Math.max(lastSeen, now));
  }

  public PeerLink heard(long now) {
    return observed(quality, now);
  }
}
