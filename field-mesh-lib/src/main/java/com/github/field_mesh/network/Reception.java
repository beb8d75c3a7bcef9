// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.network;

/// What a router did with an inbound message.
public enum Reception {
  /// Already seen so discarded silently.
  DUPLICATE,
  /// Processed locally; TTL exhausted so not re-flooded.
  ACCEPTED,
  /// Processed locally and re-flooded to peers not on the route.
  ACCEPTED_AND_FLOODED,
  /// The receiving agent is closed so nothing was processed.
  CLOSED
}
