// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// A transient failure to reach a peer or the authority. Callers retry with backoff.
public class PeerUnreachableException extends Exception {
  private final NodeId peer;

  public PeerUnreachableException(NodeId peer, String message) {
    super(message);
    this.peer = peer;
  }

  public NodeId peer() {
    return peer;
  }
}
