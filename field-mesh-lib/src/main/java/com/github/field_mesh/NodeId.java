// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// The identity of a node (a device in the field). The natural order of node ids is the system wide tie-break:
/// when two events carry equal Lamport timestamps the lower node id is ordered first.
public record NodeId(String id) implements Comparable<NodeId> {
  public NodeId {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Node ID must be non-blank");
    }
  }

  public static NodeId of(String id) {
    return new NodeId(id);
  }

  @Override
  public int compareTo(NodeId other) {
    return id.compareTo(other.id);
  }

  @Override
  public String toString() {
    return id;
  }
}
