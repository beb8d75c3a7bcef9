// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// A snapshot of a node's logical clocks.
///
/// @param lamport the scalar Lamport counter
/// @param vector  the vector clock at the same instant
public record Timestamp(long lamport, VectorClock vector) {

  public static final Timestamp ZERO = new Timestamp(0L, VectorClock.EMPTY);

  @Override
  public String toString() {
    return "T(l=" + lamport + "," + vector + ")";
  }
}
