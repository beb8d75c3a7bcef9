// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// Exponential backoff that doubles from an initial delay up to a cap.
///
/// @param initialMillis the delay after the first failure
/// @param maxMillis     the cap
public record Backoff(long initialMillis, long maxMillis) {
  public Backoff {
    if (initialMillis <= 0 || maxMillis < initialMillis) {
      throw new IllegalArgumentException("require 0 < initial <= max: " + initialMillis + ", " + maxMillis);
    }
  }

  /// @param failures the number of consecutive failures so far, at least one
  /// @return the delay before the next attempt
  public long delayAfter(int failures) {
    if (failures <= 1) {
      return initialMillis;
    }
    // shifting past 62 bits would overflow so clamp early
    final int shift = Math.min(failures - 1, 62);
    final long delay = initialMillis << shift;
    return delay <= 0 || delay > maxMillis || (delay >> shift) != initialMillis ? maxMillis : delay;
  }
}
