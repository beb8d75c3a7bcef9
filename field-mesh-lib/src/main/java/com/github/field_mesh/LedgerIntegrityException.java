// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// Thrown when a hash chain link, a payload hash or the single writer per index rule is violated. This is fatal to
/// the affected chain segment. It is never silently repaired as guessing at a resolution could mask tampering.
public class LedgerIntegrityException extends RuntimeException {
  private final long index;

  public LedgerIntegrityException(long index, String reason) {
    super(ErrorStrings.INTEGRITY + "index=" + index + " " + reason);
    this.index = index;
  }

  /// @return the index of the first offending block.
  public long index() {
    return index;
  }
}
