// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// The outcome of [Ledger#validate(java.util.List)]. An invalid result names the first offending index.
///
/// @param valid          true if every block checked out
/// @param offendingIndex the first bad index else -1
/// @param reason         a human readable reason else empty
public record ChainValidation(boolean valid, long offendingIndex, String reason) {

  public static final ChainValidation VALID = new ChainValidation(true, -1L, "");

  public static ChainValidation invalid(long index, String reason) {
    return new ChainValidation(false, index, reason);
  }

  /// @throws LedgerIntegrityException if the chain was not valid
  public void orThrow() {
    if (!valid) {
      throw new LedgerIntegrityException(offendingIndex, reason);
    }
  }
}
