// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// Thrown by reconciliation when two chains do not share a common ancestor. There is no safe default merge so this
/// is surfaced to an operator rather than resolved.
public class DivergentLedgerException extends RuntimeException {
  public DivergentLedgerException(String detail) {
    super(ErrorStrings.DIVERGENT + detail);
  }
}
