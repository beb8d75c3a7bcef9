// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// Log and exception texts that operators grep for.
public final class ErrorStrings {
  private ErrorStrings() {
  }

  public static final String INTEGRITY = "FATAL LEDGER INTEGRITY VIOLATION the affected chain segment must be "
      + "inspected by an operator and will not be repaired automatically: ";

  public static final String DIVERGENT = "DIVERGENT LEDGERS the chains share no common ancestor and need "
      + "administrative intervention: ";

  public static final String CLOSED = "This node agent has been closed and will not process any more messages.";
}
