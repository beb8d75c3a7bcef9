// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// How one vector clock relates to another.
public enum Causality {
  BEFORE, AFTER, EQUAL, CONCURRENT
}
