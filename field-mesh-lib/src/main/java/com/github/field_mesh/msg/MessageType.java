// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.msg;

/// The declared type of an application message. The type fixes the outbound queue priority; a higher
/// [#priority()] is retried first.
public enum MessageType {
  CHAT((byte) 1, 0),
  STATUS((byte) 2, 1),
  COMMAND((byte) 3, 2),
  ALERT((byte) 4, 3);

  private final byte code;
  private final int priority;

  MessageType(byte code, int priority) {
    this.code = code;
    this.priority = priority;
  }

  public byte code() {
    return code;
  }

  public int priority() {
    return priority;
  }

  public static MessageType fromCode(byte code) {
    for (MessageType t : values()) {
      if (t.code == code) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown message type code: " + code);
  }
}
