// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NodeId;

import java.util.UUID;

/// The outcome of an attempt to send a submitted message.
public record DeliveryReport(NodeId node, long at, UUID messageId, Outcome outcome) implements MeshEvent {
  public enum Outcome {
    /// Handed to the authority or to a reachable peer.
    DELIVERED,
    /// The target was unreachable so the message waits in the outbound queue.
    QUEUED
  }
}
