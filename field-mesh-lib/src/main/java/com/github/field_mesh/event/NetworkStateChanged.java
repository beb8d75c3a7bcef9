// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.NetworkState;
import com.github.field_mesh.NodeId;

public record NetworkStateChanged(NodeId node, long at, NetworkState from, NetworkState to) implements MeshEvent {
}
