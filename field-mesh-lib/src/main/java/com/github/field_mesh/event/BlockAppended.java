// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh.event;

import com.github.field_mesh.LedgerExport;
import com.github.field_mesh.NodeId;

/// A block was appended to the node's local ledger.
public record BlockAppended(NodeId node, long at, LedgerExport block) implements MeshEvent {
}
