// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

/// The opaque signing capability of a node. The ledger never looks inside signatures; key management and the
/// algorithm belong to the host application.
public interface BlockSigner {

  /// Signs content on behalf of the local node.
  byte[] sign(byte[] content);

  /// Checks a signature made by `creator`.
  boolean verify(NodeId creator, byte[] content, byte[] signature);

  /// For fleets that rely on transport security alone. Produces empty signatures and accepts any signature.
  BlockSigner UNSIGNED = new BlockSigner() {
    @Override
    public byte[] sign(byte[] content) {
      return new byte[0];
    }

    @Override
    public boolean verify(NodeId creator, byte[] content, byte[] signature) {
      return true;
    }
  };
}
