// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MeshMessage;
import com.github.field_mesh.network.PickleMessage;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/// The single place that hashes and links ledger blocks. All digests are SHA-256 rendered as lower case hex.
public final class BlockHashing {
  private BlockHashing() {
  }

  /// The previous hash of a genesis block.
  public static final String GENESIS_PREV_HASH = "0".repeat(64);

  public static String sha256Hex(byte[] bytes) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
    } catch (NoSuchAlgorithmException e) {
      // every JRE must ship SHA-256
      throw new IllegalStateException(e);
    }
  }

  /// The Merkle root over the pickled messages. An odd node at any level is paired with itself and an empty block
  /// hashes the empty byte string.
  public static String payloadHash(List<MeshMessage> messages) {
    if (messages.isEmpty()) {
      return sha256Hex(new byte[0]);
    }
    List<String> level = new ArrayList<>(messages.size());
    for (MeshMessage m : messages) {
      level.add(sha256Hex(PickleMessage.pickle(m)));
    }
    while (level.size() > 1) {
      final List<String> next = new ArrayList<>((level.size() + 1) / 2);
      for (int i = 0; i < level.size(); i += 2) {
        final var left = level.get(i);
        final var right = i + 1 < level.size() ? level.get(i + 1) : left;
        next.add(sha256Hex((left + right).getBytes(StandardCharsets.US_ASCII)));
      }
      level = next;
    }
    return level.get(0);
  }

  /// The bytes a creator signs. The index and the previous hash are excluded so that a block can be rebased.
  public static byte[] signedContent(String payloadHash, NodeId creator, long lamport) {
    try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(bytes)) {
      dos.writeUTF(payloadHash);
      dos.writeUTF(creator.id());
      dos.writeLong(lamport);
      dos.flush();
      return bytes.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static String blockHash(long index, String prevHash, String payloadHash, NodeId creator, long lamport,
                                 byte[] signature) {
    try (ByteArrayOutputStream bytes = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(bytes)) {
      dos.writeLong(index);
      dos.writeUTF(prevHash);
      dos.writeUTF(payloadHash);
      dos.writeUTF(creator.id());
      dos.writeLong(lamport);
      dos.writeInt(signature.length);
      dos.write(signature);
      dos.flush();
      return sha256Hex(bytes.toByteArray());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /// Builds a block computing its own hash.
  public static LedgerBlock seal(long index, String prevHash, String payloadHash, NodeId creator, long lamport,
                                 byte[] signature, List<MeshMessage> messages) {
    final var hash = blockHash(index, prevHash, payloadHash, creator, lamport, signature);
    return new LedgerBlock(index, prevHash, payloadHash, creator, lamport, signature, messages, hash);
  }
}
