// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MeshMessage;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/// One block of a hash chained ledger. Blocks are immutable once appended. The only way to move a block to another
/// index is [#rebase(long, String)] during reconciliation which produces a new block and leaves the old one as audit
/// evidence.
///
/// @param index       the sequence index, monotonic within one chain
/// @param prevHash    the hash of the previous block or sixty four zeros for the genesis block
/// @param payloadHash the Merkle root over the messages in this block
/// @param creator     the node that appended the block
/// @param lamport     the creator's Lamport timestamp at append
/// @param signature   opaque signature over `(payloadHash, creator, lamport)`
/// @param messages    the messages recorded by this block
/// @param hash        the hash of this block which the next block links to
public record LedgerBlock(
    long index,
    String prevHash,
    String payloadHash,
    NodeId creator,
    long lamport,
    byte[] signature,
    List<MeshMessage> messages,
    String hash
) implements ClockService.Stamped {

  public LedgerBlock {
    Objects.requireNonNull(prevHash, "prevHash required");
    Objects.requireNonNull(payloadHash, "payloadHash required");
    Objects.requireNonNull(creator, "creator required");
    Objects.requireNonNull(signature, "signature required");
    Objects.requireNonNull(hash, "hash required");
    messages = List.copyOf(messages);
  }

  @Override
  public NodeId origin() {
    return creator;
  }

  public Set<UUID> messageIds() {
    return messages.stream().map(MeshMessage::id).collect(Collectors.toUnmodifiableSet());
  }

  /// The same content sealed at a different position of a chain. The signature stays valid as it does not cover the
  /// link.
  public LedgerBlock rebase(long newIndex, String newPrevHash) {
    return BlockHashing.seal(newIndex, newPrevHash, payloadHash, creator, lamport, signature, messages);
  }

  /// Two blocks carry the same content when payload, creator and Lamport timestamp match regardless of position.
  public boolean sameContent(LedgerBlock other) {
    return lamport == other.lamport
        && creator.equals(other.creator)
        && payloadHash.equals(other.payloadHash);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LedgerBlock other)) {
      return false;
    }
    return index == other.index
        && lamport == other.lamport
        && prevHash.equals(other.prevHash)
        && payloadHash.equals(other.payloadHash)
        && creator.equals(other.creator)
        && Arrays.equals(signature, other.signature)
        && messages.equals(other.messages)
        && hash.equals(other.hash);
  }

  @Override
  public int hashCode() {
    return hash.hashCode();
  }

  @Override
  public String toString() {
    return String.format("Block[#%d, by=%s, l=%d, msgs=%d, prev=%s, hash=%s, sig=%s]",
        index, creator, lamport, messages.size(), abbreviate(prevHash), abbreviate(hash),
        abbreviate(HexFormat.of().formatHex(signature)));
  }

  private static String abbreviate(String hex) {
    return hex.length() <= 12 ? hex : hex.substring(0, 12);
  }
}
