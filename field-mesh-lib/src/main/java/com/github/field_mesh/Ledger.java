// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MeshMessage;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.logging.Level;

import static com.github.field_mesh.MeshLogger.LOGGER;

/// The append only, hash linked ledger of one node. It owns all hashing and linking behind three operations:
/// [#append(List)], [#validate(List)] and [#diff(List, List)].
///
/// Appends are serialized by a fair mutex so that two concurrent writers can never produce two blocks at the same
/// index. Readers see immutable snapshots of the chain and never block.
///
/// Blocks are never mutated or deleted. [#adopt(List, String)] replaces the live chain with a canonical chain
/// produced by reconciliation and keeps the replaced blocks flagged as superseded.
public class Ledger {

  private final NodeId owner;
  private final ClockService clock;
  private final BlockSigner signer;
  private final BlockStore store;

  /// The Semaphore acts as a mutex with:
  /// - Non-reentrant locking
  /// - Fair queuing of threads
  private final Semaphore mutex = new Semaphore(1, true);

  /// Immutable snapshot replaced under the mutex.
  private volatile List<LedgerBlock> chain;

  /// Open a ledger over a store. An empty store is initialised with the fleet genesis block. A non-empty store is
  /// validated and must start with the same genesis block.
  ///
  /// @throws LedgerIntegrityException if the stored chain is invalid or belongs to another fleet
  public Ledger(NodeId owner, ClockService clock, BlockSigner signer, BlockStore store, LedgerBlock genesis) {
    this.owner = owner;
    this.clock = clock;
    this.signer = signer;
    this.store = store;
    if (store.size() == 0) {
      store.write(genesis);
      store.sync();
    }
    final List<LedgerBlock> loaded = new ArrayList<>();
    for (long i = 0; i < store.size(); i++) {
      final long index = i;
      loaded.add(store.read(i).orElseThrow(() -> new LedgerIntegrityException(index, "missing block in store")));
    }
    final var validation = validate(loaded);
    if (!validation.valid()) {
      LOGGER.severe(ErrorStrings.INTEGRITY + owner + " refusing to open stored chain: " + validation);
      validation.orThrow();
    }
    if (!loaded.get(0).hash().equals(genesis.hash())) {
      LOGGER.severe(ErrorStrings.INTEGRITY + owner + " stored chain has a foreign genesis block");
      throw new LedgerIntegrityException(0, "stored genesis " + loaded.get(0) + " does not match " + genesis);
    }
    this.chain = Collections.unmodifiableList(loaded);
    final long highestLamport = loaded.stream().mapToLong(LedgerBlock::lamport).max().orElse(0L);
    if (highestLamport > clock.current().lamport()) {
      clock.merge(new Timestamp(highestLamport, VectorClock.EMPTY));
    }
    LOGGER.fine(() -> owner + " opened ledger with " + loaded.size() + " blocks");
  }

  public NodeId owner() {
    return owner;
  }

  /// Append a block recording the messages at the next index.
  public LedgerBlock append(List<MeshMessage> messages) {
    lock();
    try {
      return appendUnderMutex(chain.size(), messages);
    } finally {
      mutex.release();
    }
  }

  /// Append at an index the caller expects to be next. This is the compare-and-append used by writers that computed
  /// something from a snapshot of the chain.
  ///
  /// @throws LedgerIntegrityException if another writer already claimed `expectedIndex`
  public LedgerBlock append(long expectedIndex, List<MeshMessage> messages) {
    lock();
    try {
      if (expectedIndex != chain.size()) {
        LOGGER.warning(() -> owner + " refusing append at index " + expectedIndex + " as the next index is " + chain.size());
        throw new LedgerIntegrityException(expectedIndex, "index already claimed, next free index is " + chain.size());
      }
      return appendUnderMutex(expectedIndex, messages);
    } finally {
      mutex.release();
    }
  }

  private LedgerBlock appendUnderMutex(long index, List<MeshMessage> messages) {
    final var tail = chain.get(chain.size() - 1);
    final var stamp = clock.stamp();
    final var payloadHash = BlockHashing.payloadHash(messages);
    final var signature = signer.sign(BlockHashing.signedContent(payloadHash, owner, stamp.lamport()));
    final var block = BlockHashing.seal(index, tail.hash(), payloadHash, owner, stamp.lamport(), signature, messages);
    try {
      store.write(block);
      store.sync();
    } catch (RuntimeException e) {
      LOGGER.log(Level.SEVERE, owner + " failed to store block " + block + ": " + e, e);
      throw e;
    }
    final var next = new ArrayList<>(chain);
    next.add(block);
    chain = Collections.unmodifiableList(next);
    LOGGER.fine(() -> owner + " appended " + block);
    return block;
  }

  /// Replace the live chain with a canonical chain produced by reconciliation. The swap only happens if the live tail
  /// is still the one the caller based the merge on; otherwise the caller must reconcile again.
  ///
  /// @param canonical        the canonical chain, which must be valid and share our genesis block
  /// @param expectedTailHash the hash of our tail when the merge was computed
  /// @return false if our chain moved on since the merge was computed
  /// @throws LedgerIntegrityException if the canonical chain is invalid
  public boolean adopt(List<LedgerBlock> canonical, String expectedTailHash) {
    validate(canonical, signer).orThrow();
    lock();
    try {
      final var current = chain;
      if (!current.get(current.size() - 1).hash().equals(expectedTailHash)) {
        LOGGER.info(() -> owner + " not adopting canonical chain as the local tail moved since the merge");
        return false;
      }
      if (!current.get(0).hash().equals(canonical.get(0).hash())) {
        throw new LedgerIntegrityException(0, "canonical chain has a foreign genesis block");
      }
      final var fork = diff(current, canonical);
      if (fork.isEmpty() && canonical.size() <= current.size()) {
        return true;
      }
      final int from = (int) fork.orElse(current.size());
      final Set<String> canonicalHashes = new HashSet<>();
      canonical.forEach(b -> canonicalHashes.add(b.hash()));
      final List<LedgerBlock> superseded = current.subList(from, current.size()).stream()
          .filter(b -> !canonicalHashes.contains(b.hash()))
          .toList();
      final var replacement = canonical.subList(from, canonical.size());
      store.replace(from, replacement, superseded);
      store.sync();
      chain = List.copyOf(canonical);
      final long highestLamport = canonical.stream().mapToLong(LedgerBlock::lamport).max().orElse(0L);
      clock.merge(new Timestamp(highestLamport, VectorClock.EMPTY));
      LOGGER.info(() -> owner + " adopted canonical chain of " + canonical.size() + " blocks from index " + from
          + " superseding " + superseded.size() + " blocks");
      return true;
    } finally {
      mutex.release();
    }
  }

  /// @return an immutable snapshot of the live chain.
  public List<LedgerBlock> chain() {
    return chain;
  }

  public LedgerBlock tail() {
    final var snapshot = chain;
    return snapshot.get(snapshot.size() - 1);
  }

  public int size() {
    return chain.size();
  }

  public boolean containsMessage(UUID messageId) {
    return chain.stream().anyMatch(b -> b.messageIds().contains(messageId));
  }

  /// @return the ids of every message recorded by the live chain.
  public Set<UUID> messageIds() {
    return messageIdsOf(chain);
  }

  public static Set<UUID> messageIdsOf(List<LedgerBlock> blocks) {
    final Set<UUID> ids = new HashSet<>();
    blocks.forEach(b -> ids.addAll(b.messageIds()));
    return ids;
  }

  /// @return blocks that reconciliation moved out of the live chain, kept as audit evidence.
  public List<LedgerBlock> supersededBlocks() {
    return store.superseded();
  }

  public List<LedgerExport> export() {
    return LedgerExport.of(chain);
  }

  /// Recomputes every payload hash, block hash and link. Signatures are not checked.
  public static ChainValidation validate(List<LedgerBlock> chain) {
    return validate(chain, BlockSigner.UNSIGNED);
  }

  /// Recomputes every payload hash, block hash and link and verifies every signature after genesis. Stops at the
  /// first mismatch.
  public static ChainValidation validate(List<LedgerBlock> chain, BlockSigner signer) {
    if (chain.isEmpty()) {
      return ChainValidation.invalid(0, "empty chain has no genesis block");
    }
    for (int i = 0; i < chain.size(); i++) {
      final var block = chain.get(i);
      if (block.index() != i) {
        return ChainValidation.invalid(i, "index " + block.index() + " out of sequence");
      }
      final var expectedPrev = i == 0 ? BlockHashing.GENESIS_PREV_HASH : chain.get(i - 1).hash();
      if (!block.prevHash().equals(expectedPrev)) {
        return ChainValidation.invalid(i, "previous hash does not link to the prior block");
      }
      if (!block.payloadHash().equals(BlockHashing.payloadHash(block.messages()))) {
        return ChainValidation.invalid(i, "payload hash does not match the messages");
      }
      final var recomputed = BlockHashing.blockHash(block.index(), block.prevHash(), block.payloadHash(),
          block.creator(), block.lamport(), block.signature());
      if (!block.hash().equals(recomputed)) {
        return ChainValidation.invalid(i, "block hash does not match the block content");
      }
      if (i > 0 && !signer.verify(block.creator(),
          BlockHashing.signedContent(block.payloadHash(), block.creator(), block.lamport()), block.signature())) {
        return ChainValidation.invalid(i, "signature of " + block.creator() + " does not verify");
      }
    }
    return ChainValidation.VALID;
  }

  /// The lowest index at which the two chains disagree on hash.
  ///
  /// @return empty if one chain is a prefix of the other.
  public static OptionalLong diff(List<LedgerBlock> a, List<LedgerBlock> b) {
    final int common = Math.min(a.size(), b.size());
    if (common == 0) {
      return OptionalLong.empty();
    }
    // equal tips at the shorter length mean the hash links make the whole prefix equal
    if (a.get(common - 1).hash().equals(b.get(common - 1).hash())) {
      return OptionalLong.empty();
    }
    // walk back from the tips to the last block both chains agree on
    int i = common - 1;
    while (i >= 0 && !a.get(i).hash().equals(b.get(i).hash())) {
      i--;
    }
    return OptionalLong.of(i + 1);
  }

  private void lock() {
    try {
      mutex.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warning(owner + " ledger was interrupted waiting for the append mutex probably to shutdown.");
      throw new IllegalStateException("interrupted waiting for the ledger mutex", e);
    }
  }

  @TestOnly
  BlockStore store() {
    return store;
  }
}
