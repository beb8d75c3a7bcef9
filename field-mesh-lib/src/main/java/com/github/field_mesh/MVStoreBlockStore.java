// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// A [BlockStore] on an H2 MVStore. Pass `MVStore.open(null)` for an in-memory store or a file backed store for
/// crash durability. Blocks are kept pickled so the stored bytes never depend on Java serialization.
public class MVStoreBlockStore implements BlockStore {
  private final MVStore store;
  private final MVMap<Long, byte[]> blocks;
  private final MVMap<Long, byte[]> superseded;

  public MVStoreBlockStore(MVStore store, NodeId owner) {
    this.store = store;
    this.blocks = store.openMap("com.github.field_mesh#blocks#" + owner.id());
    this.superseded = store.openMap("com.github.field_mesh#superseded#" + owner.id());
  }

  @Override
  public void write(LedgerBlock block) {
    final var pickled = pickle(block);
    final var prior = blocks.putIfAbsent(block.index(), pickled);
    if (prior != null) {
      throw new LedgerIntegrityException(block.index(), "a block is already stored at this index");
    }
  }

  @Override
  public Optional<LedgerBlock> read(long index) {
    return Optional.ofNullable(blocks.get(index)).map(MVStoreBlockStore::unpickle);
  }

  @Override
  public long size() {
    return blocks.isEmpty() ? 0 : blocks.lastKey() + 1;
  }

  @Override
  public void replace(long fromIndex, List<LedgerBlock> replacement, List<LedgerBlock> supersededBlocks) {
    long next = superseded.isEmpty() ? 0 : superseded.lastKey() + 1;
    for (LedgerBlock block : supersededBlocks) {
      superseded.put(next++, pickle(block));
    }
    final var last = blocks.isEmpty() ? -1 : blocks.lastKey();
    for (long i = fromIndex; i <= last; i++) {
      blocks.remove(i);
    }
    for (LedgerBlock block : replacement) {
      blocks.put(block.index(), pickle(block));
    }
  }

  @Override
  public List<LedgerBlock> superseded() {
    final List<LedgerBlock> result = new ArrayList<>(superseded.size());
    superseded.values().forEach(bytes -> result.add(unpickle(bytes)));
    return result;
  }

  @Override
  public void sync() {
    store.commit();
  }

  private static byte[] pickle(LedgerBlock block) {
    try {
      return Pickle.writeBlock(block);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static LedgerBlock unpickle(byte[] bytes) {
    try {
      return Pickle.readBlock(bytes);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
