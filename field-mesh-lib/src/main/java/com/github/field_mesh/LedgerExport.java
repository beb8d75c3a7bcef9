// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/// The audit view of one block. It exposes the chain structure and the ids of the recorded messages but not their
/// payloads.
public record LedgerExport(
    long index,
    String prevHash,
    String payloadHash,
    String creator,
    long lamport,
    String signature,
    String hash,
    List<UUID> messageIds
) {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  public static LedgerExport of(LedgerBlock block) {
    return new LedgerExport(
        block.index(),
        block.prevHash(),
        block.payloadHash(),
        block.creator().id(),
        block.lamport(),
        HexFormat.of().formatHex(block.signature()),
        block.hash(),
        block.messages().stream().map(m -> m.id()).toList());
  }

  public static List<LedgerExport> of(List<LedgerBlock> chain) {
    return chain.stream().map(LedgerExport::of).toList();
  }

  /// Render an ordered export as a JSON array.
  public static String toJson(List<LedgerExport> export) {
    try {
      return MAPPER.writeValueAsString(export);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize ledger export", e);
    }
  }

  public static List<LedgerExport> fromJson(String json) {
    try {
      return List.of(MAPPER.readValue(json, LedgerExport[].class));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to parse ledger export", e);
    }
  }
}
