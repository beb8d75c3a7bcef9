// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.field_mesh;

import com.github.field_mesh.msg.MeshMessage;
import com.github.field_mesh.network.PickleMessage;

import java.io.*;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/// Pickle is a utility class for serializing and deserializing the ledger blocks that the [BlockStore] keeps.
/// Java serialization is famously broken so this class does things the boilerplate way. Messages inside a block are
/// written with the wire format of [PickleMessage] so that a stored block holds exactly the bytes its payload hash
/// was computed over.
public class Pickle {

  public static byte[] writeBlock(LedgerBlock block) throws IOException {
    try (ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(byteArrayOutputStream)) {
      write(block, dos);
      dos.flush();
      return byteArrayOutputStream.toByteArray();
    }
  }

  public static void write(LedgerBlock block, DataOutputStream dos) throws IOException {
    dos.writeLong(block.index());
    dos.writeUTF(block.prevHash());
    dos.writeUTF(block.payloadHash());
    dos.writeUTF(block.creator().id());
    dos.writeLong(block.lamport());
    dos.writeInt(block.signature().length);
    dos.write(block.signature());
    dos.writeInt(block.messages().size());
    for (MeshMessage m : block.messages()) {
      final var bytes = PickleMessage.pickle(m);
      dos.writeInt(bytes.length);
      dos.write(bytes);
    }
    dos.writeUTF(block.hash());
  }

  public static LedgerBlock readBlock(byte[] pickled) throws IOException {
    try (ByteArrayInputStream bis = new ByteArrayInputStream(pickled);
         DataInputStream dis = new DataInputStream(bis)) {
      return readBlock(dis);
    }
  }

  public static LedgerBlock readBlock(DataInputStream dis) throws IOException {
    final long index = dis.readLong();
    final String prevHash = dis.readUTF();
    final String payloadHash = dis.readUTF();
    final NodeId creator = new NodeId(dis.readUTF());
    final long lamport = dis.readLong();
    final byte[] signature = new byte[dis.readInt()];
    dis.readFully(signature);
    final int count = dis.readInt();
    final List<MeshMessage> messages = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      final byte[] bytes = new byte[dis.readInt()];
      dis.readFully(bytes);
      messages.add(PickleMessage.unpickle(ByteBuffer.wrap(bytes)));
    }
    final String hash = dis.readUTF();
    return new LedgerBlock(index, prevHash, payloadHash, creator, lamport, signature, messages, hash);
  }
}
