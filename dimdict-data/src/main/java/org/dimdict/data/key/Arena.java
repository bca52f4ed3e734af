/**
 * dimdict: Dimension Dictionary.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of dimdict.
 *
 * dimdict is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.dimdict.data.key;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only allocator for variable length byte data (keys of complex-key dictionaries and values of string
 * attributes).
 * 
 * <p>
 * Data is copied into chunks of growing size, each copy is identified by a {@link ByteSpan} pointing into one of the
 * chunks. Single copies are never freed, the whole arena is dropped at once when its owner is dropped.
 * 
 * <p>
 * This class is not thread safe. Each shard of a dictionary has its own arena, which is written by the single thread
 * loading that shard only.
 *
 * @author Bastian Gloeckle
 */
public class Arena {
  public static final int DEFAULT_INITIAL_CHUNK_SIZE = 4096;

  public static final int MAX_CHUNK_SIZE = 1 << 20;

  private final List<byte[]> chunks = new ArrayList<>();
  private byte[] currentChunk;
  private int position;
  private int nextChunkSize;
  private long bytesAllocated = 0;
  private long bytesUsed = 0;

  public Arena() {
    this(DEFAULT_INITIAL_CHUNK_SIZE);
  }

  public Arena(int initialChunkSize) {
    if (initialChunkSize <= 0)
      throw new IllegalArgumentException("Initial chunk size must be positive: " + initialChunkSize);
    this.nextChunkSize = initialChunkSize;
  }

  /**
   * Copy the given span into this arena.
   * 
   * @return A span with the same content pointing into this arena.
   */
  public ByteSpan copyOf(ByteSpan span) {
    return copyOf(span.getBuffer(), span.getOffset(), span.length());
  }

  /**
   * Copy the given bytes into this arena.
   * 
   * @return A span pointing to the copied data.
   */
  public ByteSpan copyOf(byte[] src, int srcOffset, int length) {
    if (currentChunk == null || currentChunk.length - position < length)
      addChunk(length);

    System.arraycopy(src, srcOffset, currentChunk, position, length);
    ByteSpan res = new ByteSpan(currentChunk, position, length);
    position += length;
    bytesUsed += length;
    return res;
  }

  private void addChunk(int minSize) {
    int size = Math.max(minSize, nextChunkSize);
    currentChunk = new byte[size];
    chunks.add(currentChunk);
    position = 0;
    bytesAllocated += size;
    nextChunkSize = Math.min(MAX_CHUNK_SIZE, nextChunkSize * 2);
  }

  /**
   * @return Number of bytes of all chunks allocated by this arena.
   */
  public long getBytesAllocated() {
    return bytesAllocated;
  }

  /**
   * @return Number of bytes actually occupied by copies.
   */
  public long getBytesUsed() {
    return bytesUsed;
  }

  public int getNumberOfChunks() {
    return chunks.size();
  }
}
