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
package org.dimdict.data.container;

import java.util.Iterator;

import org.dimdict.data.key.ByteSpan;

import it.unimi.dsi.fastutil.HashCommon;
import it.unimi.dsi.fastutil.objects.ObjectOpenCustomHashSet;

/**
 * {@link ShardKeySet} for complex ({@link ByteSpan}) keys.
 *
 * @author Bastian Gloeckle
 */
public class SpanShardKeySet implements ShardKeySet<ByteSpan> {
  private final SizeAwareSet set;

  public SpanShardKeySet(HashTableBackend backend, int expectedSize) {
    set = new SizeAwareSet(expectedSize, backend.getLoadFactor());
  }

  @Override
  public boolean add(ByteSpan key) {
    return set.add(key);
  }

  @Override
  public boolean remove(ByteSpan key) {
    return set.remove(key);
  }

  @Override
  public boolean contains(ByteSpan key) {
    return set.contains(key);
  }

  @Override
  public int size() {
    return set.size();
  }

  @Override
  public int capacity() {
    return set.getNumberOfBuckets();
  }

  @Override
  public void reserve(int expectedSize) {
    set.reserve(expectedSize);
  }

  @Override
  public void trim() {
    set.trim();
  }

  @Override
  public long getBytesAllocated() {
    return (set.getNumberOfBuckets() + 1L) * ContainerSizes.REFERENCE_BYTES
        + set.size() * (long) ContainerSizes.BYTE_SPAN_OBJECT_BYTES;
  }

  @Override
  public Iterator<ByteSpan> iterator() {
    return set.iterator();
  }

  private static class SizeAwareSet extends ObjectOpenCustomHashSet<ByteSpan> {
    private static final long serialVersionUID = 1L;

    SizeAwareSet(int expected, float f) {
      super(expected, f, ByteSpanHashStrategy.INSTANCE);
    }

    int getNumberOfBuckets() {
      return n;
    }

    void reserve(int expected) {
      int needed = HashCommon.arraySize(expected, f);
      if (needed > n)
        rehash(needed);
    }
  }
}
