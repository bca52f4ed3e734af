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
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenCustomHashMap;

/**
 * {@link ShardContainer} for complex ({@link ByteSpan}) keys, based on fastutils
 * {@link Object2ObjectOpenCustomHashMap} and {@link ByteSpanHashStrategy}.
 *
 * @author Bastian Gloeckle
 */
public class SpanShardContainer<V> implements ShardContainer<ByteSpan, V> {
  private final SizeAwareMap<V> map;

  public SpanShardContainer(HashTableBackend backend, int expectedSize) {
    map = new SizeAwareMap<>(expectedSize, backend.getLoadFactor());
  }

  @Override
  public V put(ByteSpan key, V value) {
    return map.put(key, value);
  }

  @Override
  public V get(ByteSpan key) {
    return map.get(key);
  }

  @Override
  public boolean containsKey(ByteSpan key) {
    return map.containsKey(key);
  }

  @Override
  public ByteSpan getStoredKey(ByteSpan key) {
    return map.getStoredKey(key);
  }

  @Override
  public int size() {
    return map.size();
  }

  @Override
  public int capacity() {
    return map.getNumberOfBuckets();
  }

  @Override
  public void reserve(int expectedSize) {
    map.reserve(expectedSize);
  }

  @Override
  public void trim() {
    map.trim();
  }

  @Override
  public long getBytesAllocated() {
    return (map.getNumberOfBuckets() + 1L) * 2 * ContainerSizes.REFERENCE_BYTES
        + map.size() * (long) ContainerSizes.BYTE_SPAN_OBJECT_BYTES;
  }

  @Override
  public Iterator<ByteSpan> keyIterator() {
    return map.keySet().iterator();
  }

  private static class SizeAwareMap<V> extends Object2ObjectOpenCustomHashMap<ByteSpan, V> {
    private static final long serialVersionUID = 1L;

    SizeAwareMap(int expected, float f) {
      super(expected, f, ByteSpanHashStrategy.INSTANCE);
    }

    int getNumberOfBuckets() {
      return n;
    }

    /**
     * Same probing as {@link #get(Object)}, but returns the key instance found in the table. Keys are never
     * <code>null</code>.
     */
    ByteSpan getStoredKey(ByteSpan k) {
      int pos = HashCommon.mix(strategy.hashCode(k)) & mask;
      ByteSpan curr = key[pos];
      while (curr != null) {
        if (strategy.equals(k, curr))
          return curr;
        pos = (pos + 1) & mask;
        curr = key[pos];
      }
      return null;
    }

    void reserve(int expected) {
      int needed = HashCommon.arraySize(expected, f);
      if (needed > n)
        rehash(needed);
    }
  }
}
