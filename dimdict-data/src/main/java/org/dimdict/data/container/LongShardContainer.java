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

import it.unimi.dsi.fastutil.HashCommon;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * {@link ShardContainer} for simple (long) keys, based on fastutils {@link Long2ObjectOpenHashMap}.
 *
 * @author Bastian Gloeckle
 */
public class LongShardContainer<V> implements ShardContainer<Long, V> {
  private final SizeAwareMap<V> map;

  public LongShardContainer(HashTableBackend backend, int expectedSize) {
    map = new SizeAwareMap<>(expectedSize, backend.getLoadFactor());
  }

  @Override
  public V put(Long key, V value) {
    return map.put(key.longValue(), value);
  }

  @Override
  public V get(Long key) {
    return map.get(key.longValue());
  }

  @Override
  public boolean containsKey(Long key) {
    return map.containsKey(key.longValue());
  }

  @Override
  public Long getStoredKey(Long key) {
    return map.containsKey(key.longValue()) ? key : null;
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
    // key array + value array, both with one additional slot for the 0 key.
    return (map.getNumberOfBuckets() + 1L) * (Long.BYTES + ContainerSizes.REFERENCE_BYTES);
  }

  @Override
  public Iterator<Long> keyIterator() {
    return map.keySet().iterator();
  }

  private static class SizeAwareMap<V> extends Long2ObjectOpenHashMap<V> {
    private static final long serialVersionUID = 1L;

    SizeAwareMap(int expected, float f) {
      super(expected, f);
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
