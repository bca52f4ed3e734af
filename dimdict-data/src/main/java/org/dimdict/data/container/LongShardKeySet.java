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
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

/**
 * {@link ShardKeySet} for simple (long) keys.
 *
 * @author Bastian Gloeckle
 */
public class LongShardKeySet implements ShardKeySet<Long> {
  private final SizeAwareSet set;

  public LongShardKeySet(HashTableBackend backend, int expectedSize) {
    set = new SizeAwareSet(expectedSize, backend.getLoadFactor());
  }

  @Override
  public boolean add(Long key) {
    return set.add(key.longValue());
  }

  @Override
  public boolean remove(Long key) {
    return set.remove(key.longValue());
  }

  @Override
  public boolean contains(Long key) {
    return set.contains(key.longValue());
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
    return (set.getNumberOfBuckets() + 1L) * Long.BYTES;
  }

  @Override
  public Iterator<Long> iterator() {
    return set.iterator();
  }

  private static class SizeAwareSet extends LongOpenHashSet {
    private static final long serialVersionUID = 1L;

    SizeAwareSet(int expected, float f) {
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
