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
package org.dimdict.data.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.dimdict.data.container.HashTableBackend;
import org.dimdict.data.container.ShardContainers;
import org.dimdict.data.container.ShardKeySet;
import org.dimdict.data.key.KeyShape;

/**
 * Sharded set of keys, used instead of {@link AttributeStore}s for dictionaries without any attributes. Such
 * dictionaries only answer whether a key exists.
 *
 * @author Bastian Gloeckle
 */
public class NoAttributesStore<K> {
  private final List<ShardKeySet<K>> sets;

  public NoAttributesStore(KeyShape<K> keyShape, HashTableBackend backend, int shards, int expectedSizePerShard) {
    List<ShardKeySet<K>> sets = new ArrayList<>(shards);
    for (int i = 0; i < shards; i++)
      sets.add(ShardContainers.newKeySet(keyShape, backend, expectedSizePerShard));
    this.sets = Collections.unmodifiableList(sets);
  }

  /**
   * @return <code>true</code> if the key was new.
   */
  public boolean insert(int shard, K key) {
    return sets.get(shard).add(key);
  }

  public boolean contains(int shard, K key) {
    return sets.get(shard).contains(key);
  }

  public int size(int shard) {
    return sets.get(shard).size();
  }

  public Iterator<K> keyIterator(int shard) {
    return sets.get(shard).iterator();
  }

  public void reserve(int shard, int expectedSize) {
    sets.get(shard).reserve(expectedSize);
  }

  public void trim() {
    for (ShardKeySet<K> set : sets)
      set.trim();
  }

  public long getBucketCount() {
    long res = 0;
    for (ShardKeySet<K> set : sets)
      res += set.capacity();
    return res;
  }

  public long getBytesAllocated() {
    long res = 0;
    for (ShardKeySet<K> set : sets)
      res += set.getBytesAllocated();
    return res;
  }
}
