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
import java.util.List;

import org.dimdict.data.container.HashTableBackend;
import org.dimdict.data.container.ShardContainer;
import org.dimdict.data.container.ShardContainers;
import org.dimdict.data.container.ShardKeySet;
import org.dimdict.data.key.Arena;
import org.dimdict.data.key.ByteSpan;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.structure.DictionaryAttribute;

/**
 * The values of one attribute of a dictionary, split into shards.
 * 
 * <p>
 * Each shard has its own {@link ShardContainer}. If the attribute is nullable, each shard additionally has a
 * {@link ShardKeySet} containing the keys whose value is null. For those keys the container holds the null value of
 * the attribute, so every key of the dictionary is contained in the containers of all attributes.
 * 
 * <p>
 * Values of string attributes are stored as {@link ByteSpan}s in the arena of the shard and turned into Strings again
 * when read.
 * 
 * <p>
 * Writing to one shard must happen from one thread only, but different shards can be written concurrently. Reads are
 * safe as soon as no write happens anymore.
 *
 * @param <K>
 *          Java type of the keys.
 * @author Bastian Gloeckle
 */
public class AttributeStore<K> {
  private final DictionaryAttribute attribute;
  private final List<ShardContainer<K, Object>> containers;
  /** <code>null</code> if attribute is not nullable. */
  private final List<ShardKeySet<K>> nullKeys;
  private final Object storedNullValue;

  public AttributeStore(DictionaryAttribute attribute, KeyShape<K> keyShape, HashTableBackend backend, int shards,
      int expectedSizePerShard) {
    this.attribute = attribute;
    List<ShardContainer<K, Object>> containers = new ArrayList<>(shards);
    for (int i = 0; i < shards; i++)
      containers.add(ShardContainers.newContainer(keyShape, backend, expectedSizePerShard));
    this.containers = Collections.unmodifiableList(containers);

    if (attribute.isNullable()) {
      List<ShardKeySet<K>> nullKeys = new ArrayList<>(shards);
      for (int i = 0; i < shards; i++)
        nullKeys.add(ShardContainers.newKeySet(keyShape, backend, 0));
      this.nullKeys = Collections.unmodifiableList(nullKeys);
    } else
      this.nullKeys = null;

    if (attribute.getType().isArenaBacked())
      storedNullValue = ByteSpan.ofUtf8((String) attribute.getNullValue());
    else
      storedNullValue = attribute.getNullValue();
  }

  public DictionaryAttribute getAttribute() {
    return attribute;
  }

  /**
   * Insert or overwrite the value of a key.
   * 
   * @param key
   *          The key, already copied into the arena of the shard. For keys that are contained already this must be the
   *          instance returned by {@link #getStoredKey(int, Object)}, as it is kept in the null marker set.
   * @param value
   *          The value, normalized to the type of the attribute (see
   *          {@link org.dimdict.data.attribute.AttributeUnderlyingType#normalize(Object)}). <code>null</code> is
   *          allowed for nullable attributes and stores the null value of the attribute for non-nullable ones.
   * @param arena
   *          The arena of the shard.
   */
  public void insert(int shard, K key, Object value, Arena arena) {
    Object toStore;
    if (value == null)
      toStore = storedNullValue;
    else if (attribute.getType().isArenaBacked())
      toStore = arena.copyOf(ByteSpan.ofUtf8((String) value));
    else
      toStore = value;

    containers.get(shard).put(key, toStore);

    if (nullKeys != null) {
      if (value == null)
        markNull(shard, key);
      else
        nullKeys.get(shard).remove(key);
    }
  }

  /**
   * @return The value of the key, <code>null</code> if the key is not contained in the dictionary. For keys whose value
   *         is null, this returns the null value of the attribute, see {@link #isNull(int, Object)}.
   */
  public Object getValue(int shard, K key) {
    return materialize(containers.get(shard).get(key));
  }

  public boolean contains(int shard, K key) {
    return containers.get(shard).containsKey(key);
  }

  /**
   * @return The instance of the key held by this store (i.e. the copy in the arena of the shard), <code>null</code> if
   *         the key is not contained.
   */
  public K getStoredKey(int shard, K key) {
    return containers.get(shard).getStoredKey(key);
  }

  /**
   * Mark the value of the given key as null.
   * 
   * @throws IllegalStateException
   *           if the attribute is not nullable.
   */
  public void markNull(int shard, K key) throws IllegalStateException {
    if (nullKeys == null)
      throw new IllegalStateException("Attribute '" + attribute.getName() + "' is not nullable.");
    nullKeys.get(shard).add(key);
  }

  /**
   * @return <code>true</code> if the value of the key is null.
   */
  public boolean isNull(int shard, K key) {
    return nullKeys != null && nullKeys.get(shard).contains(key);
  }

  public boolean isNullable() {
    return nullKeys != null;
  }

  public ShardContainer<K, Object> getContainer(int shard) {
    return containers.get(shard);
  }

  public int size(int shard) {
    return containers.get(shard).size();
  }

  public int getNumberOfShards() {
    return containers.size();
  }

  public void reserve(int shard, int expectedSize) {
    containers.get(shard).reserve(expectedSize);
  }

  public void trim() {
    for (ShardContainer<K, Object> container : containers)
      container.trim();
    if (nullKeys != null)
      for (ShardKeySet<K> set : nullKeys)
        set.trim();
  }

  /**
   * @return Sum of the buckets of the containers of all shards.
   */
  public long getBucketCount() {
    long res = 0;
    for (ShardContainer<K, Object> container : containers)
      res += container.capacity();
    return res;
  }

  public long getBytesAllocated() {
    long res = 0;
    for (ShardContainer<K, Object> container : containers)
      res += container.getBytesAllocated();
    if (nullKeys != null)
      for (ShardKeySet<K> set : nullKeys)
        res += set.getBytesAllocated();
    return res;
  }

  private Object materialize(Object stored) {
    if (stored instanceof ByteSpan)
      return ((ByteSpan) stored).toUtf8String();
    return stored;
  }
}
