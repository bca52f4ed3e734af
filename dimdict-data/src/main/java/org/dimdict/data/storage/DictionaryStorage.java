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

import org.dimdict.data.block.Block;
import org.dimdict.data.container.HashTableBackend;
import org.dimdict.data.key.Arena;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.key.KeysExtractor;
import org.dimdict.data.structure.DictionaryAttribute;
import org.dimdict.data.structure.DictionaryStructure;

/**
 * All data of a hashed dictionary: one {@link AttributeStore} per attribute (or one {@link NoAttributesStore} if the
 * dictionary has no attributes) and one {@link Arena} per shard.
 * 
 * <p>
 * A key is always stored in the same shard in all attribute stores, which shard is defined by
 * {@link KeyShape#getShard(Object, int)}.
 * 
 * <p>
 * As with {@link AttributeStore}, each shard may only be written by one thread at a time.
 *
 * @param <K>
 *          Java type of the keys.
 * @author Bastian Gloeckle
 */
public class DictionaryStorage<K> {
  private final DictionaryStructure structure;
  private final KeyShape<K> keyShape;
  private final HashTableBackend backend;
  private final int shards;
  private final List<AttributeStore<K>> attributeStores;
  /** <code>null</code> if there is at least one attribute */
  private final NoAttributesStore<K> noAttributesStore;
  private final Arena[] arenas;

  public DictionaryStorage(DictionaryStructure structure, KeyShape<K> keyShape, HashTableBackend backend,
      int shards, int expectedSizePerShard) {
    if (shards < 1)
      throw new IllegalArgumentException("Number of shards must be at least 1, but was " + shards);
    if (keyShape.getKeyType() != structure.getKeyType())
      throw new IllegalArgumentException(
          "Key shape " + keyShape + " does not match key type " + structure.getKeyType());

    this.structure = structure;
    this.keyShape = keyShape;
    this.backend = backend;
    this.shards = shards;

    List<AttributeStore<K>> stores = new ArrayList<>();
    for (DictionaryAttribute attr : structure.getAttributes())
      stores.add(new AttributeStore<>(attr, keyShape, backend, shards, expectedSizePerShard));
    this.attributeStores = Collections.unmodifiableList(stores);

    if (stores.isEmpty())
      noAttributesStore = new NoAttributesStore<>(keyShape, backend, shards, expectedSizePerShard);
    else
      noAttributesStore = null;

    arenas = new Arena[shards];
    for (int i = 0; i < shards; i++)
      arenas[i] = new Arena();
  }

  public DictionaryStructure getStructure() {
    return structure;
  }

  public KeyShape<K> getKeyShape() {
    return keyShape;
  }

  public HashTableBackend getBackend() {
    return backend;
  }

  public int getNumberOfShards() {
    return shards;
  }

  public int getShard(K key) {
    return keyShape.getShard(key, shards);
  }

  public AttributeStore<K> getAttributeStore(int attributeIdx) {
    return attributeStores.get(attributeIdx);
  }

  public List<AttributeStore<K>> getAttributeStores() {
    return attributeStores;
  }

  /**
   * Finds the columns of a block that hold the values of the attributes of this dictionary.
   * 
   * @return One array per attribute, in the order of {@link DictionaryStructure#getAttributes()}.
   * @throws IllegalArgumentException
   *           If the block misses a column.
   */
  public List<Object[]> findAttributeColumns(Block block) throws IllegalArgumentException {
    List<Object[]> res = new ArrayList<>(attributeStores.size());
    for (DictionaryAttribute attr : structure.getAttributes())
      res.add(block.getColumn(attr.getName()));
    return res;
  }

  /**
   * Finds the key columns of a block and creates a {@link KeysExtractor} for them.
   * 
   * @throws IllegalArgumentException
   *           If the block misses a key column.
   */
  public KeysExtractor<K> extractKeys(Block block) throws IllegalArgumentException {
    List<Object[]> keyColumns = new ArrayList<>();
    for (DictionaryAttribute keyAttr : structure.getKeyAttributes())
      keyColumns.add(block.getColumn(keyAttr.getName()));
    return keyShape.newExtractor(structure.getKeyAttributes(), keyColumns);
  }

  /**
   * Insert rows of a block into a shard. Keys that are already contained get their values overwritten.
   * 
   * @param shard
   *          The shard all the given rows belong to.
   * @param attributeColumns
   *          see {@link #findAttributeColumns(Block)}.
   * @param keys
   *          Provides the keys of the rows.
   * @param rows
   *          The indices of the rows to insert, <code>null</code> for all rows.
   * @return Number of keys that were not contained before.
   */
  public int insertRows(int shard, List<Object[]> attributeColumns, KeysExtractor<K> keys, int[] rows) {
    int numberOfRows = (rows == null) ? keys.getNumberOfRows() : rows.length;
    Arena arena = arenas[shard];
    int newKeys = 0;

    for (int i = 0; i < numberOfRows; i++) {
      int row = (rows == null) ? i : rows[i];
      K key = keys.getKey(row);

      if (noAttributesStore != null) {
        if (!noAttributesStore.contains(shard, key)) {
          noAttributesStore.insert(shard, keyShape.copyToArena(key, arena));
          newKeys++;
        }
        continue;
      }

      K storedKey = attributeStores.get(0).getStoredKey(shard, key);
      if (storedKey == null) {
        key = keyShape.copyToArena(key, arena);
        newKeys++;
      } else
        key = storedKey;

      for (int attrIdx = 0; attrIdx < attributeStores.size(); attrIdx++) {
        AttributeStore<K> store = attributeStores.get(attrIdx);
        Object value = store.getAttribute().getType().normalize(attributeColumns.get(attrIdx)[row]);
        store.insert(shard, key, value, arena);
      }
    }
    return newKeys;
  }

  /**
   * Insert all rows of a block, each into its own shard.
   * 
   * @return Number of keys that were not contained before.
   */
  public int insertBlock(Block block) {
    KeysExtractor<K> keys = extractKeys(block);
    List<Object[]> attributeColumns = findAttributeColumns(block);
    int newKeys = 0;
    for (int row = 0; row < keys.getNumberOfRows(); row++)
      newKeys += insertRows(getShard(keys.getKey(row)), attributeColumns, keys, new int[] { row });
    return newKeys;
  }

  public boolean contains(K key) {
    int shard = getShard(key);
    if (noAttributesStore != null)
      return noAttributesStore.contains(shard, key);
    return attributeStores.get(0).contains(shard, key);
  }

  /**
   * @return Number of keys stored in the given shard.
   */
  public int size(int shard) {
    if (noAttributesStore != null)
      return noAttributesStore.size(shard);
    return attributeStores.get(0).size(shard);
  }

  /**
   * @return Number of keys stored in all shards.
   */
  public long size() {
    long res = 0;
    for (int shard = 0; shard < shards; shard++)
      res += size(shard);
    return res;
  }

  /**
   * @return Iterator over all keys of the given shard.
   */
  public Iterator<K> keyIterator(int shard) {
    if (noAttributesStore != null)
      return noAttributesStore.keyIterator(shard);
    return attributeStores.get(0).getContainer(shard).keyIterator();
  }

  /**
   * Make sure the given shard can hold the given number of keys without rehashing.
   */
  public void reserve(int shard, int expectedSize) {
    if (noAttributesStore != null)
      noAttributesStore.reserve(shard, expectedSize);
    for (AttributeStore<K> store : attributeStores)
      store.reserve(shard, expectedSize);
  }

  /**
   * Shrink all tables to their content, if the backend wants that after a load.
   */
  public void trimIfNeeded() {
    if (!backend.isTrimAfterLoad())
      return;
    if (noAttributesStore != null)
      noAttributesStore.trim();
    for (AttributeStore<K> store : attributeStores)
      store.trim();
  }

  /**
   * @return Number of buckets of the tables that hold the keys, summed over all shards. Each attribute has tables of
   *         the same size, so this counts the tables of one attribute only.
   */
  public long getBucketCount() {
    if (noAttributesStore != null)
      return noAttributesStore.getBucketCount();
    return attributeStores.get(0).getBucketCount();
  }

  /**
   * @return Estimated number of bytes held by all tables and arenas.
   */
  public long getBytesAllocated() {
    long res = 0;
    if (noAttributesStore != null)
      res += noAttributesStore.getBytesAllocated();
    for (AttributeStore<K> store : attributeStores)
      res += store.getBytesAllocated();
    for (Arena arena : arenas)
      res += arena.getBytesAllocated();
    return res;
  }
}
