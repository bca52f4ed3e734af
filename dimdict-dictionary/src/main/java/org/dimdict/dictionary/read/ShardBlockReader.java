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
package org.dimdict.dictionary.read;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.dimdict.data.block.Block;
import org.dimdict.data.storage.AttributeStore;
import org.dimdict.data.storage.DictionaryStorage;
import org.dimdict.data.structure.DictionaryAttribute;
import org.dimdict.data.structure.DictionaryStructure;
import org.dimdict.loader.BlockReader;

/**
 * Reads the content of some shards of a {@link DictionaryStorage} as {@link Block}s, one shard after the other.
 * 
 * <p>
 * The requested columns can be key columns and attributes. Complex keys are decoded back into the values of their key
 * columns. Null values of nullable attributes are returned as <code>null</code>.
 *
 * @author Bastian Gloeckle
 */
public class ShardBlockReader<K> implements BlockReader {
  private final DictionaryStorage<K> storage;
  private final List<String> columnNames;
  private final int maxBlockSize;
  private final Iterator<Integer> shardIt;

  /** index into the key columns for each requested column, -1 for attributes. */
  private final int[] keyColumnIdx;
  /** attribute store for each requested column, <code>null</code> for key columns. */
  private final List<AttributeStore<K>> attributeStores;
  private final boolean needsKeyValues;

  private int currentShard = -1;
  private Iterator<K> keyIt = Collections.emptyIterator();

  /**
   * @param shards
   *          The shards to read, in this order.
   * @throws IllegalArgumentException
   *           If a requested column does not exist.
   */
  public ShardBlockReader(DictionaryStorage<K> storage, List<String> columnNames, int maxBlockSize,
      List<Integer> shards) throws IllegalArgumentException {
    if (maxBlockSize < 1)
      throw new IllegalArgumentException("Max block size must be at least 1, but was " + maxBlockSize);
    this.storage = storage;
    this.columnNames = new ArrayList<>(columnNames);
    this.maxBlockSize = maxBlockSize;
    this.shardIt = new ArrayList<>(shards).iterator();

    DictionaryStructure structure = storage.getStructure();
    keyColumnIdx = new int[columnNames.size()];
    attributeStores = new ArrayList<>();
    boolean needsKeyValues = false;
    for (int col = 0; col < columnNames.size(); col++) {
      keyColumnIdx[col] = -1;
      for (int k = 0; k < structure.getKeyAttributes().size(); k++)
        if (structure.getKeyAttributes().get(k).getName().equals(columnNames.get(col)))
          keyColumnIdx[col] = k;

      if (keyColumnIdx[col] != -1) {
        attributeStores.add(null);
        needsKeyValues = true;
      } else
        attributeStores.add(storage.getAttributeStore(structure.getAttributeIndex(columnNames.get(col))));
    }
    this.needsKeyValues = needsKeyValues;
  }

  @Override
  public Block read() {
    List<K> keys = new ArrayList<>();
    List<Integer> keyShards = new ArrayList<>();
    while (keys.size() < maxBlockSize) {
      if (!keyIt.hasNext()) {
        if (!shardIt.hasNext())
          break;
        currentShard = shardIt.next();
        keyIt = storage.keyIterator(currentShard);
        continue;
      }
      keys.add(keyIt.next());
      keyShards.add(currentShard);
    }

    if (keys.isEmpty())
      return null;

    List<DictionaryAttribute> keyAttributes = storage.getStructure().getKeyAttributes();
    List<Object[]> columns = new ArrayList<>(columnNames.size());
    for (int col = 0; col < columnNames.size(); col++)
      columns.add(new Object[keys.size()]);

    for (int row = 0; row < keys.size(); row++) {
      K key = keys.get(row);
      int shard = keyShards.get(row);
      Object[] keyValues = needsKeyValues ? storage.getKeyShape().decode(key, keyAttributes) : null;
      for (int col = 0; col < columnNames.size(); col++) {
        if (keyColumnIdx[col] != -1)
          columns.get(col)[row] = keyValues[keyColumnIdx[col]];
        else {
          AttributeStore<K> store = attributeStores.get(col);
          columns.get(col)[row] = store.isNull(shard, key) ? null : store.getValue(shard, key);
        }
      }
    }
    return new Block(columnNames, columns);
  }

  @Override
  public void close() {
  }
}
