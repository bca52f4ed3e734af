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
package org.dimdict.dictionary.hierarchy;

import org.dimdict.data.storage.AttributeStore;
import org.dimdict.data.storage.DictionaryStorage;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

/**
 * Walks up the hierarchy of a dictionary by following the values of its hierarchical attribute, which holds the parent
 * of each key.
 * 
 * <p>
 * A key has no parent if it is not contained in the dictionary, if its parent value is null or equal to the null value
 * of the attribute, or if the parent is the key itself. A parent does not need to be a key of the dictionary itself,
 * such a parent simply has no parent.
 *
 * @author Bastian Gloeckle
 */
public class ParentChain {
  /** Maximum length of the chains returned by {@link #getHierarchy(long)}. */
  public static final int MAX_DEPTH = 1000;

  private final DictionaryStorage<Long> storage;
  private final AttributeStore<Long> parents;
  private final Object nullValue;

  public ParentChain(DictionaryStorage<Long> storage, int hierarchicalAttributeIdx) {
    this.storage = storage;
    this.parents = storage.getAttributeStore(hierarchicalAttributeIdx);
    this.nullValue = parents.getAttribute().getNullValue();
  }

  /**
   * @return The parent of the key or <code>null</code> if it has none.
   */
  public Long getParent(long key) {
    int shard = storage.getShard(key);
    Object value = parents.getValue(shard, key);
    if (value == null || value.equals(nullValue) || parents.isNull(shard, key))
      return null;
    Long parent = (Long) value;
    if (parent == key)
      return null;
    return parent;
  }

  /**
   * @return <code>true</code> if the key is contained in the dictionary and ancestor is the key itself or one of its
   *         ancestors. A cycle in the chain of parents ends the search.
   */
  public boolean isInHierarchy(long key, long ancestor) {
    if (!storage.contains(key))
      return false;

    LongSet seen = new LongOpenHashSet();
    long cur = key;
    while (true) {
      if (cur == ancestor)
        return true;
      if (!seen.add(cur))
        return false;
      Long parent = getParent(cur);
      if (parent == null)
        return false;
      cur = parent;
    }
  }

  /**
   * @return The key followed by its parent, grandparent etc. Empty if the key is not contained in the dictionary.
   */
  public long[] getHierarchy(long key) {
    if (!storage.contains(key))
      return new long[0];

    LongArrayList res = new LongArrayList();
    LongSet seen = new LongOpenHashSet();
    long cur = key;
    res.add(cur);
    seen.add(cur);
    while (res.size() < MAX_DEPTH) {
      Long parent = getParent(cur);
      if (parent == null || !seen.add(parent.longValue()))
        break;
      cur = parent;
      res.add(cur);
    }
    return res.toLongArray();
  }
}
