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

import java.util.Iterator;

import org.dimdict.data.storage.DictionaryStorage;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;

/**
 * Index from parent keys to their children, the inverse of the hierarchical attribute of a dictionary.
 * 
 * <p>
 * Instances are immutable. A dictionary builds a new index after its data changed.
 *
 * @author Bastian Gloeckle
 */
public class HierarchyIndex {
  private static final long LIST_OBJECT_BYTES = 24;

  private final Long2ObjectOpenHashMap<LongArrayList> children;
  private final long bytesAllocated;

  private HierarchyIndex(Long2ObjectOpenHashMap<LongArrayList> children) {
    this.children = children;
    long bytes = (children.size() * 2L + 1) * (Long.BYTES + 8);
    for (LongArrayList list : children.values())
      bytes += LIST_OBJECT_BYTES + list.elements().length * (long) Long.BYTES;
    this.bytesAllocated = bytes;
  }

  /**
   * Build the index of the given storage.
   */
  public static HierarchyIndex build(DictionaryStorage<Long> storage, int hierarchicalAttributeIdx) {
    ParentChain chain = new ParentChain(storage, hierarchicalAttributeIdx);
    Long2ObjectOpenHashMap<LongArrayList> children = new Long2ObjectOpenHashMap<>();
    for (int shard = 0; shard < storage.getNumberOfShards(); shard++) {
      for (Iterator<Long> it = storage.keyIterator(shard); it.hasNext();) {
        long key = it.next();
        Long parent = chain.getParent(key);
        if (parent == null)
          continue;
        LongArrayList list = children.get(parent.longValue());
        if (list == null) {
          list = new LongArrayList();
          children.put(parent.longValue(), list);
        }
        list.add(key);
      }
    }
    for (LongArrayList list : children.values())
      list.trim();
    children.trim();
    return new HierarchyIndex(children);
  }

  /**
   * @return The direct children of the given key, empty if it has none.
   */
  public LongList getChildren(long parent) {
    LongArrayList res = children.get(parent);
    if (res == null)
      return LongLists.EMPTY_LIST;
    return LongLists.unmodifiable(res);
  }

  /**
   * Find the descendants of a key by walking down the index breadth first.
   * 
   * @param level
   *          Maximum number of steps to walk down, 1 returns the children only. 0 for no limit.
   * @return The descendants, not including the key itself. Each descendant is returned once, even if the hierarchy
   *         contains cycles.
   */
  public long[] getDescendants(long key, int level) {
    if (level < 0)
      throw new IllegalArgumentException("Level must not be negative: " + level);

    LongArrayList res = new LongArrayList();
    LongSet visited = new LongOpenHashSet();
    visited.add(key);
    LongArrayList frontier = new LongArrayList(new long[] { key });
    int depth = 0;
    while (!frontier.isEmpty() && (level == 0 || depth < level)) {
      LongArrayList next = new LongArrayList();
      for (int i = 0; i < frontier.size(); i++) {
        LongArrayList nodeChildren = children.get(frontier.getLong(i));
        if (nodeChildren == null)
          continue;
        for (int j = 0; j < nodeChildren.size(); j++) {
          long child = nodeChildren.getLong(j);
          if (visited.add(child)) {
            res.add(child);
            next.add(child);
          }
        }
      }
      frontier = next;
      depth++;
    }
    return res.toLongArray();
  }

  /**
   * @return Number of keys that have at least one child.
   */
  public int getNumberOfParents() {
    return children.size();
  }

  public long getBytesAllocated() {
    return bytesAllocated;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("HierarchyIndex[");
    boolean first = true;
    for (Long2ObjectMap.Entry<LongArrayList> e : Long2ObjectMaps.fastIterable(children)) {
      if (!first)
        sb.append(",");
      first = false;
      sb.append(e.getLongKey()).append("->").append(e.getValue());
    }
    return sb.append("]").toString();
  }
}
