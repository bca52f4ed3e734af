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

/**
 * Hash map holding the values of one attribute of one shard.
 * 
 * <p>
 * Implementations are not thread safe for writing. Concurrent reads are safe as long as nobody writes.
 *
 * @param <K>
 *          Java type of the keys.
 * @param <V>
 *          Java type of the values. Values are never <code>null</code>.
 * @author Bastian Gloeckle
 */
public interface ShardContainer<K, V> {
  /**
   * Insert the value or overwrite the value of an existing key. If the key exists already, the key object that is
   * stored in the container is kept.
   * 
   * @return The previous value or <code>null</code> if the key was not present.
   */
  public V put(K key, V value);

  /**
   * @return The value of the key or <code>null</code> if not present.
   */
  public V get(K key);

  public boolean containsKey(K key);

  /**
   * @return The key object held by the container that equals the given key, <code>null</code> if the key is not
   *         present.
   */
  public K getStoredKey(K key);

  public int size();

  /**
   * @return Number of buckets of the underlying table.
   */
  public int capacity();

  /**
   * Grow the table so it can take the given number of elements without rehashing.
   */
  public void reserve(int expectedSize);

  /**
   * Shrink the table to the smallest size that holds its current elements.
   */
  public void trim();

  /**
   * @return Estimated number of bytes used by the table itself (not including the values).
   */
  public long getBytesAllocated();

  public Iterator<K> keyIterator();
}
