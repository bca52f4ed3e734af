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
 * Hash set of keys of one shard, used for dictionaries without attributes and for marking keys whose value is null.
 * 
 * <p>
 * Same thread safety as {@link ShardContainer}.
 *
 * @param <K>
 *          Java type of the keys.
 * @author Bastian Gloeckle
 */
public interface ShardKeySet<K> {
  /**
   * @return <code>true</code> if the key was not contained before.
   */
  public boolean add(K key);

  public boolean remove(K key);

  public boolean contains(K key);

  public int size();

  public int capacity();

  public void reserve(int expectedSize);

  public void trim();

  public long getBytesAllocated();

  public Iterator<K> iterator();
}
