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

import org.dimdict.data.key.KeyShape;

/**
 * Creates the {@link ShardContainer}s and {@link ShardKeySet}s that match a {@link KeyShape}.
 *
 * @author Bastian Gloeckle
 */
public class ShardContainers {
  private ShardContainers() {
  }

  @SuppressWarnings("unchecked")
  public static <K, V> ShardContainer<K, V> newContainer(KeyShape<K> keyShape, HashTableBackend backend,
      int expectedSize) {
    switch (keyShape.getKeyType()) {
    case SIMPLE:
      return (ShardContainer<K, V>) new LongShardContainer<V>(backend, expectedSize);
    case COMPLEX:
      return (ShardContainer<K, V>) new SpanShardContainer<V>(backend, expectedSize);
    }
    throw new IllegalArgumentException("Unknown key type " + keyShape.getKeyType());
  }

  @SuppressWarnings("unchecked")
  public static <K> ShardKeySet<K> newKeySet(KeyShape<K> keyShape, HashTableBackend backend, int expectedSize) {
    switch (keyShape.getKeyType()) {
    case SIMPLE:
      return (ShardKeySet<K>) new LongShardKeySet(backend, expectedSize);
    case COMPLEX:
      return (ShardKeySet<K>) new SpanShardKeySet(backend, expectedSize);
    }
    throw new IllegalArgumentException("Unknown key type " + keyShape.getKeyType());
  }
}
