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
package org.dimdict.dictionary;

import org.dimdict.data.container.HashTableBackend;

/**
 * Configuration of a single {@link HashedDictionary}. Instances are immutable, the with* methods return copies.
 * 
 * <p>
 * Defaults of new dictionaries are configured in dimdict.properties, see {@link HashedDictionaryFactory}.
 *
 * @author Bastian Gloeckle
 */
public class HashedDictionaryConfiguration {
  public static final int MAX_SHARDS = 128;

  private final int shards;
  private final int shardLoadQueueBacklog;
  private final boolean requireNonempty;
  private final HashTableBackend backend;
  private final DictionaryLifetime lifetime;

  /**
   * @throws IllegalArgumentException
   *           If shards is not in 1..{@link #MAX_SHARDS} or the backlog is less than 1.
   */
  public HashedDictionaryConfiguration(int shards, int shardLoadQueueBacklog, boolean requireNonempty,
      HashTableBackend backend, DictionaryLifetime lifetime) throws IllegalArgumentException {
    if (shards < 1 || shards > MAX_SHARDS)
      throw new IllegalArgumentException("Number of shards must be in range 1.." + MAX_SHARDS + ", but was " + shards);
    if (shardLoadQueueBacklog < 1)
      throw new IllegalArgumentException("Shard load queue backlog must be at least 1, but was " + shardLoadQueueBacklog);
    this.shards = shards;
    this.shardLoadQueueBacklog = shardLoadQueueBacklog;
    this.requireNonempty = requireNonempty;
    this.backend = backend;
    this.lifetime = lifetime;
  }

  public static HashedDictionaryConfiguration defaults() {
    return new HashedDictionaryConfiguration(1, 10_000, false, HashTableBackend.DENSE, new DictionaryLifetime(0, 0));
  }

  public int getShards() {
    return shards;
  }

  public int getShardLoadQueueBacklog() {
    return shardLoadQueueBacklog;
  }

  public boolean isRequireNonempty() {
    return requireNonempty;
  }

  public HashTableBackend getBackend() {
    return backend;
  }

  public DictionaryLifetime getLifetime() {
    return lifetime;
  }

  public HashedDictionaryConfiguration withShards(int shards) {
    return new HashedDictionaryConfiguration(shards, shardLoadQueueBacklog, requireNonempty, backend, lifetime);
  }

  public HashedDictionaryConfiguration withShardLoadQueueBacklog(int shardLoadQueueBacklog) {
    return new HashedDictionaryConfiguration(shards, shardLoadQueueBacklog, requireNonempty, backend, lifetime);
  }

  public HashedDictionaryConfiguration withRequireNonempty(boolean requireNonempty) {
    return new HashedDictionaryConfiguration(shards, shardLoadQueueBacklog, requireNonempty, backend, lifetime);
  }

  public HashedDictionaryConfiguration withBackend(HashTableBackend backend) {
    return new HashedDictionaryConfiguration(shards, shardLoadQueueBacklog, requireNonempty, backend, lifetime);
  }

  public HashedDictionaryConfiguration withLifetime(DictionaryLifetime lifetime) {
    return new HashedDictionaryConfiguration(shards, shardLoadQueueBacklog, requireNonempty, backend, lifetime);
  }

  @Override
  public String toString() {
    return "HashedDictionaryConfiguration[shards=" + shards + ",backlog=" + shardLoadQueueBacklog
        + ",requireNonempty=" + requireNonempty + ",backend=" + backend + ",lifetime=" + lifetime + "]";
  }
}
