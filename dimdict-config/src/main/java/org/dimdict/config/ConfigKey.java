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
package org.dimdict.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation. All of these are defaults only, each
 * dictionary can override them in its own configuration.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * Number of shards a new dictionary splits its keys into. Each shard is loaded by its own thread.
   * 
   * <p>
   * Valid values are 1..128. A value of 1 disables parallel loading.
   */
  public static final String DICTIONARY_SHARDS = "dictionaryShards";

  /**
   * Maximum number of pending batches per shard while loading a sharded dictionary. When the queue of a shard is full,
   * reading from the source blocks until the worker of that shard caught up.
   */
  public static final String DICTIONARY_SHARD_LOAD_QUEUE_BACKLOG = "dictionaryShardLoadQueueBacklog";

  /**
   * If <code>true</code>, a load that did not produce a single row fails instead of producing an empty dictionary.
   */
  public static final String DICTIONARY_REQUIRE_NONEMPTY = "dictionaryRequireNonempty";

  /**
   * Minimum number of seconds a loaded dictionary should be used before it is reloaded. Only informational for
   * dictionaries, whoever schedules reloads reads it.
   */
  public static final String DICTIONARY_LIFETIME_MIN_SECONDS = "dictionaryLifetimeMinSeconds";

  /**
   * Maximum number of seconds a loaded dictionary should be used before it is reloaded. 0 = never reload.
   */
  public static final String DICTIONARY_LIFETIME_MAX_SECONDS = "dictionaryLifetimeMaxSeconds";

  /**
   * <code>true</code> to use the memory-compact hash tables by default, <code>false</code> to use the fast ones.
   */
  public static final String DICTIONARY_SPARSE = "dictionarySparse";
}
