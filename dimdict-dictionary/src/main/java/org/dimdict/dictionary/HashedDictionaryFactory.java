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

import javax.annotation.PostConstruct;
import javax.inject.Inject;

import org.dimdict.config.Config;
import org.dimdict.config.ConfigKey;
import org.dimdict.context.AutoInstatiate;
import org.dimdict.data.container.HashTableBackend;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.structure.DictionaryStructure;
import org.dimdict.loader.DictionarySource;
import org.dimdict.loader.LoadException;
import org.dimdict.threads.ExecutorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates and loads {@link HashedDictionary} instances.
 * 
 * <p>
 * The default configuration of new dictionaries is read from the dimdict configuration.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class HashedDictionaryFactory {
  private static final Logger logger = LoggerFactory.getLogger(HashedDictionaryFactory.class);

  @Config(ConfigKey.DICTIONARY_SHARDS)
  private int defaultShards;

  @Config(ConfigKey.DICTIONARY_SHARD_LOAD_QUEUE_BACKLOG)
  private int defaultShardLoadQueueBacklog;

  @Config(ConfigKey.DICTIONARY_REQUIRE_NONEMPTY)
  private boolean defaultRequireNonempty;

  @Config(ConfigKey.DICTIONARY_LIFETIME_MIN_SECONDS)
  private long defaultLifetimeMinSeconds;

  @Config(ConfigKey.DICTIONARY_LIFETIME_MAX_SECONDS)
  private long defaultLifetimeMaxSeconds;

  @Config(ConfigKey.DICTIONARY_SPARSE)
  private boolean defaultSparse;

  @Inject
  private ExecutorManager executorManager;

  private HashedDictionaryConfiguration defaultConfiguration;

  @PostConstruct
  public void initialize() {
    defaultConfiguration = new HashedDictionaryConfiguration(defaultShards, defaultShardLoadQueueBacklog,
        defaultRequireNonempty, defaultSparse ? HashTableBackend.SPARSE : HashTableBackend.DENSE,
        new DictionaryLifetime(defaultLifetimeMinSeconds, defaultLifetimeMaxSeconds));
    logger.debug("Default dictionary configuration: {}", defaultConfiguration);
  }

  public HashedDictionaryConfiguration getDefaultConfiguration() {
    return defaultConfiguration;
  }

  /**
   * Create a dictionary with the default configuration and load its data.
   */
  public HashedDictionary<?> createDictionary(String name, DictionaryStructure structure, DictionarySource source)
      throws LoadException {
    return createDictionary(name, structure, source, defaultConfiguration);
  }

  /**
   * Create a dictionary and load its data.
   * 
   * @throws LoadException
   *           If the data cannot be loaded.
   */
  public HashedDictionary<?> createDictionary(String name, DictionaryStructure structure, DictionarySource source,
      HashedDictionaryConfiguration configuration) throws LoadException {
    HashedDictionary<?> res = create(name, structure, KeyShape.of(structure.getKeyType()), source, configuration);
    res.loadData();
    return res;
  }

  private <K> HashedDictionary<K> create(String name, DictionaryStructure structure, KeyShape<K> keyShape,
      DictionarySource source, HashedDictionaryConfiguration configuration) {
    return new HashedDictionary<>(name, structure, keyShape, source, configuration, executorManager);
  }
}
