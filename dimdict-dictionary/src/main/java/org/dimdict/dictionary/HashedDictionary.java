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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.dimdict.data.block.Block;
import org.dimdict.data.container.HashTableBackend;
import org.dimdict.data.key.DictionaryKeyType;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.key.KeysExtractor;
import org.dimdict.data.storage.DictionaryStorage;
import org.dimdict.data.structure.DictionaryStructure;
import org.dimdict.dictionary.hierarchy.HierarchyIndex;
import org.dimdict.dictionary.hierarchy.ParentChain;
import org.dimdict.dictionary.lookup.LookupEngine;
import org.dimdict.dictionary.metrics.DictionaryMetrics;
import org.dimdict.dictionary.read.ShardBlockReader;
import org.dimdict.loader.BlockReader;
import org.dimdict.loader.DictionarySource;
import org.dimdict.loader.ListBlockReader;
import org.dimdict.loader.LoadException;
import org.dimdict.loader.ShardedLoader;
import org.dimdict.threads.ExecutorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Dictionary} that keeps its data in hash tables, split into shards which are loaded in parallel.
 * 
 * <p>
 * A full load fills a new {@link DictionaryStorage} which replaces the current one only after it was loaded
 * completely. Updates from sources with an update field are merged into the current storage.
 * 
 * <p>
 * The hierarchical index is built on the first query that needs it and dropped whenever the data changes.
 *
 * @param <K>
 *          Java type of the keys, see {@link KeyShape}.
 * @author Bastian Gloeckle
 */
public class HashedDictionary<K> implements Dictionary {
  private static final Logger logger = LoggerFactory.getLogger(HashedDictionary.class);

  private final String name;
  private final DictionaryStructure structure;
  private final KeyShape<K> keyShape;
  private final DictionarySource source;
  private final HashedDictionaryConfiguration configuration;
  private final ExecutorManager executorManager;

  private final DictionaryMetrics metrics = new DictionaryMetrics();
  private final LookupEngine<K> lookupEngine = new LookupEngine<>(metrics);

  private volatile DictionaryStorage<K> storage;
  /** <code>true</code> as soon as data was loaded into {@link #storage} */
  private boolean loaded = false;

  /** Rows received from a source with update field, <code>null</code> for other sources. */
  private final UpdateBuffer<K> updateBuffer;

  private final Object hierarchicalIndexSync = new Object();
  /** <code>null</code> if not built yet or outdated. */
  private volatile HierarchyIndex hierarchicalIndex;

  /**
   * Create a new dictionary without any data, call {@link #loadData()} to load it.
   */
  public HashedDictionary(String name, DictionaryStructure structure, KeyShape<K> keyShape, DictionarySource source,
      HashedDictionaryConfiguration configuration, ExecutorManager executorManager) {
    this(name, structure, keyShape, source, configuration, executorManager,
        source.hasUpdateField() ? new UpdateBuffer<>(structure, keyShape) : null);
  }

  private HashedDictionary(String name, DictionaryStructure structure, KeyShape<K> keyShape, DictionarySource source,
      HashedDictionaryConfiguration configuration, ExecutorManager executorManager, UpdateBuffer<K> updateBuffer) {
    this.name = name;
    this.structure = structure;
    this.keyShape = keyShape;
    this.source = source;
    this.configuration = configuration;
    this.executorManager = executorManager;
    this.updateBuffer = updateBuffer;
    this.storage = newStorage(0);
    updateMetrics();
  }

  @Override
  public synchronized void loadData() throws LoadException {
    if (source.hasUpdateField())
      updateData();
    else
      loadAll();
  }

  @Override
  public synchronized void updateData() throws LoadException, IllegalStateException {
    if (!source.hasUpdateField())
      throw new IllegalStateException("Source of dictionary '" + name + "' does not provide changed rows.");

    try {
      applyUpdate(storage, !loaded);
    } finally {
      // rows merged before a failure stay in the storage.
      loaded = true;
      dataChanged();
    }
  }

  @Override
  public synchronized void reload() throws LoadException {
    if (!source.hasUpdateField()) {
      loadAll();
      return;
    }

    DictionaryStorage<K> newStorage = newStorage(updateBuffer.size());
    applyUpdate(newStorage, true);
    storage = newStorage;
    loaded = true;
    dataChanged();
  }

  @Override
  public HashedDictionary<K> copy() throws LoadException {
    UpdateBuffer<K> bufferCopy;
    synchronized (this) {
      bufferCopy = (updateBuffer != null) ? updateBuffer.copy() : null;
    }
    HashedDictionary<K> res =
        new HashedDictionary<>(name, structure, keyShape, source.copy(), configuration, executorManager, bufferCopy);
    res.loadData();
    return res;
  }

  private void loadAll() throws LoadException {
    long estimatedRows = source.getEstimatedRowCount();
    DictionaryStorage<K> newStorage = newStorage(estimatedRows);
    logger.info("Loading dictionary '{}' with {} shards (estimated rows: {}).", name, configuration.getShards(),
        estimatedRows);
    try (BlockReader reader = source.loadAll()) {
      newLoader(newStorage, configuration.isRequireNonempty()).load(reader);
    }
    storage = newStorage;
    loaded = true;
    dataChanged();
  }

  /**
   * Merge the rows changed in the source into the target storage.
   * 
   * @param includeBuffer
   *          if <code>true</code>, all rows received earlier are inserted first.
   */
  private void applyUpdate(DictionaryStorage<K> target, boolean includeBuffer) throws LoadException {
    if (includeBuffer && !updateBuffer.isEmpty()) {
      logger.info("Loading {} buffered rows into dictionary '{}'.", updateBuffer.size(), name);
      newLoader(target, false).load(new ListBlockReader(Collections.singletonList(updateBuffer.toBlock())));
    }

    try (RecordingBlockReader reader = new RecordingBlockReader(source.loadUpdatedAll())) {
      newLoader(target, configuration.isRequireNonempty()).load(reader);
      for (Block block : reader.getBlocksRead())
        updateBuffer.merge(block);
    }
  }

  private ShardedLoader<K> newLoader(DictionaryStorage<K> target, boolean requireNonempty) {
    return new ShardedLoader<>(name, target, executorManager, configuration.getShardLoadQueueBacklog(),
        requireNonempty);
  }

  private DictionaryStorage<K> newStorage(long estimatedRows) {
    int perShard = (int) Math.min(Integer.MAX_VALUE / 2, estimatedRows / configuration.getShards());
    return new DictionaryStorage<>(structure, keyShape, configuration.getBackend(), configuration.getShards(),
        perShard);
  }

  private void dataChanged() {
    storage.trimIfNeeded();
    synchronized (hierarchicalIndexSync) {
      hierarchicalIndex = null;
      metrics.setHierarchicalIndexBytesAllocated(0);
    }
    updateMetrics();
    logger.debug("Dictionary '{}' contains {} keys in {} buckets, using {} bytes.", name, metrics.getElementCount(),
        metrics.getBucketCount(), metrics.getBytesAllocated());
  }

  private void updateMetrics() {
    DictionaryStorage<K> s = storage;
    metrics.updateStorageStatistics(s.size(), s.getBucketCount(), s.getBytesAllocated());
  }

  @Override
  public <T> ColumnResult<T> getColumn(String attributeName, Class<T> resultClass, List<Object[]> keyColumns,
      DefaultValues defaults) {
    int attributeIdx = structure.getAttributeIndex(attributeName);
    return lookupEngine.getColumn(storage, attributeIdx, resultClass, extractKeys(keyColumns), defaults);
  }

  @Override
  public boolean[] hasKeys(List<Object[]> keyColumns) {
    return lookupEngine.hasKeys(storage, extractKeys(keyColumns));
  }

  private KeysExtractor<K> extractKeys(List<Object[]> keyColumns) {
    return keyShape.newExtractor(structure.getKeyAttributes(), keyColumns);
  }

  @Override
  public boolean hasHierarchy() {
    return keyShape.getKeyType() == DictionaryKeyType.SIMPLE && structure.getHierarchicalAttributeIndex() != -1;
  }

  @Override
  public long[][] getHierarchy(long[] keys) {
    ParentChain chain = parentChain();
    long[][] res = new long[keys.length][];
    for (int i = 0; i < keys.length; i++)
      res[i] = chain.getHierarchy(keys[i]);
    return res;
  }

  @Override
  public boolean isInHierarchy(long key, long ancestor) {
    return parentChain().isInHierarchy(key, ancestor);
  }

  @Override
  public boolean[] isInHierarchy(long[] keys, long[] ancestors) {
    if (keys.length != ancestors.length)
      throw new IllegalArgumentException(
          "Got " + keys.length + " keys but " + ancestors.length + " ancestors in dictionary '" + name + "'");
    ParentChain chain = parentChain();
    boolean[] res = new boolean[keys.length];
    for (int i = 0; i < keys.length; i++)
      res[i] = chain.isInHierarchy(keys[i], ancestors[i]);
    return res;
  }

  @Override
  public long[] getDescendants(long key, int level) {
    return getHierarchicalIndex().getDescendants(key, level);
  }

  /**
   * @return The index of the children of each key, built if needed.
   * @throws UnsupportedHierarchyQueryException
   *           If {@link #hasHierarchy()} is false.
   */
  public HierarchyIndex getHierarchicalIndex() throws UnsupportedHierarchyQueryException {
    checkHierarchy();
    HierarchyIndex res = hierarchicalIndex;
    if (res != null)
      return res;

    synchronized (hierarchicalIndexSync) {
      if (hierarchicalIndex == null) {
        long startNanos = System.nanoTime();
        hierarchicalIndex = HierarchyIndex.build(longStorage(), structure.getHierarchicalAttributeIndex());
        metrics.setHierarchicalIndexBytesAllocated(hierarchicalIndex.getBytesAllocated());
        logger.debug("Built hierarchical index of dictionary '{}' with {} parents in {} ms.", name,
            hierarchicalIndex.getNumberOfParents(), (System.nanoTime() - startNanos) / 1_000_000);
      }
      return hierarchicalIndex;
    }
  }

  private ParentChain parentChain() {
    checkHierarchy();
    return new ParentChain(longStorage(), structure.getHierarchicalAttributeIndex());
  }

  @SuppressWarnings("unchecked")
  private DictionaryStorage<Long> longStorage() {
    return (DictionaryStorage<Long>) storage;
  }

  private void checkHierarchy() throws UnsupportedHierarchyQueryException {
    if (keyShape.getKeyType() != DictionaryKeyType.SIMPLE)
      throw new UnsupportedHierarchyQueryException(
          "Dictionary '" + name + "' has complex keys and therefore does not support hierarchy queries.");
    if (structure.getHierarchicalAttributeIndex() == -1)
      throw new UnsupportedHierarchyQueryException("Dictionary '" + name + "' has no hierarchical attribute.");
  }

  @Override
  public List<BlockReader> read(List<String> columnNames, int maxBlockSize, int numStreams) {
    if (numStreams < 1)
      throw new IllegalArgumentException("Number of streams must be at least 1, but was " + numStreams);

    DictionaryStorage<K> s = storage;
    List<BlockReader> res = new ArrayList<>(numStreams);
    for (int stream = 0; stream < numStreams; stream++) {
      List<Integer> shards = new ArrayList<>();
      for (int shard = stream; shard < s.getNumberOfShards(); shard += numStreams)
        shards.add(shard);
      res.add(new ShardBlockReader<>(s, columnNames, maxBlockSize, shards));
    }
    return res;
  }

  @Override
  public String getDictionaryName() {
    return name;
  }

  @Override
  public String getTypeName() {
    boolean sparse = configuration.getBackend() == HashTableBackend.SPARSE;
    if (keyShape.getKeyType() == DictionaryKeyType.SIMPLE)
      return sparse ? "SparseHashed" : "Hashed";
    return sparse ? "ComplexKeySparseHashed" : "ComplexKeyHashed";
  }

  @Override
  public DictionaryStructure getStructure() {
    return structure;
  }

  @Override
  public DictionarySource getSource() {
    return source;
  }

  @Override
  public DictionaryLifetime getLifetime() {
    return configuration.getLifetime();
  }

  @Override
  public DictionaryKeyType getKeyType() {
    return keyShape.getKeyType();
  }

  public HashedDictionaryConfiguration getConfiguration() {
    return configuration;
  }

  @Override
  public boolean isInjective(String attributeName) {
    return structure.getAttribute(attributeName).isInjective();
  }

  @Override
  public long getBytesAllocated() {
    return metrics.getBytesAllocated();
  }

  @Override
  public long getHierarchicalIndexBytesAllocated() {
    return metrics.getHierarchicalIndexBytesAllocated();
  }

  @Override
  public long getElementCount() {
    return metrics.getElementCount();
  }

  @Override
  public long getBucketCount() {
    return metrics.getBucketCount();
  }

  @Override
  public double getLoadFactor() {
    return metrics.getLoadFactor();
  }

  @Override
  public long getQueryCount() {
    return metrics.getQueryCount();
  }

  @Override
  public long getFoundCount() {
    return metrics.getFoundCount();
  }

  @Override
  public double getFoundRate() {
    return metrics.getFoundRate();
  }

  @Override
  public double getHitRate() {
    return metrics.getHitRate();
  }

  @Override
  public String toString() {
    return getTypeName() + "[" + name + "]";
  }
}
