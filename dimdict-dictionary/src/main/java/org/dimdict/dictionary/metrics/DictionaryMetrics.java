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
package org.dimdict.dictionary.metrics;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Statistics of a dictionary.
 * 
 * <p>
 * The query counters are updated by concurrent lookups without synchronization between them, reading them is therefore
 * only approximate while lookups are running. The sizes are set after each load and update.
 *
 * @author Bastian Gloeckle
 */
public class DictionaryMetrics {
  private final LongAdder queryCount = new LongAdder();
  private final LongAdder foundCount = new LongAdder();

  private final AtomicLong elementCount = new AtomicLong(0);
  private final AtomicLong bucketCount = new AtomicLong(0);
  private final AtomicLong storageBytesAllocated = new AtomicLong(0);
  private final AtomicLong hierarchicalIndexBytesAllocated = new AtomicLong(0);

  /**
   * @param queried
   *          Number of keys that were looked up.
   * @param found
   *          How many of these were contained in the dictionary.
   */
  public void recordQueries(long queried, long found) {
    queryCount.add(queried);
    foundCount.add(found);
  }

  public void updateStorageStatistics(long elementCount, long bucketCount, long bytesAllocated) {
    this.elementCount.set(elementCount);
    this.bucketCount.set(bucketCount);
    this.storageBytesAllocated.set(bytesAllocated);
  }

  public void setHierarchicalIndexBytesAllocated(long bytes) {
    hierarchicalIndexBytesAllocated.set(bytes);
  }

  public long getQueryCount() {
    return queryCount.sum();
  }

  public long getFoundCount() {
    return foundCount.sum();
  }

  /**
   * @return Number of found keys divided by number of requested keys, 0 if no key was requested yet.
   */
  public double getFoundRate() {
    long queries = queryCount.sum();
    if (queries == 0)
      return 0.;
    return (double) foundCount.sum() / queries;
  }

  /**
   * @return Always 1, as every lookup is answered from memory.
   */
  public double getHitRate() {
    return 1.;
  }

  public long getElementCount() {
    return elementCount.get();
  }

  public long getBucketCount() {
    return bucketCount.get();
  }

  /**
   * @return elements per bucket, 0 if there are no buckets.
   */
  public double getLoadFactor() {
    long buckets = bucketCount.get();
    if (buckets == 0)
      return 0.;
    return (double) elementCount.get() / buckets;
  }

  /**
   * @return Bytes of the hash tables and arenas plus the bytes of the hierarchical index.
   */
  public long getBytesAllocated() {
    return storageBytesAllocated.get() + hierarchicalIndexBytesAllocated.get();
  }

  public long getHierarchicalIndexBytesAllocated() {
    return hierarchicalIndexBytesAllocated.get();
  }
}
