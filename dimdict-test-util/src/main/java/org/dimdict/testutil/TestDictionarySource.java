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
package org.dimdict.testutil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.dimdict.data.block.Block;
import org.dimdict.loader.BlockReader;
import org.dimdict.loader.DictionarySource;
import org.dimdict.loader.LoadException;
import org.dimdict.loader.ListBlockReader;

/**
 * In-memory {@link DictionarySource} for tests.
 * 
 * <p>
 * The source provides a fixed list of blocks. If it is created {@link #withUpdateField(List)}, the first call to
 * {@link #loadUpdatedAll()} provides these blocks, too, and each following call provides the next list of changed rows
 * that was added using {@link #addUpdate(Block...)}, or nothing if there is none.
 *
 * @author Bastian Gloeckle
 */
public class TestDictionarySource implements DictionarySource {
  private final List<Block> blocks;
  private final boolean updateField;
  private final List<List<Block>> updates;
  private int nextUpdate;
  private boolean initialUpdateDone;
  private long estimatedRowCount = 0;
  /** Number of blocks after which readers fail, -1 for never. */
  private int failAfterBlocks = -1;

  private final AtomicInteger loadAllCalls = new AtomicInteger(0);
  private final AtomicInteger loadUpdatedAllCalls = new AtomicInteger(0);

  private TestDictionarySource(List<Block> blocks, boolean updateField, List<List<Block>> updates) {
    this.blocks = blocks;
    this.updateField = updateField;
    this.updates = updates;
  }

  public static TestDictionarySource of(Block... blocks) {
    return of(Arrays.asList(blocks));
  }

  public static TestDictionarySource of(List<Block> blocks) {
    return new TestDictionarySource(new ArrayList<>(blocks), false, new ArrayList<>());
  }

  public static TestDictionarySource withUpdateField(List<Block> initialBlocks) {
    return new TestDictionarySource(new ArrayList<>(initialBlocks), true, new ArrayList<>());
  }

  /**
   * Provide the given blocks on the next call to {@link #loadUpdatedAll()} that has not got any other update yet.
   */
  public synchronized TestDictionarySource addUpdate(Block... changedRows) {
    updates.add(Arrays.asList(changedRows));
    return this;
  }

  /**
   * Readers created after this call fail with an exception after providing the given number of blocks.
   */
  public synchronized TestDictionarySource failAfterBlocks(int numberOfBlocks) {
    this.failAfterBlocks = numberOfBlocks;
    return this;
  }

  public TestDictionarySource withEstimatedRowCount(long estimatedRowCount) {
    this.estimatedRowCount = estimatedRowCount;
    return this;
  }

  @Override
  public synchronized BlockReader loadAll() throws LoadException {
    loadAllCalls.incrementAndGet();
    return reader(blocks);
  }

  @Override
  public boolean hasUpdateField() {
    return updateField;
  }

  @Override
  public synchronized BlockReader loadUpdatedAll() throws LoadException {
    if (!updateField)
      throw new LoadException("Source has no update field.");
    loadUpdatedAllCalls.incrementAndGet();
    if (!initialUpdateDone) {
      initialUpdateDone = true;
      return reader(blocks);
    }
    if (nextUpdate < updates.size())
      return reader(updates.get(nextUpdate++));
    return reader(Collections.emptyList());
  }

  @Override
  public synchronized DictionarySource copy() {
    TestDictionarySource res = new TestDictionarySource(blocks, updateField, updates);
    res.nextUpdate = nextUpdate;
    res.initialUpdateDone = initialUpdateDone;
    res.estimatedRowCount = estimatedRowCount;
    res.failAfterBlocks = failAfterBlocks;
    return res;
  }

  @Override
  public long getEstimatedRowCount() {
    return estimatedRowCount;
  }

  public int getLoadAllCalls() {
    return loadAllCalls.get();
  }

  public int getLoadUpdatedAllCalls() {
    return loadUpdatedAllCalls.get();
  }

  private BlockReader reader(List<Block> blocksToRead) {
    if (failAfterBlocks < 0)
      return new ListBlockReader(blocksToRead);

    int failAfter = failAfterBlocks;
    ListBlockReader delegate = new ListBlockReader(blocksToRead);
    return new BlockReader() {
      private int blocksRead = 0;

      @Override
      public Block read() throws LoadException {
        if (blocksRead++ == failAfter)
          throw new LoadException("Simulated source failure after " + failAfter + " blocks");
        return delegate.read();
      }

      @Override
      public void close() {
        delegate.close();
      }
    };
  }
}
