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
package org.dimdict.loader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.dimdict.data.attribute.AttributeUnderlyingType;
import org.dimdict.data.block.Block;
import org.dimdict.data.container.HashTableBackend;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.storage.DictionaryStorage;
import org.dimdict.data.structure.DictionaryAttribute;
import org.dimdict.data.structure.DictionaryStructure;
import org.dimdict.threads.ExecutorManager;
import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 *
 * @author Bastian Gloeckle
 */
public class ShardedLoaderTest {
  private static final DictionaryStructure STRUCTURE = DictionaryStructure.simple("id",
      Arrays.asList(DictionaryAttribute.of("name", AttributeUnderlyingType.STRING),
          DictionaryAttribute.of("value", AttributeUnderlyingType.INT32)));

  private ExecutorManager executorManager;

  @BeforeMethod
  public void before() {
    executorManager = new ExecutorManager();
  }

  @AfterMethod
  public void after() {
    executorManager.shutdownEverything();
  }

  @Test
  public void singleShardTest() throws LoadException {
    // GIVEN
    DictionaryStorage<Long> storage = storage(1);
    ShardedLoader<Long> loader = new ShardedLoader<>("test", storage, executorManager, 10, false);

    // WHEN
    long rows = loader.load(new ListBlockReader(blocks(0, 5, 20)));

    // THEN
    Assert.assertEquals(rows, 100L);
    Assert.assertEquals(storage.size(), 100L);
    Assert.assertEquals(storage.getAttributeStore(0).getValue(0, 42L), "name42");
    Assert.assertEquals(executorManager.getNumberOfActiveExecutors(), 0, "No threads expected for single shard");
  }

  @Test
  public void multipleShardsTest() throws LoadException {
    // GIVEN
    DictionaryStorage<Long> storage = storage(4);
    ShardedLoader<Long> loader = new ShardedLoader<>("test", storage, executorManager, 10, false);

    // WHEN
    long rows = loader.load(new ListBlockReader(blocks(0, 10, 100)));

    // THEN
    Assert.assertEquals(rows, 1000L);
    Assert.assertEquals(storage.size(), 1000L);
    for (long key = 0; key < 1000; key++) {
      int shard = storage.getShard(key);
      Assert.assertEquals(storage.getAttributeStore(0).getValue(shard, key), "name" + key);
      Assert.assertEquals(storage.getAttributeStore(1).getValue(shard, key), key);
    }
  }

  @Test
  public void smallBacklogTest() throws LoadException {
    // GIVEN
    DictionaryStorage<Long> storage = storage(3);
    ShardedLoader<Long> loader = new ShardedLoader<>("test", storage, executorManager, 1, false);

    // WHEN
    long rows = loader.load(new ListBlockReader(blocks(0, 200, 7)));

    // THEN
    Assert.assertEquals(rows, 1400L);
    Assert.assertEquals(storage.size(), 1400L);
  }

  @Test
  public void producerWaitsForFullShardQueueTest() throws Exception {
    // GIVEN
    DictionaryStorage<Long> storage = Mockito.spy(storage(2));
    List<Block> blocks = new ArrayList<>();
    for (long id = 0; blocks.size() < 10; id++)
      if (storage.getShard(id) == 0)
        blocks.add(new Block(Arrays.asList("id", "name", "value"),
            Arrays.asList(new Object[] { id }, new Object[] { "name" + id }, new Object[] { (int) id })));
    AtomicInteger blocksRead = new AtomicInteger(0);
    BlockReader reader = new BlockReader() {
      private final Iterator<Block> it = blocks.iterator();

      @Override
      public Block read() {
        blocksRead.incrementAndGet();
        return it.hasNext() ? it.next() : null;
      }

      @Override
      public void close() {
      }
    };

    CountDownLatch workerInserting = new CountDownLatch(1);
    CountDownLatch releaseWorker = new CountDownLatch(1);
    Mockito.doAnswer(invocation -> {
      workerInserting.countDown();
      releaseWorker.await();
      return invocation.callRealMethod();
    }).when(storage).insertRows(Mockito.eq(0), Mockito.any(), Mockito.any(), Mockito.any());

    ShardedLoader<Long> loader = new ShardedLoader<>("test", storage, executorManager, 1, false);
    ExecutorService producer = Executors.newSingleThreadExecutor();
    try {
      // WHEN
      Future<Long> rows = producer.submit(() -> loader.load(reader));
      Assert.assertTrue(workerInserting.await(10, TimeUnit.SECONDS), "Worker did not start inserting");
      Thread.sleep(500);

      // THEN
      // one block in the worker, one in the queue, one waiting to be queued.
      Assert.assertTrue(blocksRead.get() <= 3, "Producer read " + blocksRead.get() + " blocks although queue is full");
      Assert.assertFalse(rows.isDone(), "Load should wait for the worker");

      // WHEN
      releaseWorker.countDown();

      // THEN
      Assert.assertEquals(rows.get(10, TimeUnit.SECONDS), (Long) 10L);
      Assert.assertEquals(storage.size(0), 10);
    } finally {
      releaseWorker.countDown();
      producer.shutdownNow();
    }
  }

  @Test
  public void sameContentIndependentOfBlockOrderTest() throws LoadException {
    // GIVEN
    List<Block> blocks = blocks(0, 20, 50);
    List<Block> reversed = new ArrayList<>(blocks);
    Collections.reverse(reversed);
    DictionaryStorage<Long> first = storage(5);
    DictionaryStorage<Long> second = storage(5);

    // WHEN
    new ShardedLoader<>("first", first, executorManager, 2, false).load(new ListBlockReader(blocks));
    new ShardedLoader<>("second", second, executorManager, 2, false).load(new ListBlockReader(reversed));

    // THEN
    for (int shard = 0; shard < 5; shard++)
      Assert.assertEquals(keys(second, shard), keys(first, shard), "Content of shard " + shard + " differs");
  }

  @Test
  public void laterRowOverwritesTest() throws LoadException {
    // GIVEN
    DictionaryStorage<Long> storage = storage(2);
    Block first = new Block(Arrays.asList("id", "name", "value"),
        Arrays.asList(new Object[] { 1L }, new Object[] { "old" }, new Object[] { 1 }));
    Block second = new Block(Arrays.asList("value", "id", "name"),
        Arrays.asList(new Object[] { 2 }, new Object[] { 1L }, new Object[] { "new" }));

    // WHEN
    new ShardedLoader<>("test", storage, executorManager, 10, false)
        .load(new ListBlockReader(Arrays.asList(first, second)));

    // THEN
    Assert.assertEquals(storage.size(), 1L);
    Assert.assertEquals(storage.getAttributeStore(0).getValue(storage.getShard(1L), 1L), "new");
  }

  @Test(expectedExceptions = EmptyLoadRejectedException.class)
  public void requireNonemptyTest() throws LoadException {
    new ShardedLoader<>("test", storage(2), executorManager, 10, true)
        .load(new ListBlockReader(new ArrayList<>()));
  }

  @Test
  public void emptyLoadAllowedTest() throws LoadException {
    // GIVEN
    DictionaryStorage<Long> storage = storage(2);

    // WHEN
    long rows = new ShardedLoader<>("test", storage, executorManager, 10, false)
        .load(new ListBlockReader(new ArrayList<>()));

    // THEN
    Assert.assertEquals(rows, 0L);
    Assert.assertEquals(storage.size(), 0L);
  }

  @Test(expectedExceptions = LoadException.class)
  public void nonFiniteDecimalSingleShardTest() throws LoadException {
    nonFiniteDecimal(1);
  }

  @Test(expectedExceptions = LoadException.class)
  public void nonFiniteDecimalMultipleShardsTest() throws LoadException {
    nonFiniteDecimal(3);
  }

  private void nonFiniteDecimal(int shards) throws LoadException {
    // GIVEN
    DictionaryStructure structure = DictionaryStructure.simple("id",
        Arrays.asList(DictionaryAttribute.of("price", AttributeUnderlyingType.DECIMAL64)));
    DictionaryStorage<Long> storage =
        new DictionaryStorage<>(structure, KeyShape.SIMPLE, HashTableBackend.DENSE, shards, 0);
    Block block = new Block(Arrays.asList("id", "price"),
        Arrays.asList(new Object[] { 1L, 2L }, new Object[] { 1.5d, Double.NaN }));

    // WHEN
    new ShardedLoader<>("test", storage, executorManager, 10, false)
        .load(new ListBlockReader(Collections.singletonList(block)));
  }

  @Test
  public void failingSourceSingleShardTest() throws LoadException {
    failingSource(1);
  }

  @Test
  public void failingSourceMultipleShardsTest() throws LoadException {
    failingSource(4);
  }

  private void failingSource(int shards) throws LoadException {
    // GIVEN
    BlockReader reader = Mockito.mock(BlockReader.class);
    Mockito.when(reader.read()).thenReturn(blocks(0, 1, 10).get(0))
        .thenThrow(new IllegalStateException("connection lost"));
    ShardedLoader<Long> loader = new ShardedLoader<>("test", storage(shards), executorManager, 10, false);

    try {
      // WHEN
      loader.load(reader);
      Assert.fail("Expected load to fail");
    } catch (SourceExhaustedPrematurelyException e) {
      // THEN
      Assert.assertTrue(e.getCause() instanceof IllegalStateException, "Cause should be provided");
      Assert.assertTrue(e.getMessage().contains("after 10 rows"), "Unexpected message: " + e.getMessage());
    }
  }

  @Test
  public void invalidValueInWorkerTest() throws LoadException {
    // GIVEN
    Block block = new Block(Arrays.asList("id", "name", "value"),
        Arrays.asList(new Object[] { 1L, 2L, 3L }, new Object[] { "a", "b", "c" }, new Object[] { 1, "x", 3 }));
    ShardedLoader<Long> loader = new ShardedLoader<>("test", storage(3), executorManager, 10, false);

    try {
      // WHEN
      loader.load(new ListBlockReader(Arrays.asList(block)));
      Assert.fail("Expected load to fail");
    } catch (SourceExhaustedPrematurelyException e) {
      Assert.fail("Source did not fail", e);
    } catch (LoadException e) {
      // THEN
      Assert.assertTrue(e.getMessage().contains("test"), "Dictionary name expected in message");
    }
  }

  @Test(expectedExceptions = LoadException.class)
  public void invalidValueSingleShardTest() throws LoadException {
    Block block = new Block(Arrays.asList("id", "name", "value"),
        Arrays.asList(new Object[] { 1L }, new Object[] { 5 }, new Object[] { 1 }));
    new ShardedLoader<>("test", storage(1), executorManager, 10, false)
        .load(new ListBlockReader(Arrays.asList(block)));
  }

  @Test(expectedExceptions = LoadException.class)
  public void missingColumnTest() throws LoadException {
    Block block =
        new Block(Arrays.asList("id", "name"), Arrays.asList(new Object[] { 1L }, new Object[] { "a" }));
    new ShardedLoader<>("test", storage(2), executorManager, 10, false)
        .load(new ListBlockReader(Arrays.asList(block)));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void invalidBacklogTest() {
    new ShardedLoader<>("test", storage(2), executorManager, 0, false);
  }

  private DictionaryStorage<Long> storage(int shards) {
    return new DictionaryStorage<>(STRUCTURE, KeyShape.SIMPLE, HashTableBackend.DENSE, shards, 0);
  }

  private Set<Long> keys(DictionaryStorage<Long> storage, int shard) {
    Set<Long> res = new HashSet<>();
    for (Iterator<Long> it = storage.keyIterator(shard); it.hasNext();)
      res.add(it.next());
    return res;
  }

  /**
   * @return blocks with consecutive ids starting at firstId.
   */
  private List<Block> blocks(long firstId, int numberOfBlocks, int rowsPerBlock) {
    List<Block> res = new ArrayList<>();
    long id = firstId;
    for (int b = 0; b < numberOfBlocks; b++) {
      Object[] ids = new Object[rowsPerBlock];
      Object[] names = new Object[rowsPerBlock];
      Object[] values = new Object[rowsPerBlock];
      for (int i = 0; i < rowsPerBlock; i++, id++) {
        ids[i] = id;
        names[i] = "name" + id;
        values[i] = (int) id;
      }
      res.add(new Block(Arrays.asList("id", "name", "value"), Arrays.asList(ids, names, values)));
    }
    return res;
  }
}
