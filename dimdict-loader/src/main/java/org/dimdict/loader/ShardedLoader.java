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
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.dimdict.data.attribute.TypeMismatchException;
import org.dimdict.data.block.Block;
import org.dimdict.data.key.KeysExtractor;
import org.dimdict.data.storage.DictionaryStorage;
import org.dimdict.threads.ExecutorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Loads the blocks provided by a {@link BlockReader} into a {@link DictionaryStorage}.
 * 
 * <p>
 * If the storage has only one shard, all rows are inserted on the calling thread. Otherwise the calling thread reads
 * the blocks and splits their rows by shard, while one worker thread per shard inserts the rows of its shard. Each
 * worker has a bounded queue of pending work (the backlog). If the queue of a shard is full, the reading thread waits
 * until the worker took work off the queue.
 * 
 * <p>
 * {@link #load(BlockReader)} returns only after all workers finished, so the storage is complete when it returns
 * successfully. Keys that are already contained in the storage are overwritten, which makes this usable for
 * incremental updates, too.
 *
 * @param <K>
 *          Java type of the keys.
 * @author Bastian Gloeckle
 */
public class ShardedLoader<K> {
  private static final Logger logger = LoggerFactory.getLogger(ShardedLoader.class);

  /** Milliseconds to wait for space in a full shard queue before checking for failed workers again. */
  private static final long OFFER_TIMEOUT_MS = 100;

  private final String dictionaryName;
  private final DictionaryStorage<K> storage;
  private final ExecutorManager executorManager;
  private final int backlog;
  private final boolean requireNonempty;

  /**
   * @param dictionaryName
   *          Name of the dictionary, used for thread names and logging.
   * @param backlog
   *          Maximum number of pending batches per shard.
   * @param requireNonempty
   *          If <code>true</code>, loading fails if the storage does not contain any key afterwards.
   */
  public ShardedLoader(String dictionaryName, DictionaryStorage<K> storage, ExecutorManager executorManager,
      int backlog, boolean requireNonempty) {
    if (backlog < 1)
      throw new IllegalArgumentException("Backlog must be at least 1, but was " + backlog);
    this.dictionaryName = dictionaryName;
    this.storage = storage;
    this.executorManager = executorManager;
    this.backlog = backlog;
    this.requireNonempty = requireNonempty;
  }

  /**
   * Load all blocks of the reader. The reader is not closed.
   * 
   * @return Number of rows read.
   * @throws SourceExhaustedPrematurelyException
   *           If the reader fails.
   * @throws EmptyLoadRejectedException
   *           If the storage is empty after loading and this was not allowed.
   * @throws LoadException
   *           If the data cannot be inserted, e.g. because of values that do not match the types of the attributes.
   */
  public long load(BlockReader reader) throws LoadException {
    long startNanos = System.nanoTime();
    long rows;
    if (storage.getNumberOfShards() == 1)
      rows = loadSingleShard(reader);
    else
      rows = loadSharded(reader);

    long keys = storage.size();
    logger.info("Loaded {} rows into dictionary '{}' in {} ms, it now contains {} keys.", rows, dictionaryName,
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos), keys);

    if (requireNonempty && keys == 0)
      throw new EmptyLoadRejectedException(
          "Dictionary '" + dictionaryName + "' is empty after loading, but it requires to be non-empty.");
    return rows;
  }

  private long loadSingleShard(BlockReader reader) throws LoadException {
    long rows = 0;
    Block block;
    while ((block = readBlock(reader, rows)) != null) {
      PreparedBlock<K> prepared = prepare(block);
      storage.reserve(0, storage.size(0) + block.getNumberOfRows());
      try {
        storage.insertRows(0, prepared.attributeColumns, prepared.keys, null);
      } catch (TypeMismatchException e) {
        throw new LoadException("Invalid value in block for dictionary '" + dictionaryName + "': " + e.getMessage(),
            e);
      }
      rows += block.getNumberOfRows();
    }
    return rows;
  }

  private long loadSharded(BlockReader reader) throws LoadException {
    int shards = storage.getNumberOfShards();
    List<BlockingQueue<ShardWork<K>>> queues = new ArrayList<>(shards);
    for (int i = 0; i < shards; i++)
      queues.add(new ArrayBlockingQueue<>(backlog));

    AtomicReference<Throwable> workerFailure = new AtomicReference<>();
    CountDownLatch workersDone = new CountDownLatch(shards);

    ExecutorService executor = executorManager.newFixedThreadPool("dict-load-" + dictionaryName + "-%d",
        new Thread.UncaughtExceptionHandler() {
          @Override
          public void uncaughtException(Thread t, Throwable e) {
            logger.error("Uncaught exception in loader thread {} of dictionary '{}'", t.getName(), dictionaryName, e);
            workerFailure.compareAndSet(null, e);
          }
        }, shards);

    boolean success = false;
    try {
      for (int shard = 0; shard < shards; shard++)
        executor.execute(new ShardWorker(shard, queues.get(shard), workerFailure, workersDone));

      long rows = 0;
      Block block;
      while ((block = readBlock(reader, rows)) != null) {
        PreparedBlock<K> prepared = prepare(block);

        IntArrayList[] rowsByShard = new IntArrayList[shards];
        for (int row = 0; row < prepared.keys.getNumberOfRows(); row++) {
          int shard = storage.getShard(prepared.keys.getKey(row));
          if (rowsByShard[shard] == null)
            rowsByShard[shard] = new IntArrayList();
          rowsByShard[shard].add(row);
        }

        for (int shard = 0; shard < shards; shard++)
          if (rowsByShard[shard] != null)
            enqueue(queues.get(shard),
                new ShardWork<>(prepared.attributeColumns, prepared.keys, rowsByShard[shard].toIntArray()),
                workerFailure);

        rows += block.getNumberOfRows();
        logger.trace("Dispatched block with {} rows of dictionary '{}' to the shards", block.getNumberOfRows(),
            dictionaryName);
      }

      for (int shard = 0; shard < shards; shard++)
        enqueue(queues.get(shard), ShardWork.endMarker(), workerFailure);

      try {
        workersDone.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new LoadException("Interrupted while waiting for loader threads of dictionary '" + dictionaryName + "'",
            e);
      }
      checkWorkerFailure(workerFailure);

      success = true;
      return rows;
    } finally {
      if (success)
        executor.shutdown();
      else
        executor.shutdownNow();
    }
  }

  private Block readBlock(BlockReader reader, long rowsSoFar) throws LoadException {
    try {
      return reader.read();
    } catch (LoadException | RuntimeException e) {
      throw new SourceExhaustedPrematurelyException("Source of dictionary '" + dictionaryName + "' failed after "
          + rowsSoFar + " rows: " + e.getMessage(), e);
    }
  }

  private PreparedBlock<K> prepare(Block block) throws LoadException {
    try {
      return new PreparedBlock<>(storage.findAttributeColumns(block), storage.extractKeys(block));
    } catch (IllegalArgumentException | TypeMismatchException e) {
      throw new LoadException("Invalid block for dictionary '" + dictionaryName + "': " + e.getMessage(), e);
    }
  }

  private void enqueue(BlockingQueue<ShardWork<K>> queue, ShardWork<K> work, AtomicReference<Throwable> workerFailure)
      throws LoadException {
    checkWorkerFailure(workerFailure);
    try {
      while (!queue.offer(work, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        checkWorkerFailure(workerFailure);
        logger.trace("Shard queue of dictionary '{}' is full, waiting.", dictionaryName);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LoadException("Interrupted while loading dictionary '" + dictionaryName + "'", e);
    }
  }

  private void checkWorkerFailure(AtomicReference<Throwable> workerFailure) throws LoadException {
    Throwable failure = workerFailure.get();
    if (failure != null)
      throw new LoadException(
          "Failed to load data into dictionary '" + dictionaryName + "': " + failure.getMessage(), failure);
  }

  /**
   * Inserts all work provided by one queue into one shard of the storage.
   */
  private class ShardWorker implements Runnable {
    private final int shard;
    private final BlockingQueue<ShardWork<K>> queue;
    private final AtomicReference<Throwable> workerFailure;
    private final CountDownLatch workersDone;

    ShardWorker(int shard, BlockingQueue<ShardWork<K>> queue, AtomicReference<Throwable> workerFailure,
        CountDownLatch workersDone) {
      this.shard = shard;
      this.queue = queue;
      this.workerFailure = workerFailure;
      this.workersDone = workersDone;
    }

    @Override
    public void run() {
      long rows = 0;
      try {
        while (true) {
          ShardWork<K> work = queue.take();
          if (work.isEndMarker())
            break;
          storage.insertRows(shard, work.attributeColumns, work.keys, work.rows);
          rows += work.rows.length;
        }
        logger.debug("Loader worker for shard {} of dictionary '{}' done after {} rows.", shard, dictionaryName,
            rows);
      } catch (InterruptedException e) {
        logger.debug("Loader worker for shard {} of dictionary '{}' was interrupted.", shard, dictionaryName);
        workerFailure.compareAndSet(null, e);
      } catch (RuntimeException e) {
        logger.error("Failed to insert rows into shard {} of dictionary '{}'", shard, dictionaryName, e);
        workerFailure.compareAndSet(null, e);
      } finally {
        workersDone.countDown();
      }
    }
  }

  private static class PreparedBlock<K> {
    private final List<Object[]> attributeColumns;
    private final KeysExtractor<K> keys;

    PreparedBlock(List<Object[]> attributeColumns, KeysExtractor<K> keys) {
      this.attributeColumns = attributeColumns;
      this.keys = keys;
    }
  }

  private static class ShardWork<K> {
    private final List<Object[]> attributeColumns;
    private final KeysExtractor<K> keys;
    private final int[] rows;

    ShardWork(List<Object[]> attributeColumns, KeysExtractor<K> keys, int[] rows) {
      this.attributeColumns = attributeColumns;
      this.keys = keys;
      this.rows = rows;
    }

    static <K> ShardWork<K> endMarker() {
      return new ShardWork<>(null, null, null);
    }

    boolean isEndMarker() {
      return rows == null;
    }
  }
}
