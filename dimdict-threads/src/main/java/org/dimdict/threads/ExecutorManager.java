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
package org.dimdict.threads;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import javax.annotation.PreDestroy;

import org.dimdict.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Manages {@link ExecutorService}s for dimdict.
 * 
 * <p>
 * All executors created by this manager are remembered until they terminate, so {@link #shutdownEverything()} can stop
 * all threads that are still alive, e.g. when the context is closed.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class ExecutorManager {
  private static final Logger logger = LoggerFactory.getLogger(ExecutorManager.class);

  private List<ExecutorService> executors = new ArrayList<>();

  /**
   * Create a new thread pool with a fixed set of threads, see {@link Executors#newFixedThreadPool(int)}.
   * 
   * <p>
   * Note that exceptions thrown by tasks that were passed to {@link ExecutorService#submit(Runnable)} will not reach the
   * uncaughtExceptionHandler, but will be available in the corresponding {@link java.util.concurrent.Future}.
   * 
   * @param nameFormat
   *          a {@link String#format(String, Object...)}-compatible format String, to which a unique integer (0, 1,
   *          etc.) will be supplied as the single parameter. For example, {@code "dict-load-%d"} will generate thread
   *          names like {@code "dict-load-0"}, {@code "dict-load-1"}, etc.
   * @param uncaughtExceptionHandler
   *          Called in case any of the threads ends because an exception was thrown.
   * @param numberOfThreads
   *          Number of threads the thread pool should have.
   * @return The new thread pool.
   */
  public ExecutorService newFixedThreadPool(String nameFormat, UncaughtExceptionHandler uncaughtExceptionHandler,
      int numberOfThreads) {
    ThreadFactoryBuilder threadFactoryBuilder = new ThreadFactoryBuilder();
    threadFactoryBuilder.setNameFormat(nameFormat);
    threadFactoryBuilder.setUncaughtExceptionHandler(uncaughtExceptionHandler);

    return register(new ThreadPoolExecutor(numberOfThreads, numberOfThreads, 0L, TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<Runnable>(), threadFactoryBuilder.build()));
  }

  /**
   * Calls {@link ExecutorService#shutdownNow()} on all executors created by this manager that did not terminate yet.
   */
  @PreDestroy
  public void shutdownEverything() {
    List<ExecutorService> toShutdown;
    synchronized (executors) {
      toShutdown = new ArrayList<>(executors);
      executors.clear();
    }

    int active = 0;
    for (ExecutorService executor : toShutdown) {
      if (!executor.isTerminated()) {
        active++;
        executor.shutdownNow();
      }
    }
    if (active > 0)
      logger.info("Shut down {} executors that were still active.", active);
  }

  /**
   * @return Number of executors that were created by this manager and did not terminate yet.
   */
  public int getNumberOfActiveExecutors() {
    synchronized (executors) {
      executors.removeIf(e -> e.isTerminated());
      return executors.size();
    }
  }

  private ExecutorService register(ExecutorService executor) {
    synchronized (executors) {
      // forget about the ones that are done already.
      executors.removeIf(e -> e.isTerminated());
      executors.add(executor);
    }
    return executor;
  }
}
