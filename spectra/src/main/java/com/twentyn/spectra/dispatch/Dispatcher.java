/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.spectra.dispatch;

import com.twentyn.spectra.PartitionFailureException;
import com.twentyn.spectra.SpectraConfiguration;
import com.twentyn.spectra.SpectraException;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a per-partition read over a set of partitions and merges the results back into collection row order.
 *
 * Partitions run on a fixed pool of worker threads, one task per partition.  The pool is created on first use and
 * lives until {@link #close()}; collections built without an explicit dispatcher share {@link #getDefault()}, which
 * is never closed and whose daemon workers do not keep the JVM alive.  Each result is placed at the row
 * position its partition names, so the merged output does not depend on how rows were partitioned or on the order in
 * which partitions finish.  Every partition is allowed to finish before failures are reported: the failure of the
 * earliest partition is thrown, tagged with that partition, and failures of later partitions are attached to it as
 * suppressed exceptions.
 */
public class Dispatcher implements Closeable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Dispatcher.class);

  public static final String THREAD_NAME_PATTERN = "spectra-dispatch-%d";

  /**
   * Work done for one partition.  Implementations only read; they must return exactly one result per partition row,
   * in the partition's row order.  They must not dispatch on the dispatcher running them: its workers may all be
   * busy.
   */
  @FunctionalInterface
  public interface PartitionTask<R> {
    List<R> apply(Partition partition);
  }

  private static Dispatcher defaultDispatcher = null;

  private final int parallelism;
  private final boolean shared;
  private ExecutorService executor = null;
  private boolean closed = false;

  public Dispatcher(int parallelism) {
    this(parallelism, false);
  }

  private Dispatcher(int parallelism, boolean shared) {
    if (parallelism < 1) {
      throw new IllegalArgumentException(String.format("Parallelism must be >= 1, got %d", parallelism));
    }
    this.parallelism = parallelism;
    this.shared = shared;
  }

  /**
   * @return The process-wide dispatcher sized from {@link SpectraConfiguration#getDefault()}.
   */
  public static synchronized Dispatcher getDefault() {
    if (defaultDispatcher == null) {
      defaultDispatcher = new Dispatcher(SpectraConfiguration.getDefault().getEffectiveParallelism(), true);
    }
    return defaultDispatcher;
  }

  /**
   * @return A new dispatcher with its own pool; the caller closes it.
   */
  public static Dispatcher fromConfiguration(SpectraConfiguration configuration) {
    return new Dispatcher(configuration.getEffectiveParallelism());
  }

  public int getParallelism() {
    return parallelism;
  }

  /**
   * Runs a task over every partition and merges the results.
   * @param partitions The partitions; together they must cover each of the rowCount rows exactly once.
   * @param rowCount The number of rows in the collection.
   * @param task The per-partition work.
   * @param <R> The per-row result type.
   * @return One result per row, in row order.
   * @throws SpectraException The first partition failure, in partition order.
   */
  public <R> List<R> run(List<Partition> partitions, int rowCount, PartitionTask<R> task) {
    if (isClosed()) {
      throw new IllegalStateException("Dispatcher has been closed");
    }
    Object[] merged = new Object[rowCount];
    Throwable[] failures = new Throwable[partitions.size()];

    if (partitions.size() <= 1 || parallelism == 1) {
      for (int i = 0; i < partitions.size(); i++) {
        try {
          place(partitions.get(i), task.apply(partitions.get(i)), merged);
        } catch (RuntimeException e) {
          failures[i] = e;
        }
      }
    } else {
      runOnPool(partitions, task, merged, failures);
    }

    throwFirstFailure(partitions, failures);

    List<R> result = new ArrayList<>(rowCount);
    for (Object value : merged) {
      @SuppressWarnings("unchecked")
      R r = (R) value;
      result.add(r);
    }
    return result;
  }

  private synchronized ExecutorService getExecutor() {
    if (closed) {
      throw new IllegalStateException("Dispatcher has been closed");
    }
    if (executor == null) {
      executor = Executors.newFixedThreadPool(parallelism, new BasicThreadFactory.Builder()
          .namingPattern(THREAD_NAME_PATTERN)
          .daemon(true)
          .build());
    }
    return executor;
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /**
   * Stops the workers once the partitions already submitted have finished.  A no-op on {@link #getDefault()}.
   */
  @Override
  public synchronized void close() {
    if (shared) {
      LOGGER.warn("Ignoring close() on the default dispatcher");
      return;
    }
    closed = true;
    if (executor != null) {
      executor.shutdown();
      executor = null;
    }
  }

  private <R> void runOnPool(List<Partition> partitions, PartitionTask<R> task, Object[] merged,
                             Throwable[] failures) {
    LOGGER.debug("Dispatching %d partitions over %d workers", partitions.size(), parallelism);
    ExecutorService executor = getExecutor();

    List<Future<List<R>>> futures = new ArrayList<>(partitions.size());
    try {
      for (Partition partition : partitions) {
        Callable<List<R>> callable = () -> task.apply(partition);
        futures.add(executor.submit(callable));
      }

      // Wait for every partition, even after a failure, so no worker is still reading when we return.
      for (int i = 0; i < futures.size(); i++) {
        try {
          place(partitions.get(i), futures.get(i).get(), merged);
        } catch (ExecutionException e) {
          Throwable cause = e.getCause() != null ? e.getCause() : e;
          if (cause instanceof Error) {
            throw (Error) cause;
          }
          failures[i] = cause;
        } catch (RuntimeException e) {
          failures[i] = e;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      for (Future<List<R>> future : futures) {
        future.cancel(true);
      }
      LOGGER.error("Interrupted while waiting for %d partitions", partitions.size());
      throw new SpectraException("Interrupted while reading partitions", e);
    }
  }

  private static <R> void place(Partition partition, List<R> results, Object[] merged) {
    if (results == null || results.size() != partition.size()) {
      throw new IllegalStateException(String.format("Partition task returned %s results for %d rows",
          results == null ? "no" : Integer.toString(results.size()), partition.size()));
    }
    int[] rows = partition.getRows();
    for (int i = 0; i < rows.length; i++) {
      merged[rows[i]] = results.get(i);
    }
  }

  private static void throwFirstFailure(List<Partition> partitions, Throwable[] failures) {
    SpectraException first = null;
    for (int i = 0; i < failures.length; i++) {
      Throwable failure = failures[i];
      if (failure == null) {
        continue;
      }
      String description = partitions.get(i).describe();
      if (first == null) {
        if (failure instanceof SpectraException) {
          first = ((SpectraException) failure).tagPartition(description);
        } else {
          first = new PartitionFailureException(description, failure);
        }
      } else if (failure != first) {
        first.addSuppressed(failure);
      }
    }
    if (first != null) {
      LOGGER.error("%d of %d partitions failed; first failure: %s",
          Arrays.stream(failures).filter(f -> f != null).count(), partitions.size(), first.getMessage());
      throw first;
    }
  }
}
