/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.logstats.engine.exec;

import com.google.common.collect.Lists;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.logstats.block.QueryBlock;
import org.logstats.engine.function.StatsFunction;
import org.logstats.engine.function.StatsProcessor;
import org.logstats.exception.LogStatsRuntimeException;
import org.logstats.exception.ResultCode;

import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * A running stats query. Every shard is computed by its own processor on a worker thread;
 * {@link #get()} merges the partial states and finalizes the result.
 */
public class StatsQuery {
  private static final Log LOG = LogFactory.getLog(StatsQuery.class);

  private final StatsFunction function;
  private final StatsMemoryTracker memoryTracker;
  private final List<Future<StatsProcessor>> partials = Lists.newArrayList();
  private volatile boolean killed;

  StatsQuery(StatsFunction function, StatsMemoryTracker memoryTracker) {
    this.function = function;
    this.memoryTracker = memoryTracker;
  }

  public StatsFunction getFunction() {
    return function;
  }

  public StatsMemoryTracker getMemoryTracker() {
    return memoryTracker;
  }

  void addPartial(Future<StatsProcessor> partial) {
    partials.add(partial);
  }

  /**
   * Stops the workers before their next block. A later {@link #get()} fails with
   * {@link ResultCode#QUERY_KILLED}.
   */
  public void kill() {
    if (!killed) {
      killed = true;
      LOG.info("Stats query " + function + " is killed");
    }
  }

  public boolean isKilled() {
    return killed;
  }

  /**
   * Folds one shard into a new processor. It runs on a worker thread.
   */
  StatsProcessor runShard(List<BlockSource> shard) {
    StatsProcessor processor = function.newStatsProcessor();
    memoryTracker.charge(processor.shallowSize());

    for (BlockSource source : shard) {
      if (killed || Thread.currentThread().isInterrupted()) {
        throw new LogStatsRuntimeException(ResultCode.QUERY_KILLED);
      }

      QueryBlock block = source.getBlock();
      if (source.hasRowSelection()) {
        BitSet rows = source.getRows();
        for (int i = rows.nextSetBit(0); i >= 0; i = rows.nextSetBit(i + 1)) {
          memoryTracker.charge(processor.updateStatsForRow(block, i));
        }
      } else {
        memoryTracker.charge(processor.updateStatsForAllRows(block));
      }
    }
    return processor;
  }

  /**
   * Waits for every shard, then merges the partial states and finalizes them.
   *
   * @return the result of the stats function over all shards
   * @throws LogStatsRuntimeException if the query was killed, ran out of memory or failed
   */
  public String get() {
    List<StatsProcessor> processors = Lists.newArrayListWithCapacity(partials.size());
    for (Future<StatsProcessor> partial : partials) {
      try {
        processors.add(partial.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        kill();
        throw new LogStatsRuntimeException(ResultCode.QUERY_KILLED);
      } catch (CancellationException e) {
        throw new LogStatsRuntimeException(ResultCode.QUERY_KILLED);
      } catch (ExecutionException e) {
        kill();
        throw unwrap(e);
      }
    }

    if (killed) {
      throw new LogStatsRuntimeException(ResultCode.QUERY_KILLED);
    }

    String result = merge(processors).finalizeStats();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Stats query " + function + " is finished over " + partials.size() + " shard(s): " + result);
    }
    return result;
  }

  /**
   * Merges neighbours pairwise, level by level, so the merge depth is logarithmic in the
   * number of partial states.
   */
  StatsProcessor merge(List<StatsProcessor> processors) {
    if (processors.isEmpty()) {
      return function.newStatsProcessor();
    }

    List<StatsProcessor> level = processors;
    while (level.size() > 1) {
      List<StatsProcessor> next = Lists.newArrayListWithCapacity((level.size() + 1) / 2);
      for (int i = 0; i < level.size(); i += 2) {
        StatsProcessor left = level.get(i);
        if (i + 1 < level.size()) {
          left.mergeState(level.get(i + 1));
        }
        next.add(left);
      }
      level = next;
    }
    return level.get(0);
  }

  private RuntimeException unwrap(ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof LogStatsRuntimeException
        && ((LogStatsRuntimeException) cause).getErrorCode() == ResultCode.QUERY_KILLED) {
      return (LogStatsRuntimeException) cause;
    }

    LOG.error("Stats query " + function + " has been failed: " + cause.getMessage(), cause);
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new LogStatsRuntimeException(ResultCode.QUERY_FAILED, cause, String.valueOf(cause));
  }
}
