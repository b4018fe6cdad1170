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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.logstats.conf.LogStatsConf;
import org.logstats.conf.LogStatsConf.ConfVars;
import org.logstats.engine.function.StatsFunction;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * StatsExecutor computes stats functions over shards of blocks on a fixed number of worker threads.
 * Each shard gets its own processor, and the partial states are merged once all shards are done.
 */
public class StatsExecutor implements Closeable {
  private static final Log LOG = LogFactory.getLog(StatsExecutor.class);

  private final ExecutorService threadPool;
  private final long maxStateBytes;

  public StatsExecutor(LogStatsConf conf) {
    int nThreads = conf.getIntVar(ConfVars.STATS_WORKER_THREADS);
    this.maxStateBytes = conf.getLongVar(ConfVars.STATS_MAX_STATE_BYTES);
    this.threadPool = Executors.newFixedThreadPool(nThreads,
        new ThreadFactoryBuilder().setNameFormat("Stats worker #%d").setDaemon(true).build());
    LOG.info("Started StatsExecutor[" + nThreads + "], max state bytes: " + maxStateBytes);
  }

  /**
   * Starts computing the function. Every shard is folded by one worker.
   */
  public StatsQuery submit(final StatsFunction function, List<List<BlockSource>> shards) {
    StatsQuery query = new StatsQuery(function, new StatsMemoryTracker(function.toString(), maxStateBytes));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Stats query " + function + " is started over " + shards.size() + " shard(s)");
    }

    for (final List<BlockSource> shard : shards) {
      query.addPartial(threadPool.submit(() -> query.runShard(shard)));
    }
    return query;
  }

  /**
   * Computes the function and waits for the result.
   */
  public String execute(StatsFunction function, List<List<BlockSource>> shards) {
    return submit(function, shards).get();
  }

  @Override
  public void close() {
    threadPool.shutdownNow();
    LOG.info("StatsExecutor is stopped");
  }
}
