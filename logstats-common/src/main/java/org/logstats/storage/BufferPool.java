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

package org.logstats.storage;

import com.google.common.annotations.VisibleForTesting;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.buffer.UnpooledByteBufAllocator;
import io.netty.util.ResourceLeakDetector;
import io.netty.util.internal.PlatformDependent;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.logstats.LogStatsConstants;
import org.logstats.conf.LogStatsConf;
import org.logstats.conf.LogStatsConf.ConfVars;

import java.util.concurrent.atomic.AtomicLong;

/* this class is PooledBuffer holder */
public class BufferPool {
  private static final Log LOG = LogFactory.getLog(BufferPool.class);

  private static final ByteBufAllocator ALLOCATOR;
  private static final int SCRATCH_INITIAL_SIZE;

  /* only maintained in test mode, the hot path must not pay for a shared counter */
  private static final boolean TRACK_SCRATCH = LogStatsConstants.IS_TEST_MODE;
  private static final AtomicLong OUTSTANDING_SCRATCH = new AtomicLong();

  private BufferPool() {
  }

  static {
    LogStatsConf conf = new LogStatsConf();
    SCRATCH_INITIAL_SIZE = conf.getIntVar(ConfVars.SCRATCH_BUFFER_INITIAL_SIZE);

    if (LogStatsConstants.IS_TEST_MODE) {
      /* Disable pooling buffers for memory usage  */
      ALLOCATOR = UnpooledByteBufAllocator.DEFAULT;

      /* if you are finding memory leak, please enable this line */
      ResourceLeakDetector.setLevel(ResourceLeakDetector.Level.PARANOID);
    } else {
      ALLOCATOR = createPooledByteBufAllocator(false, conf.getBoolVar(ConfVars.BUFFER_POOL_THREAD_LOCAL_CACHE), 0);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Scratch buffers are allocated by " + ALLOCATOR.getClass().getSimpleName()
          + " (initial size: " + SCRATCH_INITIAL_SIZE + ")");
    }
  }

  public static PooledByteBufAllocator createPooledByteBufAllocator(
      boolean allowDirectBufs,
      boolean allowCache,
      int numCores) {
    if (numCores == 0) {
      numCores = Runtime.getRuntime().availableProcessors();
    }
    return new PooledByteBufAllocator(
        allowDirectBufs && PlatformDependent.directBufferPreferred(),
        Math.min(PooledByteBufAllocator.defaultNumHeapArena(), numCores),
        Math.min(PooledByteBufAllocator.defaultNumDirectArena(), allowDirectBufs ? numCores : 0),
        PooledByteBufAllocator.defaultPageSize(),
        PooledByteBufAllocator.defaultMaxOrder(),
        allowCache ? PooledByteBufAllocator.defaultSmallCacheSize() : 0,
        allowCache ? PooledByteBufAllocator.defaultNormalCacheSize() : 0,
        allowCache && PooledByteBufAllocator.defaultUseCacheForAllThreads()
    );
  }

  /**
   * Borrows a heap buffer which is used to render a single value into text.
   * Every call must be paired with {@link #releaseScratch(ByteBuf)} in a finally block.
   *
   * @return an empty buffer
   */
  public static ByteBuf acquireScratch() {
    ByteBuf buf = ALLOCATOR.heapBuffer(SCRATCH_INITIAL_SIZE);
    if (TRACK_SCRATCH) {
      OUTSTANDING_SCRATCH.incrementAndGet();
    }
    return buf;
  }

  /**
   * Gives the buffer back to the pool. The buffer must not be used afterwards.
   */
  public static void releaseScratch(ByteBuf buf) {
    buf.release();
    if (TRACK_SCRATCH) {
      OUTSTANDING_SCRATCH.decrementAndGet();
    }
  }

  /**
   * @return the number of scratch buffers which have been acquired but not released yet.
   * It is always zero unless the test mode is enabled.
   */
  @VisibleForTesting
  public static long outstandingScratchBuffers() {
    return OUTSTANDING_SCRATCH.get();
  }
}
