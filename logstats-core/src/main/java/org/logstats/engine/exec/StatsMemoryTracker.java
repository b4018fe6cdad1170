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

import org.logstats.exception.LogStatsRuntimeException;
import org.logstats.exception.ResultCode;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sums the state sizes reported by all processors of one query and fails the query once the
 * total exceeds the limit.
 */
public class StatsMemoryTracker {
  private final String queryDesc;
  private final long limit;
  private final AtomicLong used = new AtomicLong();

  public StatsMemoryTracker(String queryDesc, long limit) {
    this.queryDesc = queryDesc;
    this.limit = limit;
  }

  /**
   * @param delta bytes allocated (positive) or released (negative) by a processor
   * @throws LogStatsRuntimeException with {@link ResultCode#MEMORY_LIMIT_EXCEEDED}
   */
  public void charge(long delta) {
    if (delta == 0) {
      return;
    }
    long total = used.addAndGet(delta);
    if (delta > 0 && total > limit) {
      throw new LogStatsRuntimeException(ResultCode.MEMORY_LIMIT_EXCEEDED, queryDesc, Long.toString(limit));
    }
  }

  public long getUsed() {
    return used.get();
  }

  public long getLimit() {
    return limit;
  }
}
