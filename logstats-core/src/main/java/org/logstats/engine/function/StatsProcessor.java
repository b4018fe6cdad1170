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

package org.logstats.engine.function;

import org.logstats.block.QueryBlock;

/**
 * The running state of one stats function in one computation context.
 *
 * A processor is owned by a single thread. Partial processors computed over disjoint inputs
 * are combined with {@link #mergeState(StatsProcessor)} in any order or grouping.
 */
public interface StatsProcessor {

  /**
   * Folds every row of the block into the state.
   *
   * @return the change of the retained state size in bytes
   */
  int updateStatsForAllRows(QueryBlock block);

  /**
   * Folds the row at <code>rowIdx</code> into the state.
   *
   * @return the change of the retained state size in bytes
   */
  int updateStatsForRow(QueryBlock block, int rowIdx);

  /**
   * Folds the state of a processor created by the same function into this one.
   */
  void mergeState(StatsProcessor other);

  /**
   * @return the result text; <code>NaN</code> if nothing has been observed
   */
  String finalizeStats();

  /**
   * @return the footprint of a freshly created processor in bytes
   */
  int shallowSize();
}
