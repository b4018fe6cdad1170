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

import com.google.common.base.Preconditions;
import org.logstats.block.QueryBlock;

import java.util.BitSet;

/**
 * One input block of a stats query, optionally restricted to the rows which passed
 * the query filters.
 */
public class BlockSource {
  private final QueryBlock block;
  private final BitSet rows;

  private BlockSource(QueryBlock block, BitSet rows) {
    this.block = Preconditions.checkNotNull(block);
    this.rows = rows;
  }

  /**
   * All rows of the block take part.
   */
  public static BlockSource of(QueryBlock block) {
    return new BlockSource(block, null);
  }

  /**
   * Only the rows whose bits are set take part. The bit set is copied.
   */
  public static BlockSource of(QueryBlock block, BitSet rows) {
    Preconditions.checkArgument(rows.length() <= block.getRowCount(),
        "row %s is selected, but the block has %s rows", rows.length() - 1, block.getRowCount());
    return new BlockSource(block, (BitSet) rows.clone());
  }

  public QueryBlock getBlock() {
    return block;
  }

  public boolean hasRowSelection() {
    return rows != null;
  }

  public BitSet getRows() {
    Preconditions.checkState(rows != null, "no row selection");
    return rows;
  }

  @Override
  public String toString() {
    return rows == null ? "all rows of " + block : "rows " + rows + " of " + block;
  }
}
