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

package org.logstats.engine.function.builtin;

import io.netty.buffer.ByteBuf;
import io.netty.util.CharsetUtil;
import org.logstats.LogStatsConstants;
import org.logstats.block.BlockColumn;
import org.logstats.block.BlockStats;
import org.logstats.block.QueryBlock;
import org.logstats.block.ValueRenderer;
import org.logstats.block.ValueType;
import org.logstats.engine.function.FieldSelector;
import org.logstats.engine.function.StatsProcessor;
import org.logstats.exception.ExceptionUtil;
import org.logstats.exception.LogStatsInternalError;
import org.logstats.exception.ResultCode;
import org.logstats.storage.BufferPool;
import org.logstats.util.LexicalOrder;
import org.logstats.util.datetime.TimestampFormat;

/**
 * Keeps the lexically smallest or largest canonical text of all observed values.
 *
 * Values of numeric-like columns are compared by their rendered text as well, so
 * <code>"10"</code> is smaller than <code>"2"</code>. The whole-block path only trusts the
 * cached block extremes when the rendered text sorts the same way as the raw values over
 * the cached range, so it always agrees with folding every row one by one.
 */
public abstract class LexicalExtremeProcessor implements StatsProcessor {
  /** object header, the selector and value references, the flags */
  static final int SHALLOW_SIZE = 32;

  private final FieldSelector selector;
  private final boolean strictBlockExtremes;

  private boolean hasItems;
  private String value = LogStatsConstants.EMPTY_STRING;

  protected LexicalExtremeProcessor(FieldSelector selector, boolean strictBlockExtremes) {
    this.selector = selector;
    this.strictBlockExtremes = strictBlockExtremes;
  }

  /**
   * @return true to keep the smallest value, false to keep the largest one
   */
  protected abstract boolean isMinimum();

  @Override
  public int updateStatsForAllRows(QueryBlock block) {
    if (block.isEmpty()) {
      return 0;
    }

    int delta = 0;
    for (BlockColumn column : selector.resolve(block)) {
      delta += updateStateForColumn(block, column);
    }
    return delta;
  }

  @Override
  public int updateStatsForRow(QueryBlock block, int rowIdx) {
    int delta = 0;
    ByteBuf buf = null;
    try {
      for (BlockColumn column : selector.resolve(block)) {
        if (column.isRendered()) {
          if (buf == null) {
            buf = BufferPool.acquireScratch();
          }
          buf.clear();
          column.renderValueAtRow(block, rowIdx, buf);
          delta += updateState(buf);
        } else {
          delta += updateState(column.getValueAtRow(block, rowIdx));
        }
      }
    } finally {
      if (buf != null) {
        BufferPool.releaseScratch(buf);
      }
    }
    return delta;
  }

  @Override
  public void mergeState(StatsProcessor other) {
    if (other.getClass() != getClass()) {
      throw new LogStatsInternalError("cannot merge " + other.getClass().getSimpleName()
          + " into " + getClass().getSimpleName());
    }
    LexicalExtremeProcessor that = (LexicalExtremeProcessor) other;
    if (that.hasItems) {
      updateState(that.value);
    }
  }

  @Override
  public String finalizeStats() {
    return hasItems ? value : LogStatsConstants.NAN;
  }

  @Override
  public int shallowSize() {
    return SHALLOW_SIZE;
  }

  public boolean hasItems() {
    return hasItems;
  }

  private int updateStateForColumn(QueryBlock block, BlockColumn column) {
    if (column.isTime()) {
      return updateStateForTimeColumn(block);
    }
    if (column.isConst()) {
      return updateState(column.getConstValue());
    }

    ValueType type = column.getValueType();
    switch (type) {
    case STRING: {
      int delta = 0;
      for (int i = 0; i < block.getRowCount(); i++) {
        delta += updateState(column.getValueAtRow(block, i));
      }
      return delta;
    }
    case DICT: {
      int delta = 0;
      for (int i = 0; i < column.getDictSize(); i++) {
        if (column.isDictValueUsed(i)) {
          delta += updateState(column.getDictValue(i));
        }
      }
      return delta;
    }
    case UINT8:
    case UINT16:
    case UINT32:
    case UINT64:
    case FLOAT64:
    case IPV4:
    case TIMESTAMP_ISO8601:
      return updateStateForEncodedColumn(block, column);
    default:
      throw ExceptionUtil.panic(ResultCode.UNEXPECTED_VALUE_TYPE, type.name(), "column " + column.getName());
    }
  }

  private int updateStateForEncodedColumn(QueryBlock block, BlockColumn column) {
    ValueType type = column.getValueType();
    BlockStats stats = column.getStats();

    ValueRenderer.TextOrder order = strictBlockExtremes ?
        ValueRenderer.textOrder(type, stats.getMinValue(), stats.getMaxValue()) : ValueRenderer.TextOrder.PRESERVING;

    ByteBuf buf = BufferPool.acquireScratch();
    try {
      switch (order) {
      case PRESERVING:
        ValueRenderer.writeEncoded(buf, type, isMinimum() ? stats.getMinValue() : stats.getMaxValue());
        return updateState(buf);
      case REVERSING:
        ValueRenderer.writeEncoded(buf, type, isMinimum() ? stats.getMaxValue() : stats.getMinValue());
        return updateState(buf);
      default:
        int delta = 0;
        for (int i = 0; i < block.getRowCount(); i++) {
          buf.clear();
          column.renderValueAtRow(block, i, buf);
          delta += updateState(buf);
        }
        return delta;
      }
    } finally {
      BufferPool.releaseScratch(buf);
    }
  }

  /**
   * The extreme instant renders to the extreme text within its second only, since trimmed
   * fractions put <code>...:05Z</code> after <code>...:05.5Z</code>. Every row of that second
   * is folded, the others cannot win.
   */
  private int updateStateForTimeColumn(QueryBlock block) {
    int rowCount = block.getRowCount();
    long extreme = block.getTimestamp(0);
    for (int i = 1; i < rowCount; i++) {
      long ts = block.getTimestamp(i);
      if (isMinimum() ? ts < extreme : ts > extreme) {
        extreme = ts;
      }
    }

    ByteBuf buf = BufferPool.acquireScratch();
    try {
      if (!strictBlockExtremes) {
        ValueRenderer.writeTimestamp(buf, extreme);
        return updateState(buf);
      }

      long second = TimestampFormat.toEpochSecond(extreme);
      int delta = 0;
      for (int i = 0; i < rowCount; i++) {
        long ts = block.getTimestamp(i);
        if (TimestampFormat.toEpochSecond(ts) == second) {
          buf.clear();
          ValueRenderer.writeTimestamp(buf, ts);
          delta += updateState(buf);
        }
      }
      return delta;
    } finally {
      BufferPool.releaseScratch(buf);
    }
  }

  private boolean accepts(String v) {
    return isMinimum() ? LexicalOrder.less(v, value) : LexicalOrder.greater(v, value);
  }

  private boolean accepts(ByteBuf ascii) {
    return isMinimum() ? LexicalOrder.less(ascii, value) : LexicalOrder.greater(ascii, value);
  }

  private int updateState(String v) {
    if (hasItems && !accepts(v)) {
      return 0;
    }
    return replaceValue(v);
  }

  private int updateState(ByteBuf ascii) {
    if (hasItems && !accepts(ascii)) {
      return 0;
    }
    return replaceValue(ascii.toString(CharsetUtil.US_ASCII));
  }

  private int replaceValue(String v) {
    int delta = stateSize(v) - stateSize(value);
    value = v;
    hasItems = true;
    return delta;
  }

  // chars of the held value
  private static int stateSize(String v) {
    return 2 * v.length();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + selector + "): " + finalizeStats();
  }
}
