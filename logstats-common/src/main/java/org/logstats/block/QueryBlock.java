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

package org.logstats.block;

import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;
import org.logstats.LogStatsConstants;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A batch of rows produced by one scan iteration. Columns keep their physical encodings.
 *
 * A block is immutable once built: the builder copies every array it is given and
 * columns expose their rows by index only. Stats processors read a block during a single
 * update call and never keep a reference to it.
 */
public class QueryBlock {
  /** the largest number of distinct values in a dictionary-encoded column */
  public static final int MAX_DICT_VALUES = 8;

  private final int rowCount;
  private final long[] timestamps;
  private final Map<String, BlockColumn> columns;

  private QueryBlock(int rowCount, long[] timestamps, Map<String, BlockColumn> columns) {
    this.rowCount = rowCount;
    this.timestamps = timestamps;
    this.columns = Collections.unmodifiableMap(columns);
  }

  public int getRowCount() {
    return rowCount;
  }

  public boolean isEmpty() {
    return rowCount == 0;
  }

  public boolean hasTimestamps() {
    return timestamps != null;
  }

  /**
   * @return the timestamp of the given row in nanoseconds since the Unix epoch
   */
  public long getTimestamp(int rowIdx) {
    Preconditions.checkState(timestamps != null, "the block has no timestamps");
    return timestamps[rowIdx];
  }

  /**
   * @return all columns in the order they were added
   */
  public Collection<BlockColumn> getColumns() {
    return columns.values();
  }

  /**
   * Returns the column with the given name. A column missing in this block reads as
   * an empty string at every row.
   */
  public BlockColumn getColumnByName(String name) {
    BlockColumn column = columns.get(name);
    if (column == null) {
      return BlockColumn.newConstColumn(name, LogStatsConstants.EMPTY_STRING);
    }
    return column;
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  @Override
  public String toString() {
    return "rows=" + rowCount + ", columns=" + columns.values();
  }

  public static Builder newBuilder(int rowCount) {
    return new Builder(rowCount);
  }

  public static class Builder {
    private final int rowCount;
    private long[] timestamps;
    private final Map<String, BlockColumn> columns = new LinkedHashMap<>();

    private Builder(int rowCount) {
      Preconditions.checkArgument(rowCount >= 0, "negative row count: %s", rowCount);
      this.rowCount = rowCount;
    }

    public Builder setTimestamps(long... timestamps) {
      checkRows("timestamps", timestamps.length);
      this.timestamps = timestamps.clone();
      return this;
    }

    /**
     * Exposes the block timestamps as the <code>_time</code> column.
     */
    public Builder addTimeColumn() {
      return addTimeColumn(LogStatsConstants.TIME_FIELD);
    }

    public Builder addTimeColumn(String name) {
      Preconditions.checkState(timestamps != null, "timestamps must be set before the time column");
      return add(BlockColumn.newTimeColumn(name));
    }

    public Builder addConstColumn(String name, String value) {
      return add(BlockColumn.newConstColumn(name, value));
    }

    public Builder addStringColumn(String name, String... values) {
      checkRows(name, values.length);
      return add(BlockColumn.newStringColumn(name, values.clone()));
    }

    public Builder addDictColumn(String name, String[] dictValues, byte[] indexes) {
      checkRows(name, indexes.length);
      Preconditions.checkArgument(dictValues.length <= MAX_DICT_VALUES,
          "too many dictionary values for %s: %s", name, dictValues.length);
      return add(BlockColumn.newDictColumn(name, dictValues.clone(), indexes.clone()));
    }

    /**
     * Dictionary-encodes the given row values. The dictionary keeps the order of first occurrence.
     */
    public Builder addDictColumn(String name, String... rowValues) {
      checkRows(name, rowValues.length);
      Map<String, Integer> dict = new LinkedHashMap<>();
      byte[] indexes = new byte[rowValues.length];
      for (int i = 0; i < rowValues.length; i++) {
        Integer idx = dict.get(rowValues[i]);
        if (idx == null) {
          idx = dict.size();
          dict.put(rowValues[i], idx);
        }
        indexes[i] = (byte) idx.intValue();
      }
      return addDictColumn(name, dict.keySet().toArray(new String[dict.size()]), indexes);
    }

    public Builder addUintColumn(String name, ValueType type, long... values) {
      Preconditions.checkArgument(type.isUnsignedInt(), "%s is not an unsigned integer type", type);
      for (long v : values) {
        Preconditions.checkArgument(Long.compareUnsigned(v, type.maxUnsignedValue()) <= 0,
            "%s does not fit in %s", Long.toUnsignedString(v), type);
      }
      return addEncodedColumn(name, type, values);
    }

    public Builder addFloat64Column(String name, double... values) {
      long[] encoded = new long[values.length];
      for (int i = 0; i < values.length; i++) {
        encoded[i] = Double.doubleToRawLongBits(values[i]);
      }
      return addOwnedEncodedColumn(name, ValueType.FLOAT64, encoded);
    }

    public Builder addIPv4Column(String name, String... addresses) {
      long[] encoded = new long[addresses.length];
      for (int i = 0; i < addresses.length; i++) {
        InetAddress address = InetAddresses.forString(addresses[i]);
        Preconditions.checkArgument(address instanceof Inet4Address, "not an IPv4 address: %s", addresses[i]);
        encoded[i] = InetAddresses.coerceToInteger(address) & 0xFFFFFFFFL;
      }
      return addOwnedEncodedColumn(name, ValueType.IPV4, encoded);
    }

    /**
     * @param nanos timestamps in nanoseconds since the Unix epoch
     */
    public Builder addTimestampISO8601Column(String name, long... nanos) {
      return addEncodedColumn(name, ValueType.TIMESTAMP_ISO8601, nanos);
    }

    /**
     * Adds a numeric-like column and computes its block stats from the values.
     */
    public Builder addEncodedColumn(String name, ValueType type, long[] encoded) {
      return addOwnedEncodedColumn(name, type, encoded.clone());
    }

    /**
     * Adds a numeric-like column read from storage, where the type arrives as a storage tag
     * and the block stats have been computed by the writer.
     */
    public Builder addEncodedColumn(String name, int typeTag, long[] encoded, BlockStats stats) {
      ValueType type = ValueType.fromTag(typeTag);
      checkRows(name, encoded.length);
      Preconditions.checkArgument(type.isNumericLike(), "%s has no raw encoding", type);
      return add(BlockColumn.newEncodedColumn(name, type, encoded.clone(), Preconditions.checkNotNull(stats)));
    }

    public QueryBlock build() {
      return new QueryBlock(rowCount, timestamps, new LinkedHashMap<>(columns));
    }

    // the stats are computed from the array the column keeps
    private Builder addOwnedEncodedColumn(String name, ValueType type, long[] encoded) {
      checkRows(name, encoded.length);
      BlockStats stats = encoded.length == 0 ? new BlockStats(0, 0) : BlockStats.compute(type, encoded);
      return add(BlockColumn.newEncodedColumn(name, type, encoded, stats));
    }

    private Builder add(BlockColumn column) {
      Preconditions.checkArgument(!columns.containsKey(column.getName()),
          "duplicate column: %s", column.getName());
      columns.put(column.getName(), column);
      return this;
    }

    private void checkRows(String name, int length) {
      Preconditions.checkArgument(length == rowCount,
          "%s has %s values, but the block has %s rows", name, length, rowCount);
    }
  }
}
