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
import io.netty.buffer.ByteBuf;

/**
 * A read-only view of one column of a {@link QueryBlock}.
 *
 * Values are kept in their physical encoding. String-like encodings expose their text
 * directly; numeric-like encodings and the time column are rendered on demand, and
 * numeric-like encodings carry the block-level {@link BlockStats}.
 */
public class BlockColumn {
  private final String name;
  private final ValueType valueType;
  private final boolean isConst;
  private final boolean isTime;

  // STRING rows, or the single value of a const column
  private final String[] valuesEncoded;

  // DICT
  private final String[] dictValues;
  private final byte[] dictIndexes;
  private final boolean[] dictValueUsed;

  // numeric-like rows
  private final long[] encoded;
  private final BlockStats stats;

  private BlockColumn(String name, ValueType valueType, boolean isConst, boolean isTime,
                      String[] valuesEncoded, String[] dictValues, byte[] dictIndexes,
                      long[] encoded, BlockStats stats) {
    this.name = Preconditions.checkNotNull(name);
    this.valueType = valueType;
    this.isConst = isConst;
    this.isTime = isTime;
    this.valuesEncoded = valuesEncoded;
    this.dictValues = dictValues;
    this.dictIndexes = dictIndexes;
    this.encoded = encoded;
    this.stats = stats;

    if (dictIndexes != null) {
      this.dictValueUsed = new boolean[dictValues.length];
      for (byte idx : dictIndexes) {
        dictValueUsed[idx & 0xFF] = true;
      }
    } else {
      this.dictValueUsed = null;
    }
  }

  static BlockColumn newConstColumn(String name, String value) {
    return new BlockColumn(name, ValueType.STRING, true, false,
        new String[] {Preconditions.checkNotNull(value)}, null, null, null, null);
  }

  // the time column has no type tag of its own, its rows are the raw timestamps of the block
  static BlockColumn newTimeColumn(String name) {
    return new BlockColumn(name, ValueType.UINT64, false, true, null, null, null, null, null);
  }

  static BlockColumn newStringColumn(String name, String[] values) {
    return new BlockColumn(name, ValueType.STRING, false, false, values, null, null, null, null);
  }

  static BlockColumn newDictColumn(String name, String[] dictValues, byte[] indexes) {
    for (byte idx : indexes) {
      Preconditions.checkArgument((idx & 0xFF) < dictValues.length,
          "dictionary index %s is out of range for column %s", idx & 0xFF, name);
    }
    return new BlockColumn(name, ValueType.DICT, false, false, null, dictValues, indexes, null, null);
  }

  static BlockColumn newEncodedColumn(String name, ValueType type, long[] encoded, BlockStats stats) {
    Preconditions.checkArgument(type.isNumericLike(), "%s is not a numeric-like type", type);
    return new BlockColumn(name, type, false, false, null, null, null, encoded, stats);
  }

  public String getName() {
    return name;
  }

  public ValueType getValueType() {
    return valueType;
  }

  public boolean isConst() {
    return isConst;
  }

  public boolean isTime() {
    return isTime;
  }

  /**
   * @return true if the values are produced by rendering into a buffer
   * rather than being available as strings
   */
  public boolean isRendered() {
    return isTime || (!isConst && valueType.isNumericLike());
  }

  public String getConstValue() {
    Preconditions.checkState(isConst, "%s is not a const column", name);
    return valuesEncoded[0];
  }

  public int getDictSize() {
    Preconditions.checkState(valueType == ValueType.DICT, "%s is not a dict column", name);
    return dictValues.length;
  }

  /**
   * @return the dictionary entry at the given index, in order of first occurrence
   */
  public String getDictValue(int dictIdx) {
    Preconditions.checkState(valueType == ValueType.DICT, "%s is not a dict column", name);
    return dictValues[dictIdx];
  }

  /**
   * @return true if at least one row of this block refers to the given dictionary entry
   */
  public boolean isDictValueUsed(int dictIdx) {
    return dictValueUsed[dictIdx];
  }

  public BlockStats getStats() {
    Preconditions.checkState(!isTime && !isConst && valueType.isNumericLike(),
        "%s has no block stats", name);
    return stats;
  }

  /**
   * Returns the canonical text of the value at the given row.
   */
  public String getValueAtRow(QueryBlock block, int rowIdx) {
    if (isConst) {
      return valuesEncoded[0];
    }
    if (isTime) {
      return ValueRenderer.renderTimestamp(block.getTimestamp(rowIdx));
    }

    switch (valueType) {
    case STRING:
      return valuesEncoded[rowIdx];
    case DICT:
      return dictValues[dictIndexes[rowIdx] & 0xFF];
    default:
      return ValueRenderer.renderEncoded(valueType, encoded[rowIdx]);
    }
  }

  /**
   * Appends the ASCII text of the value at the given row to <code>buf</code> without allocating.
   * Only valid for columns where {@link #isRendered()} is true.
   */
  public void renderValueAtRow(QueryBlock block, int rowIdx, ByteBuf buf) {
    Preconditions.checkState(isRendered(), "%s holds string values", name);
    if (isTime) {
      ValueRenderer.writeTimestamp(buf, block.getTimestamp(rowIdx));
    } else {
      ValueRenderer.writeEncoded(buf, valueType, encoded[rowIdx]);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name).append(" (");
    if (isTime) {
      sb.append("time");
    } else if (isConst) {
      sb.append("const");
    } else {
      sb.append(valueType.name().toLowerCase());
    }
    return sb.append(")").toString();
  }
}
