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

import org.logstats.exception.ExceptionUtil;
import org.logstats.exception.ResultCode;

/**
 * Physical encodings of the values of a block column.
 */
public enum ValueType {
  /** plain strings, one per row */
  STRING(1, false, 0),
  /** per-row indexes into a small ordered list of distinct strings */
  DICT(2, false, 0),
  UINT8(3, true, 0xFFL),
  UINT16(4, true, 0xFFFFL),
  UINT32(5, true, 0xFFFFFFFFL),
  UINT64(6, true, -1L),
  /** IEEE 754 bits of a 64-bit float */
  FLOAT64(7, true, 0),
  /** big-endian IPv4 address in the lower 32 bits */
  IPV4(8, true, 0xFFFFFFFFL),
  /** nanoseconds since the Unix epoch, ingested from ISO 8601 text */
  TIMESTAMP_ISO8601(9, true, 0);

  private static final ValueType[] BY_TAG;

  static {
    BY_TAG = new ValueType[values().length + 1];
    for (ValueType type : values()) {
      BY_TAG[type.tag] = type;
    }
  }

  private final int tag;
  private final boolean numericLike;
  private final long maxUnsignedValue;

  ValueType(int tag, boolean numericLike, long maxUnsignedValue) {
    this.tag = tag;
    this.numericLike = numericLike;
    this.maxUnsignedValue = maxUnsignedValue;
  }

  /**
   * @return the one-byte tag identifying this type in storage
   */
  public int tag() {
    return tag;
  }

  /**
   * @return true if values are kept as raw 64-bit encodings with cached block min/max
   */
  public boolean isNumericLike() {
    return numericLike;
  }

  public boolean isUnsignedInt() {
    return this == UINT8 || this == UINT16 || this == UINT32 || this == UINT64;
  }

  /**
   * @return the largest unsigned value for fixed-width integer types and IPv4
   */
  public long maxUnsignedValue() {
    return maxUnsignedValue;
  }

  /**
   * Decodes a storage tag. An unknown tag means that the block was written by an incompatible
   * storage version or is corrupted, so the process is stopped instead of producing wrong results.
   */
  public static ValueType fromTag(int tag) {
    if (tag > 0 && tag < BY_TAG.length) {
      return BY_TAG[tag];
    }
    throw ExceptionUtil.panic(ResultCode.UNKNOWN_VALUE_TYPE, Integer.toString(tag));
  }
}
