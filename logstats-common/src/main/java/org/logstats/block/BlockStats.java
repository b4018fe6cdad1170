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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Block-level minimum and maximum of a numeric-like column, kept as raw encodings.
 * The storage layer computes it once per block; it must equal the extremes of the row values.
 */
public class BlockStats {
  private final long minValue;
  private final long maxValue;

  public BlockStats(long minValue, long maxValue) {
    this.minValue = minValue;
    this.maxValue = maxValue;
  }

  public long getMinValue() {
    return minValue;
  }

  public long getMaxValue() {
    return maxValue;
  }

  /**
   * Computes the extremes of the given encoded values in the natural order of the type.
   */
  public static BlockStats compute(ValueType type, long[] encoded) {
    Preconditions.checkArgument(type.isNumericLike(), "no block stats for %s", type);
    Preconditions.checkArgument(encoded.length > 0, "no values");

    long min = encoded[0];
    long max = encoded[0];
    for (int i = 1; i < encoded.length; i++) {
      long v = encoded[i];
      if (compare(type, v, min) < 0) {
        min = v;
      }
      if (compare(type, v, max) > 0) {
        max = v;
      }
    }
    return new BlockStats(min, max);
  }

  static int compare(ValueType type, long a, long b) {
    switch (type) {
    case FLOAT64:
      return Double.compare(Double.longBitsToDouble(a), Double.longBitsToDouble(b));
    case TIMESTAMP_ISO8601:
      return Long.compare(a, b);
    default:
      return Long.compareUnsigned(a, b);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof BlockStats) {
      BlockStats other = (BlockStats) obj;
      return minValue == other.minValue && maxValue == other.maxValue;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(minValue, maxValue);
  }

  @Override
  public String toString() {
    return "min=" + minValue + ", max=" + maxValue;
  }
}
