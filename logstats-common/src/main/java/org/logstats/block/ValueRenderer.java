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

import io.netty.buffer.ByteBuf;
import io.netty.util.CharsetUtil;
import org.logstats.exception.ExceptionUtil;
import org.logstats.exception.ResultCode;
import org.logstats.storage.BufferPool;
import org.logstats.util.NumberUtil;
import org.logstats.util.datetime.TimestampFormat;

/**
 * Renders raw column encodings into their canonical text form.
 *
 * All stats functions compare values by this text, including values of numeric columns.
 * The text of every numeric-like encoding is ASCII.
 */
public class ValueRenderer {

  /**
   * How the lexical order of rendered values relates to the natural order of the encoded
   * values within a block, given the block's cached minimum and maximum.
   */
  public enum TextOrder {
    /** the text of the smallest value is the lexically smallest text */
    PRESERVING,
    /** the text of the largest value is the lexically smallest text */
    REVERSING,
    /** neither holds for every value in the range */
    MIXED
  }

  private ValueRenderer() {
  }

  /**
   * Appends the canonical text of a raw numeric-like encoding.
   */
  public static void writeEncoded(ByteBuf buf, ValueType type, long encoded) {
    switch (type) {
    case UINT8:
    case UINT16:
    case UINT32:
    case UINT64:
      NumberUtil.writeUnsignedDecimal(buf, encoded);
      break;
    case FLOAT64:
      NumberUtil.writeFloat64(buf, Double.longBitsToDouble(encoded));
      break;
    case IPV4:
      writeIPv4(buf, (int) encoded);
      break;
    case TIMESTAMP_ISO8601:
      TimestampFormat.writeISO8601(buf, encoded);
      break;
    default:
      throw ExceptionUtil.panic(ResultCode.UNEXPECTED_VALUE_TYPE, type.name(), "an encoded value");
    }
  }

  /**
   * Appends the canonical text of a value of the time column.
   */
  public static void writeTimestamp(ByteBuf buf, long nanos) {
    TimestampFormat.writeRFC3339Nano(buf, nanos);
  }

  public static String renderEncoded(ValueType type, long encoded) {
    ByteBuf buf = BufferPool.acquireScratch();
    try {
      writeEncoded(buf, type, encoded);
      return buf.toString(CharsetUtil.US_ASCII);
    } finally {
      BufferPool.releaseScratch(buf);
    }
  }

  public static String renderTimestamp(long nanos) {
    ByteBuf buf = BufferPool.acquireScratch();
    try {
      writeTimestamp(buf, nanos);
      return buf.toString(CharsetUtil.US_ASCII);
    } finally {
      BufferPool.releaseScratch(buf);
    }
  }

  /**
   * Tells whether the lexical extreme of all values between <code>min</code> and <code>max</code>
   * can be derived from the cached extremes alone.
   */
  public static TextOrder textOrder(ValueType type, long min, long max) {
    if (min == max) {
      return TextOrder.PRESERVING;
    }

    switch (type) {
    case UINT8:
    case UINT16:
    case UINT32:
    case UINT64:
      // numbers of the same width sort the same way as text
      return NumberUtil.unsignedDecimalLength(min) == NumberUtil.unsignedDecimalLength(max) ?
          TextOrder.PRESERVING : TextOrder.MIXED;
    case FLOAT64:
      return float64TextOrder(Double.longBitsToDouble(min), Double.longBitsToDouble(max));
    case IPV4:
      return TextOrder.MIXED;
    case TIMESTAMP_ISO8601:
      // fixed width text
      return TextOrder.PRESERVING;
    default:
      throw ExceptionUtil.panic(ResultCode.UNEXPECTED_VALUE_TYPE, type.name(), "block stats");
    }
  }

  private static TextOrder float64TextOrder(double min, double max) {
    if (Double.isNaN(min) || Double.isNaN(max) || Double.isInfinite(min) || Double.isInfinite(max)) {
      return TextOrder.MIXED;
    }

    boolean minNegative = Double.doubleToRawLongBits(min) < 0;
    boolean maxNegative = Double.doubleToRawLongBits(max) < 0;
    if (!minNegative && !maxNegative) {
      return NumberUtil.integerDigits(min) == NumberUtil.integerDigits(max) ?
          TextOrder.PRESERVING : TextOrder.MIXED;
    } else if (minNegative && maxNegative) {
      // "-2" < "-2.5" < "-3" as text
      return NumberUtil.integerDigits(-min) == NumberUtil.integerDigits(-max) ?
          TextOrder.REVERSING : TextOrder.MIXED;
    } else {
      return TextOrder.MIXED;
    }
  }

  private static void writeIPv4(ByteBuf buf, int address) {
    NumberUtil.writeUnsignedDecimal(buf, (address >>> 24) & 0xFF);
    buf.writeByte('.');
    NumberUtil.writeUnsignedDecimal(buf, (address >>> 16) & 0xFF);
    buf.writeByte('.');
    NumberUtil.writeUnsignedDecimal(buf, (address >>> 8) & 0xFF);
    buf.writeByte('.');
    NumberUtil.writeUnsignedDecimal(buf, address & 0xFF);
  }
}
