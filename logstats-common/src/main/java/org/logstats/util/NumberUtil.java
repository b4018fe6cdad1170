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

package org.logstats.util;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

public class NumberUtil {

  /** 10^19, the smallest unsigned 64-bit value with 20 decimal digits */
  private static final long TEN_POW_19 = Long.parseUnsignedLong("10000000000000000000");

  /**
   * 2^53. Every integral double below it is the shortest decimal of itself, so it is rendered
   * through a long without any allocation. Above it neighbouring doubles are more than one apart.
   */
  private static final double MAX_FAST_INTEGRAL = 9007199254740992d;

  /** 17 significant digits identify any double */
  private static final int MAX_FLOAT64_DIGITS = 17;

  private NumberUtil() {
  }

  /**
   * @param v a value interpreted as unsigned 64-bit integer
   * @return the number of decimal digits of v
   */
  public static int unsignedDecimalLength(long v) {
    if (v < 0) {
      return Long.compareUnsigned(v, TEN_POW_19) < 0 ? 19 : 20;
    }
    long p = 10;
    for (int len = 1; len < 19; len++) {
      if (v < p) {
        return len;
      }
      p *= 10;
    }
    return 19;
  }

  /**
   * Writes v as unsigned base-10 integer.
   */
  public static void writeUnsignedDecimal(ByteBuf buf, long v) {
    int len = unsignedDecimalLength(v);
    buf.ensureWritable(len);
    int start = buf.writerIndex();
    int pos = start + len - 1;
    if (v < 0) {
      long q = Long.divideUnsigned(v, 10);
      buf.setByte(pos--, (int) ('0' + (v - q * 10)));
      v = q;
    }
    do {
      buf.setByte(pos--, (int) ('0' + v % 10));
      v /= 10;
    } while (v != 0);
    buf.writerIndex(start + len);
  }

  /**
   * Writes a non-negative value left-padded with zeros to the given width.
   */
  public static void writePaddedDecimal(ByteBuf buf, int v, int width) {
    buf.ensureWritable(width);
    int start = buf.writerIndex();
    for (int pos = start + width - 1; pos >= start; pos--) {
      buf.setByte(pos, '0' + v % 10);
      v /= 10;
    }
    buf.writerIndex(start + width);
  }

  /**
   * Writes the shortest decimal text which identifies f, in plain notation without exponent.
   * Special values are written as <code>NaN</code>, <code>+Inf</code> and <code>-Inf</code>.
   */
  public static void writeFloat64(ByteBuf buf, double f) {
    if (Double.isNaN(f)) {
      ByteBufUtil.writeAscii(buf, "NaN");
    } else if (f == Double.POSITIVE_INFINITY) {
      ByteBufUtil.writeAscii(buf, "+Inf");
    } else if (f == Double.NEGATIVE_INFINITY) {
      ByteBufUtil.writeAscii(buf, "-Inf");
    } else if (f == 0) {
      if (Double.doubleToRawLongBits(f) < 0) {
        buf.writeByte('-');
      }
      buf.writeByte('0');
    } else if (f == Math.rint(f) && Math.abs(f) < MAX_FAST_INTEGRAL) {
      long l = (long) f;
      if (l < 0) {
        buf.writeByte('-');
        l = -l;
      }
      writeUnsignedDecimal(buf, l);
    } else {
      ByteBufUtil.writeAscii(buf, toPlainDecimal(f).toPlainString());
    }
  }

  /**
   * @param a a finite non-negative value
   * @return the number of digits before the decimal point of the text written by
   * {@link #writeFloat64(ByteBuf, double)}
   */
  public static int integerDigits(double a) {
    if (a < MAX_FAST_INTEGRAL) {
      return unsignedDecimalLength((long) a);
    }
    BigDecimal d = toPlainDecimal(a);
    return d.precision() - d.scale();
  }

  /**
   * Finds the shortest decimal which parses back to f. {@link Double#toString(double)} is not
   * used since it emits extra digits for some values, e.g. 2.82879384806159E17.
   */
  static BigDecimal toPlainDecimal(double f) {
    BigDecimal exact = new BigDecimal(f);
    for (int digits = 1; digits < MAX_FLOAT64_DIGITS; digits++) {
      BigDecimal d = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
      if (d.doubleValue() == f) {
        return d.stripTrailingZeros();
      }
      // at a power of two the gap below f is half the gap above, try the other neighbour
      BigDecimal other = d.compareTo(exact) < 0 ? d.add(d.ulp()) : d.subtract(d.ulp());
      if (other.precision() <= digits && other.doubleValue() == f) {
        return other.stripTrailingZeros();
      }
    }
    return exact.round(new MathContext(MAX_FLOAT64_DIGITS, RoundingMode.HALF_EVEN)).stripTrailingZeros();
  }
}
