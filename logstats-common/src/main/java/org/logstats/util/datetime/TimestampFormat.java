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

package org.logstats.util.datetime;

import io.netty.buffer.ByteBuf;
import org.logstats.util.NumberUtil;

/**
 * Renders nanosecond timestamps as UTC text.
 *
 * Every timestamp representable as 64-bit nanoseconds falls in years 1677-2262, so the
 * date and time prefix is always fixed width.
 */
public class TimestampFormat {
  public static final long NANOS_PER_SECOND = 1000000000L;
  public static final long NANOS_PER_MILLI = 1000000L;
  public static final int SECS_PER_DAY = 86400;

  private TimestampFormat() {
  }

  /**
   * RFC 3339 with up to nine fractional digits, trailing zeros trimmed,
   * e.g. <code>2024-01-02T03:04:05.12Z</code> or <code>2024-01-02T03:04:05Z</code>.
   */
  public static void writeRFC3339Nano(ByteBuf buf, long nanos) {
    long secs = Math.floorDiv(nanos, NANOS_PER_SECOND);
    int fraction = (int) Math.floorMod(nanos, NANOS_PER_SECOND);
    writeDateTime(buf, secs);
    if (fraction != 0) {
      int digits = 9;
      while (fraction % 10 == 0) {
        fraction /= 10;
        digits--;
      }
      buf.writeByte('.');
      NumberUtil.writePaddedDecimal(buf, fraction, digits);
    }
    buf.writeByte('Z');
  }

  /**
   * ISO 8601 with millisecond precision, e.g. <code>2024-01-02T03:04:05.120Z</code>.
   */
  public static void writeISO8601(ByteBuf buf, long nanos) {
    long secs = Math.floorDiv(nanos, NANOS_PER_SECOND);
    int millis = (int) (Math.floorMod(nanos, NANOS_PER_SECOND) / NANOS_PER_MILLI);
    writeDateTime(buf, secs);
    buf.writeByte('.');
    NumberUtil.writePaddedDecimal(buf, millis, 3);
    buf.writeByte('Z');
  }

  /**
   * @param nanos nanoseconds since the Unix epoch
   * @return the start of the second which contains the given instant, in seconds
   */
  public static long toEpochSecond(long nanos) {
    return Math.floorDiv(nanos, NANOS_PER_SECOND);
  }

  // yyyy-MM-ddTHH:mm:ss
  private static void writeDateTime(ByteBuf buf, long epochSecs) {
    long days = Math.floorDiv(epochSecs, SECS_PER_DAY);
    int secsOfDay = (int) Math.floorMod(epochSecs, SECS_PER_DAY);

    // civil date from days since 1970-01-01, proleptic Gregorian calendar
    long z = days + 719468;
    long era = (z >= 0 ? z : z - 146096) / 146097;
    long dayOfEra = z - era * 146097;
    long yearOfEra = (dayOfEra - dayOfEra / 1460 + dayOfEra / 36524 - dayOfEra / 146096) / 365;
    long dayOfYear = dayOfEra - (365 * yearOfEra + yearOfEra / 4 - yearOfEra / 100);
    long mp = (5 * dayOfYear + 2) / 153;
    int dayOfMonth = (int) (dayOfYear - (153 * mp + 2) / 5 + 1);
    int month = (int) (mp < 10 ? mp + 3 : mp - 9);
    int year = (int) (yearOfEra + era * 400 + (month <= 2 ? 1 : 0));

    NumberUtil.writePaddedDecimal(buf, year, 4);
    buf.writeByte('-');
    NumberUtil.writePaddedDecimal(buf, month, 2);
    buf.writeByte('-');
    NumberUtil.writePaddedDecimal(buf, dayOfMonth, 2);
    buf.writeByte('T');
    NumberUtil.writePaddedDecimal(buf, secsOfDay / 3600, 2);
    buf.writeByte(':');
    NumberUtil.writePaddedDecimal(buf, (secsOfDay / 60) % 60, 2);
    buf.writeByte(':');
    NumberUtil.writePaddedDecimal(buf, secsOfDay % 60, 2);
  }
}
