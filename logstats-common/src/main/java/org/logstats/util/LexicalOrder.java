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

/**
 * Lexical ordering of canonical text values.
 *
 * Values are compared by Unicode code point, which is the same order as comparing their
 * UTF-8 encodings byte by byte. {@link String#compareTo(String)} compares UTF-16 code units
 * instead and disagrees for supplementary characters, so it is not used here.
 */
public class LexicalOrder {

  private LexicalOrder() {
  }

  public static int compare(String a, String b) {
    int len = Math.min(a.length(), b.length());
    for (int i = 0; i < len; i++) {
      char c1 = a.charAt(i);
      char c2 = b.charAt(i);
      if (c1 != c2) {
        return fixupForCodePointOrder(c1) - fixupForCodePointOrder(c2);
      }
    }
    return a.length() - b.length();
  }

  /**
   * Compares ASCII text held in the readable bytes of <code>ascii</code> with <code>s</code>.
   * The buffer indexes are not modified.
   */
  public static int compare(ByteBuf ascii, String s) {
    int offset = ascii.readerIndex();
    int bufLen = ascii.readableBytes();
    int len = Math.min(bufLen, s.length());
    for (int i = 0; i < len; i++) {
      char c1 = (char) (ascii.getByte(offset + i) & 0xFF);
      char c2 = s.charAt(i);
      if (c1 != c2) {
        return c1 - c2;
      }
    }
    return bufLen - s.length();
  }

  public static boolean less(String a, String b) {
    return compare(a, b) < 0;
  }

  public static boolean less(ByteBuf ascii, String s) {
    return compare(ascii, s) < 0;
  }

  public static boolean greater(String a, String b) {
    return compare(a, b) > 0;
  }

  public static boolean greater(ByteBuf ascii, String s) {
    return compare(ascii, s) > 0;
  }

  // moves surrogates above the rest of the BMP, so that UTF-16 units sort like code points
  private static int fixupForCodePointOrder(char c) {
    if (c >= 0xD800) {
      return c >= 0xE000 ? c - 0x800 : c + 0x2000;
    }
    return c;
  }
}
