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
import io.netty.buffer.Unpooled;
import io.netty.util.CharsetUtil;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestLexicalOrder {

  @Test
  public final void testAsciiOrder() {
    assertTrue(LexicalOrder.less("10", "2"));
    assertTrue(LexicalOrder.less("", "a"));
    assertTrue(LexicalOrder.less("abc", "abd"));
    assertTrue(LexicalOrder.less("ab", "abc"));
    assertTrue(LexicalOrder.less("Z", "a"));
    assertFalse(LexicalOrder.less("abc", "abc"));
    assertFalse(LexicalOrder.greater("abc", "abc"));
    assertEquals(0, LexicalOrder.compare("abc", "abc"));
  }

  @Test
  public final void testCodePointOrder() {
    String supplementary = new String(Character.toChars(0x1F600));
    String highBmp = "Ａ";

    // UTF-16 puts the surrogate pair below U+FF21, code point order does not
    assertTrue(supplementary.compareTo(highBmp) < 0);
    assertTrue(LexicalOrder.greater(supplementary, highBmp));
    assertTrue(LexicalOrder.less("é", supplementary));
  }

  @Test
  public final void testCompareBufferWithString() {
    ByteBuf buf = Unpooled.copiedBuffer("1.5", CharsetUtil.US_ASCII);
    try {
      assertEquals(0, LexicalOrder.compare(buf, "1.5"));
      assertTrue(LexicalOrder.less(buf, "1.6"));
      assertTrue(LexicalOrder.less(buf, "1.50"));
      assertTrue(LexicalOrder.greater(buf, "1."));
      assertTrue(LexicalOrder.greater(buf, "-2"));
      assertTrue(LexicalOrder.less(buf, "é"));
      assertEquals(0, buf.readerIndex());
      assertEquals(3, buf.writerIndex());
    } finally {
      buf.release();
    }
  }

  @Test
  public final void testCompareBufferRespectsReaderIndex() {
    ByteBuf buf = Unpooled.copiedBuffer("xx10", CharsetUtil.US_ASCII);
    try {
      buf.skipBytes(2);
      assertEquals(0, LexicalOrder.compare(buf, "10"));
      assertTrue(LexicalOrder.less(buf, "2"));
    } finally {
      buf.release();
    }
  }
}
