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

import org.apache.hadoop.util.ExitUtil;
import org.junit.Test;
import org.logstats.LogStatsConstants;

import static org.junit.Assert.*;

public class TestQueryBlock {

  @Test
  public final void testColumns() {
    QueryBlock block = QueryBlock.newBuilder(3)
        .setTimestamps(1, 2, 3)
        .addTimeColumn()
        .addConstColumn("host", "web-1")
        .addStringColumn("msg", "a", "b", "c")
        .addUintColumn("code", ValueType.UINT16, 200, 404, 500)
        .build();

    assertEquals(3, block.getRowCount());
    assertFalse(block.isEmpty());
    assertTrue(block.hasTimestamps());
    assertEquals(4, block.getColumns().size());
    assertTrue(block.hasColumn("msg"));
    assertFalse(block.hasColumn("missing"));

    BlockColumn time = block.getColumnByName(LogStatsConstants.TIME_FIELD);
    assertTrue(time.isTime());
    assertTrue(time.isRendered());
    assertEquals("1970-01-01T00:00:00.000000002Z", time.getValueAtRow(block, 1));

    BlockColumn host = block.getColumnByName("host");
    assertTrue(host.isConst());
    assertFalse(host.isRendered());
    assertEquals("web-1", host.getConstValue());
    assertEquals("web-1", host.getValueAtRow(block, 2));

    BlockColumn code = block.getColumnByName("code");
    assertTrue(code.isRendered());
    assertEquals("404", code.getValueAtRow(block, 1));
    assertEquals(new BlockStats(200, 500), code.getStats());
  }

  @Test
  public final void testMissingColumnIsEmptyString() {
    QueryBlock block = QueryBlock.newBuilder(2).addStringColumn("a", "x", "y").build();
    BlockColumn missing = block.getColumnByName("b");
    assertTrue(missing.isConst());
    assertEquals("b", missing.getName());
    assertEquals("", missing.getValueAtRow(block, 1));
  }

  @Test
  public final void testDictColumn() {
    QueryBlock block = QueryBlock.newBuilder(4).addDictColumn("level", "b", "a", "a", "c").build();
    BlockColumn level = block.getColumnByName("level");
    assertEquals(ValueType.DICT, level.getValueType());
    assertEquals(3, level.getDictSize());
    assertEquals("b", level.getDictValue(0));
    assertEquals("a", level.getDictValue(1));
    assertEquals("c", level.getDictValue(2));
    assertEquals("b", level.getValueAtRow(block, 0));
    assertEquals("a", level.getValueAtRow(block, 2));
    assertEquals("c", level.getValueAtRow(block, 3));
  }

  @Test
  public final void testUnusedDictValue() {
    QueryBlock block = QueryBlock.newBuilder(2)
        .addDictColumn("level", new String[] {"info", "debug", "error"}, new byte[] {0, 2})
        .build();
    BlockColumn level = block.getColumnByName("level");
    assertTrue(level.isDictValueUsed(0));
    assertFalse(level.isDictValueUsed(1));
    assertTrue(level.isDictValueUsed(2));
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testDictIndexOutOfRange() {
    QueryBlock.newBuilder(1).addDictColumn("level", new String[] {"info"}, new byte[] {1});
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testTooManyDictValues() {
    QueryBlock.newBuilder(9).addDictColumn("n", "1", "2", "3", "4", "5", "6", "7", "8", "9");
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testDuplicateColumn() {
    QueryBlock.newBuilder(1).addStringColumn("a", "x").addConstColumn("a", "y");
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testRowCountMismatch() {
    QueryBlock.newBuilder(2).addStringColumn("a", "x");
  }

  @Test(expected = IllegalStateException.class)
  public final void testTimeColumnWithoutTimestamps() {
    QueryBlock.newBuilder(1).addTimeColumn();
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testUintOverflow() {
    QueryBlock.newBuilder(1).addUintColumn("a", ValueType.UINT8, 256);
  }

  @Test
  public final void testEncodedColumns() {
    QueryBlock block = QueryBlock.newBuilder(3)
        .addFloat64Column("f", 2.5, -1.5, 10)
        .addIPv4Column("ip", "10.0.0.2", "192.168.0.1", "10.0.0.10")
        .addTimestampISO8601Column("ts", 3000000000L, 1000000000L, 2000000000L)
        .build();

    BlockColumn f = block.getColumnByName("f");
    assertEquals("-1.5", f.getValueAtRow(block, 1));
    assertEquals(new BlockStats(Double.doubleToRawLongBits(-1.5), Double.doubleToRawLongBits(10)), f.getStats());

    BlockColumn ip = block.getColumnByName("ip");
    assertEquals("192.168.0.1", ip.getValueAtRow(block, 1));
    assertEquals(new BlockStats(0x0A000002L, 0xC0A80001L), ip.getStats());

    BlockColumn ts = block.getColumnByName("ts");
    assertEquals("1970-01-01T00:00:01.000Z", ts.getValueAtRow(block, 1));
    assertEquals(new BlockStats(1000000000L, 3000000000L), ts.getStats());
  }

  @Test
  public final void testEncodedColumnFromStorage() {
    QueryBlock block = QueryBlock.newBuilder(2)
        .addEncodedColumn("n", ValueType.UINT32.tag(), new long[] {7, 3}, new BlockStats(3, 7))
        .build();
    assertEquals(ValueType.UINT32, block.getColumnByName("n").getValueType());
    assertEquals("7", block.getColumnByName("n").getValueAtRow(block, 0));
  }

  @Test
  public final void testUnknownTag() {
    ExitUtil.disableSystemExit();
    try {
      ValueType.fromTag(42);
      fail("an unknown tag must stop the process");
    } catch (ExitUtil.ExitException e) {
      assertTrue(e.getMessage().contains("unknown valueType=42"));
    } finally {
      ExitUtil.resetFirstExitException();
    }
  }

  @Test
  public final void testTags() {
    for (ValueType type : ValueType.values()) {
      assertEquals(type, ValueType.fromTag(type.tag()));
    }
  }

  @Test
  public final void testEmptyBlock() {
    QueryBlock block = QueryBlock.newBuilder(0).addStringColumn("a").addUintColumn("n", ValueType.UINT8).build();
    assertTrue(block.isEmpty());
    assertFalse(block.hasTimestamps());
  }

  @Test(expected = IllegalStateException.class)
  public final void testNoTimestamps() {
    QueryBlock.newBuilder(1).addStringColumn("a", "x").build().getTimestamp(0);
  }

  @Test
  public final void testCallerArraysAreCopied() {
    long[] timestamps = {1000000000L, 2000000000L};
    long[] codes = {5, 7};
    long[] nanos = {3000000000L, 4000000000L};
    String[] messages = {"x", "y"};
    String[] dict = {"info", "error"};
    byte[] indexes = {0, 1};
    QueryBlock block = QueryBlock.newBuilder(2)
        .setTimestamps(timestamps)
        .addTimeColumn()
        .addUintColumn("u", ValueType.UINT8, codes)
        .addTimestampISO8601Column("ts", nanos)
        .addStringColumn("msg", messages)
        .addDictColumn("level", dict, indexes)
        .build();

    timestamps[0] = 0;
    codes[0] = 3;
    nanos[0] = 0;
    messages[0] = "a";
    dict[1] = "debug";
    indexes[1] = 0;

    assertEquals(1000000000L, block.getTimestamp(0));
    assertEquals("1970-01-01T00:00:01Z", block.getColumnByName(LogStatsConstants.TIME_FIELD).getValueAtRow(block, 0));

    BlockColumn u = block.getColumnByName("u");
    assertEquals("5", u.getValueAtRow(block, 0));
    assertEquals(new BlockStats(5, 7), u.getStats());

    BlockColumn ts = block.getColumnByName("ts");
    assertEquals("1970-01-01T00:00:03.000Z", ts.getValueAtRow(block, 0));
    assertEquals(new BlockStats(3000000000L, 4000000000L), ts.getStats());

    assertEquals("x", block.getColumnByName("msg").getValueAtRow(block, 0));

    BlockColumn level = block.getColumnByName("level");
    assertEquals("error", level.getValueAtRow(block, 1));
    assertEquals("error", level.getDictValue(1));
    assertTrue(level.isDictValueUsed(1));
  }

  @Test
  public final void testStorageArraysAreCopied() {
    long[] encoded = {7, 3};
    QueryBlock block = QueryBlock.newBuilder(2)
        .addEncodedColumn("n", ValueType.UINT32.tag(), encoded, new BlockStats(3, 7))
        .build();
    encoded[1] = 1;
    assertEquals("3", block.getColumnByName("n").getValueAtRow(block, 1));
  }
}
