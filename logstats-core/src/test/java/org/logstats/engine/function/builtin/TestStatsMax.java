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

package org.logstats.engine.function.builtin;

import com.google.common.collect.Lists;
import org.junit.After;
import org.junit.Test;
import org.logstats.LogStatsConstants;
import org.logstats.block.QueryBlock;
import org.logstats.block.ValueType;
import org.logstats.engine.function.FieldSelector;
import org.logstats.engine.function.StatsFunction;
import org.logstats.engine.function.StatsProcessor;
import org.logstats.storage.BufferPool;

import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;
import static org.logstats.engine.function.builtin.StatsFunctionTestBase.allRows;
import static org.logstats.engine.function.builtin.StatsFunctionTestBase.perRow;
import static org.logstats.engine.function.builtin.StatsFunctionTestBase.randomBlock;

public class TestStatsMax {
  // 2024-01-02T03:04:05Z
  private static final long SECS = 1704164645L * 1000000000L;

  private static StatsFunction max(String... fields) {
    return new StatsMax(FieldSelector.of(fields), true);
  }

  private static void assertBothPaths(String expected, StatsFunction function, QueryBlock... blocks) {
    assertEquals("per-row", expected, perRow(function, blocks));
    assertEquals("whole block", expected, allRows(function, blocks));
  }

  @After
  public void tearDown() {
    assertEquals(0, BufferPool.outstandingScratchBuffers());
  }

  @Test
  public final void testEmpty() {
    assertEquals(LogStatsConstants.NAN, max("a").newStatsProcessor().finalizeStats());
    assertBothPaths(LogStatsConstants.NAN, max("a"), QueryBlock.newBuilder(0).build());
  }

  @Test
  public final void testStringEncodings() {
    QueryBlock block = QueryBlock.newBuilder(4)
        .addDictColumn("d", "b", "a", "a", "c")
        .addStringColumn("s", "x", "xy", "", "w")
        .addConstColumn("k", "z")
        .build();
    assertBothPaths("c", max("d"), block);
    assertBothPaths("xy", max("s"), block);
    assertBothPaths("z", max("d", "s", "k"), block);
  }

  @Test
  public final void testNumbersCompareAsText() {
    QueryBlock block = QueryBlock.newBuilder(3).addUintColumn("n", ValueType.UINT16, 2, 10, 9).build();
    assertBothPaths("9", max("n"), block);

    QueryBlock sameWidth = QueryBlock.newBuilder(3).addUintColumn("n", ValueType.UINT8, 25, 17, 99).build();
    assertBothPaths("99", max("n"), sameWidth);

    QueryBlock negative = QueryBlock.newBuilder(3).addFloat64Column("f", -2.5, -2.0, -2.25).build();
    assertBothPaths("-2.5", max("f"), negative);

    QueryBlock ips = QueryBlock.newBuilder(2).addIPv4Column("ip", "10.0.0.10", "9.1.1.1").build();
    assertBothPaths("9.1.1.1", max("ip"), ips);
  }

  @Test
  public final void testTimeColumn() {
    QueryBlock block = QueryBlock.newBuilder(3)
        .setTimestamps(SECS, SECS + 500000000L, SECS + 1000000000L)
        .addTimeColumn()
        .build();
    assertBothPaths("2024-01-02T03:04:06Z", max("_time"), block);

    // the whole second sorts after its fractions
    QueryBlock sameSecond = QueryBlock.newBuilder(2)
        .setTimestamps(SECS + 500000000L, SECS)
        .addTimeColumn()
        .build();
    assertBothPaths("2024-01-02T03:04:05Z", max("_time"), sameSecond);
  }

  @Test
  public final void testUpdatePathsAgree() {
    Random rnd = new Random(7L);
    List<String> fields = Lists.newArrayList("_time", "s", "d", "c", "u", "f", "ip", "iso");
    for (int i = 0; i < 200; i++) {
      QueryBlock block = randomBlock(rnd, 1 + rnd.nextInt(12));
      for (String field : fields) {
        StatsFunction function = max(field);
        assertEquals(field + " in " + block, perRow(function, block), allRows(function, block));
      }
      assertEquals(perRow(max("*"), block), allRows(max("*"), block));
    }
  }

  @Test
  public final void testMerge() {
    QueryBlock first = QueryBlock.newBuilder(2).addStringColumn("a", "k", "m").build();
    QueryBlock second = QueryBlock.newBuilder(1).addStringColumn("a", "l").build();

    StatsProcessor left = max("a").newStatsProcessor();
    left.updateStatsForAllRows(first);
    StatsProcessor right = max("a").newStatsProcessor();
    right.updateStatsForAllRows(second);

    right.mergeState(left);
    assertEquals("m", right.finalizeStats());
    left.mergeState(max("a").newStatsProcessor());
    assertEquals("m", left.finalizeStats());
  }

  @Test
  public final void testDescription() {
    assertEquals("max(*)", max("*").toString());
    assertEquals("max(\"\", a.b)", max("", "a.b").toString());
    assertNotEquals(max("a"), new StatsMin(FieldSelector.of("a"), true));
    assertEquals(max("a"), max("a"));
  }
}
