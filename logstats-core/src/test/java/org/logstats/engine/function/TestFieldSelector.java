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

package org.logstats.engine.function;

import com.google.common.collect.Lists;
import org.junit.Test;
import org.logstats.block.BlockColumn;
import org.logstats.block.QueryBlock;
import org.logstats.engine.parser.Lexer;
import org.logstats.engine.parser.StatsSyntaxError;

import java.util.List;

import static org.junit.Assert.*;

public class TestFieldSelector {

  private static List<String> names(Iterable<BlockColumn> columns) {
    List<String> names = Lists.newArrayList();
    for (BlockColumn column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  @Test
  public final void testExplicit() throws StatsSyntaxError {
    FieldSelector selector = FieldSelector.parse(new Lexer("min(b, a)"), "min");
    assertFalse(selector.isWildcard());
    assertEquals(Lists.newArrayList("b", "a"), selector.getFields());
    assertEquals(Lists.newArrayList("b", "a"), selector.neededFields());
    assertEquals("b, a", selector.toString());
  }

  @Test
  public final void testWildcard() throws StatsSyntaxError {
    FieldSelector selector = FieldSelector.parse(new Lexer("min(a, *)"), "min");
    assertTrue(selector.isWildcard());
    assertTrue(selector.getFields().isEmpty());
    assertEquals(Lists.newArrayList("*"), selector.neededFields());
    assertEquals("*", selector.toString());
    assertEquals(FieldSelector.wildcard(), selector);
  }

  @Test
  public final void testResolve() {
    QueryBlock first = QueryBlock.newBuilder(1).addStringColumn("a", "1").addStringColumn("b", "2").build();
    QueryBlock second = QueryBlock.newBuilder(1).addStringColumn("c", "3").build();

    assertEquals(Lists.newArrayList("a", "b"), names(FieldSelector.wildcard().resolve(first)));
    assertEquals(Lists.newArrayList("c"), names(FieldSelector.wildcard().resolve(second)));

    FieldSelector explicit = FieldSelector.of("b", "c");
    assertEquals(Lists.newArrayList("b", "c"), names(explicit.resolve(first)));
    BlockColumn missing = Lists.newArrayList(explicit.resolve(first)).get(1);
    assertTrue(missing.isConst());
    assertEquals("", missing.getConstValue());
  }

  @Test
  public final void testEquality() {
    assertEquals(FieldSelector.of("a", "b"), FieldSelector.of(Lists.newArrayList("a", "b")));
    assertNotEquals(FieldSelector.of("a", "b"), FieldSelector.of("b", "a"));
    assertEquals(FieldSelector.of("a").hashCode(), FieldSelector.of("a").hashCode());
  }
}
