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

package org.logstats.engine.parser;

import com.google.common.collect.Lists;
import org.junit.Test;
import org.logstats.exception.ResultCode;

import java.util.List;

import static org.junit.Assert.*;

public class TestFieldListParser {

  private static List<String> parse(String s, String funcName) throws StatsSyntaxError {
    Lexer lex = new Lexer(s);
    List<String> fields = FieldListParser.parseFieldNamesForStatsFunc(lex, funcName);
    assertTrue("trailing input in " + s, lex.isEnd());
    return fields;
  }

  private static String parseError(String s) {
    try {
      parse(s, "min");
      fail("expected a syntax error for " + s);
      return null;
    } catch (StatsSyntaxError e) {
      assertEquals(ResultCode.SYNTAX_ERROR, e.getErrorCode());
      return e.getMessage();
    }
  }

  @Test
  public final void testFieldList() throws StatsSyntaxError {
    assertEquals(Lists.newArrayList("a"), parse("min(a)", "min"));
    assertEquals(Lists.newArrayList("a", "b", "c"), parse("min( a ,b,  c )", "min"));
    assertEquals(Lists.newArrayList("*"), parse("min(*)", "min"));
    assertEquals(Lists.newArrayList("b", "a", "b"), parse("MIN(b, a, b)", "min"));
  }

  @Test
  public final void testCompoundNames() throws StatsSyntaxError {
    assertEquals(Lists.newArrayList("foo.bar-baz", "x y", "kubernetes.pod_name"),
        parse("min(foo.bar-baz, \"x y\", kubernetes.pod_name)", "min"));
  }

  @Test
  public final void testEmptyNameIsMessageField() throws StatsSyntaxError {
    assertEquals(Lists.newArrayList("_msg", "a"), parse("max(\"\", a)", "max"));
  }

  @Test
  public final void testDanglingComma() throws StatsSyntaxError {
    assertEquals(Lists.newArrayList("a", "b"), parse("min(a, b,)", "min"));
  }

  @Test
  public final void testErrors() {
    assertEquals("unexpected func; got 'max'; want 'min'", parseError("max(a)"));
    assertEquals("'min' must contain at least one arg", parseError("min()"));
    assertEquals("cannot parse 'min' args: missing '('; context: [min a]", parseError("min a"));
    assertEquals("cannot parse 'min' args: missing ')'; context: [min(a]", parseError("min(a"));
    assertEquals("cannot parse 'min' args: cannot parse field name: missing ')'; context: [min(]",
        parseError("min("));
    assertEquals("cannot parse 'min' args: unexpected ','; context: [min(,]", parseError("min(,a)"));
    assertEquals("cannot parse 'min' args: unexpected token: 'b'; want ',' or ')'; context: [min(a b]",
        parseError("min(a b)"));
    assertTrue(parseError("min(a, |)").contains("compound token cannot start with '|'"));
    assertTrue(parseError("min(\"a)").contains("missing closing quote"));
  }

  @Test
  public final void testQuoteTokenIfNeeded() {
    assertEquals("foo", FieldListParser.quoteTokenIfNeeded("foo"));
    assertEquals("foo.bar-baz", FieldListParser.quoteTokenIfNeeded("foo.bar-baz"));
    assertEquals("_msg", FieldListParser.quoteTokenIfNeeded("_msg"));
    assertEquals("\"x y\"", FieldListParser.quoteTokenIfNeeded("x y"));
    assertEquals("\"\"", FieldListParser.quoteTokenIfNeeded(""));
    assertEquals("\"by\"", FieldListParser.quoteTokenIfNeeded("by"));
    assertEquals("\"OR\"", FieldListParser.quoteTokenIfNeeded("OR"));
    assertEquals("\"*\"", FieldListParser.quoteTokenIfNeeded("*"));
    assertEquals("\"a\\\"b\"", FieldListParser.quoteTokenIfNeeded("a\"b"));
    assertEquals("\"a\\nb\"", FieldListParser.quoteTokenIfNeeded("a\nb"));
  }

  @Test
  public final void testFieldNamesString() {
    assertEquals("*", FieldListParser.fieldNamesString(Lists.newArrayList("*")));
    assertEquals("a, \"b c\", d.e", FieldListParser.fieldNamesString(Lists.newArrayList("a", "b c", "d.e")));
    assertEquals("", FieldListParser.fieldNamesString(Lists.<String>newArrayList()));
  }

  @Test
  public final void testQuotedNamesParseBack() throws StatsSyntaxError {
    List<String> fields = Lists.newArrayList("a\"b", "x y", "by", "a\\b", "tab\there");
    assertEquals(fields, parse("min(" + FieldListParser.fieldNamesString(fields) + ")", "min"));
  }
}
