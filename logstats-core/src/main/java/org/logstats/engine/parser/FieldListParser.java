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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import org.logstats.LogStatsConstants;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the argument list of stats functions: <code>func(field1, field2, ...)</code>
 * or <code>func(*)</code>.
 */
public class FieldListParser {
  public static final String WILDCARD = "*";

  private static final String[] STOP_TOKENS = {",", "(", ")", "[", "]", "|", "!", ""};

  private static final Set<String> RESERVED_KEYWORDS = ImmutableSet.of(
      ",", "(", ")", "[", "]", "|", "!", "", "and", "or", "not", "by", "as");

  private FieldListParser() {
  }

  /**
   * Parses <code>funcName(field, ...)</code> and returns the field names in the written order.
   * The lexer is left at the token following the closing parenthesis.
   */
  public static List<String> parseFieldNamesForStatsFunc(Lexer lex, String funcName) throws StatsSyntaxError {
    if (!lex.isKeyword(funcName)) {
      throw new StatsSyntaxError(String.format("unexpected func; got '%s'; want '%s'", lex.getToken(), funcName));
    }
    lex.nextToken();

    List<String> fields;
    try {
      fields = parseFieldNamesInParens(lex);
    } catch (StatsSyntaxError e) {
      throw new StatsSyntaxError(String.format("cannot parse '%s' args", funcName), e);
    }
    if (fields.isEmpty()) {
      throw new StatsSyntaxError(String.format("'%s' must contain at least one arg", funcName));
    }
    return fields;
  }

  static List<String> parseFieldNamesInParens(Lexer lex) throws StatsSyntaxError {
    if (!lex.isKeyword("(")) {
      throw new StatsSyntaxError("missing '('; context: [" + lex.context() + "]");
    }

    List<String> fields = Lists.newArrayList();
    while (true) {
      lex.nextToken();
      if (lex.isKeyword(")")) {
        lex.nextToken();
        return fields;
      }
      if (lex.isKeyword(",")) {
        throw new StatsSyntaxError("unexpected ','; context: [" + lex.context() + "]");
      }
      String field;
      try {
        field = parseFieldName(lex);
      } catch (StatsSyntaxError e) {
        throw new StatsSyntaxError("cannot parse field name", e);
      }
      fields.add(field);

      if (lex.isEnd()) {
        throw new StatsSyntaxError("missing ')'; context: [" + lex.context() + "]");
      }
      if (lex.isKeyword(")")) {
        lex.nextToken();
        return fields;
      }
      if (!lex.isKeyword(",")) {
        throw new StatsSyntaxError(String.format("unexpected token: '%s'; want ',' or ')'; context: [%s]",
            lex.getRawToken(), lex.context()));
      }
    }
  }

  static String parseFieldName(Lexer lex) throws StatsSyntaxError {
    String name = getCompoundToken(lex);
    return name.isEmpty() ? LogStatsConstants.MSG_FIELD : name;
  }

  /**
   * Glues adjacent tokens which are not separated by whitespace, e.g. <code>foo.bar-baz</code>.
   */
  static String getCompoundToken(Lexer lex) throws StatsSyntaxError {
    if (lex.isKeyword(STOP_TOKENS)) {
      if (lex.isEnd()) {
        throw new StatsSyntaxError("missing ')'; context: [" + lex.context() + "]");
      }
      throw new StatsSyntaxError(String.format("compound token cannot start with '%s'", lex.getToken()));
    }

    String s = lex.getToken();
    lex.nextToken();
    if (lex.isSkippedSpace() || lex.isKeyword(STOP_TOKENS)) {
      return s;
    }

    StringBuilder sb = new StringBuilder(s);
    while (!lex.isSkippedSpace() && !lex.isKeyword(STOP_TOKENS)) {
      sb.append(lex.getToken());
      lex.nextToken();
    }
    return sb.toString();
  }

  /**
   * Renders field names the way they can be parsed back: <code>foo, "bar baz", *</code>.
   */
  public static String fieldNamesString(List<String> fields) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      String field = fields.get(i);
      sb.append(WILDCARD.equals(field) ? field : quoteTokenIfNeeded(field));
    }
    return sb.toString();
  }

  public static String quoteTokenIfNeeded(String s) {
    if (!needQuoteToken(s)) {
      return s;
    }
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
      case '"': sb.append("\\\""); break;
      case '\\': sb.append("\\\\"); break;
      case '\n': sb.append("\\n"); break;
      case '\t': sb.append("\\t"); break;
      case '\r': sb.append("\\r"); break;
      default:
        if (c < 0x20) {
          sb.append(String.format("\\u%04x", (int) c));
        } else {
          sb.append(c);
        }
      }
    }
    return sb.append('"').toString();
  }

  private static boolean needQuoteToken(String s) {
    if (RESERVED_KEYWORDS.contains(s.toLowerCase(Locale.ROOT))) {
      return true;
    }
    for (int i = 0; i < s.length(); ) {
      int c = s.codePointAt(i);
      if (!Lexer.isTokenRune(c) && c != '.' && c != '-') {
        return true;
      }
      i += Character.charCount(c);
    }
    return false;
  }
}
