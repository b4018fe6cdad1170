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

/**
 * Splits stats function invocations such as <code>min(foo, "bar baz")</code> into tokens.
 *
 * A token is either a run of letters, digits and underscores, a quoted string, or a single
 * other character. Whitespace separates tokens and is remembered, so that the parser can glue
 * adjacent tokens into compound names like <code>host.name</code>.
 */
public class Lexer {
  private final String s;
  private int pos;

  private String token;
  private String rawToken;
  private boolean quoted;
  private boolean skippedSpace;
  private int tokenStart;

  public Lexer(String s) throws StatsSyntaxError {
    this.s = s;
    this.pos = 0;
    nextToken();
  }

  /**
   * @return the current token; quoted strings are unquoted. It is empty at the end of input.
   */
  public String getToken() {
    return token;
  }

  /**
   * @return the current token as written in the input
   */
  public String getRawToken() {
    return rawToken;
  }

  public boolean isQuoted() {
    return quoted;
  }

  /**
   * @return true if whitespace precedes the current token
   */
  public boolean isSkippedSpace() {
    return skippedSpace;
  }

  public boolean isEnd() {
    return rawToken.isEmpty();
  }

  /**
   * @return true if the current token is an unquoted token equal to one of the keywords,
   * ignoring case. The empty keyword matches the end of input.
   */
  public boolean isKeyword(String... keywords) {
    if (quoted) {
      return false;
    }
    for (String keyword : keywords) {
      if (token.equalsIgnoreCase(keyword)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the input consumed so far including the current token, for error messages
   */
  public String context() {
    return s.substring(0, Math.min(s.length(), tokenStart + rawToken.length()));
  }

  public void nextToken() throws StatsSyntaxError {
    int start = pos;
    while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) {
      pos++;
    }
    skippedSpace = pos > start;
    tokenStart = pos;
    quoted = false;

    if (pos >= s.length()) {
      token = "";
      rawToken = "";
      return;
    }

    int c = s.codePointAt(pos);
    if (isTokenRune(c)) {
      while (pos < s.length() && isTokenRune(s.codePointAt(pos))) {
        pos += Character.charCount(s.codePointAt(pos));
      }
      token = s.substring(tokenStart, pos);
      rawToken = token;
    } else if (c == '"' || c == '\'' || c == '`') {
      token = readQuoted((char) c);
      rawToken = s.substring(tokenStart, pos);
      quoted = true;
    } else {
      pos += Character.charCount(c);
      token = s.substring(tokenStart, pos);
      rawToken = token;
    }
  }

  private String readQuoted(char quote) throws StatsSyntaxError {
    StringBuilder sb = new StringBuilder();
    pos++;
    while (pos < s.length()) {
      char c = s.charAt(pos++);
      if (c == quote) {
        return sb.toString();
      }
      if (c == '\\' && quote != '`') {
        if (pos >= s.length()) {
          break;
        }
        sb.append(unescape(s.charAt(pos++)));
      } else {
        sb.append(c);
      }
    }
    throw new StatsSyntaxError("missing closing quote in " + s.substring(tokenStart));
  }

  private char unescape(char c) throws StatsSyntaxError {
    switch (c) {
    case 'n': return '\n';
    case 't': return '\t';
    case 'r': return '\r';
    case 'b': return '\b';
    case 'f': return '\f';
    case '0': return '\0';
    case 'u':
      if (pos + 4 > s.length()) {
        throw new StatsSyntaxError("invalid unicode escape in " + s.substring(tokenStart));
      }
      try {
        char decoded = (char) Integer.parseInt(s.substring(pos, pos + 4), 16);
        pos += 4;
        return decoded;
      } catch (NumberFormatException e) {
        throw new StatsSyntaxError("invalid unicode escape in " + s.substring(tokenStart));
      }
    default:
      // \\, \", \' and any other escaped char stand for themselves
      return c;
    }
  }

  static boolean isTokenRune(int c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }
}
