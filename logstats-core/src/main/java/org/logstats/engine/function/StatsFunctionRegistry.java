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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.logstats.conf.LogStatsConf;
import org.logstats.conf.LogStatsConf.ConfVars;
import org.logstats.engine.function.builtin.StatsMax;
import org.logstats.engine.function.builtin.StatsMin;
import org.logstats.engine.parser.Lexer;
import org.logstats.engine.parser.StatsSyntaxError;
import org.logstats.exception.UndefinedFunctionException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps stats function names to their implementations and parses invocations.
 */
public class StatsFunctionRegistry {
  private static final Log LOG = LogFactory.getLog(StatsFunctionRegistry.class);

  private final Map<String, StatsFunctionFactory> factories = Maps.newTreeMap();
  private final boolean strictBlockExtremes;

  public StatsFunctionRegistry(LogStatsConf conf) {
    this.strictBlockExtremes = conf.getBoolVar(ConfVars.STATS_STRICT_BLOCK_EXTREMES);
    register(StatsMin.NAME, StatsMin::new);
    register(StatsMax.NAME, StatsMax::new);
  }

  public void register(String name, StatsFunctionFactory factory) {
    factories.put(name.toLowerCase(Locale.ROOT), factory);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Stats function '" + name + "' is registered");
    }
  }

  public Set<String> getFunctionNames() {
    return ImmutableSet.copyOf(factories.keySet());
  }

  public boolean contains(String name) {
    return factories.containsKey(name.toLowerCase(Locale.ROOT));
  }

  /**
   * Parses a single invocation such as <code>min(a, b)</code> or <code>max(*)</code>.
   *
   * @throws UndefinedFunctionException if no function with the given name is registered
   * @throws StatsSyntaxError if the invocation is malformed or followed by other tokens
   */
  public StatsFunction parse(String invocation) throws StatsSyntaxError, UndefinedFunctionException {
    Lexer lex = new Lexer(invocation);
    return parse(lex, true);
  }

  /**
   * Parses an invocation at the current position of the lexer.
   *
   * @param requireEnd if true, nothing may follow the closing parenthesis
   */
  public StatsFunction parse(Lexer lex, boolean requireEnd) throws StatsSyntaxError, UndefinedFunctionException {
    if (lex.isQuoted() || lex.isEnd()) {
      throw new StatsSyntaxError("missing stats function name; context: [" + lex.context() + "]");
    }

    String name = lex.getToken().toLowerCase(Locale.ROOT);
    StatsFunctionFactory factory = factories.get(name);
    if (factory == null) {
      throw new UndefinedFunctionException(lex.getToken());
    }

    FieldSelector selector = FieldSelector.parse(lex, name);
    if (requireEnd && !lex.isEnd()) {
      throw new StatsSyntaxError(String.format("unexpected token after %s(...): '%s'", name, lex.getRawToken()));
    }
    return factory.create(selector, strictBlockExtremes);
  }
}
