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

import org.logstats.engine.function.FieldSelector;
import org.logstats.engine.function.StatsFunction;
import org.logstats.engine.function.StatsProcessor;

/**
 * <code>min(field, ...)</code> returns the lexically smallest canonical text of the given fields
 * over all rows, or <code>NaN</code> if there are no rows.
 */
public class StatsMin extends StatsFunction {
  public static final String NAME = "min";

  public StatsMin(FieldSelector selector, boolean strictBlockExtremes) {
    super(NAME, selector, strictBlockExtremes);
  }

  @Override
  public StatsProcessor newStatsProcessor() {
    return new MinProcessor(selector, strictBlockExtremes);
  }

  static class MinProcessor extends LexicalExtremeProcessor {
    MinProcessor(FieldSelector selector, boolean strictBlockExtremes) {
      super(selector, strictBlockExtremes);
    }

    @Override
    protected boolean isMinimum() {
      return true;
    }
  }
}
