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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import java.util.List;

/**
 * A parsed stats function invocation such as <code>min(a, b)</code>. It creates a fresh
 * {@link StatsProcessor} for every computation context.
 */
public abstract class StatsFunction {
  private final String name;
  protected final FieldSelector selector;
  protected final boolean strictBlockExtremes;

  protected StatsFunction(String name, FieldSelector selector, boolean strictBlockExtremes) {
    this.name = Preconditions.checkNotNull(name);
    this.selector = Preconditions.checkNotNull(selector);
    this.strictBlockExtremes = strictBlockExtremes;
  }

  public String getName() {
    return name;
  }

  public FieldSelector getSelector() {
    return selector;
  }

  public abstract StatsProcessor newStatsProcessor();

  public List<String> neededFields() {
    return selector.neededFields();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof StatsFunction) {
      StatsFunction other = (StatsFunction) obj;
      return getClass() == other.getClass() && selector.equals(other.selector)
          && strictBlockExtremes == other.strictBlockExtremes;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, selector, strictBlockExtremes);
  }

  @Override
  public String toString() {
    return name + "(" + selector + ")";
  }
}
