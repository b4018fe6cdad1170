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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.logstats.block.BlockColumn;
import org.logstats.block.QueryBlock;
import org.logstats.engine.parser.FieldListParser;
import org.logstats.engine.parser.Lexer;
import org.logstats.engine.parser.StatsSyntaxError;

import java.util.Collection;
import java.util.List;

/**
 * The fields a stats function reads: either an explicit list of names, or <code>*</code>
 * which stands for every column of each block. Immutable, and shared by all processors
 * created from one parsed function.
 */
public class FieldSelector {
  private static final List<String> WILDCARD_FIELDS = ImmutableList.of(FieldListParser.WILDCARD);

  private final List<String> fields;
  private final boolean wildcard;

  private FieldSelector(List<String> fields, boolean wildcard) {
    this.fields = fields;
    this.wildcard = wildcard;
  }

  public static FieldSelector wildcard() {
    return new FieldSelector(WILDCARD_FIELDS, true);
  }

  public static FieldSelector of(String... fields) {
    return of(Lists.newArrayList(fields));
  }

  /**
   * Any <code>*</code> in the list turns the selector into a wildcard.
   */
  public static FieldSelector of(List<String> fields) {
    if (fields.contains(FieldListParser.WILDCARD)) {
      return wildcard();
    }
    return new FieldSelector(ImmutableList.copyOf(fields), false);
  }

  /**
   * Parses <code>funcName(...)</code> at the current position of the lexer.
   */
  public static FieldSelector parse(Lexer lex, String funcName) throws StatsSyntaxError {
    return of(FieldListParser.parseFieldNamesForStatsFunc(lex, funcName));
  }

  public boolean isWildcard() {
    return wildcard;
  }

  /**
   * @return the explicit field names in the written order; empty for a wildcard
   */
  public List<String> getFields() {
    return wildcard ? ImmutableList.<String>of() : fields;
  }

  /**
   * @return the fields which must be loaded for the function; <code>["*"]</code> for a wildcard
   */
  public List<String> neededFields() {
    return fields;
  }

  /**
   * Resolves the columns of the given block this selector refers to. Explicit fields
   * missing in the block resolve to empty-string columns.
   */
  public Collection<BlockColumn> resolve(QueryBlock block) {
    if (wildcard) {
      return block.getColumns();
    }
    List<BlockColumn> columns = Lists.newArrayListWithCapacity(fields.size());
    for (String field : fields) {
      columns.add(block.getColumnByName(field));
    }
    return columns;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof FieldSelector) {
      FieldSelector other = (FieldSelector) obj;
      return wildcard == other.wildcard && fields.equals(other.fields);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(fields, wildcard);
  }

  @Override
  public String toString() {
    return FieldListParser.fieldNamesString(fields);
  }
}
