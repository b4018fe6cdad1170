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

package org.logstats.exception;

import com.google.common.base.Joiner;
import com.google.common.collect.Maps;

import java.util.Map;

import static org.logstats.exception.ResultCode.*;

public class ErrorMessages {
  private static final Map<ResultCode, Template> MESSAGES;

  static {
    MESSAGES = Maps.newEnumMap(ResultCode.class);

    // General Errors
    ADD_MESSAGE(INTERNAL_ERROR, "internal error: %s", 1);

    // Query Management
    ADD_MESSAGE(QUERY_FAILED, "query has been failed due to %s", 1);
    ADD_MESSAGE(QUERY_KILLED, "query has been killed");
    ADD_MESSAGE(MEMORY_LIMIT_EXCEEDED,
        "cannot calculate %s: the retained state exceeds the limit of %s bytes", 2);

    // Syntax Error
    ADD_MESSAGE(SYNTAX_ERROR, "%s", 1);
    ADD_MESSAGE(UNDEFINED_FUNCTION, "function does not exist: %s", 1);

    // Storage and Block Format
    ADD_MESSAGE(UNKNOWN_VALUE_TYPE, "BUG: unknown valueType=%s", 1);
    ADD_MESSAGE(UNEXPECTED_VALUE_TYPE, "BUG: unexpected valueType=%s for %s", 2);
  }

  private static class Template {
    final String format;
    final int numArgs;

    Template(String format, int numArgs) {
      this.format = format;
      this.numArgs = numArgs;
    }
  }

  private static void ADD_MESSAGE(ResultCode code, String msgFormat) {
    ADD_MESSAGE(code, msgFormat, 0);
  }

  private static void ADD_MESSAGE(ResultCode code, String msgFormat, int argNum) {
    MESSAGES.put(code, new Template(msgFormat, argNum));
  }

  public static String getMessage(ResultCode code, String...args) {
    Template template = MESSAGES.get(code);
    if (template == null) {
      throw new LogStatsInternalError("no error message for " + code);
    }

    if (template.numArgs != args.length) {
      throw new LogStatsInternalError(
          "Error message arguments are invalid: code=" + code.name() + ", args=" + Joiner.on(",").join(args));
    }

    if (args.length == 0) {
      return template.format;
    } else {
      return String.format(template.format, (Object[]) args);
    }
  }
}
