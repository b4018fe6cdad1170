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

import org.junit.Test;

import static org.junit.Assert.*;

public class TestErrorMessages {

  @Test
  public final void testMessages() {
    assertEquals("query has been killed", ErrorMessages.getMessage(ResultCode.QUERY_KILLED));
    assertEquals(302, ResultCode.QUERY_KILLED.getNumber());
    assertEquals("function does not exist: median",
        ErrorMessages.getMessage(ResultCode.UNDEFINED_FUNCTION, "median"));
    assertEquals("cannot calculate min(a): the retained state exceeds the limit of 10 bytes",
        ErrorMessages.getMessage(ResultCode.MEMORY_LIMIT_EXCEEDED, "min(a)", "10"));
  }

  @Test
  public final void testEveryCodeHasMessage() {
    for (ResultCode code : ResultCode.values()) {
      try {
        ErrorMessages.getMessage(code);
      } catch (LogStatsInternalError e) {
        // wrong number of arguments, but the template exists
        assertTrue(e.getMessage(), e.getMessage().contains("Error message arguments are invalid"));
      }
    }
  }

  @Test(expected = LogStatsInternalError.class)
  public final void testWrongArgumentCount() {
    ErrorMessages.getMessage(ResultCode.UNEXPECTED_VALUE_TYPE, "only one");
  }

  @Test
  public final void testExceptions() {
    LogStatsException checked = new UndefinedFunctionException("median");
    assertEquals(ResultCode.UNDEFINED_FUNCTION, checked.getErrorCode());
    assertEquals("function does not exist: median", checked.getMessage());

    LogStatsRuntimeException wrapped = new LogStatsRuntimeException(checked);
    assertEquals(ResultCode.UNDEFINED_FUNCTION, wrapped.getErrorCode());
    assertSame(checked, wrapped.getCause());

    assertEquals("internal error: broken", new LogStatsInternalError("broken").getMessage());

    IllegalStateException cause = new IllegalStateException("boom");
    LogStatsRuntimeException failed = new LogStatsRuntimeException(ResultCode.QUERY_FAILED, cause, "boom");
    assertEquals("query has been failed due to boom", failed.getMessage());
    assertSame(cause, failed.getCause());
  }
}
