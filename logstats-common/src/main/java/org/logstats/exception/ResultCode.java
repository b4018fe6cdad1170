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

public enum ResultCode {
  // General Errors
  INTERNAL_ERROR(201),

  // Query Management
  QUERY_FAILED(301),
  QUERY_KILLED(302),
  MEMORY_LIMIT_EXCEEDED(303),

  // Syntax Error
  SYNTAX_ERROR(601),
  UNDEFINED_FUNCTION(602),

  // Storage and Block Format
  UNKNOWN_VALUE_TYPE(702),
  UNEXPECTED_VALUE_TYPE(703);

  private final int code;

  ResultCode(int code) {
    this.code = code;
  }

  public int getNumber() {
    return code;
  }
}
