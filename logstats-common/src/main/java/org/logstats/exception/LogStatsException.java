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

/**
 * LogStatsException contains all checked exceptions of LogStats. Every subclass
 * should be a failure which the caller is able to report back to the user.
 */
public class LogStatsException extends Exception implements DefaultLogStatsException {
  private static final long serialVersionUID = -6387213461852391746L;

  private final ResultCode code;

  public LogStatsException(ResultCode code, String ... args) {
    super(ErrorMessages.getMessage(code, args));
    this.code = code;
  }

  public LogStatsException(ResultCode code, Throwable cause, String ... args) {
    super(ErrorMessages.getMessage(code, args), cause);
    this.code = code;
  }

  @Override
  public ResultCode getErrorCode() {
    return code;
  }
}
