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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.util.ExitUtil;

public class ExceptionUtil {
  private static final Log LOG = LogFactory.getLog(ExceptionUtil.class);

  /** Exit status used when a storage or encoding contract is broken */
  public static final int PANIC_EXIT_STATUS = 70;

  private ExceptionUtil() {
  }

  /**
   * Stops the process. It is used when continuing would produce a wrong result,
   * e.g., an unknown value encoding arrives from the storage layer.
   *
   * Unless the system exit is disabled through {@link ExitUtil#disableSystemExit()},
   * this method never returns. When it is disabled, {@link ExitUtil.ExitException} is thrown.
   * The return type only lets callers write <code>throw ExceptionUtil.panic(...)</code>.
   *
   * @param code Error code
   * @param args Message arguments
   * @return never returns normally
   */
  public static LogStatsInternalError panic(ResultCode code, String ... args) {
    String message = ErrorMessages.getMessage(code, args);
    LOG.fatal(message);
    ExitUtil.terminate(PANIC_EXIT_STATUS, message);
    // unreachable unless ExitUtil is replaced by a no-op
    throw new LogStatsInternalError(message);
  }
}
