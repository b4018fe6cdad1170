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

package org.logstats;

public class LogStatsConstants {
  public static final String TEST_KEY = "logstats.test.enabled";
  public static final boolean IS_TEST_MODE = Boolean.parseBoolean(System.getProperty(TEST_KEY, "false"));

  public static final String DEFAULT_CONF_FILENAME = "logstats-default.xml";
  public static final String SITE_CONF_FILENAME = "logstats-site.xml";

  /** Name of the implicit per-row timestamp column */
  public static final String TIME_FIELD = "_time";

  /** Name of the log message field, which an empty field name refers to */
  public static final String MSG_FIELD = "_msg";

  /** Finalized value of a stats function which has observed no input */
  public static final String NAN = "NaN";

  public static final String EMPTY_STRING = "";

  private LogStatsConstants() {}
}
