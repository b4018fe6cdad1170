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

package org.logstats.conf;

import org.apache.hadoop.conf.Configuration;
import org.logstats.ConfigKey;
import org.logstats.LogStatsConstants;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;

public class LogStatsConf extends Configuration {
  private static final Map<String, ConfVars> vars = new HashMap<>();

  static {
    Configuration.addDefaultResource(LogStatsConstants.DEFAULT_CONF_FILENAME);
    Configuration.addDefaultResource(LogStatsConstants.SITE_CONF_FILENAME);

    for (ConfVars confVars: ConfVars.values()) {
      vars.put(confVars.keyname(), confVars);
    }
  }

  public LogStatsConf() {
    super();
  }

  public static enum ConfVars implements ConfigKey {

    ///////////////////////////////////////////////////////////////////////////////////////
    // Buffer Pool
    ///////////////////////////////////////////////////////////////////////////////////////
    BUFFER_POOL_THREAD_LOCAL_CACHE("logstats.buffer-pool.thread-local.cache", true),
    // initial capacity of a scratch buffer used to render one value
    SCRATCH_BUFFER_INITIAL_SIZE("logstats.buffer-pool.scratch.initial-size", 64),

    ///////////////////////////////////////////////////////////////////////////////////////
    // Stats Execution
    ///////////////////////////////////////////////////////////////////////////////////////
    STATS_WORKER_THREADS("logstats.stats.worker-threads", 4),
    // upper bound of the retained state of all processors of a single query
    STATS_MAX_STATE_BYTES("logstats.stats.max-state-bytes", 64L * 1024 * 1024),
    // use cached block extremes only when their text form keeps the numeric order
    STATS_STRICT_BLOCK_EXTREMES("logstats.stats.strict-block-extremes", true);

    public final String varname;
    public final String defaultVal;
    public final int defaultIntVal;
    public final long defaultLongVal;
    public final boolean defaultBoolVal;
    private final Class<?> valClass;

    ConfVars(String varname, int defaultIntVal) {
      this.varname = varname;
      this.valClass = Integer.class;
      this.defaultVal = Integer.toString(defaultIntVal);
      this.defaultIntVal = defaultIntVal;
      this.defaultLongVal = -1;
      this.defaultBoolVal = false;
    }

    ConfVars(String varname, long defaultLongVal) {
      this.varname = varname;
      this.valClass = Long.class;
      this.defaultVal = Long.toString(defaultLongVal);
      this.defaultIntVal = -1;
      this.defaultLongVal = defaultLongVal;
      this.defaultBoolVal = false;
    }

    ConfVars(String varname, boolean defaultBoolVal) {
      this.varname = varname;
      this.valClass = Boolean.class;
      this.defaultVal = Boolean.toString(defaultBoolVal);
      this.defaultIntVal = -1;
      this.defaultLongVal = -1;
      this.defaultBoolVal = defaultBoolVal;
    }

    @Override
    public String keyname() {
      return varname;
    }

    @Override
    public Class<?> valueClass() {
      return valClass;
    }

    @Override
    public String defaultValue() {
      return defaultVal;
    }
  }

  public static int getIntVar(Configuration conf, ConfVars var) {
    assert (var.valClass == Integer.class);
    return conf.getInt(var.varname, var.defaultIntVal);
  }

  public static void setIntVar(Configuration conf, ConfVars var, int val) {
    assert (var.valClass == Integer.class);
    conf.setInt(var.varname, val);
  }

  public int getIntVar(ConfVars var) {
    return getIntVar(this, var);
  }

  public void setIntVar(ConfVars var, int val) {
    setIntVar(this, var, val);
  }

  public static long getLongVar(Configuration conf, ConfVars var) {
    assert (var.valClass == Long.class || var.valClass == Integer.class);
    if (var.valClass == Integer.class) {
      return conf.getInt(var.varname, var.defaultIntVal);
    } else {
      return conf.getLong(var.varname, var.defaultLongVal);
    }
  }

  public static void setLongVar(Configuration conf, ConfVars var, long val) {
    assert (var.valClass == Long.class);
    conf.setLong(var.varname, val);
  }

  public long getLongVar(ConfVars var) {
    return getLongVar(this, var);
  }

  public void setLongVar(ConfVars var, long val) {
    setLongVar(this, var, val);
  }

  public static boolean getBoolVar(Configuration conf, ConfVars var) {
    assert (var.valClass == Boolean.class);
    return conf.getBoolean(var.varname, var.defaultBoolVal);
  }

  public static void setBoolVar(Configuration conf, ConfVars var, boolean val) {
    assert (var.valClass == Boolean.class);
    conf.setBoolean(var.varname, val);
  }

  public boolean getBoolVar(ConfVars var) {
    return getBoolVar(this, var);
  }

  public void setBoolVar(ConfVars var, boolean val) {
    setBoolVar(this, var, val);
  }

  public static String getVar(Configuration conf, ConfVars var) {
    return conf.get(var.varname, var.defaultVal);
  }

  public String getVar(ConfVars var) {
    return getVar(this, var);
  }

  public static ConfVars getConfVars(String name) {
    return vars.get(name);
  }

  public void logVars(PrintStream ps) {
    for (ConfVars one : ConfVars.values()) {
      ps.println(one.varname + "=" + getVar(one));
    }
  }
}
