/*
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

package org.wharf.configuration;


import java.io.File;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

/**
 * Transport configuration: <code>wharf-transport-default.xml</code> from the
 * classpath, overridden by <code>wharf-transport-conf.xml</code> from
 * <code>$WHARF_CONF_DIR</code> (default <code>$WHARF_HOME/conf</code>).
 */
public class WharfConfigurationFactory {
  static Logger log = Logger.getLogger(WharfConfigurationFactory.class);

  public static final String DEFAULT_RESOURCE = "wharf-transport-default.xml";
  public static final String SITE_FILE = "wharf-transport-conf.xml";

  static Object lock = new Object();

  protected static WharfConfigurationFactory wharfConfigurationFactory = null;
  protected Configuration transportConfiguration = null;
  protected String wharfConf = null;

  private WharfConfigurationFactory() {
    String wharfHome = System.getenv("WHARF_HOME");
    if (wharfHome == null) {
      wharfHome = ".";
    }

    if (!wharfHome.endsWith("/")) {
      wharfHome = wharfHome + File.separator;
    }

    wharfConf = System.getenv("WHARF_CONF_DIR");
    if (wharfConf == null) {
      wharfConf = wharfHome + "conf" + File.separator;
    }

    log.info("Wharf configuration is using " + wharfConf);
  }

  public static WharfConfigurationFactory getInstance() {
    synchronized(lock) {
      if ( wharfConfigurationFactory == null ) {
        wharfConfigurationFactory = new WharfConfigurationFactory();
      }
    }
    return wharfConfigurationFactory;
  }

  public String getConfDir() {
    return wharfConf;
  }

  /**
   * Shared instance, callers that change settings must work on a copy
   * (<code>new Configuration(getTransportConfiguration())</code>).
   */
  public Configuration getTransportConfiguration() {
    synchronized(lock) {
      if (transportConfiguration == null) {
        Configuration conf = new Configuration();
        conf.addResource(DEFAULT_RESOURCE);
        File siteFile = new File(wharfConf, SITE_FILE);
        if (siteFile.isFile()) {
          conf.addResource(new Path(siteFile.getAbsolutePath()));
          log.info("Loaded transport configuration from " + siteFile.getAbsolutePath());
        } else if (log.isDebugEnabled()) {
          log.debug("No " + SITE_FILE + " in " + wharfConf + ", using defaults");
        }
        transportConfiguration = conf;
      }
    }
    return transportConfiguration;
  }

}
