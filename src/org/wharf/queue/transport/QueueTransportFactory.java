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
package org.wharf.queue.transport;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;
import org.apache.log4j.Logger;
import org.wharf.queue.transport.fs.HadoopFsQueueTransport;

public class QueueTransportFactory {
  static Logger log = Logger.getLogger(QueueTransportFactory.class);

  public static final String TRANSPORT_CLASS_KEY = "wharf.transport.class";
  public static final Class<? extends QueueTransport> DEFAULT_TRANSPORT_CLASS = HadoopFsQueueTransport.class;

  private QueueTransportFactory() {
  }

  /**
   * Instantiates the transport named by {@value #TRANSPORT_CLASS_KEY}.
   *
   * @throws RuntimeException if the class cannot be loaded, does not
   *           implement {@link QueueTransport} or cannot be instantiated
   */
  public static QueueTransport createTransport(Configuration conf) {
    Class<? extends QueueTransport> transportClass = conf.getClass(TRANSPORT_CLASS_KEY,
        DEFAULT_TRANSPORT_CLASS, QueueTransport.class);
    QueueTransport transport = ReflectionUtils.newInstance(transportClass, conf);
    log.info("Queue transport is " + transportClass.getName());
    return transport;
  }
}
