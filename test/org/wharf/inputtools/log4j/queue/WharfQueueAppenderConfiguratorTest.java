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
package org.wharf.inputtools.log4j.queue;

import java.nio.charset.StandardCharsets;

import org.apache.log4j.Logger;
import org.apache.log4j.PropertyConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wharf.queue.MessagePriority;
import org.wharf.queue.QueueMessage;
import org.wharf.queue.transport.memory.InMemoryQueueTransport;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Configures the appender the way applications do, from a log4j properties file.
 */
class WharfQueueAppenderConfiguratorTest {

  private Logger parent;
  private WharfQueueAppender appender;

  @BeforeEach
  void setUp() {
    PropertyConfigurator.configure(getClass().getResource("/wharf-queue-appender.properties"));
    parent = Logger.getLogger("org.wharf.configured");
    appender = (WharfQueueAppender) parent.getAppender("queue");
  }

  @AfterEach
  void tearDown() {
    parent.removeAllAppenders();
    parent.setAdditivity(true);
  }

  @Test
  void propertiesReachTheAppender() {
    assertThat(appender).isNotNull();
    QueueAppenderConfig config = appender.getConfig();
    assertThat(config.getQueueTemplate().getPattern()).isEqualTo("app/%c{1}");
    assertThat(config.getLabelTemplate().getPattern()).isEqualTo("%p");
    assertThat(config.isCreateIfMissing()).isTrue();
    assertThat(config.getEncoding()).isEqualTo(StandardCharsets.UTF_16);
    assertThat(config.getPriority()).isEqualTo(MessagePriority.HIGH);
    assertThat(config.isRecoverable()).isTrue();
    assertThat(appender.getTransport()).isInstanceOf(InMemoryQueueTransport.class);
  }

  @Test
  void loggedEventArrivesOnItsQueue() throws Exception {
    Logger.getLogger("org.wharf.configured.Orders").warn("order 42 rejected");

    InMemoryQueueTransport transport = (InMemoryQueueTransport) appender.getTransport();
    QueueMessage message = transport.receive("app/Orders");
    assertThat(message).isNotNull();
    assertThat(message.getLabel()).isEqualTo("WARN");
    assertThat(message.getPriority()).isEqualTo(MessagePriority.HIGH);
    assertThat(message.isRecoverable()).isTrue();
    assertThat(new String(message.getBodyStream().toByteArray(), StandardCharsets.UTF_16))
      .isEqualTo("order 42 rejected");
    assertThat(transport.receive("app/Orders")).isNull();
  }

  @Test
  void thresholdFiltersEvents() throws Exception {
    Logger.getLogger("org.wharf.configured.Orders").debug("below threshold");

    InMemoryQueueTransport transport = (InMemoryQueueTransport) appender.getTransport();
    assertThat(transport.exists("app/Orders")).isFalse();
  }
}
