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
package org.wharf.queue.transport.memory;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.wharf.queue.MessagePriority;
import org.wharf.queue.QueueMessage;
import org.wharf.queue.transport.QueueHandle;
import org.wharf.queue.transport.QueueTransportException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryQueueTransportTest {

  private final InMemoryQueueTransport transport = new InMemoryQueueTransport();

  @Test
  void queuesExistOnceCreated() {
    assertThat(transport.exists("q")).isFalse();
    transport.create("q");
    transport.create("q");
    assertThat(transport.exists("q")).isTrue();

    transport.delete("q");
    assertThat(transport.exists("q")).isFalse();
  }

  @Test
  void receiveHonoursPriorityThenSendingOrder() throws Exception {
    transport.create("q");
    QueueHandle handle = transport.open("q");
    handle.send(message("a", MessagePriority.NORMAL));
    handle.send(message("b", MessagePriority.HIGHEST));
    handle.send(message("c", MessagePriority.NORMAL));
    handle.send(message("d", MessagePriority.LOWEST));
    handle.close();

    assertThat(transport.count("q")).isEqualTo(4);
    assertThat(transport.receive("q").getLabel()).isEqualTo("b");
    assertThat(transport.receive("q").getLabel()).isEqualTo("a");
    assertThat(transport.receive("q").getLabel()).isEqualTo("c");
    assertThat(transport.receive("q").getLabel()).isEqualTo("d");
    assertThat(transport.receive("q")).isNull();
  }

  @Test
  void receiveWaitsUpToTimeout() throws Exception {
    transport.create("q");

    assertThat(transport.receive("q", 10, TimeUnit.MILLISECONDS)).isNull();
  }

  @Test
  void missingQueueFails() {
    QueueHandle handle = transport.open("missing");

    assertThatThrownBy(() -> handle.send(message("x", MessagePriority.NORMAL)))
      .isInstanceOf(QueueTransportException.class)
      .hasMessageContaining("missing");
    assertThatThrownBy(() -> transport.receive("missing")).isInstanceOf(QueueTransportException.class);
  }

  private static QueueMessage message(String label, MessagePriority priority) {
    QueueMessage message = new QueueMessage();
    message.setLabel(label);
    message.setPriority(priority);
    return message;
  }
}
