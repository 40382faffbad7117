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

import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.wharf.queue.QueueMessage;
import org.wharf.queue.transport.QueueHandle;
import org.wharf.queue.transport.QueueTransport;
import org.wharf.queue.transport.QueueTransportException;

/**
 * Process-local queues. Messages are received highest priority first, in
 * sending order within a priority. Nothing survives the JVM, whatever the
 * recoverable flag says.
 */
public class InMemoryQueueTransport implements QueueTransport {

  private static final Comparator<Entry> ORDER = new Comparator<Entry>() {
    public int compare(Entry a, Entry b) {
      int byPriority = b.message.getPriority().compareTo(a.message.getPriority());
      if (byPriority != 0) {
        return byPriority;
      }
      return Long.compare(a.seqId, b.seqId);
    }
  };

  private final ConcurrentMap<String, PriorityBlockingQueue<Entry>> queues =
      new ConcurrentHashMap<String, PriorityBlockingQueue<Entry>>();
  private final AtomicLong seqId = new AtomicLong(0);

  private static class Entry {
    final QueueMessage message;
    final long seqId;

    Entry(QueueMessage message, long seqId) {
      this.message = message;
      this.seqId = seqId;
    }
  }

  public boolean exists(String queueName) {
    return queues.containsKey(queueName);
  }

  public void create(String queueName) {
    queues.putIfAbsent(queueName, new PriorityBlockingQueue<Entry>(11, ORDER));
  }

  public QueueHandle open(final String queueName) {
    return new QueueHandle() {
      public String getQueueName() {
        return queueName;
      }

      public void send(QueueMessage message) throws QueueTransportException {
        getQueue(queueName).add(new Entry(message, seqId.getAndIncrement()));
      }

      public void close() {
        // nothing to release
      }
    };
  }

  /** @return the next message, or null if the queue is empty */
  public QueueMessage receive(String queueName) throws QueueTransportException {
    Entry entry = getQueue(queueName).poll();
    return (entry == null) ? null : entry.message;
  }

  /** @return the next message, or null if none arrived before the timeout */
  public QueueMessage receive(String queueName, long timeout, TimeUnit unit)
      throws QueueTransportException, InterruptedException {
    Entry entry = getQueue(queueName).poll(timeout, unit);
    return (entry == null) ? null : entry.message;
  }

  public int count(String queueName) throws QueueTransportException {
    return getQueue(queueName).size();
  }

  public void delete(String queueName) {
    queues.remove(queueName);
  }

  private PriorityBlockingQueue<Entry> getQueue(String queueName) throws QueueTransportException {
    PriorityBlockingQueue<Entry> queue = queues.get(queueName);
    if (queue == null) {
      throw new QueueTransportException("Queue does not exist: " + queueName);
    }
    return queue;
  }
}
