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

import java.io.Closeable;

import org.wharf.queue.QueueMessage;

/**
 * A queue opened for sending. Handles are cheap and are not meant to be
 * kept across log events.
 */
public interface QueueHandle extends Closeable {

  String getQueueName();

  void send(QueueMessage message) throws QueueTransportException;

  /** Releases the handle. Never fails. */
  void close();
}
