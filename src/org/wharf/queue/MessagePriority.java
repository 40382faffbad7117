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
package org.wharf.queue;

/**
 * Delivery priority of a queued message, from {@link #LOWEST} (0) to
 * {@link #HIGHEST} (7).
 */
public enum MessagePriority {
  LOWEST,
  VERY_LOW,
  LOW,
  NORMAL,
  ABOVE_NORMAL,
  HIGH,
  VERY_HIGH,
  HIGHEST;

  public int getValue() {
    return ordinal();
  }

  public static MessagePriority fromValue(int value) {
    MessagePriority[] priorities = values();
    if (value < 0 || value >= priorities.length) {
      throw new IllegalArgumentException("Invalid message priority value: " + value);
    }
    return priorities[value];
  }

  /**
   * Accepts the enum name as well as the usual spellings found in
   * configuration files: "AboveNormal", "above-normal", "above normal".
   */
  public static MessagePriority parse(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Message priority is null");
    }
    String wanted = normalize(name);
    for (MessagePriority priority : values()) {
      if (normalize(priority.name()).equals(wanted)) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Unknown message priority: " + name);
  }

  private static String normalize(String name) {
    StringBuilder sb = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(Character.toUpperCase(c));
      }
    }
    return sb.toString();
  }
}
