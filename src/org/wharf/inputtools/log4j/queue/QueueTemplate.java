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

import org.apache.log4j.PatternLayout;
import org.apache.log4j.spi.LoggingEvent;

/**
 * A per-event string, such as a queue name or a message label, written as a
 * log4j conversion pattern: <code>errors/%c</code>, <code>L-%p</code>.
 * <p>
 * Not thread safe, {@link PatternLayout} reuses its buffer. The appender
 * only formats while holding its own lock.
 */
public class QueueTemplate {
  private final String pattern;
  private final PatternLayout layout;
  private final StackTraceLevel stackTraceLevel;

  public QueueTemplate(String pattern) {
    if (pattern == null) {
      throw new IllegalArgumentException("pattern cannot be null");
    }
    this.pattern = pattern;
    this.layout = new PatternLayout(pattern);
    this.stackTraceLevel = StackTraceLevel.ofPattern(pattern);
  }

  public String format(LoggingEvent event) {
    return layout.format(event);
  }

  public String getPattern() {
    return pattern;
  }

  public StackTraceLevel getStackTraceLevel() {
    return stackTraceLevel;
  }

  @Override
  public String toString() {
    return pattern;
  }
}
