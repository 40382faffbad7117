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

import org.apache.log4j.EnhancedPatternLayout;
import org.apache.log4j.HTMLLayout;
import org.apache.log4j.Layout;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.xml.XMLLayout;

/**
 * How much caller information a layout needs from the logging event.
 */
public enum StackTraceLevel {
  /** No caller information. */
  NONE(0),
  /** Calling class and method, without source file information. */
  WITHOUT_SOURCE(1),
  /** Full location: source file and line number. */
  FULL(2);

  private final int value;

  StackTraceLevel(int value) {
    this.value = value;
  }

  public int getValue() {
    return value;
  }

  public StackTraceLevel max(StackTraceLevel other) {
    return (other != null && other.value > value) ? other : this;
  }

  public static StackTraceLevel of(Layout layout) {
    if (layout instanceof PatternLayout) {
      return ofPattern(((PatternLayout) layout).getConversionPattern());
    }
    if (layout instanceof EnhancedPatternLayout) {
      return ofPattern(((EnhancedPatternLayout) layout).getConversionPattern());
    }
    if (layout instanceof XMLLayout) {
      return ((XMLLayout) layout).getLocationInfo() ? FULL : NONE;
    }
    if (layout instanceof HTMLLayout) {
      return ((HTMLLayout) layout).getLocationInfo() ? FULL : NONE;
    }
    return NONE;
  }

  /**
   * Scans a log4j conversion pattern: <code>%C</code> and <code>%M</code>
   * need the caller frame, <code>%F</code>, <code>%L</code> and
   * <code>%l</code> need its source information.
   */
  public static StackTraceLevel ofPattern(String pattern) {
    StackTraceLevel level = NONE;
    if (pattern == null) {
      return level;
    }
    int len = pattern.length();
    int i = 0;
    while (i < len) {
      if (pattern.charAt(i++) != '%' || i >= len) {
        continue;
      }
      if (pattern.charAt(i) == '%') {
        i++;
        continue;
      }
      // format modifiers, e.g. %-20.30C
      while (i < len && (pattern.charAt(i) == '-' || pattern.charAt(i) == '.'
          || Character.isDigit(pattern.charAt(i)))) {
        i++;
      }
      if (i >= len) {
        break;
      }
      switch (pattern.charAt(i++)) {
      case 'F':
      case 'L':
      case 'l':
        return FULL;
      case 'C':
      case 'M':
        level = WITHOUT_SOURCE;
        break;
      default:
        break;
      }
    }
    return level;
  }
}
