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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessagePriorityTest {

  @Test
  void parsesConfigurationSpellings() {
    assertThat(MessagePriority.parse("Normal")).isEqualTo(MessagePriority.NORMAL);
    assertThat(MessagePriority.parse("AboveNormal")).isEqualTo(MessagePriority.ABOVE_NORMAL);
    assertThat(MessagePriority.parse("above_normal")).isEqualTo(MessagePriority.ABOVE_NORMAL);
    assertThat(MessagePriority.parse("very-low")).isEqualTo(MessagePriority.VERY_LOW);
  }

  @Test
  void rejectsUnknownNames() {
    assertThatThrownBy(() -> MessagePriority.parse("urgent")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> MessagePriority.parse(null)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void valuesRangeFromLowestToHighest() {
    assertThat(MessagePriority.LOWEST.getValue()).isZero();
    assertThat(MessagePriority.NORMAL.getValue()).isEqualTo(3);
    assertThat(MessagePriority.HIGHEST.getValue()).isEqualTo(7);
    assertThat(MessagePriority.fromValue(5)).isEqualTo(MessagePriority.HIGH);
    assertThatThrownBy(() -> MessagePriority.fromValue(8)).isInstanceOf(IllegalArgumentException.class);
  }
}
