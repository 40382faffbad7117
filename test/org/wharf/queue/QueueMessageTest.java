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

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.hadoop.io.DataInputBuffer;
import org.apache.hadoop.io.DataOutputBuffer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueueMessageTest {

  @Test
  void textBodyTravelsAsXml() throws IOException {
    QueueMessage message = new QueueMessage();
    message.setBody("a < b && c > d\r\nnext line");

    String xml = new String(message.getBodyBytes(), StandardCharsets.UTF_8);
    assertThat(xml).startsWith("<?xml");
    assertThat(xml).contains("<string>").contains("&lt;").contains("&amp;&amp;");

    QueueMessage copy = copy(message);
    assertThat(copy.getBodyType()).isEqualTo(QueueMessage.BodyType.XML);
    assertThat(copy.getBody()).isEqualTo("a < b && c > d\r\nnext line");
  }

  @Test
  void binaryBodyIsKeptAsIs() throws IOException {
    byte[] data = {0, 1, (byte) 0xff, 'x'};
    QueueMessage message = new QueueMessage();
    message.setLabel("binary");
    message.setPriority(MessagePriority.LOWEST);
    message.setRecoverable(true);
    message.getBodyStream().write(data, 0, data.length);

    QueueMessage copy = copy(message);

    assertThat(copy.getBodyType()).isEqualTo(QueueMessage.BodyType.BINARY);
    assertThat(copy.getBody()).isNull();
    assertThat(copy.getBodyStream().toByteArray()).containsExactly(data);
    assertThat(copy.getLabel()).isEqualTo("binary");
    assertThat(copy.getPriority()).isEqualTo(MessagePriority.LOWEST);
    assertThat(copy.isRecoverable()).isTrue();
  }

  @Test
  void absentLabelStaysAbsentAndEmptyLabelStaysEmpty() throws IOException {
    QueueMessage unlabelled = new QueueMessage();
    assertThat(copy(unlabelled).hasLabel()).isFalse();

    QueueMessage empty = new QueueMessage();
    empty.setLabel("");
    assertThat(copy(empty).getLabel()).isEmpty();
  }

  @Test
  void xmlBodyWithWrongRootIsRejected() {
    assertThatThrownBy(() -> XmlBodyFormat.fromXml("<?xml version=\"1.0\"?><int>3</int>"))
      .isInstanceOf(IOException.class)
      .hasMessageContaining("int");
    assertThatThrownBy(() -> XmlBodyFormat.fromXml("<string>unterminated"))
      .isInstanceOf(IOException.class);
  }

  @Test
  void charactersXmlCannotCarryAreReplaced() throws IOException {
    QueueMessage message = new QueueMessage();
    message.setBody("\u001b[31mred\u001b[0m \u0000 \ud800 \ud83d\ude00\tend");

    QueueMessage copy = copy(message);

    assertThat(copy.getBody()).isEqualTo("\ufffd[31mred\ufffd[0m \ufffd \ufffd \ud83d\ude00\tend");
  }

  private static QueueMessage copy(QueueMessage message) throws IOException {
    DataOutputBuffer out = new DataOutputBuffer();
    message.write(out);
    DataInputBuffer in = new DataInputBuffer();
    in.reset(out.getData(), out.getLength());
    QueueMessage copy = new QueueMessage();
    copy.readFields(in);
    return copy;
  }
}
