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

import org.apache.log4j.Layout;
import org.apache.log4j.spi.LoggingEvent;
import org.wharf.queue.QueueMessage;

public class DefaultMessageBuilder implements MessageBuilder {

  public QueueMessage prepareMessage(QueueAppenderConfig config, LoggingEvent event) {
    QueueMessage message = new QueueMessage();
    if (config.getLabelTemplate() != null) {
      message.setLabel(config.getLabelTemplate().format(event));
    }
    message.setRecoverable(config.isRecoverable());
    message.setPriority(config.getPriority());

    String text = formatBody(config.getLayout(), event);
    if (config.isUseXmlBody()) {
      message.setBody(text);
    } else {
      byte[] data = text.getBytes(config.getEncoding());
      message.getBodyStream().write(data, 0, data.length);
    }
    return message;
  }

  protected String formatBody(Layout layout, LoggingEvent event) {
    StringBuilder sb = new StringBuilder(layout.format(event));

    if (layout.ignoresThrowable()) {
      String[] s = event.getThrowableStrRep();
      if (s != null) {
        int len = s.length;
        for (int i = 0; i < len; i++) {
          sb.append(s[i]);
          sb.append(Layout.LINE_SEP);
        }
      }
    }
    return sb.toString();
  }
}
