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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import org.apache.log4j.Layout;
import org.apache.log4j.helpers.Loader;
import org.wharf.queue.MessagePriority;
import org.wharf.queue.transport.QueueTransport;

/**
 * Settings of a {@link WharfQueueAppender}, validated once when the appender
 * is activated and read-only afterwards.
 */
public final class QueueAppenderConfig {
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;
  public static final MessagePriority DEFAULT_PRIORITY = MessagePriority.NORMAL;

  private final QueueTemplate queueTemplate;
  private final QueueTemplate labelTemplate;
  private final boolean createIfMissing;
  private final Charset encoding;
  private final boolean useXmlBody;
  private final MessagePriority priority;
  private final boolean recoverable;
  private final Layout layout;
  private final Class<? extends QueueTransport> transportClass;
  private final String queueRoot;
  private final Class<? extends MessageBuilder> messageBuilderClass;

  private QueueAppenderConfig(Builder builder, Charset encoding, MessagePriority priority,
      Class<? extends QueueTransport> transportClass,
      Class<? extends MessageBuilder> messageBuilderClass) {
    this.queueTemplate = isBlank(builder.queue) ? null : new QueueTemplate(builder.queue);
    this.labelTemplate = (builder.label == null) ? null : new QueueTemplate(builder.label);
    this.createIfMissing = builder.createIfMissing;
    this.encoding = encoding;
    this.useXmlBody = builder.useXmlBody;
    this.priority = priority;
    this.recoverable = builder.recoverable;
    this.layout = builder.layout;
    this.transportClass = transportClass;
    this.queueRoot = isBlank(builder.queueRoot) ? null : builder.queueRoot.trim();
    this.messageBuilderClass = messageBuilderClass;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean hasQueueTemplate() {
    return queueTemplate != null;
  }

  /** @return the queue name template, or null if none was configured */
  public QueueTemplate getQueueTemplate() {
    return queueTemplate;
  }

  /** @return the label template, or null if messages carry no label */
  public QueueTemplate getLabelTemplate() {
    return labelTemplate;
  }

  public boolean isCreateIfMissing() {
    return createIfMissing;
  }

  public Charset getEncoding() {
    return encoding;
  }

  public boolean isUseXmlBody() {
    return useXmlBody;
  }

  public MessagePriority getPriority() {
    return priority;
  }

  public boolean isRecoverable() {
    return recoverable;
  }

  public Layout getLayout() {
    return layout;
  }

  public Class<? extends QueueTransport> getTransportClass() {
    return transportClass;
  }

  public String getQueueRoot() {
    return queueRoot;
  }

  public Class<? extends MessageBuilder> getMessageBuilderClass() {
    return messageBuilderClass;
  }

  public StackTraceLevel getStackTraceLevel() {
    StackTraceLevel level = StackTraceLevel.of(layout);
    if (queueTemplate != null) {
      level = level.max(queueTemplate.getStackTraceLevel());
    }
    if (labelTemplate != null) {
      level = level.max(labelTemplate.getStackTraceLevel());
    }
    return level;
  }

  @Override
  public String toString() {
    return "QueueAppenderConfig[queue=" + queueTemplate + ", label=" + labelTemplate
        + ", createIfMissing=" + createIfMissing + ", encoding=" + encoding.name()
        + ", useXmlBody=" + useXmlBody + ", priority=" + priority
        + ", recoverable=" + recoverable + "]";
  }

  static boolean isBlank(String s) {
    return s == null || s.trim().length() == 0;
  }

  public static class Builder {
    private String queue = null;
    private String label = null;
    private boolean createIfMissing = false;
    private String encoding = DEFAULT_ENCODING.name();
    private boolean useXmlBody = false;
    private String priority = DEFAULT_PRIORITY.name();
    private boolean recoverable = false;
    private Layout layout = null;
    private String transportClass = null;
    private String queueRoot = null;
    private String messageBuilderClass = null;

    private Builder() {
    }

    public Builder queue(String queue) {
      this.queue = queue;
      return this;
    }

    public Builder label(String label) {
      this.label = label;
      return this;
    }

    public Builder createIfMissing(boolean createIfMissing) {
      this.createIfMissing = createIfMissing;
      return this;
    }

    public Builder encoding(String encoding) {
      this.encoding = encoding;
      return this;
    }

    public Builder useXmlBody(boolean useXmlBody) {
      this.useXmlBody = useXmlBody;
      return this;
    }

    public Builder priority(String priority) {
      this.priority = priority;
      return this;
    }

    public Builder recoverable(boolean recoverable) {
      this.recoverable = recoverable;
      return this;
    }

    public Builder layout(Layout layout) {
      this.layout = layout;
      return this;
    }

    public Builder transportClass(String transportClass) {
      this.transportClass = transportClass;
      return this;
    }

    public Builder queueRoot(String queueRoot) {
      this.queueRoot = queueRoot;
      return this;
    }

    public Builder messageBuilderClass(String messageBuilderClass) {
      this.messageBuilderClass = messageBuilderClass;
      return this;
    }

    /**
     * @throws IllegalArgumentException on an unknown encoding or priority, a
     *           missing layout, or a class that cannot be loaded or has the
     *           wrong type
     */
    public QueueAppenderConfig build() {
      if (layout == null) {
        throw new IllegalArgumentException("No layout set");
      }
      return new QueueAppenderConfig(this,
          toCharset(encoding),
          MessagePriority.parse(priority),
          toClass(transportClass, QueueTransport.class),
          toClass(messageBuilderClass, MessageBuilder.class));
    }

    private static Charset toCharset(String encoding) {
      if (isBlank(encoding)) {
        return DEFAULT_ENCODING;
      }
      try {
        return Charset.forName(encoding.trim());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown encoding: " + encoding, e);
      }
    }

    private static <T> Class<? extends T> toClass(String className, Class<T> type) {
      if (isBlank(className)) {
        return null;
      }
      Class<?> clazz;
      try {
        clazz = Loader.loadClass(className.trim());
      } catch (ClassNotFoundException e) {
        throw new IllegalArgumentException("Class not found: " + className, e);
      }
      if (!type.isAssignableFrom(clazz)) {
        throw new IllegalArgumentException(className + " does not implement " + type.getName());
      }
      return clazz.asSubclass(type);
    }
  }
}
