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

import java.io.Closeable;
import java.io.IOException;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;
import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.helpers.LogLog;
import org.apache.log4j.spi.ErrorCode;
import org.apache.log4j.spi.LoggingEvent;
import org.wharf.configuration.WharfConfigurationFactory;
import org.wharf.queue.QueueMessage;
import org.wharf.queue.transport.QueueHandle;
import org.wharf.queue.transport.QueueTransport;
import org.wharf.queue.transport.QueueTransportException;
import org.wharf.queue.transport.QueueTransportFactory;
import org.wharf.queue.transport.fs.HadoopFsQueueTransport;

/**
 * Sends each logging event to a message queue.
 * <p>
 * The queue name and the optional message label are log4j conversion
 * patterns evaluated per event, so one appender can feed several queues:
 *
 * <pre>
 * log4j.appender.queue=org.wharf.inputtools.log4j.queue.WharfQueueAppender
 * log4j.appender.queue.Queue=errors/%c
 * log4j.appender.queue.Label=L-%p
 * log4j.appender.queue.CreateQueueIfNotExists=true
 * log4j.appender.queue.layout=org.apache.log4j.PatternLayout
 * log4j.appender.queue.layout.ConversionPattern=%d{ISO8601}|%p|%c|%m%n
 * </pre>
 *
 * Events for a queue that does not exist are dropped unless
 * <code>CreateQueueIfNotExists</code> is set. Transport failures are reported
 * to the appender's {@link org.apache.log4j.spi.ErrorHandler} and are not
 * retried.
 * <p>
 * Calling {@link #activateOptions()} again rebuilds the transport and the
 * message builder from the current options, unless they were injected with
 * {@link #setTransport(QueueTransport)} or
 * {@link #setMessageBuilder(MessageBuilder)}.
 */
public class WharfQueueAppender extends AppenderSkeleton {

  public static final String DEFAULT_CONVERSION_PATTERN = "%d{ISO8601}|%p|%c|%m%n";

  // events logged by the transport while this thread is sending are dropped
  private static final ThreadLocal<Boolean> sending = new ThreadLocal<Boolean>();

  protected String queue = null;
  protected String label = null;
  protected boolean createQueueIfNotExists = false;
  protected String encoding = QueueAppenderConfig.DEFAULT_ENCODING.name();
  protected boolean useXmlEncoding = false;
  protected String priority = "Normal";
  protected boolean recoverable = false;
  protected String transportClass = null;
  protected String queueRoot = null;
  protected String messageBuilderClass = null;

  protected QueueAppenderConfig config = null;
  protected QueueTransport transport = null;
  protected MessageBuilder messageBuilder = null;
  protected StackTraceLevel stackTraceLevel = StackTraceLevel.NONE;

  private boolean ownsTransport = false;
  private boolean ownsMessageBuilder = false;

  public WharfQueueAppender() {
  }

  public WharfQueueAppender(QueueTransport transport) {
    this.transport = transport;
  }

  @Override
  public void activateOptions() {
    super.activateOptions();

    if (layout == null) {
      LogLog.debug("No layout set for appender [" + name + "], using " + DEFAULT_CONVERSION_PATTERN);
      setLayout(new PatternLayout(DEFAULT_CONVERSION_PATTERN));
    }

    QueueAppenderConfig newConfig;
    try {
      newConfig = QueueAppenderConfig.builder()
          .queue(queue)
          .label(label)
          .createIfMissing(createQueueIfNotExists)
          .encoding(encoding)
          .useXmlBody(useXmlEncoding)
          .priority(priority)
          .recoverable(recoverable)
          .layout(layout)
          .transportClass(transportClass)
          .queueRoot(queueRoot)
          .messageBuilderClass(messageBuilderClass)
          .build();

      // instances built from a previous activation follow the current options
      if (messageBuilder == null || ownsMessageBuilder) {
        if (newConfig.getMessageBuilderClass() == null) {
          messageBuilder = new DefaultMessageBuilder();
        } else {
          messageBuilder = ReflectionUtils.newInstance(newConfig.getMessageBuilderClass(), null);
        }
        ownsMessageBuilder = true;
      }
      if (transport == null || ownsTransport) {
        QueueTransport newTransport =
            QueueTransportFactory.createTransport(getTransportConfiguration(newConfig));
        closeOwnedTransport();
        transport = newTransport;
        ownsTransport = true;
      }
    } catch (RuntimeException e) {
      config = null;
      errorHandler.error("Invalid configuration for appender [" + name + "]: " + e.getMessage(),
          e, ErrorCode.GENERIC_FAILURE);
      return;
    }

    if (!newConfig.hasQueueTemplate()) {
      LogLog.warn("No Queue set for appender [" + name + "], events will be dropped.");
    }
    stackTraceLevel = newConfig.getStackTraceLevel();
    config = newConfig;
    LogLog.debug("Appender [" + name + "] activated: " + config);
  }

  protected Configuration getTransportConfiguration(QueueAppenderConfig appenderConfig) {
    Configuration conf = new Configuration(
        WharfConfigurationFactory.getInstance().getTransportConfiguration());
    if (appenderConfig.getTransportClass() != null) {
      conf.setClass(QueueTransportFactory.TRANSPORT_CLASS_KEY,
          appenderConfig.getTransportClass(), QueueTransport.class);
    }
    if (appenderConfig.getQueueRoot() != null) {
      conf.set(HadoopFsQueueTransport.ROOT_KEY, appenderConfig.getQueueRoot());
    }
    return conf;
  }

  @Override
  protected void append(LoggingEvent event) {
    if (config == null || !config.hasQueueTemplate()) {
      return;
    }
    if (sending.get() != null) {
      return;
    }

    sending.set(Boolean.TRUE);
    try {
      send(event);
    } catch (QueueTransportException e) {
      errorHandler.error("Failed to send event to queue for appender [" + name + "]",
          e, ErrorCode.WRITE_FAILURE, event);
    } finally {
      sending.remove();
    }
  }

  protected void send(LoggingEvent event) throws QueueTransportException {
    if (stackTraceLevel != StackTraceLevel.NONE) {
      event.getLocationInformation();
    }

    String queueName = config.getQueueTemplate().format(event);

    if (!transport.exists(queueName)) {
      if (config.isCreateIfMissing()) {
        transport.create(queueName);
      } else {
        return;
      }
    }

    QueueHandle handle = transport.open(queueName);
    try {
      QueueMessage message = messageBuilder.prepareMessage(config, event);
      if (message != null) {
        handle.send(message);
      }
    } finally {
      handle.close();
    }
  }

  /**
   * Caller information needed by the layout, the queue and the label
   * patterns: 0 none, 1 class and method, 2 full location with source file.
   */
  public int needsStackTraceLevel() {
    if (config != null) {
      return stackTraceLevel.getValue();
    }
    StackTraceLevel level = StackTraceLevel.of(layout)
        .max(StackTraceLevel.ofPattern(queue))
        .max(StackTraceLevel.ofPattern(label));
    return level.getValue();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    closeOwnedTransport();
  }

  private void closeOwnedTransport() {
    if (ownsTransport && transport instanceof Closeable) {
      try {
        ((Closeable) transport).close();
      } catch (IOException e) {
        LogLog.warn("Could not close queue transport of appender [" + name + "]", e);
      }
    }
  }

  public boolean requiresLayout() {
    return true;
  }

  public QueueAppenderConfig getConfig() {
    return config;
  }

  public QueueTransport getTransport() {
    return transport;
  }

  public void setTransport(QueueTransport transport) {
    this.transport = transport;
    this.ownsTransport = false;
  }

  public MessageBuilder getMessageBuilder() {
    return messageBuilder;
  }

  public void setMessageBuilder(MessageBuilder messageBuilder) {
    this.messageBuilder = messageBuilder;
    this.ownsMessageBuilder = false;
  }

  public String getQueue() {
    return queue;
  }

  public void setQueue(String queue) {
    this.queue = queue;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public boolean getCreateQueueIfNotExists() {
    return createQueueIfNotExists;
  }

  public void setCreateQueueIfNotExists(boolean createQueueIfNotExists) {
    this.createQueueIfNotExists = createQueueIfNotExists;
  }

  public String getEncoding() {
    return encoding;
  }

  public void setEncoding(String encoding) {
    this.encoding = encoding;
  }

  public boolean getUseXmlEncoding() {
    return useXmlEncoding;
  }

  public void setUseXmlEncoding(boolean useXmlEncoding) {
    this.useXmlEncoding = useXmlEncoding;
  }

  public String getPriority() {
    return priority;
  }

  public void setPriority(String priority) {
    this.priority = priority;
  }

  public boolean getRecoverable() {
    return recoverable;
  }

  public void setRecoverable(boolean recoverable) {
    this.recoverable = recoverable;
  }

  public String getTransportClass() {
    return transportClass;
  }

  public void setTransportClass(String transportClass) {
    this.transportClass = transportClass;
  }

  public String getQueueRoot() {
    return queueRoot;
  }

  public void setQueueRoot(String queueRoot) {
    this.queueRoot = queueRoot;
  }

  public String getMessageBuilderClass() {
    return messageBuilderClass;
  }

  public void setMessageBuilderClass(String messageBuilderClass) {
    this.messageBuilderClass = messageBuilderClass;
  }
}
