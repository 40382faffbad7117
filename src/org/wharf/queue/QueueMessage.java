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

import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.Writable;
import org.apache.hadoop.io.WritableUtils;

/**
 * A message handed to a queue transport.
 * <p>
 * The body is either a text object, serialized by the transport in its XML
 * representation (see {@link XmlBodyFormat}), or raw bytes written to
 * {@link #getBodyStream()}. Setting a text body takes precedence over the
 * body stream.
 */
public class QueueMessage implements Writable {

  public enum BodyType {
    BINARY,
    XML
  }

  private String label = null;
  private MessagePriority priority = MessagePriority.NORMAL;
  private boolean recoverable = false;
  private String body = null;
  private ByteArrayOutputStream bodyStream = new ByteArrayOutputStream();

  public QueueMessage() {
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public boolean hasLabel() {
    return label != null;
  }

  public MessagePriority getPriority() {
    return priority;
  }

  public void setPriority(MessagePriority priority) {
    if (priority == null) {
      throw new IllegalArgumentException("priority cannot be null");
    }
    this.priority = priority;
  }

  public boolean isRecoverable() {
    return recoverable;
  }

  public void setRecoverable(boolean recoverable) {
    this.recoverable = recoverable;
  }

  /** The text body, or null when the message carries a binary body. */
  public String getBody() {
    return body;
  }

  public void setBody(String body) {
    this.body = body;
  }

  public ByteArrayOutputStream getBodyStream() {
    return bodyStream;
  }

  public BodyType getBodyType() {
    return (body != null) ? BodyType.XML : BodyType.BINARY;
  }

  /**
   * Bytes as they travel on the transport: the XML document for a text body,
   * the content of the body stream otherwise.
   */
  public byte[] getBodyBytes() {
    if (body != null) {
      return XmlBodyFormat.toXml(body).getBytes(StandardCharsets.UTF_8);
    }
    return bodyStream.toByteArray();
  }

  public void write(DataOutput out) throws IOException {
    out.writeBoolean(label != null);
    if (label != null) {
      Text.writeString(out, label);
    }
    out.writeByte(priority.getValue());
    out.writeBoolean(recoverable);
    WritableUtils.writeEnum(out, getBodyType());
    byte[] data = getBodyBytes();
    WritableUtils.writeVInt(out, data.length);
    out.write(data);
  }

  public void readFields(DataInput in) throws IOException {
    label = in.readBoolean() ? Text.readString(in) : null;
    try {
      priority = MessagePriority.fromValue(in.readByte());
    } catch (IllegalArgumentException e) {
      throw new IOException(e.getMessage(), e);
    }
    recoverable = in.readBoolean();
    BodyType bodyType = WritableUtils.readEnum(in, BodyType.class);
    byte[] data = new byte[WritableUtils.readVInt(in)];
    in.readFully(data);

    bodyStream.reset();
    if (bodyType == BodyType.XML) {
      body = XmlBodyFormat.fromXml(new String(data, StandardCharsets.UTF_8));
    } else {
      body = null;
      bodyStream.write(data, 0, data.length);
    }
  }

  @Override
  public String toString() {
    return "QueueMessage[label=" + label + ", priority=" + priority
        + ", recoverable=" + recoverable + ", bodyType=" + getBodyType()
        + ", bodySize=" + (body != null ? body.length() : bodyStream.size()) + "]";
  }
}
