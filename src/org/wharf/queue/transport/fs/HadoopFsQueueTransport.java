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
package org.wharf.queue.transport.fs;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;
import java.util.TimeZone;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.hadoop.conf.Configurable;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.PathFilter;
import org.apache.hadoop.io.IOUtils;
import org.apache.log4j.Logger;
import org.wharf.queue.MessagePriority;
import org.wharf.queue.QueueMessage;
import org.wharf.queue.transport.QueueHandle;
import org.wharf.queue.transport.QueueTransport;
import org.wharf.queue.transport.QueueTransportException;

/**
 * Queues stored as directories of a Hadoop {@link FileSystem}, the local one
 * unless {@value #FS_URI_KEY} says otherwise.
 * <p>
 * A queue name such as <code>path/to/Q</code> (or <code>.\private$\Q</code>)
 * maps to the directory <code>&lt;root&gt;/path/to/Q</code>. Every message is
 * one file, written under a <code>.tmp</code> name and renamed to
 * <code>.msg</code> once complete, so consumers never see partial messages.
 * File names sort by priority (highest first), then by age.
 */
public class HadoopFsQueueTransport implements QueueTransport, Configurable, Closeable {
  static Logger log = Logger.getLogger(HadoopFsQueueTransport.class);

  public static final String FS_URI_KEY = "wharf.transport.fs.uri";
  public static final String ROOT_KEY = "wharf.transport.fs.root";
  public static final String SYNC_KEY = "wharf.transport.fs.sync";

  public static final String DEFAULT_FS_URI = "file:///";
  public static final String DEFAULT_ROOT = "/tmp/wharf/queues";

  public static final String MESSAGE_SUFFIX = ".msg";
  public static final String TMP_SUFFIX = ".tmp";

  static final PathFilter MESSAGE_FILTER = new PathFilter() {
    public boolean accept(Path path) {
      return path.getName().endsWith(MESSAGE_SUFFIX);
    }
  };

  static String localHostAddr = null;

  static {
    try {
      localHostAddr = "_" + InetAddress.getLocalHost().getHostName() + "_";
    } catch (UnknownHostException e) {
      localHostAddr = "_NA_";
    }
  }

  private final SimpleDateFormat day = new SimpleDateFormat("yyyyMMdd'T'HHmmssSSS");
  private final AtomicLong sequence = new AtomicLong(0);

  private Configuration conf = null;
  private FileSystem fs = null;
  private Path root = null;
  private boolean syncRecoverable = true;

  public HadoopFsQueueTransport() {
    day.setTimeZone(TimeZone.getTimeZone("GMT"));
  }

  public HadoopFsQueueTransport(Configuration conf) {
    this();
    setConf(conf);
  }

  public void setConf(Configuration conf) {
    this.conf = conf;
    if (conf == null) {
      return;
    }
    root = new Path(conf.get(ROOT_KEY, DEFAULT_ROOT));
    syncRecoverable = conf.getBoolean(SYNC_KEY, true);
  }

  public Configuration getConf() {
    return conf;
  }

  public Path getRoot() {
    return root;
  }

  protected synchronized FileSystem getFileSystem() throws QueueTransportException {
    if (conf == null) {
      throw new QueueTransportException("HadoopFsQueueTransport has not been configured");
    }
    if (fs == null) {
      String fsUri = conf.get(FS_URI_KEY, DEFAULT_FS_URI);
      try {
        fs = FileSystem.newInstance(new URI(fsUri), conf);
      } catch (URISyntaxException e) {
        throw new QueueTransportException("Invalid file system URI: " + fsUri, e);
      } catch (IOException e) {
        throw new QueueTransportException("Cannot open file system " + fsUri, e);
      }
      log.info("Queue file system is " + fs.getUri() + ", queue root is " + root);
    }
    return fs;
  }

  protected Path getQueuePath(String queueName) throws QueueTransportException {
    if (queueName == null) {
      throw new QueueTransportException("Queue name is null");
    }
    StringBuilder relative = new StringBuilder(queueName.length());
    for (String segment : queueName.replace('\\', '/').split("/")) {
      String s = segment.trim();
      if (s.length() == 0 || s.equals(".")) {
        continue;
      }
      if (s.equals("..") || s.indexOf(':') >= 0) {
        throw new QueueTransportException("Invalid queue name: " + queueName);
      }
      if (relative.length() > 0) {
        relative.append('/');
      }
      relative.append(s);
    }
    if (relative.length() == 0) {
      throw new QueueTransportException("Invalid queue name: [" + queueName + "]");
    }
    return new Path(root, relative.toString());
  }

  public boolean exists(String queueName) throws QueueTransportException {
    Path queuePath = getQueuePath(queueName);
    try {
      return getFileSystem().getFileStatus(queuePath).isDirectory();
    } catch (FileNotFoundException e) {
      return false;
    } catch (IOException e) {
      throw new QueueTransportException("Cannot check queue " + queueName, e);
    }
  }

  public void create(String queueName) throws QueueTransportException {
    Path queuePath = getQueuePath(queueName);
    try {
      if (!getFileSystem().mkdirs(queuePath)) {
        throw new QueueTransportException("Cannot create queue directory: " + queuePath);
      }
    } catch (IOException e) {
      throw new QueueTransportException("Cannot create queue " + queueName, e);
    }
    log.info("Created queue " + queueName + " at " + queuePath);
  }

  public QueueHandle open(String queueName) throws QueueTransportException {
    return new FsQueueHandle(queueName, getQueuePath(queueName));
  }

  /**
   * Removes and returns the next message of a queue: highest priority first,
   * oldest first within a priority.
   *
   * @return the message, or null if the queue is empty
   */
  public QueueMessage receive(String queueName) throws QueueTransportException {
    FileSystem fileSystem = getFileSystem();
    Path queuePath = getQueuePath(queueName);
    for (Path messagePath : listMessages(fileSystem, queueName, queuePath)) {
      QueueMessage message = new QueueMessage();
      FSDataInputStream in = null;
      try {
        in = fileSystem.open(messagePath);
        message.readFields(in);
      } catch (FileNotFoundException e) {
        // taken by another consumer
        continue;
      } catch (IOException e) {
        throw new QueueTransportException("Cannot read message " + messagePath, e);
      } finally {
        IOUtils.closeStream(in);
      }
      try {
        if (fileSystem.delete(messagePath, false)) {
          return message;
        }
      } catch (IOException e) {
        throw new QueueTransportException("Cannot remove message " + messagePath, e);
      }
    }
    return null;
  }

  public int count(String queueName) throws QueueTransportException {
    return listMessages(getFileSystem(), queueName, getQueuePath(queueName)).length;
  }

  protected Path[] listMessages(FileSystem fileSystem, String queueName, Path queuePath)
      throws QueueTransportException {
    FileStatus[] statuses;
    try {
      statuses = fileSystem.listStatus(queuePath, MESSAGE_FILTER);
    } catch (FileNotFoundException e) {
      throw new QueueTransportException("Queue does not exist: " + queueName, e);
    } catch (IOException e) {
      throw new QueueTransportException("Cannot list queue " + queueName, e);
    }
    Path[] paths = new Path[statuses.length];
    for (int i = 0; i < statuses.length; i++) {
      paths[i] = statuses[i].getPath();
    }
    Arrays.sort(paths);
    return paths;
  }

  protected String nextMessageName(MessagePriority priority) {
    String timestamp;
    synchronized (day) {
      timestamp = day.format(new Date());
    }
    String uid = new java.rmi.server.UID().toString().replace("-", "").replace(":", "");
    return "p" + (MessagePriority.HIGHEST.getValue() - priority.getValue())
        + "_" + timestamp
        + "_" + String.format("%012d", sequence.getAndIncrement())
        + localHostAddr + uid;
  }

  public synchronized void close() throws IOException {
    if (fs != null) {
      fs.close();
      fs = null;
    }
  }

  private class FsQueueHandle implements QueueHandle {
    private final String queueName;
    private final Path queuePath;

    FsQueueHandle(String queueName, Path queuePath) {
      this.queueName = queueName;
      this.queuePath = queuePath;
    }

    public String getQueueName() {
      return queueName;
    }

    public void send(QueueMessage message) throws QueueTransportException {
      FileSystem fileSystem = getFileSystem();
      String name = nextMessageName(message.getPriority());
      Path tmpPath = new Path(queuePath, name + TMP_SUFFIX);
      Path messagePath = new Path(queuePath, name + MESSAGE_SUFFIX);

      FSDataOutputStream out = null;
      boolean committed = false;
      try {
        // create() would make the queue directory on the fly
        if (!fileSystem.exists(queuePath)) {
          throw new QueueTransportException("Queue does not exist: " + queueName);
        }
        out = fileSystem.create(tmpPath, false);
        message.write(out);
        if (message.isRecoverable() && syncRecoverable) {
          out.hsync();
        }
        out.close();
        out = null;
        if (!fileSystem.rename(tmpPath, messagePath)) {
          throw new QueueTransportException("Cannot commit message " + messagePath);
        }
        committed = true;
      } catch (IOException e) {
        throw new QueueTransportException("Cannot write message to queue " + queueName, e);
      } catch (IllegalStateException e) {
        throw new QueueTransportException("Cannot serialize message for queue " + queueName, e);
      } finally {
        IOUtils.closeStream(out);
        if (!committed) {
          discard(fileSystem, tmpPath);
        }
      }
      if (log.isDebugEnabled()) {
        log.debug("Sent " + message + " to " + messagePath);
      }
    }

    public void close() {
      // nothing is held open between sends
    }

    private void discard(FileSystem fileSystem, Path tmpPath) {
      try {
        fileSystem.delete(tmpPath, false);
      } catch (IOException e) {
        log.warn("Cannot remove incomplete message " + tmpPath, e);
      }
    }
  }
}
