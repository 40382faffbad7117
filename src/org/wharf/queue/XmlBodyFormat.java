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
import java.io.StringReader;
import java.io.StringWriter;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import javax.xml.stream.XMLStreamWriter;

/**
 * XML representation of a text message body:
 * <pre>&lt;?xml version="1.0"?&gt;&lt;string&gt;text&lt;/string&gt;</pre>
 * Documents are always UTF-8. Characters XML 1.0 cannot carry (control
 * characters other than tab, line feed and carriage return, unpaired
 * surrogates, U+FFFE and U+FFFF) are written as U+FFFD.
 */
public final class XmlBodyFormat {
  public static final String ROOT_ELEMENT = "string";
  public static final char REPLACEMENT_CHAR = '\uFFFD';

  private static final XMLOutputFactory outputFactory = XMLOutputFactory.newInstance();
  private static final XMLInputFactory inputFactory = XMLInputFactory.newInstance();

  static {
    inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    inputFactory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
  }

  private XmlBodyFormat() {
  }

  public static String toXml(String text) {
    text = replaceInvalidChars(text);
    StringWriter out = new StringWriter(text.length() + 64);
    try {
      XMLStreamWriter writer = outputFactory.createXMLStreamWriter(out);
      writer.writeStartDocument("1.0");
      writer.writeStartElement(ROOT_ELEMENT);
      // carriage returns would be normalized away by any parser
      int start = 0;
      int cr;
      while ((cr = text.indexOf('\r', start)) >= 0) {
        writer.writeCharacters(text.substring(start, cr));
        writer.writeEntityRef("#13");
        start = cr + 1;
      }
      writer.writeCharacters(text.substring(start));
      writer.writeEndElement();
      writer.writeEndDocument();
      writer.close();
    } catch (XMLStreamException e) {
      throw new IllegalStateException("Cannot serialize message body to XML", e);
    }
    return out.toString();
  }

  static boolean isXmlChar(int c) {
    return c == 0x9 || c == 0xA || c == 0xD
        || (c >= 0x20 && c <= 0xD7FF)
        || (c >= 0xE000 && c <= 0xFFFD)
        || (c >= 0x10000 && c <= 0x10FFFF);
  }

  static String replaceInvalidChars(String text) {
    StringBuilder sb = null;
    int i = 0;
    while (i < text.length()) {
      int c = text.codePointAt(i);
      int n = Character.charCount(c);
      if (!isXmlChar(c)) {
        if (sb == null) {
          sb = new StringBuilder(text.length());
          sb.append(text, 0, i);
        }
        sb.append(REPLACEMENT_CHAR);
      } else if (sb != null) {
        sb.appendCodePoint(c);
      }
      i += n;
    }
    return (sb == null) ? text : sb.toString();
  }

  public static String fromXml(String xml) throws IOException {
    try {
      XMLStreamReader reader = inputFactory.createXMLStreamReader(new StringReader(xml));
      try {
        StringBuilder text = new StringBuilder(xml.length());
        int depth = 0;
        while (reader.hasNext()) {
          int event = reader.next();
          switch (event) {
          case XMLStreamConstants.START_ELEMENT:
            if (depth == 0 && !ROOT_ELEMENT.equals(reader.getLocalName())) {
              throw new IOException("Unexpected XML body root element: " + reader.getLocalName());
            }
            depth++;
            break;
          case XMLStreamConstants.END_ELEMENT:
            depth--;
            break;
          case XMLStreamConstants.CHARACTERS:
          case XMLStreamConstants.CDATA:
          case XMLStreamConstants.SPACE:
            if (depth > 0) {
              text.append(reader.getText());
            }
            break;
          default:
            break;
          }
        }
        return text.toString();
      } finally {
        reader.close();
      }
    } catch (XMLStreamException e) {
      throw new IOException("Malformed XML message body", e);
    }
  }
}
