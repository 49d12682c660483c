/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package retlog.decoding;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Serializes record payloads. The enclosing log record carries its own CRC, so payloads are
 * written bare.
 */
public class ChangePayloadCodec {
  private static final int BUFFER_SIZE = 512;

  private ChangePayloadCodec() {
  }

  public static byte[] encode(ChangePayload payload) {
    return toByteArray(payload, ChangePayload.getSchema());
  }

  public static byte[] encode(TransactionMarker marker) {
    return toByteArray(marker, TransactionMarker.getSchema());
  }

  public static ChangePayload decodeChange(byte[] bytes) throws IOException {
    return fromByteArray(bytes, ChangePayload.getSchema());
  }

  public static TransactionMarker decodeMarker(byte[] bytes) throws IOException {
    return fromByteArray(bytes, TransactionMarker.getSchema());
  }

  private static <T> byte[] toByteArray(T message, Schema<T> schema) {
    final LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
    try {
      return ProtostuffIOUtil.toByteArray(message, schema, buffer);
    } finally {
      buffer.clear();
    }
  }

  private static <T> T fromByteArray(byte[] bytes, Schema<T> schema) throws IOException {
    final T message = schema.newMessage();
    ProtostuffIOUtil.mergeFrom(new ByteArrayInputStream(bytes), message, schema);
    return message;
  }
}
