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

package retlog.log;

import com.google.common.primitives.Ints;
import io.protostuff.LinkBuffer;
import io.protostuff.LowCopyProtobufOutput;
import io.protostuff.ProtobufIOUtil;
import io.protostuff.Schema;
import retlog.util.CrcInputStream;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.Adler32;

import static com.google.common.math.IntMath.checkedAdd;

/**
 * Framing shared by every file the store writes: record headers, record contents, segment headers,
 * the segment index and the slot table.
 * <p>
 * A framed message is a varint length, the protostuff-encoded message, then a 4-byte Adler-32 of
 * the length and message. Raw content is followed by a 4-byte Adler-32 of the content alone.
 */
public class EntryEncodingUtil {

  /**
   * A stored checksum disagrees with the bytes it covers.
   */
  public static class CrcError extends RuntimeException {
    public CrcError(String s) {
      super(s);
    }
  }

  /**
   * @return Buffers holding the varint length, the message, and its checksum, in that order.
   */
  public static <T> List<ByteBuffer> encodeWithLengthAndCrc(Schema<T> schema, T message) {
    final LinkBuffer body = new LinkBuffer();
    final LowCopyProtobufOutput output = new LowCopyProtobufOutput(body);
    try {
      schema.writeTo(output, message);
      final LinkBuffer length = new LinkBuffer().writeVarInt32((int) output.buffer.size());

      final List<ByteBuffer> framed = new ArrayList<>(length.finish());
      framed.addAll(body.finish());
      return appendCrcToBufferList(framed);
    } catch (IOException e) {
      // LinkBuffer writes only to memory
      throw new RuntimeException(e);
    }
  }

  /**
   * Read back one message written by {@link #encodeWithLengthAndCrc}.
   *
   * @throws java.io.EOFException if the stream ends inside the message or its checksum.
   * @throws CrcError             if the checksum does not match.
   */
  public static <T> T decodeAndCheckCrc(InputStream inputStream, Schema<T> schema)
      throws IOException, CrcError {
    final T message = schema.newMessage();
    final CrcInputStream checked = new CrcInputStream(inputStream, new Adler32());
    ProtobufIOUtil.mergeDelimitedFrom(checked, message, schema);

    if (readCrc(inputStream) != checked.getValue()) {
      throw new CrcError("CRC mismatch on deserialized message " + message);
    }
    return message;
  }

  /**
   * @return A new, mutable list with the given buffers, untouched, followed by their combined checksum.
   */
  public static List<ByteBuffer> appendCrcToBufferList(List<ByteBuffer> content) throws IOException {
    final Adler32 crc = new Adler32();
    for (ByteBuffer buffer : content) {
      crc.update(buffer.duplicate());
    }

    final LinkBuffer crcBuffer = new LinkBuffer(8);
    // Adler-32 is unsigned 32-bit; shift it into int range.
    crcBuffer.writeInt32(Ints.checkedCast(crc.getValue() + Integer.MIN_VALUE));

    final List<ByteBuffer> withCrc = new ArrayList<>(content);
    withCrc.addAll(crcBuffer.finish());
    return withCrc;
  }

  static long readCrc(InputStream inputStream) throws IOException {
    final int stored = new DataInputStream(inputStream).readInt();
    return ((long) stored) - Integer.MIN_VALUE;
  }

  /**
   * Read contentLength bytes of raw content and the checksum that follows them.
   *
   * @throws java.io.EOFException if the stream ends first.
   * @throws CrcError             if the checksum does not match; the content and checksum have
   *                              been consumed regardless.
   */
  public static byte[] getAndCheckContent(InputStream inputStream, int contentLength)
      throws IOException, CrcError {
    final CrcInputStream checked = new CrcInputStream(inputStream, new Adler32());
    final byte[] content = new byte[contentLength];
    new DataInputStream(checked).readFully(content);

    if (readCrc(inputStream) != checked.getValue()) {
      throw new CrcError("CRC mismatch on log record contents");
    }
    return content;
  }

  public static void skip(InputStream inputStream, int numBytes) throws IOException {
    if (inputStream.skip(numBytes) < numBytes) {
      throw new IOException("Unable to skip requested number of bytes");
    }
  }

  public static int sumRemaining(List<ByteBuffer> buffers) {
    int length = 0;
    for (ByteBuffer buffer : buffers) {
      length = checkedAdd(length, buffer.remaining());
    }
    return length;
  }
}
