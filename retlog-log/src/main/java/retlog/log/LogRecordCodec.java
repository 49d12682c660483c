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

import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.math.IntMath;
import io.protostuff.Schema;
import retlog.interfaces.log.LogRecord;
import retlog.interfaces.log.RecordKind;
import retlog.interfaces.log.SequentialEntryCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.List;

import static retlog.log.EntryEncodingUtil.CrcError;
import static retlog.log.EntryEncodingUtil.appendCrcToBufferList;
import static retlog.log.EntryEncodingUtil.decodeAndCheckCrc;
import static retlog.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static retlog.log.EntryEncodingUtil.getAndCheckContent;
import static retlog.log.EntryEncodingUtil.skip;

/**
 * Encodes a LogRecord as a length-delimited header and its CRC, followed by the payload
 * and the payload's CRC.
 */
public class LogRecordCodec implements SequentialEntryCodec<LogRecord> {
  private static final Schema<RecordHeader> SCHEMA = RecordHeader.getSchema();
  private static final int CRC_BYTES = 4;

  @Override
  public ByteBuffer[] encode(LogRecord record) {
    try {
      final List<ByteBuffer> contentBufs = Lists.newArrayList(ByteBuffer.wrap(record.getPayload()));
      final List<ByteBuffer> recordBufs = encodeWithLengthAndCrc(SCHEMA, headerOf(record));
      recordBufs.addAll(appendCrcToBufferList(contentBufs));

      return Iterables.toArray(recordBufs, ByteBuffer.class);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  /**
   * Bytes the record occupies once encoded: framed header, payload, and payload CRC.
   */
  static int encodedLength(LogRecord record) {
    final List<ByteBuffer> header = encodeWithLengthAndCrc(SCHEMA, headerOf(record));
    return IntMath.checkedAdd(EntryEncodingUtil.sumRemaining(header), record.getPayloadLength() + CRC_BYTES);
  }

  @Override
  public LogRecord decode(InputStream inputStream) throws IOException, CrcError {
    final RecordHeader header = decodeAndCheckCrc(inputStream, SCHEMA);
    final byte[] content = getAndCheckContent(inputStream, header.getContentLength());

    return new LogRecord(header.getSeqNum(), kindOf(header), content);
  }

  @Override
  public long skipEntryAndReturnSeqNum(InputStream inputStream) throws IOException, CrcError {
    return skipEntryAndReturnHeader(inputStream).getSeqNum();
  }

  public RecordHeader skipEntryAndReturnHeader(InputStream inputStream) throws IOException, CrcError {
    final RecordHeader header = decodeAndCheckCrc(inputStream, SCHEMA);
    skip(inputStream, IntMath.checkedAdd(header.getContentLength(), CRC_BYTES));
    return header;
  }

  private static RecordHeader headerOf(LogRecord record) {
    return new RecordHeader(record.getSeqNum(), record.getKind().getCode(), record.getPayloadLength());
  }

  private static RecordKind kindOf(RecordHeader header) throws IOException {
    try {
      return RecordKind.fromCode(header.getKind());
    } catch (IllegalArgumentException e) {
      throw new IOException("Record " + header.getSeqNum() + " has an unreadable kind", e);
    }
  }
}
