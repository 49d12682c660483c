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
import com.google.common.io.CountingInputStream;
import io.protostuff.ProtobufException;
import io.protostuff.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.interfaces.log.LogRecord;
import retlog.interfaces.log.SequentialEntryIterator;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.util.Collections;
import java.util.List;

import static retlog.log.EntryEncodingUtil.CrcError;
import static retlog.log.EntryEncodingUtil.decodeAndCheckCrc;
import static retlog.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static retlog.log.LogPersistenceService.BytePersistence;
import static retlog.log.LogPersistenceService.PersistenceNavigator;
import static retlog.log.LogPersistenceService.PersistenceReader;
import static retlog.log.SequentialLog.LogEntryNotFound;

/**
 * A SequentialLog of LogRecord, together with the SegmentHeader written at the start of the
 * same BytePersistence. Together they are the contents of one segment file.
 */
class SegmentLog {
  private static final Logger LOG = LoggerFactory.getLogger(SegmentLog.class);
  private static final Schema<SegmentHeader> HEADER_SCHEMA = SegmentHeader.getSchema();
  static final LogRecordCodec CODEC = new LogRecordCodec();

  final SegmentHeader header;
  final long headerSize;
  private final BytePersistence persistence;
  private final PersistenceNavigator navigator;
  private final SequentialLog<LogRecord> log;

  private SegmentLog(BytePersistence persistence, HeaderWithSize headerWithSize) throws IOException {
    this.persistence = persistence;
    this.header = headerWithSize.header;
    this.headerSize = headerWithSize.size;
    this.navigator = new InMemoryPersistenceNavigator<>(persistence, CODEC, headerSize);
    this.navigator.addToIndex(header.getBaseSeqNum() + 1, headerSize);
    this.log = new EncodedSequentialLog<>(persistence, CODEC, navigator);
  }

  /**
   * Create a new segment data store and durably write its header.
   */
  static SegmentLog writeNewSegment(LogPersistenceService<?> persistenceService, long segmentId, long baseSeqNum)
      throws IOException {
    final BytePersistence persistence = persistenceService.create(segmentId);
    try {
      final HeaderWithSize headerWithSize =
          writeHeaderToPersistence(persistence, new SegmentHeader(segmentId, baseSeqNum));
      persistence.sync();
      return new SegmentLog(persistence, headerWithSize);
    } catch (IOException | RuntimeException e) {
      persistence.close();
      throw e;
    }
  }

  /**
   * Read the header of an existing segment data store, and check its CRC.
   */
  static SegmentLog readSegment(BytePersistence persistence) throws IOException {
    try {
      return new SegmentLog(persistence, readHeaderFromPersistence(persistence));
    } catch (IOException | RuntimeException e) {
      persistence.close();
      throw e;
    }
  }

  /**
   * Read every record of the segment. A record that is incomplete or fails its CRC, and everything
   * after it, is the remnant of an append interrupted by a crash; it is truncated away.
   *
   * @return The sequence number of the last intact record, or the base sequence number if there is none.
   */
  long recoverTail() throws IOException {
    final long size = persistence.size();
    long lastGoodSeqNum = header.getBaseSeqNum();
    long lastGoodAddress = headerSize;

    try (PersistenceReader reader = persistence.getReader()) {
      reader.position(headerSize);
      final InputStream input = Channels.newInputStream(reader);

      while (lastGoodAddress < size) {
        final LogRecord record;
        try {
          record = CODEC.decode(input);
        } catch (EOFException | ProtobufException | CrcError e) {
          LOG.warn("Segment {}: unreadable record at address {} ({})", header.getSegmentId(), lastGoodAddress,
              e.toString());
          break;
        }
        if (record.getSeqNum() != lastGoodSeqNum + 1) {
          LOG.warn("Segment {}: record {} found where {} was expected", header.getSegmentId(),
              record.getSeqNum(), lastGoodSeqNum + 1);
          break;
        }
        navigator.notifyLogging(record.getSeqNum(), lastGoodAddress);
        lastGoodSeqNum = record.getSeqNum();
        lastGoodAddress = reader.position();
      }
    }

    if (lastGoodAddress < size) {
      LOG.warn("Segment {}: truncating {} trailing bytes after record {}", header.getSegmentId(),
          size - lastGoodAddress, lastGoodSeqNum);
      persistence.truncate(lastGoodAddress);
      persistence.sync();
    }
    return lastGoodSeqNum;
  }

  /**
   * Append a record and force it to the underlying medium.
   */
  void appendDurably(LogRecord record) throws IOException {
    log.append(Collections.singletonList(record));
    log.sync();
  }

  SequentialEntryIterator<LogRecord> iteratorFrom(long start, long last) throws IOException, LogEntryNotFound {
    return log.iteratorFrom(start, last);
  }

  long size() throws IOException {
    return persistence.size();
  }

  void close() throws IOException {
    log.close();
  }

  private static HeaderWithSize readHeaderFromPersistence(BytePersistence persistence) throws IOException {
    try (CountingInputStream input = new CountingInputStream(Channels.newInputStream(persistence.getReader()))) {
      final SegmentHeader header = decodeAndCheckCrc(input, HEADER_SCHEMA);
      return new HeaderWithSize(header, input.getCount());
    }
  }

  private static HeaderWithSize writeHeaderToPersistence(BytePersistence persistence, SegmentHeader header)
      throws IOException {
    final List<ByteBuffer> serializedHeader = encodeWithLengthAndCrc(HEADER_SCHEMA, header);
    persistence.append(Iterables.toArray(serializedHeader, ByteBuffer.class));

    return new HeaderWithSize(header, persistence.size());
  }

  private static class HeaderWithSize {
    public final SegmentHeader header;
    public final long size;

    private HeaderWithSize(SegmentHeader header, long size) {
      this.header = header;
      this.size = size;
    }
  }
}
