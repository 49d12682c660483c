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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import retlog.interfaces.log.SegmentDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.List;

import static retlog.log.SequentialLog.LogEntryNotFound;

/**
 * Storage for the segments of a log and for the index that lists them.
 *
 * @param <P> Type of the persistence holding one segment's bytes
 */
public interface LogPersistenceService<P extends LogPersistenceService.BytePersistence> {
  /**
   * Create a new, empty data store for a segment. The store is not part of the log until
   * it is listed by a subsequent {@link #writeIndex}.
   *
   * @param segmentId ID of the new segment.
   * @return A new, open persistence instance.
   * @throws IOException
   */
  @NotNull
  P create(long segmentId) throws IOException;

  /**
   * Open an existing segment data store.
   *
   * @param fileName Name recorded for the segment in the index.
   * @throws IOException
   */
  @NotNull
  P open(String fileName) throws IOException;

  String fileNameFor(long segmentId);

  /**
   * Delete a segment's data store. Any persistence instance referring to it becomes invalid.
   */
  void delete(String fileName) throws IOException;

  /**
   * @return The names of every segment data store present, whether or not the index lists it.
   */
  ImmutableList<String> listSegmentFiles() throws IOException;

  /**
   * Atomically replace the segment index. After a crash, {@link #readIndex} returns either the
   * previous index or this one, never a mixture.
   */
  void writeIndex(List<SegmentDescriptor> segments) throws IOException;

  /**
   * @return The segments listed by the last index written, oldest first; empty if none was.
   */
  ImmutableList<SegmentDescriptor> readIndex() throws IOException;

  /**
   * The bytes of one segment. Size is the address the next append lands at.
   */
  interface BytePersistence extends AutoCloseable {
    boolean isEmpty() throws IOException;

    long size() throws IOException;

    void append(ByteBuffer[] buffers) throws IOException;

    /**
     * @return A reader with its own position, starting at 0; the caller closes it.
     */
    PersistenceReader getReader() throws IOException;

    /**
     * Drop everything from the given address on. May not grow the data.
     */
    void truncate(long size) throws IOException;

    /**
     * Force every append so far to the underlying medium.
     */
    void sync() throws IOException;

    void close() throws IOException;
  }

  interface PersistenceReader extends ReadableByteChannel, AutoCloseable {
    long position() throws IOException;

    void position(long newPos) throws IOException;
  }

  /**
   * Maps sequence numbers to byte addresses within one segment, so a reader can start at a given
   * record without decoding everything before it. Safe for one writer and many readers.
   */
  interface PersistenceNavigator {
    /**
     * A record with this sequence number is about to be written at this address. The navigator
     * may or may not remember it.
     */
    void notifyLogging(long seqNum, long byteAddress) throws IOException;

    /**
     * Remember this address unconditionally.
     */
    void addToIndex(long seqNum, long byteAddress) throws IOException;

    /**
     * Records from seqNum on have been removed.
     */
    void notifyTruncation(long seqNum) throws IOException;

    /**
     * @return A stream positioned at the start of the record with sequence number fromSeqNum;
     * the caller closes it.
     * @throws LogEntryNotFound if the segment holds no such record.
     */
    InputStream getStreamAtSeqNum(long fromSeqNum) throws IOException, LogEntryNotFound;
  }
}
