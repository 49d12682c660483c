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

package retlog.interfaces.log;

import com.google.common.collect.ImmutableList;
import retlog.interfaces.ErrorKind;
import retlog.interfaces.RetentionException;

import java.io.IOException;

/**
 * Append-only, segment-structured log of change records. Sequence numbers start at 1, are
 * assigned by the store, are consecutive, and are never reused, even after reclamation.
 * <p>
 * A single writer appends; any number of readers may read concurrently with the writer
 * and with reclamation.
 */
public interface LogStore extends AutoCloseable {
  /**
   * Durably append a record. The record is flushed to the underlying medium before this
   * method returns.
   *
   * @param payload Opaque record payload.
   * @param kind    Record kind.
   * @return The sequence number assigned to the record.
   * @throws IOException
   */
  long append(byte[] payload, RecordKind kind) throws IOException;

  /**
   * Return a lazy iterator over every record with sequence number >= fromSeq that had been
   * appended when this method was called, in ascending order. The caller must close the
   * iterator; while open, it pins the segment it is positioned in against reclamation.
   * Invoking read again with the same fromSeq, including after a restart, reproduces the
   * same records.
   *
   * @param fromSeq First sequence number wanted; 0 means "from the first record".
   * @throws RecordNotFound if some record at or after fromSeq has already been reclaimed.
   * @throws IOException
   */
  SequentialEntryIterator<LogRecord> read(long fromSeq) throws IOException, RecordNotFound;

  /**
   * Delete every sealed segment whose maxSeq is below belowSeq. Segments are removed oldest
   * first; if a qualifying segment is pinned by an open reader, reclamation stops there, the
   * segments before it remain deleted, and SegmentInUse is thrown.
   *
   * @param belowSeq Exclusive upper bound on the sequence numbers that may be discarded.
   * @return Descriptors of the segments deleted.
   * @throws SegmentInUse
   * @throws IOException
   */
  ImmutableList<SegmentDescriptor> reclaim(long belowSeq) throws IOException, SegmentInUse;

  /**
   * Seal the active segment, if it holds any records, and start a new one.
   */
  void roll() throws IOException;

  ImmutableList<SegmentDescriptor> segments();

  /**
   * The sequence number of the latest record appended, or 0 if none has been.
   */
  long lastSeq();

  /**
   * The lowest sequence number still readable; equal to lastSeq() + 1 if the store holds no records.
   */
  long firstRetainedSeq();

  @Override
  void close() throws IOException;

  /**
   * A segment eligible for reclamation is being read.
   */
  class SegmentInUse extends RetentionException {
    private final long segmentId;

    public SegmentInUse(long segmentId, String message) {
      super(ErrorKind.SEGMENT_IN_USE, message);
      this.segmentId = segmentId;
    }

    public long getSegmentId() {
      return segmentId;
    }
  }

  /**
   * A requested record is not present in the log, because it was reclaimed or never written.
   */
  class RecordNotFound extends Exception {
    public RecordNotFound(String s) {
      super(s);
    }

    public RecordNotFound(Throwable cause) {
      super(cause);
    }
  }
}
