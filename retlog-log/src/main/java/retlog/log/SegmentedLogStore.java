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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.LogConstants;
import retlog.interfaces.log.LogRecord;
import retlog.interfaces.log.LogStore;
import retlog.interfaces.log.RecordKind;
import retlog.interfaces.log.SegmentDescriptor;
import retlog.interfaces.log.SequentialEntryIterator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;

import static retlog.log.SequentialLog.LogEntryNotFound;

/**
 * LogStore made of a chain of segment files. Appends go to the last, active segment; once appending
 * a record would carry the active segment past the configured size, it is sealed and a new segment
 * is started. Only sealed segments are ever reclaimed.
 * <p>
 * One lock guards the segment map, segment metadata, reader pins and index writes; it is never
 * held while a record is encoded or read. Appends are additionally serialized by their own lock.
 */
public class SegmentedLogStore implements LogStore {
  private static final Logger LOG = LoggerFactory.getLogger(SegmentedLogStore.class);

  private final LogPersistenceService<?> persistenceService;
  private final long segmentSizeBytes;

  private final Object appendLock = new Object();
  private final Object lock = new Object();
  private final NavigableMap<Long, Segment> segments = new TreeMap<>();
  private long lastSeq;
  private boolean closed;

  /**
   * Open the store kept under the given data directory, creating it if it does not exist.
   */
  public static SegmentedLogStore open(Path basePath, long segmentSizeBytes) throws IOException {
    return new SegmentedLogStore(new SegmentFileService(basePath), segmentSizeBytes);
  }

  public SegmentedLogStore(LogPersistenceService<?> persistenceService, long segmentSizeBytes) throws IOException {
    if (segmentSizeBytes <= 0) {
      throw new IllegalArgumentException("segmentSizeBytes must be positive");
    }
    this.persistenceService = persistenceService;
    this.segmentSizeBytes = segmentSizeBytes;

    recover();
  }

  @Override
  public long append(byte[] payload, RecordKind kind) throws IOException {
    synchronized (appendLock) {
      final long seqNum = lastSeq() + 1;
      final LogRecord record = new LogRecord(seqNum, kind, payload);

      Segment active = activeSegment();
      if (!active.isEmpty() && active.sizeBytes + LogRecordCodec.encodedLength(record) > segmentSizeBytes) {
        active = startNewSegment();
      }

      active.segmentLog.appendDurably(record);

      final long now = System.currentTimeMillis();
      synchronized (lock) {
        if (active.isEmpty()) {
          active.firstRecordAtMillis = now;
        }
        active.lastRecordAtMillis = now;
        active.maxSeq = seqNum;
        active.sizeBytes = active.segmentLog.size();
        lastSeq = seqNum;
      }
      return seqNum;
    }
  }

  @Override
  public SequentialEntryIterator<LogRecord> read(long fromSeq) throws IOException, RecordNotFound {
    final long startSeq = Math.max(fromSeq, 1);
    final long upTo;
    Segment first = null;

    synchronized (lock) {
      ensureOpen();
      upTo = lastSeq;
      final long firstRetained = firstRetainedSeqLocked();
      if (startSeq < firstRetained) {
        throw new RecordNotFound("Record " + startSeq + " has been reclaimed; the log starts at " + firstRetained);
      }
      if (startSeq <= upTo) {
        for (Segment segment : segments.values()) {
          if (segment.maxSeq >= startSeq) {
            first = segment;
            break;
          }
        }
        if (first == null) {
          throw new IllegalStateException("No segment holds record " + startSeq);
        }
        first.pins++;
      }
    }

    try {
      return new StoreIterator(first, startSeq, upTo);
    } catch (LogEntryNotFound e) {
      unpin(first);
      throw new RecordNotFound(e);
    } catch (IOException | RuntimeException e) {
      unpin(first);
      throw e;
    }
  }

  @Override
  public ImmutableList<SegmentDescriptor> reclaim(long belowSeq) throws IOException, SegmentInUse {
    final List<Segment> removed = new ArrayList<>();
    Segment blocked = null;

    synchronized (lock) {
      ensureOpen();
      for (Segment segment : segments.values()) {
        if (!segment.sealed || segment.maxSeq >= belowSeq) {
          break;
        }
        if (segment.pins > 0) {
          blocked = segment;
          break;
        }
        removed.add(segment);
      }

      if (!removed.isEmpty()) {
        removed.forEach(segment -> segments.remove(segment.id));
        try {
          writeIndexLocked();
        } catch (IOException e) {
          removed.forEach(segment -> segments.put(segment.id, segment));
          throw e;
        }
      }
    }

    final ImmutableList.Builder<SegmentDescriptor> reclaimed = ImmutableList.builder();
    for (Segment segment : removed) {
      segment.segmentLog.close();
      persistenceService.delete(segment.fileName);
      reclaimed.add(segment.describe());
      LOG.info("Reclaimed segment {} holding records {} to {}", segment.id, segment.minSeq, segment.maxSeq);
    }

    if (blocked != null) {
      LOG.error("Segment {} (records {} to {}) is below {} but is pinned by {} reader(s)",
          blocked.id, blocked.minSeq, blocked.maxSeq, belowSeq, blocked.pins);
      throw new SegmentInUse(blocked.id, "segment " + blocked.id + " is being read");
    }

    return reclaimed.build();
  }

  @Override
  public void roll() throws IOException {
    synchronized (appendLock) {
      if (!activeSegment().isEmpty()) {
        startNewSegment();
      }
    }
  }

  @Override
  public ImmutableList<SegmentDescriptor> segments() {
    synchronized (lock) {
      return describeLocked();
    }
  }

  @Override
  public long lastSeq() {
    synchronized (lock) {
      return lastSeq;
    }
  }

  @Override
  public long firstRetainedSeq() {
    synchronized (lock) {
      return firstRetainedSeqLocked();
    }
  }

  @Override
  public void close() throws IOException {
    synchronized (appendLock) {
      synchronized (lock) {
        if (closed) {
          return;
        }
        closed = true;
        writeIndexLocked();
        for (Segment segment : segments.values()) {
          segment.segmentLog.close();
        }
      }
    }
    LOG.info("Closed log store at record {}", lastSeq);
  }

  private void recover() throws IOException {
    final ImmutableList<SegmentDescriptor> indexed = persistenceService.readIndex();
    final Set<String> unindexedFiles = new HashSet<>(persistenceService.listSegmentFiles());

    long expectedMinSeq = -1;
    for (SegmentDescriptor descriptor : indexed) {
      unindexedFiles.remove(descriptor.getFileName());
      if (expectedMinSeq >= 0 && descriptor.getMinSeq() != expectedMinSeq) {
        throw new IOException("Segment " + descriptor.getId() + " starts at record " + descriptor.getMinSeq()
            + " but record " + expectedMinSeq + " was expected");
      }

      final SegmentLog segmentLog = SegmentLog.readSegment(persistenceService.open(descriptor.getFileName()));
      if (segmentLog.header.getSegmentId() != descriptor.getId()) {
        segmentLog.close();
        throw new IOException("Segment file " + descriptor.getFileName() + " has the header of segment "
            + segmentLog.header.getSegmentId());
      }

      final Segment segment = new Segment(descriptor.getId(), descriptor.getFileName(), segmentLog);
      segment.sealed = descriptor.isSealed();
      segment.sealedAtMillis = descriptor.getSealedAtMillis();
      segment.maxSeq = segment.sealed ? descriptor.getMaxSeq() : segmentLog.recoverTail();
      segment.sizeBytes = segmentLog.size();
      if (!segment.sealed && !segment.isEmpty()) {
        // Append times were not persisted; count the recovered records as appended now.
        segment.firstRecordAtMillis = segment.lastRecordAtMillis = System.currentTimeMillis();
      }
      segments.put(segment.id, segment);

      expectedMinSeq = segment.maxSeq + 1;
    }

    for (String orphan : unindexedFiles) {
      // A segment file created just before a crash, before the index listed it; it holds no records.
      LOG.warn("Deleting segment file {}, which is not listed in the segment index", orphan);
      persistenceService.delete(orphan);
    }

    synchronized (lock) {
      if (segments.isEmpty()) {
        final SegmentLog segmentLog = SegmentLog.writeNewSegment(persistenceService, LogConstants.FIRST_SEGMENT_ID, 0);
        final Segment segment = new Segment(LogConstants.FIRST_SEGMENT_ID,
            persistenceService.fileNameFor(LogConstants.FIRST_SEGMENT_ID), segmentLog);
        segment.sizeBytes = segmentLog.size();
        segments.put(segment.id, segment);
        writeIndexLocked();
      }
      lastSeq = segments.lastEntry().getValue().maxSeq;
    }

    if (activeSegment().sealed) {
      startNewSegment();
    }

    LOG.info("Opened log store with {} segment(s); records {} to {}", segments.size(), firstRetainedSeq(), lastSeq);
  }

  /**
   * Seal the active segment and start its successor. Caller holds the append lock.
   */
  private Segment startNewSegment() throws IOException {
    final Segment previous = activeSegment();
    final long newId = previous.id + 1;
    final SegmentLog segmentLog = SegmentLog.writeNewSegment(persistenceService, newId, previous.maxSeq);
    final Segment next = new Segment(newId, persistenceService.fileNameFor(newId), segmentLog);
    next.sizeBytes = segmentLog.size();

    synchronized (lock) {
      ensureOpen();
      final boolean wasSealed = previous.sealed;
      previous.sealed = true;
      if (!wasSealed) {
        previous.sealedAtMillis = System.currentTimeMillis();
      }
      segments.put(next.id, next);
      try {
        writeIndexLocked();
      } catch (IOException e) {
        segments.remove(next.id);
        previous.sealed = wasSealed;
        segmentLog.close();
        persistenceService.delete(next.fileName);
        throw e;
      }
    }

    LOG.debug("Sealed segment {} at record {}; started segment {}", previous.id, previous.maxSeq, next.id);
    return next;
  }

  private Segment activeSegment() throws IOException {
    synchronized (lock) {
      ensureOpen();
      return segments.lastEntry().getValue();
    }
  }

  private void unpin(@Nullable Segment segment) {
    if (segment == null) {
      return;
    }
    synchronized (lock) {
      segment.pins--;
    }
  }

  private long firstRetainedSeqLocked() {
    return segments.firstEntry().getValue().minSeq;
  }

  private ImmutableList<SegmentDescriptor> describeLocked() {
    final ImmutableList.Builder<SegmentDescriptor> builder = ImmutableList.builder();
    for (Segment segment : segments.values()) {
      builder.add(segment.describe());
    }
    return builder.build();
  }

  private void writeIndexLocked() throws IOException {
    persistenceService.writeIndex(describeLocked());
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("Log store is closed");
    }
  }

  private static final class Segment {
    final long id;
    final String fileName;
    final SegmentLog segmentLog;
    final long minSeq;
    volatile long maxSeq;
    volatile long sizeBytes;
    boolean sealed;
    long sealedAtMillis;
    volatile long firstRecordAtMillis;
    volatile long lastRecordAtMillis;
    int pins;

    Segment(long id, String fileName, SegmentLog segmentLog) {
      this.id = id;
      this.fileName = fileName;
      this.segmentLog = segmentLog;
      this.minSeq = segmentLog.header.getBaseSeqNum() + 1;
      this.maxSeq = segmentLog.header.getBaseSeqNum();
    }

    boolean isEmpty() {
      return maxSeq < minSeq;
    }

    SegmentDescriptor describe() {
      return new SegmentDescriptor(id, minSeq, maxSeq, sealed, sealedAtMillis, sizeBytes, fileName,
          firstRecordAtMillis, lastRecordAtMillis);
    }
  }

  /**
   * Reads across segments, keeping a pin on the segment it is positioned in.
   */
  private class StoreIterator implements SequentialEntryIterator<LogRecord> {
    private final long lastSeqNum;
    private Segment segment;
    private SequentialEntryIterator<LogRecord> segmentIterator;
    private long nextSeqNum;
    private boolean closed;

    StoreIterator(Segment segment, long firstSeqNum, long lastSeqNum) throws IOException, LogEntryNotFound {
      this.segment = segment;
      this.nextSeqNum = firstSeqNum;
      this.lastSeqNum = lastSeqNum;
      this.segmentIterator = segment == null ? null : openSegmentIterator();
    }

    @Override
    public boolean hasNext() throws IOException {
      return !closed && nextSeqNum <= lastSeqNum;
    }

    @Override
    public LogRecord next() throws IOException {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      if (!segmentIterator.hasNext()) {
        moveToNextSegment();
      }
      final LogRecord record = segmentIterator.next();
      nextSeqNum++;
      return record;
    }

    @Override
    public void close() throws IOException {
      if (closed) {
        return;
      }
      closed = true;
      if (segment != null) {
        try {
          segmentIterator.close();
        } finally {
          unpin(segment);
        }
      }
    }

    private void moveToNextSegment() throws IOException {
      segmentIterator.close();

      synchronized (lock) {
        final Map.Entry<Long, Segment> next = segments.higherEntry(segment.id);
        if (next == null) {
          throw new IOException("No segment follows segment " + segment.id);
        }
        next.getValue().pins++;
        segment.pins--;
        segment = next.getValue();
      }

      try {
        segmentIterator = openSegmentIterator();
      } catch (LogEntryNotFound e) {
        throw new IOException(e);
      }
    }

    private SequentialEntryIterator<LogRecord> openSegmentIterator() throws IOException, LogEntryNotFound {
      return segment.segmentLog.iteratorFrom(nextSeqNum, Math.min(lastSeqNum, segment.maxSeq));
    }
  }
}
