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

import retlog.LogConstants;
import retlog.interfaces.log.SequentialEntry;
import retlog.interfaces.log.SequentialEntryCodec;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import static retlog.log.LogPersistenceService.BytePersistence;
import static retlog.log.LogPersistenceService.PersistenceNavigator;
import static retlog.log.LogPersistenceService.PersistenceReader;
import static retlog.log.SequentialLog.LogEntryNotFound;

/**
 * Sparse seq-to-address index held on the heap. An address is kept for every maxEntrySeek-th
 * record appended, and for any record a lookup had to scan to. Nothing is written to disk; the
 * index is rebuilt lazily after a restart.
 */
public class InMemoryPersistenceNavigator<E extends SequentialEntry> implements PersistenceNavigator {

  private final BytePersistence persistence;
  private final SequentialEntryCodec<E> codec;

  private final NavigableMap<Long, Long> index = new ConcurrentSkipListMap<>();
  private volatile int maxEntrySeek = LogConstants.LOG_NAVIGATOR_DEFAULT_MAX_ENTRY_SEEK;

  public InMemoryPersistenceNavigator(BytePersistence persistence, SequentialEntryCodec<E> codec) {
    this(persistence, codec, 0);
  }

  /**
   * @param offset Address of the first entry; bytes before it belong to a header.
   */
  public InMemoryPersistenceNavigator(BytePersistence persistence, SequentialEntryCodec<E> codec, long offset) {
    this.persistence = persistence;
    this.codec = codec;

    // floorEntry never returns null
    index.put(0L, offset);
  }

  public void setMaxEntrySeek(int numberOfEntries) {
    if (numberOfEntries < 1) {
      throw new IllegalArgumentException("maxEntrySeek must be positive: " + numberOfEntries);
    }
    maxEntrySeek = numberOfEntries;
  }

  @Override
  public void notifyLogging(long seqNum, long byteAddress) throws IOException {
    if (seqNum - index.lastKey() >= maxEntrySeek) {
      index.put(seqNum, byteAddress);
    }
  }

  @Override
  public void addToIndex(long seqNum, long address) {
    index.put(seqNum, address);
  }

  @Override
  public void notifyTruncation(long seqNum) throws IOException {
    if (seqNum <= 0) {
      throw new IllegalArgumentException("cannot truncate from seq " + seqNum);
    }
    index.tailMap(seqNum, true).clear();
  }

  @Override
  public InputStream getStreamAtSeqNum(long seqNum) throws IOException, LogEntryNotFound {
    return Channels.newInputStream(getReaderAtSeqNum(seqNum));
  }

  private PersistenceReader getReaderAtSeqNum(long seqNum) throws IOException, LogEntryNotFound {
    Map.Entry<Long, Long> nearest = index.floorEntry(seqNum);
    PersistenceReader reader = persistence.getReader();
    reader.position(nearest.getValue());
    if (nearest.getKey() == seqNum) {
      return reader;
    }

    InputStream scan = Channels.newInputStream(reader);
    try {
      long address = reader.position();
      while (codec.skipEntryAndReturnSeqNum(scan) != seqNum) {
        address = reader.position();
      }
      reader.position(address);
      addToIndex(seqNum, address);
      return reader;
    } catch (EOFException e) {
      reader.close();
      throw new LogEntryNotFound("no record with seq " + seqNum + " in " + persistence);
    } catch (IOException | RuntimeException e) {
      reader.close();
      throw e;
    }
  }
}
