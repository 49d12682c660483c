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

import retlog.interfaces.log.SequentialEntry;
import retlog.interfaces.log.SequentialEntryCodec;
import retlog.interfaces.log.SequentialEntryIterator;

import java.io.IOException;
import java.io.InputStream;
import java.util.NoSuchElementException;

import static retlog.log.LogPersistenceService.PersistenceNavigator;
import static retlog.log.SequentialLog.LogEntryNotFound;
import static retlog.log.SequentialLog.LogEntryNotInSequence;

/**
 * Implementation of SequentialEntryIterator for logs encoded with a SequentialEntryCodec. It reads
 * an entry only when asked for it, and never reads past the last sequence number it was given.
 */
class EncodedSequentialEntryIterator<E extends SequentialEntry> implements SequentialEntryIterator<E> {
  private final SequentialEntryCodec<E> codec;
  private final InputStream inputStream;
  private final long lastSeqNum;
  private long nextSeqNum;

  EncodedSequentialEntryIterator(PersistenceNavigator persistenceNavigator,
                                 SequentialEntryCodec<E> codec,
                                 long firstSeqNum,
                                 long lastSeqNum)
      throws IOException, LogEntryNotFound {

    this.codec = codec;
    this.nextSeqNum = firstSeqNum;
    this.lastSeqNum = lastSeqNum;
    this.inputStream = firstSeqNum <= lastSeqNum ? persistenceNavigator.getStreamAtSeqNum(firstSeqNum) : null;
  }

  @Override
  public void close() throws IOException {
    if (inputStream != null) {
      inputStream.close();
    }
  }

  @Override
  public boolean hasNext() throws IOException {
    return nextSeqNum <= lastSeqNum;
  }

  @Override
  public E next() throws IOException {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }

    E entry = codec.decode(inputStream);
    if (entry.getSeqNum() != nextSeqNum) {
      throw new LogEntryNotInSequence("Expected entry " + nextSeqNum + " but read " + entry.getSeqNum());
    }
    nextSeqNum++;
    return entry;
  }
}
