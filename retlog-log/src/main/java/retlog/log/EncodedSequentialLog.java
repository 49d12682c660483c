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
import java.util.List;

import static retlog.log.LogPersistenceService.BytePersistence;
import static retlog.log.LogPersistenceService.PersistenceNavigator;

/**
 * Writes each entry through a codec, telling the navigator where it landed.
 */
public class EncodedSequentialLog<E extends SequentialEntry> implements SequentialLog<E> {
  private final BytePersistence persistence;
  private final SequentialEntryCodec<E> codec;
  private final PersistenceNavigator navigator;

  public EncodedSequentialLog(BytePersistence persistence,
                              SequentialEntryCodec<E> codec,
                              PersistenceNavigator navigator) {
    this.persistence = persistence;
    this.codec = codec;
    this.navigator = navigator;
  }

  @Override
  public void append(List<E> entries) throws IOException {
    if (entries.isEmpty()) {
      return;
    }

    long rollbackSize = persistence.size();
    long address = rollbackSize;
    try {
      for (E entry : entries) {
        navigator.notifyLogging(entry.getSeqNum(), address);
        persistence.append(codec.encode(entry));
        address = persistence.size();
      }
    } catch (IOException e) {
      persistence.truncate(rollbackSize);
      navigator.notifyTruncation(entries.get(0).getSeqNum());
      throw e;
    }
  }

  @Override
  public SequentialEntryIterator<E> iteratorFrom(long start, long last) throws IOException, LogEntryNotFound {
    return new EncodedSequentialEntryIterator<>(navigator, codec, start, last);
  }

  @Override
  public void sync() throws IOException {
    persistence.sync();
  }

  @Override
  public void close() throws IOException {
    persistence.close();
  }
}
