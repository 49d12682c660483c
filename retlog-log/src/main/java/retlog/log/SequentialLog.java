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
import retlog.interfaces.log.SequentialEntryIterator;

import java.io.IOException;
import java.util.List;

/**
 * An append-only run of entries with consecutive sequence numbers, kept in one persistence.
 */
public interface SequentialLog<E extends SequentialEntry> extends AutoCloseable {
  /**
   * All or nothing: on IOException the persistence is cut back to where it was.
   */
  void append(List<E> entries) throws IOException;

  /**
   * Entries start through last, inclusive, decoded one at a time as the caller asks. The caller
   * closes the iterator.
   */
  SequentialEntryIterator<E> iteratorFrom(long start, long last) throws IOException, LogEntryNotFound;

  void sync() throws IOException;

  void close() throws IOException;

  class LogEntryNotFound extends Exception {
    public LogEntryNotFound(String message) {
      super(message);
    }
  }

  /**
   * A decoded entry carried a sequence number other than the one expected at its position.
   */
  class LogEntryNotInSequence extends IOException {
    public LogEntryNotInSequence(String message) {
      super(message);
    }
  }
}
