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

package retlog.interfaces.streaming;

import retlog.interfaces.ErrorKind;
import retlog.interfaces.RetentionException;
import retlog.interfaces.decoding.ChangeBatch;

/**
 * The producing end of a bounded byte-stream-like connection to one consumer. A batch is
 * either accepted whole or not at all.
 */
public interface ConsumerChannel {
  /**
   * @throws ConsumerBackpressure if the consumer's buffer is full; try again later.
   * @throws ChannelIOError       if the transport failed; try again after a backoff.
   */
  void push(ChangeBatch batch) throws ConsumerBackpressure, ChannelIOError;

  /**
   * Signal the consumer that no further batches will be pushed.
   */
  void close();

  class ConsumerBackpressure extends RetentionException {
    public ConsumerBackpressure(String message) {
      super(ErrorKind.CONSUMER_BACKPRESSURE, message);
    }
  }

  class ChannelIOError extends RetentionException {
    public ChannelIOError(String message, Throwable cause) {
      super(ErrorKind.CHANNEL_IO_ERROR, message, cause);
    }
  }
}
