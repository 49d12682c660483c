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

package retlog.streaming;

import org.jetbrains.annotations.Nullable;
import retlog.interfaces.decoding.ChangeBatch;
import retlog.interfaces.streaming.ConsumerChannel;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process ConsumerChannel backed by a bounded queue of batches. The session pushes; the consumer
 * polls. A full queue is reported to the session as backpressure.
 */
public class BoundedConsumerChannel implements ConsumerChannel {
  private final BlockingQueue<ChangeBatch> batches;
  private final int capacity;
  private volatile boolean closed;

  public BoundedConsumerChannel(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.batches = new ArrayBlockingQueue<>(capacity);
  }

  @Override
  public void push(ChangeBatch batch) throws ConsumerBackpressure, ChannelIOError {
    if (closed) {
      throw new ChannelIOError("channel is closed", null);
    }
    if (!batches.offer(batch)) {
      throw new ConsumerBackpressure("consumer has " + capacity + " unread batches");
    }
  }

  @Override
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * @return The next batch, or null if none arrives within the timeout.
   */
  @Nullable
  public ChangeBatch poll(long timeout, TimeUnit unit) throws InterruptedException {
    return batches.poll(timeout, unit);
  }

  public int drainTo(List<? super ChangeBatch> destination) {
    return batches.drainTo(destination);
  }

  public int size() {
    return batches.size();
  }
}
