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

import com.google.common.util.concurrent.ListenableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.Subscriber;
import retlog.interfaces.ErrorKind;
import retlog.interfaces.RetentionException;

/**
 * A live, ordered feed of the committed changes of one publication, pushed to one consumer and
 * tracked by one retention slot. The slot only advances when the consumer acknowledges.
 */
public interface StreamingSession {

  String getSessionId();

  String getSlotName();

  String getPublicationName();

  State getState();

  /**
   * Commit sequence number of the last batch handed to the consumer channel, or the starting
   * position if none has been.
   */
  long getLastSentSeq();

  /**
   * The error that closed the session, or null if it is open or was stopped on request.
   */
  @Nullable
  Throwable getFailure();

  /**
   * Acquire the slot and begin streaming.
   *
   * @return A future that completes with the state reached once the slot has been acquired and
   * checked, or fails with the error that closed the session.
   */
  ListenableFuture<State> start();

  /**
   * Record the consumer's acknowledgment of every batch with commit sequence number <= seqNum,
   * advancing the slot accordingly.
   *
   * @return A future holding the slot's confirmedSeq after the acknowledgment has been persisted.
   */
  ListenableFuture<Long> acknowledge(long seqNum);

  void pause();

  void resume();

  /**
   * Close the session and release its slot; the slot itself is kept.
   */
  ListenableFuture<Void> stop();

  /**
   * Each state transition of the session is published on this channel.
   */
  Subscriber<SessionEvent> getEventChannel();

  enum State {
    INIT,
    CATCHUP,
    STREAMING,
    PAUSED,
    CLOSED
  }

  /**
   * The slot's position refers to records that have already been reclaimed. The slot must be
   * dropped, recreated, and the consumer re-synchronized.
   */
  class SlotTooFarBehind extends RetentionException {
    public SlotTooFarBehind(String slotName, long slotSeq, long firstRetainedSeq) {
      super(ErrorKind.SLOT_TOO_FAR_BEHIND,
          "slot " + slotName + " needs sequence " + slotSeq + " but the log starts at " + firstRetainedSeq);
    }
  }
}
