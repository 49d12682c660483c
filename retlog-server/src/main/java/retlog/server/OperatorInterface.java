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

package retlog.server;

import com.google.common.util.concurrent.ListenableFuture;
import retlog.decoding.PublicationCatalog.DuplicatePublication;
import retlog.decoding.PublicationCatalog.PublicationNotFound;
import retlog.interfaces.ErrorKind;
import retlog.interfaces.RetentionException;
import retlog.interfaces.decoding.Publication;
import retlog.interfaces.slots.RetentionSlot;
import retlog.interfaces.slots.SlotKind;
import retlog.interfaces.slots.SlotRegistry.DuplicateSlot;
import retlog.interfaces.slots.SlotRegistry.SlotBusy;
import retlog.interfaces.slots.SlotRegistry.SlotNotFound;
import retlog.streaming.BoundedConsumerChannel;

import java.io.IOException;

/**
 * Administrative commands over slots, publications and streaming sessions. Every failure a caller
 * can act on is a {@link RetentionException} carrying a stable {@link ErrorKind}.
 */
public interface OperatorInterface {

  /**
   * Create a slot positioned at the current end of the log.
   */
  RetentionSlot createSlot(String name, SlotKind kind) throws IOException, DuplicateSlot;

  void dropSlot(String name) throws IOException, SlotNotFound, SlotBusy;

  void createPublication(Publication publication) throws DuplicatePublication;

  void alterPublication(Publication publication) throws PublicationNotFound;

  void dropPublication(String name) throws PublicationNotFound;

  /**
   * Start streaming the given publication from the given slot. The returned future completes once
   * the session holds its slot, or fails with the reason it could not start (e.g. SlotBusy or
   * SlotTooFarBehind).
   */
  ListenableFuture<SessionHandle> startSession(String slotName, String publicationName, boolean withSnapshot)
      throws SlotNotFound, PublicationNotFound;

  /**
   * Confirm that the consumer of a session has durably processed everything up to seqNum.
   *
   * @return A future of the slot's confirmed position after the acknowledgment.
   */
  ListenableFuture<Long> acknowledge(String sessionId, long seqNum) throws SessionNotFound;

  void pauseSession(String sessionId) throws SessionNotFound;

  void resumeSession(String sessionId) throws SessionNotFound;

  /**
   * Stop a session, releasing its slot but keeping the slot's position, and forget it.
   */
  ListenableFuture<Void> stopSession(String sessionId) throws SessionNotFound;

  MonitoringSnapshot monitor();

  /**
   * A started session together with the channel its batches are delivered on.
   */
  final class SessionHandle {
    public final String sessionId;
    public final BoundedConsumerChannel channel;

    public SessionHandle(String sessionId, BoundedConsumerChannel channel) {
      this.sessionId = sessionId;
      this.channel = channel;
    }

    @Override
    public String toString() {
      return "SessionHandle{" + sessionId + '}';
    }
  }

  class SessionNotFound extends RetentionException {
    public SessionNotFound(String sessionId) {
      super(ErrorKind.SESSION_NOT_FOUND, "session " + sessionId + " does not exist");
    }
  }
}
