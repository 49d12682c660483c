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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;
import retlog.interfaces.slots.RetentionSlot;
import retlog.interfaces.slots.SlotKind;
import retlog.interfaces.slots.SlotRegistry;
import retlog.interfaces.streaming.StreamingSession;
import retlog.maintenance.CostLimiter;
import retlog.maintenance.MaintenanceWorker;

/**
 * Point-in-time, read-only view of the log, its slots, the running sessions and the maintenance
 * workers.
 */
public final class MonitoringSnapshot {
  public final long currentMaxSeq;
  public final long firstRetainedSeq;
  /**
   * Minimum restart position over all slots, or {@link SlotRegistry#UNBOUNDED}.
   */
  public final long watermark;
  public final ImmutableList<SlotStatus> slots;
  public final ImmutableList<SessionStatus> sessions;
  public final ImmutableList<WorkerStatus> workers;

  public MonitoringSnapshot(long currentMaxSeq,
                            long firstRetainedSeq,
                            long watermark,
                            ImmutableList<SlotStatus> slots,
                            ImmutableList<SessionStatus> sessions,
                            ImmutableList<WorkerStatus> workers) {
    this.currentMaxSeq = currentMaxSeq;
    this.firstRetainedSeq = firstRetainedSeq;
    this.watermark = watermark;
    this.slots = slots;
    this.sessions = sessions;
    this.workers = workers;
  }

  @Nullable
  public SlotStatus slot(String name) {
    for (SlotStatus slot : slots) {
      if (slot.name.equals(name)) {
        return slot;
      }
    }
    return null;
  }

  @Nullable
  public SessionStatus session(String sessionId) {
    for (SessionStatus session : sessions) {
      if (session.sessionId.equals(sessionId)) {
        return session;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "MonitoringSnapshot{" +
        "currentMaxSeq=" + currentMaxSeq +
        ", firstRetainedSeq=" + firstRetainedSeq +
        ", watermark=" + (watermark == SlotRegistry.UNBOUNDED ? "none" : watermark) +
        ", slots=" + slots +
        ", sessions=" + sessions +
        ", workers=" + workers +
        '}';
  }

  public static final class SlotStatus {
    public final String name;
    public final SlotKind kind;
    public final long restartSeq;
    public final long confirmedSeq;
    public final boolean active;
    @Nullable
    public final String holderId;
    public final long lag;

    SlotStatus(RetentionSlot slot, long currentMaxSeq) {
      this.name = slot.getName();
      this.kind = slot.getKind();
      this.restartSeq = slot.getRestartSeq();
      this.confirmedSeq = slot.getConfirmedSeq();
      this.active = slot.isActive();
      this.holderId = slot.getHolderId();
      this.lag = Math.max(0, currentMaxSeq - slot.getRestartSeq());
    }

    @Override
    public String toString() {
      return "{" + name + " " + kind + " restart=" + restartSeq + " confirmed=" + confirmedSeq
          + (active ? " held by " + holderId : "") + " lag=" + lag + "}";
    }
  }

  public static final class SessionStatus {
    public final String sessionId;
    public final String slotName;
    public final String publication;
    public final StreamingSession.State state;
    public final long lastSentSeq;
    @Nullable
    public final Throwable failure;

    SessionStatus(StreamingSession session) {
      this.sessionId = session.getSessionId();
      this.slotName = session.getSlotName();
      this.publication = session.getPublicationName();
      this.state = session.getState();
      this.lastSentSeq = session.getLastSentSeq();
      this.failure = session.getFailure();
    }

    @Override
    public String toString() {
      return "{" + sessionId + " on " + slotName + "/" + publication + " " + state + " sent=" + lastSentSeq
          + (failure == null ? "" : " failure=" + failure) + "}";
    }
  }

  public static final class WorkerStatus {
    public final String shard;
    public final long accumulated;
    public final long limit;
    public final long sleeps;

    WorkerStatus(MaintenanceWorker worker) {
      final CostLimiter limiter = worker.getLimiter();
      this.shard = worker.getShard();
      this.accumulated = limiter.getAccumulated();
      this.limit = limiter.getLimit();
      this.sleeps = limiter.getSleeps();
    }

    @Override
    public String toString() {
      return "{" + shard + " " + accumulated + "/" + limit + " sleeps=" + sleeps + "}";
    }
  }
}
