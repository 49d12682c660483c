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

package retlog.interfaces.slots;

import com.google.common.collect.ImmutableList;
import retlog.interfaces.ErrorKind;
import retlog.interfaces.RetentionException;

import java.io.IOException;

/**
 * Process-wide table of retention slots. Every mutation is durable before it returns, and the
 * watermark only moves once the mutation that moves it has been persisted.
 */
public interface SlotRegistry extends AutoCloseable {
  /**
   * Value of {@link #watermark()} when there are no slots, so nothing is retained on their behalf.
   */
  long UNBOUNDED = Long.MAX_VALUE;

  /**
   * Create a slot positioned at sequence 0, so that it retains the entire log.
   */
  RetentionSlot create(String name, SlotKind kind) throws IOException, DuplicateSlot;

  /**
   * Create a slot with both restartSeq and confirmedSeq set to startSeq.
   */
  RetentionSlot create(String name, SlotKind kind, long startSeq) throws IOException, DuplicateSlot;

  void drop(String name) throws IOException, SlotNotFound, SlotBusy;

  /**
   * Mark the slot as held by holderId. Re-acquiring a slot already held by the same holder succeeds.
   *
   * @throws SlotBusy if the slot is held by a different holder.
   */
  RetentionSlot acquire(String name, String holderId) throws IOException, SlotNotFound, SlotBusy;

  /**
   * Clear the holder of the slot. Releasing a slot that is not held is a no-op.
   *
   * @throws SlotBusy if the slot is held by a different holder.
   */
  void release(String name, String holderId) throws IOException, SlotNotFound, SlotBusy;

  /**
   * Move the slot forward. Neither position may move backwards, and restartSeq may not exceed
   * confirmedSeq. On failure the slot is left unchanged.
   */
  RetentionSlot advance(String name, long newRestartSeq, long newConfirmedSeq)
      throws IOException, SlotNotFound, NonMonotonicAdvance, SlotInvariantViolation;

  RetentionSlot get(String name) throws SlotNotFound;

  ImmutableList<RetentionSlot> slots();

  /**
   * Minimum restartSeq across all slots, held or not, or {@link #UNBOUNDED} if there are none.
   */
  long watermark();

  /**
   * Synchronously persist the current table.
   */
  void flush() throws IOException;

  @Override
  void close() throws IOException;

  class DuplicateSlot extends RetentionException {
    public DuplicateSlot(String slotName) {
      super(ErrorKind.DUPLICATE_SLOT, "slot " + slotName + " already exists");
    }
  }

  class SlotNotFound extends RetentionException {
    public SlotNotFound(String slotName) {
      super(ErrorKind.SLOT_NOT_FOUND, "slot " + slotName + " does not exist");
    }
  }

  class SlotBusy extends RetentionException {
    public SlotBusy(String slotName, String holderId) {
      super(ErrorKind.SLOT_BUSY, "slot " + slotName + " is held by " + holderId);
    }
  }

  class NonMonotonicAdvance extends RetentionException {
    public NonMonotonicAdvance(String slotName, long currentSeq, long requestedSeq) {
      super(ErrorKind.NON_MONOTONIC_ADVANCE,
          "slot " + slotName + " cannot move back from " + currentSeq + " to " + requestedSeq);
    }
  }

  class SlotInvariantViolation extends RetentionException {
    public SlotInvariantViolation(String slotName, long restartSeq, long confirmedSeq) {
      super(ErrorKind.SLOT_INVARIANT_VIOLATION,
          "slot " + slotName + ": restartSeq " + restartSeq + " would exceed confirmedSeq " + confirmedSeq);
    }
  }
}
