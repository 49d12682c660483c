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

package retlog.slots;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.interfaces.slots.RetentionSlot;
import retlog.interfaces.slots.SlotKind;
import retlog.interfaces.slots.SlotRegistry;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * SlotRegistry holding its table in memory and writing the whole table through a
 * SlotTablePersistence on every mutation.
 * <p>
 * Every operation takes the registry's monitor. Slots are few and change rarely compared with the
 * rate of log appends, so one lock serializing all mutations, including their persistence, is
 * simpler than per-slot locking and costs nothing measurable. A mutation is applied to a copy of
 * the table; the copy replaces the live table only once it has been persisted, so a failed or
 * interrupted write never moves the watermark.
 */
public class PersistentSlotRegistry implements SlotRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(PersistentSlotRegistry.class);

  private final SlotTablePersistence persistence;
  private Map<String, RetentionSlot> slots = new TreeMap<>();
  private boolean closed;

  /**
   * Load the registry from its persisted table. Holders recorded in the table belonged to sessions
   * of a previous process; they are released.
   */
  public PersistentSlotRegistry(SlotTablePersistence persistence) throws IOException {
    this.persistence = persistence;

    boolean releasedAny = false;
    for (RetentionSlot slot : persistence.readSlots()) {
      if (slot.isActive()) {
        LOG.info("Releasing slot {}, held by {} before restart", slot.getName(), slot.getHolderId());
        slot = slot.withHolder(null);
        releasedAny = true;
      }
      slots.put(slot.getName(), slot);
    }
    if (releasedAny) {
      persistence.writeSlots(slots.values());
    }

    LOG.info("Loaded {} slot(s); watermark {}", slots.size(), describeWatermark(watermark()));
  }

  @Override
  public RetentionSlot create(String name, SlotKind kind) throws IOException, DuplicateSlot {
    return create(name, kind, 0);
  }

  @Override
  public synchronized RetentionSlot create(String name, SlotKind kind, long startSeq)
      throws IOException, DuplicateSlot {
    ensureOpen();
    validateName(name);
    if (startSeq < 0) {
      throw new IllegalArgumentException("startSeq must not be negative");
    }
    if (slots.containsKey(name)) {
      throw new DuplicateSlot(name);
    }

    final RetentionSlot slot = new RetentionSlot(name, kind, startSeq, startSeq, null);
    final Map<String, RetentionSlot> updated = copyOfTable();
    updated.put(name, slot);
    persistAndSwap(updated);

    LOG.info("Created {} slot {} at {}", kind, name, startSeq);
    return slot;
  }

  @Override
  public synchronized void drop(String name) throws IOException, SlotNotFound, SlotBusy {
    ensureOpen();
    final RetentionSlot slot = getLocked(name);
    if (slot.isActive()) {
      throw new SlotBusy(name, slot.getHolderId());
    }

    final Map<String, RetentionSlot> updated = copyOfTable();
    updated.remove(name);
    persistAndSwap(updated);

    LOG.info("Dropped slot {}", name);
  }

  @Override
  public synchronized RetentionSlot acquire(String name, String holderId) throws IOException, SlotNotFound, SlotBusy {
    ensureOpen();
    if (holderId == null || holderId.isEmpty()) {
      throw new IllegalArgumentException("holderId must not be empty");
    }

    final RetentionSlot slot = getLocked(name);
    if (holderId.equals(slot.getHolderId())) {
      return slot;
    }
    if (slot.isActive()) {
      throw new SlotBusy(name, slot.getHolderId());
    }

    final RetentionSlot acquired = slot.withHolder(holderId);
    replaceSlot(acquired);

    LOG.debug("Slot {} acquired by {}", name, holderId);
    return acquired;
  }

  @Override
  public synchronized void release(String name, String holderId) throws IOException, SlotNotFound, SlotBusy {
    ensureOpen();
    final RetentionSlot slot = getLocked(name);
    if (!slot.isActive()) {
      return;
    }
    if (!Objects.equals(holderId, slot.getHolderId())) {
      throw new SlotBusy(name, slot.getHolderId());
    }

    replaceSlot(slot.withHolder(null));
    LOG.debug("Slot {} released by {}", name, holderId);
  }

  @Override
  public synchronized RetentionSlot advance(String name, long newRestartSeq, long newConfirmedSeq)
      throws IOException, SlotNotFound, NonMonotonicAdvance, SlotInvariantViolation {
    ensureOpen();
    final RetentionSlot slot = getLocked(name);
    if (newRestartSeq < slot.getRestartSeq()) {
      throw new NonMonotonicAdvance(name, slot.getRestartSeq(), newRestartSeq);
    }
    if (newConfirmedSeq < slot.getConfirmedSeq()) {
      throw new NonMonotonicAdvance(name, slot.getConfirmedSeq(), newConfirmedSeq);
    }
    if (newRestartSeq > newConfirmedSeq) {
      throw new SlotInvariantViolation(name, newRestartSeq, newConfirmedSeq);
    }
    if (newRestartSeq == slot.getRestartSeq() && newConfirmedSeq == slot.getConfirmedSeq()) {
      return slot;
    }

    final RetentionSlot advanced = slot.withPosition(newRestartSeq, newConfirmedSeq);
    replaceSlot(advanced);

    LOG.debug("Slot {} advanced to restart {} confirmed {}", name, newRestartSeq, newConfirmedSeq);
    return advanced;
  }

  @Override
  public synchronized RetentionSlot get(String name) throws SlotNotFound {
    return getLocked(name);
  }

  @Override
  public synchronized ImmutableList<RetentionSlot> slots() {
    return ImmutableList.copyOf(slots.values());
  }

  @Override
  public synchronized long watermark() {
    long watermark = UNBOUNDED;
    for (RetentionSlot slot : slots.values()) {
      watermark = Math.min(watermark, slot.getRestartSeq());
    }
    return watermark;
  }

  @Override
  public synchronized void flush() throws IOException {
    ensureOpen();
    persistence.writeSlots(slots.values());
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    persistence.writeSlots(slots.values());
    closed = true;
    LOG.info("Closed slot registry; watermark {}", describeWatermark(watermark()));
  }

  private RetentionSlot getLocked(String name) throws SlotNotFound {
    final RetentionSlot slot = slots.get(name);
    if (slot == null) {
      throw new SlotNotFound(name);
    }
    return slot;
  }

  private void replaceSlot(RetentionSlot slot) throws IOException {
    final Map<String, RetentionSlot> updated = copyOfTable();
    updated.put(slot.getName(), slot);
    persistAndSwap(updated);
  }

  private Map<String, RetentionSlot> copyOfTable() {
    return new TreeMap<>(slots);
  }

  private void persistAndSwap(Map<String, RetentionSlot> updated) throws IOException {
    persistence.writeSlots(updated.values());
    slots = updated;
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("Slot registry is closed");
    }
  }

  private static void validateName(String name) {
    if (name == null || name.isEmpty() || !name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_' || c == '-')) {
      throw new IllegalArgumentException("Invalid slot name: " + name);
    }
  }

  private static String describeWatermark(long watermark) {
    return watermark == UNBOUNDED ? "unbounded" : Long.toString(watermark);
  }
}
