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

import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import retlog.interfaces.slots.RetentionSlot;
import retlog.interfaces.slots.SlotKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Persisted form of the slot table.
 */
class SlotTableMessage {
  private static final Schema<SlotTableMessage> SCHEMA = RuntimeSchema.getSchema(SlotTableMessage.class);

  private List<Entry> slots = new ArrayList<>();

  static Schema<SlotTableMessage> getSchema() {
    return SCHEMA;
  }

  static SlotTableMessage fromSlots(Collection<RetentionSlot> retentionSlots) {
    SlotTableMessage message = new SlotTableMessage();
    for (RetentionSlot slot : retentionSlots) {
      Entry entry = new Entry();
      entry.name = slot.getName();
      entry.kind = slot.getKind().name();
      entry.restartSeq = slot.getRestartSeq();
      entry.confirmedSeq = slot.getConfirmedSeq();
      entry.active = slot.isActive();
      entry.holderId = slot.getHolderId();
      message.slots.add(entry);
    }
    return message;
  }

  List<RetentionSlot> toSlots() {
    List<RetentionSlot> retentionSlots = new ArrayList<>();
    if (slots != null) {
      for (Entry entry : slots) {
        retentionSlots.add(new RetentionSlot(entry.name, SlotKind.valueOf(entry.kind), entry.restartSeq,
            entry.confirmedSeq, entry.active ? entry.holderId : null));
      }
    }
    return retentionSlots;
  }

  @Override
  public String toString() {
    return "SlotTableMessage{slots=" + (slots == null ? 0 : slots.size()) + '}';
  }

  static class Entry {
    private String name;
    private String kind;
    private long restartSeq;
    private long confirmedSeq;
    private boolean active;
    private String holderId;
  }
}
