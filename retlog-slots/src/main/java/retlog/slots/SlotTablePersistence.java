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
import retlog.interfaces.slots.RetentionSlot;

import java.io.IOException;
import java.util.Collection;

/**
 * Durable storage of the slot table. Writing replaces the whole table atomically: after a crash,
 * reading returns either the table as it was before the write or as it was written, never a mixture.
 */
public interface SlotTablePersistence {

  ImmutableList<RetentionSlot> readSlots() throws IOException;

  void writeSlots(Collection<RetentionSlot> slots) throws IOException;
}
