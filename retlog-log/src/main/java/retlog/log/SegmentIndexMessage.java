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

import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import retlog.interfaces.log.SegmentDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of the segment index: one entry per live segment, oldest first.
 */
class SegmentIndexMessage {
  private static final Schema<SegmentIndexMessage> SCHEMA = RuntimeSchema.getSchema(SegmentIndexMessage.class);

  private List<Entry> segments = new ArrayList<>();

  static Schema<SegmentIndexMessage> getSchema() {
    return SCHEMA;
  }

  static SegmentIndexMessage fromDescriptors(List<SegmentDescriptor> descriptors) {
    SegmentIndexMessage message = new SegmentIndexMessage();
    for (SegmentDescriptor descriptor : descriptors) {
      Entry entry = new Entry();
      entry.id = descriptor.getId();
      entry.minSeq = descriptor.getMinSeq();
      entry.maxSeq = descriptor.getMaxSeq();
      entry.sealed = descriptor.isSealed();
      entry.sealedAtMillis = descriptor.getSealedAtMillis();
      entry.sizeBytes = descriptor.getSizeBytes();
      entry.fileName = descriptor.getFileName();
      message.segments.add(entry);
    }
    return message;
  }

  List<SegmentDescriptor> toDescriptors() {
    List<SegmentDescriptor> descriptors = new ArrayList<>();
    if (segments != null) {
      for (Entry entry : segments) {
        descriptors.add(new SegmentDescriptor(entry.id, entry.minSeq, entry.maxSeq, entry.sealed,
            entry.sealedAtMillis, entry.sizeBytes, entry.fileName));
      }
    }
    return descriptors;
  }

  @Override
  public String toString() {
    return "SegmentIndexMessage{segments=" + (segments == null ? 0 : segments.size()) + '}';
  }

  static class Entry {
    private long id;
    private long minSeq;
    private long maxSeq;
    private boolean sealed;
    private long sealedAtMillis;
    private long sizeBytes;
    private String fileName;
  }
}
