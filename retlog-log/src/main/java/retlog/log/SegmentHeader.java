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

/**
 * Written once at the start of each segment file. The first record of the segment, if any,
 * has sequence number baseSeqNum + 1.
 */
public class SegmentHeader {
  private static final Schema<SegmentHeader> SCHEMA = RuntimeSchema.getSchema(SegmentHeader.class);

  private long segmentId;
  private long baseSeqNum;

  public SegmentHeader() {
  }

  public SegmentHeader(long segmentId, long baseSeqNum) {
    this.segmentId = segmentId;
    this.baseSeqNum = baseSeqNum;
  }

  public static Schema<SegmentHeader> getSchema() {
    return SCHEMA;
  }

  public long getSegmentId() {
    return segmentId;
  }

  public long getBaseSeqNum() {
    return baseSeqNum;
  }

  @Override
  public String toString() {
    return "SegmentHeader{segmentId=" + segmentId + ", baseSeqNum=" + baseSeqNum + '}';
  }
}
