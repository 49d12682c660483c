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
 * Serialized ahead of every record's payload.
 */
public class RecordHeader {
  private static final Schema<RecordHeader> SCHEMA = RuntimeSchema.getSchema(RecordHeader.class);

  private long seqNum;
  private int kind;
  private int contentLength;

  public RecordHeader() {
  }

  public RecordHeader(long seqNum, int kind, int contentLength) {
    this.seqNum = seqNum;
    this.kind = kind;
    this.contentLength = contentLength;
  }

  public static Schema<RecordHeader> getSchema() {
    return SCHEMA;
  }

  public long getSeqNum() {
    return seqNum;
  }

  public int getKind() {
    return kind;
  }

  public int getContentLength() {
    return contentLength;
  }

  @Override
  public String toString() {
    return "RecordHeader{seqNum=" + seqNum + ", kind=" + kind + ", contentLength=" + contentLength + '}';
  }
}
