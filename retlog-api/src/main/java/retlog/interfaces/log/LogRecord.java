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

package retlog.interfaces.log;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * An immutable record of the log: its sequence number, its kind, and an opaque payload.
 */
public final class LogRecord extends SequentialEntry {
  private final RecordKind kind;
  private final byte[] payload;

  public LogRecord(long seqNum, @NotNull RecordKind kind, @NotNull byte[] payload) {
    super(seqNum);
    this.kind = kind;
    this.payload = payload.clone();
  }

  public RecordKind getKind() {
    return kind;
  }

  public byte[] getPayload() {
    return payload.clone();
  }

  public int getPayloadLength() {
    return payload.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    LogRecord that = (LogRecord) o;
    return seqNum == that.seqNum
        && kind == that.kind
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(seqNum);
    result = 31 * result + kind.hashCode();
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "LogRecord{" +
        "seqNum=" + seqNum +
        ", kind=" + kind +
        ", payloadLength=" + payload.length +
        '}';
  }
}
