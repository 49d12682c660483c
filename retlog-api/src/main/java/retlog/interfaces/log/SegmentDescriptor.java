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

/**
 * Snapshot of the metadata of one log segment. An empty segment has maxSeq == minSeq - 1.
 */
public final class SegmentDescriptor {
  private final long id;
  private final long minSeq;
  private final long maxSeq;
  private final boolean sealed;
  private final long sealedAtMillis;
  private final long sizeBytes;
  private final String fileName;
  private final long firstRecordAtMillis;
  private final long lastRecordAtMillis;

  public SegmentDescriptor(long id, long minSeq, long maxSeq, boolean sealed, long sealedAtMillis,
                           long sizeBytes, String fileName) {
    this(id, minSeq, maxSeq, sealed, sealedAtMillis, sizeBytes, fileName, 0, 0);
  }

  /**
   * @param firstRecordAtMillis When the segment's first record was appended; 0 if unknown.
   * @param lastRecordAtMillis  When its last record was appended; 0 if unknown.
   */
  public SegmentDescriptor(long id, long minSeq, long maxSeq, boolean sealed, long sealedAtMillis,
                           long sizeBytes, String fileName, long firstRecordAtMillis, long lastRecordAtMillis) {
    this.id = id;
    this.minSeq = minSeq;
    this.maxSeq = maxSeq;
    this.sealed = sealed;
    this.sealedAtMillis = sealedAtMillis;
    this.sizeBytes = sizeBytes;
    this.fileName = fileName;
    this.firstRecordAtMillis = firstRecordAtMillis;
    this.lastRecordAtMillis = lastRecordAtMillis;
  }

  public long getId() {
    return id;
  }

  public long getMinSeq() {
    return minSeq;
  }

  public long getMaxSeq() {
    return maxSeq;
  }

  public boolean isSealed() {
    return sealed;
  }

  /**
   * Wall-clock time the segment was sealed, or 0 if it is still open.
   */
  public long getSealedAtMillis() {
    return sealedAtMillis;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public String getFileName() {
    return fileName;
  }

  /**
   * Append times are kept only in memory, so segments loaded from the index report 0 until they
   * take a new record.
   */
  public long getFirstRecordAtMillis() {
    return firstRecordAtMillis;
  }

  public long getLastRecordAtMillis() {
    return lastRecordAtMillis;
  }

  public boolean isEmpty() {
    return maxSeq < minSeq;
  }

  @Override
  public String toString() {
    return "SegmentDescriptor{" +
        "id=" + id +
        ", minSeq=" + minSeq +
        ", maxSeq=" + maxSeq +
        ", sealed=" + sealed +
        ", sizeBytes=" + sizeBytes +
        ", fileName='" + fileName + '\'' +
        '}';
  }
}
