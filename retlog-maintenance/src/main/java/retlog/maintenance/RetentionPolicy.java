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

package retlog.maintenance;

import retlog.interfaces.log.SegmentDescriptor;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * Bounds log growth when no slot holds the log back. Sealed segments are released oldest first,
 * while the log exceeds maxRetainedBytes or while the segment's newest record is older than
 * maxRetainedAgeMillis. A bound of zero disables it.
 * <p>
 * The active segment is never released, so the age bound also asks for it to be sealed once its
 * oldest record passes the bound.
 */
public class RetentionPolicy {
  private final long maxRetainedBytes;
  private final long maxRetainedAgeMillis;
  private final LongSupplier clock;

  public RetentionPolicy(long maxRetainedBytes, long maxRetainedAgeMillis) {
    this(maxRetainedBytes, maxRetainedAgeMillis, System::currentTimeMillis);
  }

  public RetentionPolicy(long maxRetainedBytes, long maxRetainedAgeMillis, LongSupplier clock) {
    if (maxRetainedBytes < 0 || maxRetainedAgeMillis < 0) {
      throw new IllegalArgumentException("Retention bounds must not be negative");
    }
    this.maxRetainedBytes = maxRetainedBytes;
    this.maxRetainedAgeMillis = maxRetainedAgeMillis;
    this.clock = clock;
  }

  /**
   * @param segments The log's segments, oldest first.
   * @return The sequence number below which segments may be reclaimed, or 0 if none may.
   */
  public long reclaimBoundary(List<SegmentDescriptor> segments) {
    final long now = clock.getAsLong();
    long retainedBytes = 0;
    for (SegmentDescriptor segment : segments) {
      retainedBytes += segment.getSizeBytes();
    }

    long boundary = 0;
    for (SegmentDescriptor segment : segments) {
      if (!segment.isSealed()) {
        break;
      }
      final boolean tooLarge = maxRetainedBytes > 0 && retainedBytes > maxRetainedBytes;
      final boolean tooOld = maxRetainedAgeMillis > 0 && now - newestRecordMillis(segment) > maxRetainedAgeMillis;
      if (!tooLarge && !tooOld) {
        break;
      }
      retainedBytes -= segment.getSizeBytes();
      boundary = segment.getMaxSeq() + 1;
    }
    return boundary;
  }

  /**
   * @param active The log's active segment.
   * @return Whether it holds a record older than the age bound and should be sealed.
   */
  public boolean shouldSeal(SegmentDescriptor active) {
    if (maxRetainedAgeMillis == 0 || active.isSealed() || active.isEmpty()) {
      return false;
    }
    final long oldest = active.getFirstRecordAtMillis();
    return oldest > 0 && clock.getAsLong() - oldest > maxRetainedAgeMillis;
  }

  private static long newestRecordMillis(SegmentDescriptor segment) {
    return segment.getLastRecordAtMillis() > 0 ? segment.getLastRecordAtMillis() : segment.getSealedAtMillis();
  }

  @Override
  public String toString() {
    return "RetentionPolicy{" +
        "maxRetainedBytes=" + maxRetainedBytes +
        ", maxRetainedAgeMillis=" + maxRetainedAgeMillis +
        '}';
  }
}
