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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import retlog.interfaces.log.SegmentDescriptor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

public class RetentionPolicyTest {
  private static final long NOW = 1_000_000;

  private static final ImmutableList<SegmentDescriptor> SEGMENTS = ImmutableList.of(
      sealedSegment(1, 1, 10, NOW - 5000, 100),
      sealedSegment(2, 11, 20, NOW - 3000, 100),
      sealedSegment(3, 21, 30, NOW - 1000, 100),
      new SegmentDescriptor(4, 31, 35, false, 0, 50, "4.seg"));

  @Test
  public void releasesOldestSegmentsUntilTheLogFitsTheSizeBound() {
    RetentionPolicy policy = new RetentionPolicy(200, 0, () -> NOW);

    assertThat(policy.reclaimBoundary(SEGMENTS), is(equalTo(21L)));
  }

  @Test
  public void releasesSegmentsSealedLongerAgoThanTheAgeBound() {
    RetentionPolicy policy = new RetentionPolicy(0, 2000, () -> NOW);

    assertThat(policy.reclaimBoundary(SEGMENTS), is(equalTo(21L)));
  }

  @Test
  public void neverReleasesTheActiveSegment() {
    RetentionPolicy policy = new RetentionPolicy(1, 1, () -> NOW);

    assertThat(policy.reclaimBoundary(SEGMENTS), is(equalTo(31L)));
  }

  @Test
  public void releasesNothingWithinBounds() {
    RetentionPolicy policy = new RetentionPolicy(10_000, 60_000, () -> NOW);

    assertThat(policy.reclaimBoundary(SEGMENTS), is(equalTo(0L)));
  }

  @Test
  public void releasesNothingWhenBothBoundsAreDisabled() {
    RetentionPolicy policy = new RetentionPolicy(0, 0, () -> NOW);

    assertThat(policy.reclaimBoundary(SEGMENTS), is(equalTo(0L)));
  }

  @Test
  public void agesASegmentByItsNewestRecordWhenThatIsKnown() {
    SegmentDescriptor sealedLongAgoButWrittenRecently =
        new SegmentDescriptor(1, 1, 10, true, NOW - 5000, 100, "1.seg", NOW - 6000, NOW - 500);
    RetentionPolicy policy = new RetentionPolicy(0, 2000, () -> NOW);

    assertThat(policy.reclaimBoundary(ImmutableList.of(sealedLongAgoButWrittenRecently, activeSegment(11, NOW - 100))),
        is(equalTo(0L)));
  }

  @Test
  public void asksToSealAnActiveSegmentWhoseOldestRecordPassedTheAgeBound() {
    RetentionPolicy policy = new RetentionPolicy(0, 2000, () -> NOW);

    assertThat(policy.shouldSeal(activeSegment(1, NOW - 2001)), is(true));
    assertThat(policy.shouldSeal(activeSegment(1, NOW - 1999)), is(false));
  }

  @Test
  public void neverAsksToSealWithoutAnAgeBoundOrWithoutKnownAppendTimes() {
    assertThat(new RetentionPolicy(100, 0, () -> NOW).shouldSeal(activeSegment(1, NOW - 60_000)), is(false));
    assertThat(new RetentionPolicy(0, 2000, () -> NOW).shouldSeal(SEGMENTS.get(3)), is(false));
  }

  private static SegmentDescriptor sealedSegment(long id, long minSeq, long maxSeq, long sealedAt, long size) {
    return new SegmentDescriptor(id, minSeq, maxSeq, true, sealedAt, size, id + ".seg");
  }

  private static SegmentDescriptor activeSegment(long minSeq, long firstRecordAt) {
    return new SegmentDescriptor(99, minSeq, minSeq + 4, false, 0, 50, "99.seg", firstRecordAt, firstRecordAt);
  }
}
