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

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import retlog.RetlogCommonTestUtil;
import retlog.interfaces.slots.RetentionSlot;
import retlog.interfaces.slots.SlotKind;
import retlog.interfaces.slots.SlotRegistry;

import java.io.IOException;
import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static retlog.interfaces.slots.SlotRegistry.UNBOUNDED;

public class PersistentSlotRegistryTest {
  private final RetlogCommonTestUtil testUtil = new RetlogCommonTestUtil();
  private Path dataDirectory;
  private PersistentSlotRegistry registry;

  @Before
  public void openRegistry() throws Exception {
    dataDirectory = testUtil.getDataTestDir("slot-registry-test");
    registry = openRegistryAt(dataDirectory);
  }

  @After
  public void closeRegistryAndRemoveData() throws Exception {
    registry.close();
    testUtil.cleanupTestDir();
  }

  @Test
  public void createsSlotsPositionedAtTheRequestedSequenceNumber() throws Exception {
    RetentionSlot slot = registry.create("s1", SlotKind.LOGICAL, 17);

    assertThat(slot.getRestartSeq(), is(equalTo(17L)));
    assertThat(slot.getConfirmedSeq(), is(equalTo(17L)));
    assertThat(slot.isActive(), is(false));
    assertThat(registry.get("s1"), is(equalTo(slot)));
  }

  @Test(expected = SlotRegistry.DuplicateSlot.class)
  public void refusesToCreateASlotWhoseNameIsTaken() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.create("s1", SlotKind.PHYSICAL);
  }

  @Test(expected = SlotRegistry.SlotNotFound.class)
  public void throwsSlotNotFoundForAnUnknownName() throws Exception {
    registry.get("nope");
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsSlotNamesContainingWhitespace() throws Exception {
    registry.create("two words", SlotKind.LOGICAL);
  }

  @Test
  public void allowsOnlyOneHolderAtATime() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.acquire("s1", "A");

    try {
      registry.acquire("s1", "B");
      throw new AssertionError("expected SlotBusy");
    } catch (SlotRegistry.SlotBusy expected) {
      assertThat(registry.get("s1").getHolderId(), is(equalTo("A")));
    }

    registry.release("s1", "A");
    assertThat(registry.acquire("s1", "B").getHolderId(), is(equalTo("B")));
  }

  @Test
  public void reacquiringBySameHolderSucceeds() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.acquire("s1", "A");

    assertThat(registry.acquire("s1", "A").getHolderId(), is(equalTo("A")));
  }

  @Test(expected = SlotRegistry.SlotBusy.class)
  public void refusesToDropAHeldSlot() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.acquire("s1", "A");

    registry.drop("s1");
  }

  @Test(expected = SlotRegistry.SlotBusy.class)
  public void refusesReleaseByANonHolder() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.acquire("s1", "A");

    registry.release("s1", "B");
  }

  @Test
  public void releasingAnUnheldSlotIsANoOp() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.release("s1", "A");

    assertThat(registry.get("s1").isActive(), is(false));
  }

  @Test
  public void advancesBothPositions() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);

    RetentionSlot advanced = registry.advance("s1", 5, 9);

    assertThat(advanced.getRestartSeq(), is(equalTo(5L)));
    assertThat(advanced.getConfirmedSeq(), is(equalTo(9L)));
    assertThat(registry.get("s1"), is(equalTo(advanced)));
  }

  @Test
  public void refusesToMoveRestartSeqBackwardsAndLeavesTheSlotUnchanged() throws Exception {
    registry.create("s1", SlotKind.LOGICAL, 10);

    try {
      registry.advance("s1", 5, 10);
      throw new AssertionError("expected NonMonotonicAdvance");
    } catch (SlotRegistry.NonMonotonicAdvance expected) {
      assertThat(registry.get("s1").getRestartSeq(), is(equalTo(10L)));
      assertThat(registry.get("s1").getConfirmedSeq(), is(equalTo(10L)));
    }
  }

  @Test(expected = SlotRegistry.NonMonotonicAdvance.class)
  public void refusesToMoveConfirmedSeqBackwards() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.advance("s1", 2, 8);

    registry.advance("s1", 3, 7);
  }

  @Test
  public void refusesRestartSeqBeyondConfirmedSeq() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);

    try {
      registry.advance("s1", 8, 4);
      throw new AssertionError("expected SlotInvariantViolation");
    } catch (SlotRegistry.SlotInvariantViolation expected) {
      assertThat(registry.get("s1").getRestartSeq(), is(equalTo(0L)));
    }
  }

  @Test
  public void watermarkIsUnboundedWithoutSlots() throws Exception {
    assertThat(registry.watermark(), is(equalTo(UNBOUNDED)));
  }

  @Test
  public void watermarkIsTheMinimumRestartSeqOfAllSlotsHeldOrNot() throws Exception {
    registry.create("s1", SlotKind.LOGICAL, 40);
    registry.create("s2", SlotKind.PHYSICAL, 25);
    registry.create("s3", SlotKind.LOGICAL, 60);
    registry.acquire("s3", "A");

    assertThat(registry.watermark(), is(equalTo(25L)));

    registry.advance("s2", 50, 55);
    assertThat(registry.watermark(), is(equalTo(40L)));

    registry.drop("s1");
    assertThat(registry.watermark(), is(equalTo(50L)));
  }

  @Test
  public void dropRemovesTheSlot() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.drop("s1");

    assertThat(registry.slots(), is(empty()));
  }

  @Test
  public void slotTableSurvivesReopening() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.create("s2", SlotKind.PHYSICAL, 3);
    registry.advance("s1", 4, 6);
    registry.close();

    registry = openRegistryAt(dataDirectory);

    assertThat(registry.slots(), contains(
        new RetentionSlot("s1", SlotKind.LOGICAL, 4, 6, null),
        new RetentionSlot("s2", SlotKind.PHYSICAL, 3, 3, null)));
    assertThat(registry.watermark(), is(equalTo(3L)));
  }

  @Test
  public void holdersFromBeforeARestartAreReleased() throws Exception {
    registry.create("s1", SlotKind.LOGICAL);
    registry.acquire("s1", "A");
    // Simulate a crash: the table on disk still records the holder.
    SlotTablePersistence persistence = new NioSlotTableReaderWriter(dataDirectory);

    registry = new PersistentSlotRegistry(persistence);

    assertThat(registry.get("s1").getHolderId(), is(nullValue()));
    assertThat(persistence.readSlots().get(0).isActive(), is(false));
  }

  @Test(expected = IOException.class)
  public void refusesMutationsOnceClosed() throws Exception {
    registry.close();
    registry.create("s1", SlotKind.LOGICAL);
  }

  private static PersistentSlotRegistry openRegistryAt(Path directory) throws IOException {
    return new PersistentSlotRegistry(new NioSlotTableReaderWriter(directory));
  }
}
