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

package retlog.decoding;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import retlog.interfaces.decoding.ChangeBatch;
import retlog.interfaces.decoding.DecodedChange;
import retlog.interfaces.decoding.Decoder;
import retlog.interfaces.decoding.Operation;
import retlog.interfaces.decoding.Publication;
import retlog.interfaces.log.LogRecord;
import retlog.interfaces.log.RecordKind;

import java.util.EnumSet;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static retlog.decoding.DecodingTestUtil.abortRecord;
import static retlog.decoding.DecodingTestUtil.bytes;
import static retlog.decoding.DecodingTestUtil.changeRecord;
import static retlog.decoding.DecodingTestUtil.commitRecord;
import static retlog.decoding.DecodingTestUtil.deleteRecord;
import static retlog.decoding.DecodingTestUtil.insertRecord;

public class LogicalDecoderTest {
  private static final Publication EVERYTHING =
      Publication.forAllEntities("everything", EnumSet.allOf(Operation.class));

  private final Decoder decoder = new LogicalDecoder(EVERYTHING, 1000);

  @Test
  public void emitsNothingUntilTheTransactionCommits() throws Exception {
    assertThat(decoder.decode(insertRecord(1, 7, "accounts", "a")), is(nullValue()));
    assertThat(decoder.decode(insertRecord(2, 7, "accounts", "b")), is(nullValue()));
    assertThat(decoder.openTransactions(), is(equalTo(1)));
  }

  @Test
  public void emitsAllChangesOfACommittedTransactionAsOneOrderedBatch() throws Exception {
    decoder.decode(insertRecord(1, 7, "accounts", "a"));
    decoder.decode(deleteRecord(2, 7, "orders", "b"));
    ChangeBatch batch = decoder.decode(commitRecord(3, 7));

    assertThat(batch, is(notNullValue()));
    assertThat(batch.getTransactionId(), is(equalTo(7L)));
    assertThat(batch.getFirstSeq(), is(equalTo(1L)));
    assertThat(batch.getCommitSeq(), is(equalTo(3L)));
    assertThat(batch.getRestartSeq(), is(equalTo(3L)));
    assertThat(batch.getChanges(), contains(
        new DecodedChange("accounts", Operation.INSERT, null, bytes("a"), 3, 7),
        new DecodedChange("orders", Operation.DELETE, bytes("b"), null, 3, 7)));
    assertThat(decoder.openTransactions(), is(equalTo(0)));
  }

  @Test
  public void abortedTransactionProducesNoChanges() throws Exception {
    decoder.decode(insertRecord(1, 7, "accounts", "a"));
    decoder.decode(insertRecord(2, 7, "accounts", "b"));

    assertThat(decoder.decode(abortRecord(3, 7)), is(nullValue()));
    assertThat(decoder.openTransactions(), is(equalTo(0)));
    assertThat(decoder.decode(commitRecord(4, 8)).isEmpty(), is(true));
  }

  @Test
  public void keepsInterleavedTransactionsApart() throws Exception {
    decoder.decode(insertRecord(1, 1, "accounts", "from-1"));
    decoder.decode(insertRecord(2, 2, "accounts", "from-2"));
    decoder.decode(insertRecord(3, 1, "accounts", "from-1-again"));

    ChangeBatch second = decoder.decode(commitRecord(4, 2));
    ChangeBatch first = decoder.decode(commitRecord(5, 1));

    assertThat(second.getChanges(), contains(
        new DecodedChange("accounts", Operation.INSERT, null, bytes("from-2"), 4, 2)));
    assertThat(first.getChanges().size(), is(equalTo(2)));
  }

  @Test
  public void restartSeqPointsAtTheOldestTransactionStillOpen() throws Exception {
    decoder.decode(insertRecord(1, 1, "accounts", "x"));
    decoder.decode(insertRecord(2, 2, "accounts", "y"));

    ChangeBatch second = decoder.decode(commitRecord(3, 2));
    assertThat(second.getRestartSeq(), is(equalTo(1L)));

    ChangeBatch first = decoder.decode(commitRecord(4, 1));
    assertThat(first.getRestartSeq(), is(equalTo(4L)));
  }

  @Test
  public void filtersDuringDecodeButStillTracksTheTransaction() throws Exception {
    Decoder filtered = new LogicalDecoder(
        Publication.forEntities("accounts-only", ImmutableList.of("accounts"), EnumSet.of(Operation.INSERT)), 1000);

    filtered.decode(insertRecord(1, 1, "orders", "hidden"));
    filtered.decode(changeRecord(2, 2, "accounts", Operation.UPDATE, bytes("old"), bytes("new")));
    filtered.decode(insertRecord(3, 2, "accounts", "shown"));

    ChangeBatch batch = filtered.decode(commitRecord(4, 2));
    assertThat(batch.getChanges(), contains(
        new DecodedChange("accounts", Operation.INSERT, null, bytes("shown"), 4, 2)));
    assertThat(batch.getRestartSeq(), is(equalTo(1L)));

    assertThat(filtered.decode(commitRecord(5, 1)).isEmpty(), is(true));
  }

  @Test
  public void skipsCheckpointRecords() throws Exception {
    assertThat(decoder.decode(new LogRecord(1, RecordKind.CHECKPOINT, new byte[0])), is(nullValue()));
    assertThat(decoder.openTransactions(), is(equalTo(0)));
  }

  @Test
  public void commitOfAnUnseenTransactionYieldsAnEmptyBatch() throws Exception {
    ChangeBatch batch = decoder.decode(commitRecord(9, 42));

    assertThat(batch.isEmpty(), is(true));
    assertThat(batch.getCommitSeq(), is(equalTo(9L)));
  }

  @Test(expected = Decoder.TransactionTooLarge.class)
  public void refusesToBufferMoreThanTheConfiguredNumberOfChanges() throws Exception {
    Decoder small = new LogicalDecoder(EVERYTHING, 2);

    small.decode(insertRecord(1, 1, "accounts", "a"));
    small.decode(insertRecord(2, 1, "accounts", "b"));
    small.decode(insertRecord(3, 1, "accounts", "c"));
  }

  @Test
  public void filteredChangesDoNotCountTowardsTheBound() throws Exception {
    Decoder small = new LogicalDecoder(
        Publication.forEntities("accounts-only", ImmutableList.of("accounts"), EnumSet.allOf(Operation.class)), 1);

    small.decode(insertRecord(1, 1, "orders", "a"));
    small.decode(insertRecord(2, 1, "orders", "b"));
    small.decode(insertRecord(3, 1, "accounts", "c"));

    assertThat(small.decode(commitRecord(4, 1)).getChanges().size(), is(equalTo(1)));
  }

  @Test(expected = Decoder.DecodeCorruption.class)
  public void unreadablePayloadIsCorruption() throws Exception {
    decoder.decode(new LogRecord(1, RecordKind.DATA, new byte[]{(byte) 0xff, (byte) 0xff, (byte) 0xff}));
  }

  @Test(expected = Decoder.DecodeCorruption.class)
  public void unknownOperationCodeIsCorruption() throws Exception {
    ChangePayload payload = new ChangePayload(1, "accounts", 99, null, bytes("a"));
    decoder.decode(new LogRecord(1, RecordKind.DATA, ChangePayloadCodec.encode(payload)));
  }

  @Test
  public void corruptionNamesTheOffendingRecord() throws Exception {
    try {
      decoder.decode(new LogRecord(12, RecordKind.DATA, new byte[0]));
      throw new AssertionError("expected DecodeCorruption");
    } catch (Decoder.DecodeCorruption e) {
      assertThat(e.getMessage().startsWith("record 12"), is(true));
    }
  }
}
