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
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import retlog.interfaces.decoding.ChangeBatch;
import retlog.interfaces.decoding.DecodedChange;
import retlog.interfaces.decoding.Decoder;
import retlog.interfaces.decoding.Operation;
import retlog.interfaces.decoding.Publication;
import retlog.interfaces.log.LogRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoder for records written by {@link ChangeRecordWriter}.
 * <p>
 * Changes are buffered per transaction, keyed by transaction id, until the transaction's COMMIT or
 * ABORT record. Only changes the publication includes are buffered, but every transaction seen is
 * tracked by the sequence number of its first record, whether or not any of its changes are
 * published: that sequence number bounds how far back a reader must start to see the transaction
 * in full, which is what {@link ChangeBatch#getRestartSeq()} reports.
 * <p>
 * Not thread safe; a decoder belongs to the single reader feeding it.
 */
public class LogicalDecoder implements Decoder {
  private static final Logger LOG = LoggerFactory.getLogger(LogicalDecoder.class);

  private final Publication publication;
  private final int maxTransactionChanges;

  /**
   * Open transactions in order of their first record.
   */
  private final Map<Long, OpenTransaction> openTransactions = new LinkedHashMap<>();

  public LogicalDecoder(Publication publication, int maxTransactionChanges) {
    if (maxTransactionChanges <= 0) {
      throw new IllegalArgumentException("maxTransactionChanges must be positive");
    }
    this.publication = publication;
    this.maxTransactionChanges = maxTransactionChanges;
  }

  public static Decoder.Factory factory(int maxTransactionChanges) {
    return (publication) -> new LogicalDecoder(publication, maxTransactionChanges);
  }

  @Nullable
  @Override
  public ChangeBatch decode(LogRecord record) throws DecodeCorruption, TransactionTooLarge {
    switch (record.getKind()) {
      case DATA:
        bufferChange(record);
        return null;
      case COMMIT:
        return commit(record);
      case ABORT:
        abort(record);
        return null;
      default:
        return null;
    }
  }

  @Override
  public int openTransactions() {
    return openTransactions.size();
  }

  private void bufferChange(LogRecord record) throws DecodeCorruption, TransactionTooLarge {
    final ChangePayload payload;
    try {
      payload = ChangePayloadCodec.decodeChange(record.getPayload());
    } catch (IOException | RuntimeException e) {
      throw new DecodeCorruption(record.getSeqNum(), "unreadable change payload", e);
    }

    if (payload.getEntity() == null || payload.getEntity().isEmpty()) {
      throw new DecodeCorruption(record.getSeqNum(), "change names no entity");
    }
    final Operation operation = Operation.fromCode(payload.getOperation());
    if (operation == null) {
      throw new DecodeCorruption(record.getSeqNum(), "unknown operation code " + payload.getOperation());
    }

    final OpenTransaction transaction = openTransactions.computeIfAbsent(payload.getTransactionId(),
        (id) -> new OpenTransaction(id, record.getSeqNum()));

    if (!publication.includes(payload.getEntity(), operation)) {
      return;
    }
    if (transaction.changes.size() >= maxTransactionChanges) {
      throw new TransactionTooLarge(transaction.transactionId, maxTransactionChanges);
    }
    transaction.changes.add(new BufferedChange(payload.getEntity(), operation,
        payload.getBeforeImage(), payload.getAfterImage()));
  }

  private ChangeBatch commit(LogRecord record) throws DecodeCorruption {
    final long transactionId = markerTransactionId(record);
    final long commitSeq = record.getSeqNum();
    final OpenTransaction transaction = openTransactions.remove(transactionId);

    long restartSeq = commitSeq;
    for (OpenTransaction other : openTransactions.values()) {
      restartSeq = Math.min(restartSeq, other.firstSeq);
    }

    if (transaction == null) {
      // A transaction that made no changes.
      return new ChangeBatch(transactionId, commitSeq, commitSeq, restartSeq, ImmutableList.of());
    }

    final ImmutableList.Builder<DecodedChange> changes = ImmutableList.builder();
    for (BufferedChange change : transaction.changes) {
      changes.add(new DecodedChange(change.entity, change.operation, change.beforeImage, change.afterImage,
          commitSeq, transactionId));
    }
    return new ChangeBatch(transactionId, transaction.firstSeq, commitSeq, restartSeq, changes.build());
  }

  private void abort(LogRecord record) throws DecodeCorruption {
    final long transactionId = markerTransactionId(record);
    final OpenTransaction discarded = openTransactions.remove(transactionId);
    if (discarded != null) {
      LOG.debug("Discarded {} buffered change(s) of aborted transaction {}", discarded.changes.size(), transactionId);
    }
  }

  private static long markerTransactionId(LogRecord record) throws DecodeCorruption {
    try {
      return ChangePayloadCodec.decodeMarker(record.getPayload()).getTransactionId();
    } catch (IOException | RuntimeException e) {
      throw new DecodeCorruption(record.getSeqNum(), "unreadable " + record.getKind() + " marker", e);
    }
  }

  private static class OpenTransaction {
    private final long transactionId;
    private final long firstSeq;
    private final List<BufferedChange> changes = new ArrayList<>();

    private OpenTransaction(long transactionId, long firstSeq) {
      this.transactionId = transactionId;
      this.firstSeq = firstSeq;
    }
  }

  private static class BufferedChange {
    private final String entity;
    private final Operation operation;
    private final byte[] beforeImage;
    private final byte[] afterImage;

    private BufferedChange(String entity, Operation operation, byte[] beforeImage, byte[] afterImage) {
      this.entity = entity;
      this.operation = operation;
      this.beforeImage = beforeImage;
      this.afterImage = afterImage;
    }
  }
}
