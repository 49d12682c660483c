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

package retlog.interfaces.decoding;

import org.jetbrains.annotations.Nullable;
import retlog.interfaces.ErrorKind;
import retlog.interfaces.RetentionException;
import retlog.interfaces.log.LogRecord;

/**
 * Turns log records into committed, published changes. A decoder is stateful: it buffers the
 * changes of each open transaction until that transaction's commit or abort record is seen. It
 * must be fed records in sequence order; a reader that repositions discards the decoder and
 * starts a fresh one.
 */
public interface Decoder {
  /**
   * Consume one record.
   *
   * @return The batch completed by this record, if it is the commit of a transaction; otherwise null.
   * The returned batch may hold no changes if the publication filtered all of them out.
   * @throws DecodeCorruption    if the record cannot be decoded.
   * @throws TransactionTooLarge if buffering the record would exceed the per-transaction bound.
   */
  @Nullable
  ChangeBatch decode(LogRecord record) throws DecodeCorruption, TransactionTooLarge;

  /**
   * Number of transactions seen but neither committed nor aborted yet.
   */
  int openTransactions();

  interface Factory {
    Decoder create(Publication publication);
  }

  class DecodeCorruption extends RetentionException {
    public DecodeCorruption(long seqNum, String message) {
      super(ErrorKind.DECODE_CORRUPTION, "record " + seqNum + ": " + message);
    }

    public DecodeCorruption(long seqNum, String message, Throwable cause) {
      super(ErrorKind.DECODE_CORRUPTION, "record " + seqNum + ": " + message, cause);
    }
  }

  class TransactionTooLarge extends RetentionException {
    public TransactionTooLarge(long transactionId, int limit) {
      super(ErrorKind.TRANSACTION_TOO_LARGE,
          "transaction " + transactionId + " buffered more than " + limit + " changes");
    }
  }
}
