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

import retlog.interfaces.decoding.Operation;
import retlog.interfaces.log.LogStore;
import retlog.interfaces.log.RecordKind;

import java.io.IOException;

/**
 * Producer-side helper appending change, commit, abort and checkpoint records in the format
 * {@link LogicalDecoder} reads. Each method returns the sequence number assigned to the record.
 */
public class ChangeRecordWriter {
  private static final byte[] EMPTY = new byte[0];

  private final LogStore store;

  public ChangeRecordWriter(LogStore store) {
    this.store = store;
  }

  public long insert(long transactionId, String entity, byte[] afterImage) throws IOException {
    return change(transactionId, entity, Operation.INSERT, null, afterImage);
  }

  public long update(long transactionId, String entity, byte[] beforeImage, byte[] afterImage)
      throws IOException {
    return change(transactionId, entity, Operation.UPDATE, beforeImage, afterImage);
  }

  public long delete(long transactionId, String entity, byte[] beforeImage) throws IOException {
    return change(transactionId, entity, Operation.DELETE, beforeImage, null);
  }

  public long truncate(long transactionId, String entity) throws IOException {
    return change(transactionId, entity, Operation.TRUNCATE, null, null);
  }

  public long commit(long transactionId) throws IOException {
    return store.append(ChangePayloadCodec.encode(new TransactionMarker(transactionId)), RecordKind.COMMIT);
  }

  public long abort(long transactionId) throws IOException {
    return store.append(ChangePayloadCodec.encode(new TransactionMarker(transactionId)), RecordKind.ABORT);
  }

  public long checkpoint() throws IOException {
    return store.append(EMPTY, RecordKind.CHECKPOINT);
  }

  private long change(long transactionId, String entity, Operation operation, byte[] beforeImage, byte[] afterImage)
      throws IOException {
    final ChangePayload payload = new ChangePayload(transactionId, entity, operation.getCode(), beforeImage, afterImage);
    return store.append(ChangePayloadCodec.encode(payload), RecordKind.DATA);
  }
}
