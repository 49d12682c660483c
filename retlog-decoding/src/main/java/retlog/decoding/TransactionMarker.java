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

import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Payload of a COMMIT or ABORT record.
 */
public class TransactionMarker {
  private static final Schema<TransactionMarker> SCHEMA = RuntimeSchema.getSchema(TransactionMarker.class);

  private long transactionId;

  public TransactionMarker() {
  }

  public TransactionMarker(long transactionId) {
    this.transactionId = transactionId;
  }

  public static Schema<TransactionMarker> getSchema() {
    return SCHEMA;
  }

  public long getTransactionId() {
    return transactionId;
  }

  @Override
  public String toString() {
    return "TransactionMarker{transactionId=" + transactionId + '}';
  }
}
